package com.aadhaar.verifier.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AadhaarChecksumTest {

    @Test
    void computesVerhoeffCheckDigit() {
        assertEquals(3, AadhaarChecksum.checkDigit("236"));
        assertEquals(0, AadhaarChecksum.verhoeffChecksum("2363"));
        assertEquals(4, AadhaarChecksum.checkDigit("23456789012"));
    }

    @Test
    void acceptsNumberWithValidCheckDigit() {
        assertTrue(AadhaarChecksum.isValid("234567890124"));
    }

    @Test
    void rejectsAlteredDigit() {
        assertFalse(AadhaarChecksum.isValid("234567890125"));
        assertFalse(AadhaarChecksum.isValid("234567890214"));
    }

    @Test
    void rejectsLeadingZeroOrOne() {
        String payload = "13456789012";
        assertFalse(AadhaarChecksum.isValid(payload + AadhaarChecksum.checkDigit(payload)));
    }

    @Test
    void rejectsWrongLength() {
        assertFalse(AadhaarChecksum.isValid("2345678901"));
        assertFalse(AadhaarChecksum.isValid(null));
    }
}
