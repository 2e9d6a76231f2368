package com.aadhaar.verifier.model;

import java.util.Optional;

/**
 * Fields located in OCR text. An empty slot means no extraction rule matched.
 *
 * @param name upper-cased name with single spaces
 * @param dob normalized date of birth
 * @param idNumber twelve digits without separators
 * @param rawDob the date text as it appeared on the document, kept even when it failed to normalize
 */
public record ExtractedFields(
        Optional<String> name,
        Optional<CanonicalDate> dob,
        Optional<String> idNumber,
        Optional<String> rawDob) {

    private static final ExtractedFields NONE =
            new ExtractedFields(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    public ExtractedFields {
        name = name == null ? Optional.empty() : name;
        dob = dob == null ? Optional.empty() : dob;
        idNumber = idNumber == null ? Optional.empty() : idNumber;
        rawDob = rawDob == null ? Optional.empty() : rawDob;
    }

    public static ExtractedFields none() {
        return NONE;
    }

    public boolean isEmpty() {
        return name.isEmpty() && dob.isEmpty() && idNumber.isEmpty();
    }
}
