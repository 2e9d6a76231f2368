package com.aadhaar.verifier.util;

import java.util.regex.Pattern;

/**
 * Helpers for Aadhaar numbers written with or without separators.
 */
public final class IdNumbers {

    public static final int LENGTH = 12;

    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    private IdNumbers() {
    }

    public static String digitsOnly(String value) {
        if (value == null) {
            return "";
        }
        return NON_DIGIT.matcher(value).replaceAll("");
    }

    public static boolean isWellFormed(String digits) {
        return digits != null && digits.length() == LENGTH && digits.chars().allMatch(Character::isDigit);
    }

    /**
     * Hides all but the last four digits, for log output.
     */
    public static String mask(String value) {
        String digits = digitsOnly(value);
        if (digits.length() <= 4) {
            return "*".repeat(digits.length());
        }
        return "*".repeat(digits.length() - 4) + digits.substring(digits.length() - 4);
    }
}
