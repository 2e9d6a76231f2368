package com.aadhaar.verifier.exception;

/**
 * Raised when a date string matches none of the supported forms, is not a real calendar date or
 * lies outside the accepted year range.
 */
public class DateParseException extends VerificationException {

    private final String input;

    public DateParseException(String input, String message) {
        super(message);
        this.input = input;
    }

    public DateParseException(String input, String message, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
