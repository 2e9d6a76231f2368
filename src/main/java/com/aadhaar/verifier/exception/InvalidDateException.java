package com.aadhaar.verifier.exception;

/**
 * Raised when the reference date of an age computation precedes the date of birth.
 */
public class InvalidDateException extends VerificationException {

    public InvalidDateException(String message) {
        super(message);
    }
}
