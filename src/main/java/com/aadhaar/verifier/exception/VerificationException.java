package com.aadhaar.verifier.exception;

/**
 * Root of the exceptions raised by the verification engine.
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
