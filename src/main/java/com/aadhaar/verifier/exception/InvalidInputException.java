package com.aadhaar.verifier.exception;

public class InvalidInputException extends VerificationException {

    public InvalidInputException(String message) {
        super(message);
    }
}
