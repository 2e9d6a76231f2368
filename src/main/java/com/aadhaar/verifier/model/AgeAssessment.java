package com.aadhaar.verifier.model;

public record AgeAssessment(int years, boolean teen) {

    public AgeAssessment {
        if (years < 0) {
            throw new IllegalArgumentException("Age must not be negative: " + years);
        }
    }
}
