package com.aadhaar.verifier.model;

import java.util.Optional;

/**
 * Outcome of comparing one extracted field with its expected value.
 */
public record FieldMatch(
        boolean matched,
        double similarityScore,
        Optional<String> extractedValue,
        String expectedValue) {

    public FieldMatch {
        if (Double.isNaN(similarityScore) || similarityScore < 0.0 || similarityScore > 1.0) {
            throw new IllegalArgumentException("Similarity must lie in [0,1]: " + similarityScore);
        }
        extractedValue = extractedValue == null ? Optional.empty() : extractedValue;
        expectedValue = expectedValue == null ? "" : expectedValue;
    }

    public static FieldMatch exact(boolean matched, Optional<String> extractedValue, String expectedValue) {
        return new FieldMatch(matched, matched ? 1.0 : 0.0, extractedValue, expectedValue);
    }

    public static FieldMatch mismatch(Optional<String> extractedValue, String expectedValue) {
        return new FieldMatch(false, 0.0, extractedValue, expectedValue);
    }
}
