package com.aadhaar.verifier.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Result of one verification run. The age assessment is present exactly when a date of birth was
 * extracted from the document.
 */
public record VerificationReport(
        FieldMatch name,
        FieldMatch dob,
        FieldMatch idNumber,
        ExtractedFields extracted,
        Optional<AgeAssessment> age) {

    public VerificationReport {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dob, "dob");
        Objects.requireNonNull(idNumber, "idNumber");
        Objects.requireNonNull(extracted, "extracted");
        age = age == null ? Optional.empty() : age;
        if (age.isPresent() != extracted.dob().isPresent()) {
            throw new IllegalArgumentException("Age must be present exactly when a date of birth was extracted");
        }
    }

    public boolean allMatch() {
        return name.matched() && dob.matched() && idNumber.matched();
    }

    public OptionalInt ageYears() {
        return age.map(assessment -> OptionalInt.of(assessment.years())).orElseGet(OptionalInt::empty);
    }

    public Optional<Boolean> isTeen() {
        return age.map(AgeAssessment::teen);
    }
}
