package com.aadhaar.verifier.service.age;

import com.aadhaar.verifier.config.VerificationProperties;
import com.aadhaar.verifier.exception.InvalidDateException;
import com.aadhaar.verifier.model.AgeAssessment;
import com.aadhaar.verifier.model.CanonicalDate;
import java.time.LocalDate;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class AgeCalculator {

    private final TeenPolicy teenPolicy;

    public AgeCalculator(VerificationProperties properties) {
        this.teenPolicy = properties.age().teenPolicy();
    }

    /**
     * Whole years elapsed between the date of birth and {@code asOf}, with the configured teen
     * classification.
     *
     * @throws InvalidDateException if {@code asOf} precedes the date of birth
     */
    public AgeAssessment assess(CanonicalDate dob, LocalDate asOf) {
        int years = ageInYears(dob, asOf);
        return new AgeAssessment(years, teenPolicy.isTeen(years));
    }

    public int ageInYears(CanonicalDate dob, LocalDate asOf) {
        Objects.requireNonNull(dob, "dob");
        Objects.requireNonNull(asOf, "asOf");
        if (asOf.isBefore(dob.toLocalDate())) {
            throw new InvalidDateException("Reference date " + asOf + " precedes date of birth " + dob.format());
        }
        int years = asOf.getYear() - dob.year();
        boolean birthdayPending = asOf.getMonthValue() < dob.month()
                || (asOf.getMonthValue() == dob.month() && asOf.getDayOfMonth() < dob.day());
        if (birthdayPending) {
            years--;
        }
        return years;
    }

    public TeenPolicy teenPolicy() {
        return teenPolicy;
    }
}
