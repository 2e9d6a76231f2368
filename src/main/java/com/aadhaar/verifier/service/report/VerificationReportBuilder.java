package com.aadhaar.verifier.service.report;

import com.aadhaar.verifier.model.AgeAssessment;
import com.aadhaar.verifier.model.ExtractedFields;
import com.aadhaar.verifier.model.FieldMatch;
import com.aadhaar.verifier.model.VerificationReport;
import com.aadhaar.verifier.service.age.AgeCalculator;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Assembles the verification report. The age is always derived from the date found on the
 * document, never from the reference record.
 */
@Component
public class VerificationReportBuilder {

    private final AgeCalculator ageCalculator;

    public VerificationReportBuilder(AgeCalculator ageCalculator) {
        this.ageCalculator = ageCalculator;
    }

    public VerificationReport build(ExtractedFields extracted,
                                    FieldMatch name,
                                    FieldMatch dob,
                                    FieldMatch idNumber,
                                    LocalDate asOf) {
        Optional<AgeAssessment> age = extracted.dob().map(date -> ageCalculator.assess(date, asOf));
        return new VerificationReport(name, dob, idNumber, extracted, age);
    }
}
