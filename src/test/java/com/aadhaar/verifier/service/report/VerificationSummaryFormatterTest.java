package com.aadhaar.verifier.service.report;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.aadhaar.verifier.model.AgeAssessment;
import com.aadhaar.verifier.model.CanonicalDate;
import com.aadhaar.verifier.model.ExtractedFields;
import com.aadhaar.verifier.model.FieldMatch;
import com.aadhaar.verifier.model.VerificationReport;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class VerificationSummaryFormatterTest {

    private final VerificationSummaryFormatter formatter = new VerificationSummaryFormatter();

    @Test
    void rendersMatchingReport() {
        ExtractedFields extracted = new ExtractedFields(
                Optional.of("JOHN DOE"),
                Optional.of(new CanonicalDate(1995, 8, 15)),
                Optional.of("123456789012"),
                Optional.of("15-08-1995"));
        VerificationReport report = new VerificationReport(
                FieldMatch.exact(true, Optional.of("JOHN DOE"), "John Doe"),
                FieldMatch.exact(true, Optional.of("15-08-1995"), "15/08/1995"),
                FieldMatch.exact(true, Optional.of("123456789012"), "1234 5678 9012"),
                extracted,
                Optional.of(new AgeAssessment(28, false)));

        String expected = """
                All details match: Yes
                Name matches: Yes (JOHN DOE)
                DOB matches: Yes (15-08-1995)
                Aadhaar matches: Yes (123456789012)

                Extracted Details:
                Name: JOHN DOE
                DOB: 15-08-1995
                Aadhaar: 123456789012
                Age: 28 (Not teen)
                """;
        assertEquals(expected, formatter.format(report));
    }

    @Test
    void marksMissingFieldsAndOmitsAge() {
        ExtractedFields extracted = new ExtractedFields(
                Optional.of("RAHUL KUMAR"), Optional.empty(), Optional.empty(), Optional.empty());
        VerificationReport report = new VerificationReport(
                new FieldMatch(false, 0.5, Optional.of("RAHUL KUMAR"), "John Doe"),
                FieldMatch.mismatch(Optional.empty(), "15/08/1995"),
                FieldMatch.mismatch(Optional.empty(), "1234 5678 9012"),
                extracted,
                Optional.empty());

        String expected = """
                All details match: No
                Name matches: No (RAHUL KUMAR)
                DOB matches: No (Not found)
                Aadhaar matches: No (Not found)

                Extracted Details:
                Name: RAHUL KUMAR
                DOB: Not found
                Aadhaar: Not found
                """;
        assertEquals(expected, formatter.format(report));
    }

    @Test
    void labelsTeenAge() {
        ExtractedFields extracted = new ExtractedFields(
                Optional.empty(), Optional.of(new CanonicalDate(2005, 3, 12)), Optional.empty(), Optional.empty());
        VerificationReport report = new VerificationReport(
                FieldMatch.mismatch(Optional.empty(), ""),
                FieldMatch.exact(true, Optional.of("12-03-2005"), "12/03/2005"),
                FieldMatch.mismatch(Optional.empty(), ""),
                extracted,
                Optional.of(new AgeAssessment(18, true)));

        String summary = formatter.format(report);

        assertEquals("Age: 18 (Teen)", summary.lines().reduce((first, second) -> second).orElseThrow());
    }
}
