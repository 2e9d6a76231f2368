package com.aadhaar.verifier.service.report;

import com.aadhaar.verifier.model.AgeAssessment;
import com.aadhaar.verifier.model.CanonicalDate;
import com.aadhaar.verifier.model.ExtractedFields;
import com.aadhaar.verifier.model.FieldMatch;
import com.aadhaar.verifier.model.VerificationReport;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Renders a report as the plain-text summary shown to operators: one match line per field, the
 * extracted values, then the age line when a date of birth was found.
 */
@Component
public class VerificationSummaryFormatter {

    private static final String NOT_FOUND = "Not found";

    public String format(VerificationReport report) {
        ExtractedFields extracted = report.extracted();
        String name = extracted.name().orElse(NOT_FOUND);
        String dob = extracted.dob().map(CanonicalDate::format).orElse(NOT_FOUND);
        String idNumber = extracted.idNumber().orElse(NOT_FOUND);

        StringBuilder summary = new StringBuilder();
        summary.append("All details match: ").append(yesNo(report.allMatch())).append('\n');
        appendMatchLine(summary, "Name", report.name(), name);
        appendMatchLine(summary, "DOB", report.dob(), dob);
        appendMatchLine(summary, "Aadhaar", report.idNumber(), idNumber);
        summary.append('\n');
        summary.append("Extracted Details:").append('\n');
        summary.append("Name: ").append(name).append('\n');
        summary.append("DOB: ").append(dob).append('\n');
        summary.append("Aadhaar: ").append(idNumber).append('\n');

        Optional<AgeAssessment> age = report.age();
        age.ifPresent(assessment -> summary.append("Age: ")
                .append(assessment.years())
                .append(" (")
                .append(assessment.teen() ? "Teen" : "Not teen")
                .append(")\n"));
        return summary.toString();
    }

    private static void appendMatchLine(StringBuilder summary, String label, FieldMatch match, String shown) {
        summary.append(label).append(" matches: ").append(yesNo(match.matched()))
                .append(" (").append(shown).append(")\n");
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }
}
