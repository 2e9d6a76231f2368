package com.aadhaar.verifier.service.extraction;

import static com.aadhaar.verifier.service.extraction.DocumentPatterns.FLAGS;
import static com.aadhaar.verifier.service.extraction.DocumentPatterns.ID_GROUPS;
import static com.aadhaar.verifier.service.extraction.DocumentPatterns.ID_NUMBER;

import com.aadhaar.verifier.util.IdNumbers;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds a twelve digit Aadhaar number printed as three groups of four. Digit runs that continue a
 * date already claimed for the date of birth are skipped.
 */
@Component
public class IdNumberExtractor extends RuleCascadeExtractor {

    private static final String LABEL = "(?<![A-Za-z])(?:Aadhaar|Aadhar|आधार|UID)(?:\\s*(?:Number|No\\.?))?";

    private static final List<ExtractionRule> RULES = List.of(
            new ExtractionRule("labelled-id",
                    Pattern.compile(LABEL + "\\s*[:;.\\-]*\\s*(" + ID_GROUPS + ")(?![ \\-]?\\d)", FLAGS),
                    IdNumberExtractor::clean, true),
            new ExtractionRule("grouped-id",
                    Pattern.compile("(" + ID_NUMBER + ")", FLAGS),
                    IdNumberExtractor::clean, true));

    @Override
    public String field() {
        return "idNumber";
    }

    @Override
    protected List<ExtractionRule> rules() {
        return RULES;
    }

    private static Optional<String> clean(String captured) {
        String digits = IdNumbers.digitsOnly(captured);
        return digits.length() == IdNumbers.LENGTH ? Optional.of(digits) : Optional.empty();
    }
}
