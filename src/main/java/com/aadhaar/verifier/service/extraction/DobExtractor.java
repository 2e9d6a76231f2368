package com.aadhaar.verifier.service.extraction;

import static com.aadhaar.verifier.service.extraction.DocumentPatterns.ANY_DATE;
import static com.aadhaar.verifier.service.extraction.DocumentPatterns.DAY_FIRST_DATE;
import static com.aadhaar.verifier.service.extraction.DocumentPatterns.DAY_MONTH_NAME_DATE;
import static com.aadhaar.verifier.service.extraction.DocumentPatterns.FLAGS;
import static com.aadhaar.verifier.service.extraction.DocumentPatterns.MONTH_NAME_DAY_DATE;
import static com.aadhaar.verifier.service.extraction.DocumentPatterns.YEAR_FIRST_DATE;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds the date-of-birth text. A date next to a birth label wins over any other date-shaped
 * token; the returned text is not calendar-checked.
 */
@Component
public class DobExtractor extends RuleCascadeExtractor {

    private static final String LABEL =
            "(?<![A-Za-z])(?:DOB|D\\.\\s?O\\.\\s?B\\.?|Date\\s+of\\s+Birth|Birth\\s+Date|जन्म\\s*तिथि)";

    private static final List<ExtractionRule> RULES = List.of(
            ExtractionRule.of("labelled-date",
                    Pattern.compile(LABEL + "\\s*[:;.\\-/]*\\s*(" + ANY_DATE + ")", FLAGS),
                    DobExtractor::clean),
            ExtractionRule.of("day-first-date",
                    Pattern.compile("(" + DAY_FIRST_DATE + ")", FLAGS), DobExtractor::clean),
            ExtractionRule.of("year-first-date",
                    Pattern.compile("(" + YEAR_FIRST_DATE + ")", FLAGS), DobExtractor::clean),
            ExtractionRule.of("day-month-name-date",
                    Pattern.compile("(" + DAY_MONTH_NAME_DATE + ")", FLAGS), DobExtractor::clean),
            ExtractionRule.of("month-name-day-date",
                    Pattern.compile("(" + MONTH_NAME_DAY_DATE + ")", FLAGS), DobExtractor::clean));

    @Override
    public String field() {
        return "dob";
    }

    @Override
    protected List<ExtractionRule> rules() {
        return RULES;
    }

    private static Optional<String> clean(String captured) {
        String trimmed = captured.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
}
