package com.aadhaar.verifier.service.extraction;

import java.util.regex.Pattern;

/**
 * Regular expression fragments shared by the extractors.
 */
final class DocumentPatterns {

    static final String MONTH_NAME =
            "(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?";

    static final String DAY_FIRST_DATE = "(?<!\\d)\\d{1,2}[/\\-. ]\\d{1,2}[/\\-. ]\\d{4}(?!\\d)";
    static final String YEAR_FIRST_DATE = "(?<!\\d)\\d{4}[/\\-.]\\d{1,2}[/\\-.]\\d{1,2}(?!\\d)";
    static final String DAY_MONTH_NAME_DATE =
            "(?<!\\d)\\d{1,2}(?:st|nd|rd|th)?[ \\-/]+" + MONTH_NAME + "[ \\-/,]+\\d{4}(?!\\d)";
    static final String MONTH_NAME_DAY_DATE =
            "(?<![A-Za-z])" + MONTH_NAME + "[ \\-]+\\d{1,2}(?:st|nd|rd|th)?,? ?\\d{4}(?!\\d)";

    static final String ANY_DATE = "(?:" + DAY_MONTH_NAME_DATE + "|" + MONTH_NAME_DAY_DATE + "|"
            + DAY_FIRST_DATE + "|" + YEAR_FIRST_DATE + ")";

    static final String ID_GROUPS = "\\d{4}[ \\-]?\\d{4}[ \\-]?\\d{4}";
    static final String ID_NUMBER = "(?<!\\d[ \\-]?)" + ID_GROUPS + "(?![ \\-]?\\d)";

    static final Pattern ANY_DATE_PATTERN = Pattern.compile(ANY_DATE, Pattern.CASE_INSENSITIVE);
    static final Pattern ID_NUMBER_PATTERN = Pattern.compile(ID_NUMBER);

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

    private DocumentPatterns() {
    }
}
