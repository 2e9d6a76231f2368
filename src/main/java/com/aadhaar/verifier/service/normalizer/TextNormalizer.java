package com.aadhaar.verifier.service.normalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Cleans raw OCR output before the field extractors search it. Whitespace is collapsed, blank lines
 * are dropped and a field label printed on a line of its own is joined with the value below it.
 * Character casing is left untouched.
 */
@Component
public class TextNormalizer {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("\\h+");
    private static final Pattern EDGE_NOISE = Pattern.compile("^[|_~`•*]+|[|_~`•*]+$");
    private static final String LABEL =
            "(?:(?:full\\s+)?name|नाम|dob|d\\.\\s?o\\.\\s?b\\.?|date\\s+of\\s+birth|birth\\s+date"
                    + "|जन्म\\s*तिथि|aadhaar|aadhar|आधार|uid)(?:\\s*(?:number|no\\.?))?";

    // a bilingual card prints the label twice, e.g. "जन्म तिथि / DOB"
    private static final Pattern LABEL_ONLY = Pattern.compile(
            "^" + LABEL + "(?:\\s*/\\s*" + LABEL + ")?\\s*[:;.\\-]*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /**
     * @param rawText OCR output, possibly {@code null}, empty or garbled
     * @return the cleaned text, lines separated by {@code \n}
     */
    public String normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }

        List<String> lines = new ArrayList<>();
        for (String line : LINE_BREAK.split(rawText)) {
            String cleaned = HORIZONTAL_SPACE.matcher(line).replaceAll(" ").trim();
            cleaned = EDGE_NOISE.matcher(cleaned).replaceAll("").trim();
            if (!cleaned.isEmpty()) {
                lines.add(cleaned);
            }
        }

        List<String> joined = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean hasValueBelow = i + 1 < lines.size() && !isLabelOnly(lines.get(i + 1));
            if (isLabelOnly(line) && hasValueBelow) {
                joined.add(line + " " + lines.get(i + 1));
                i++;
            } else {
                joined.add(line);
            }
        }
        return String.join("\n", joined);
    }

    static boolean isLabelOnly(String line) {
        return LABEL_ONLY.matcher(line).matches();
    }
}
