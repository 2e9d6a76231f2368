package com.aadhaar.verifier.service.extraction;

import static com.aadhaar.verifier.service.extraction.DocumentPatterns.FLAGS;

import com.aadhaar.verifier.config.VerificationProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds the holder's name. Labelled, addressee and honorific forms are tried first; otherwise the
 * line that looks most like a personal name is used. Names are returned upper-cased.
 */
@Component
public class NameExtractor extends RuleCascadeExtractor {

    private static final Logger log = LoggerFactory.getLogger(NameExtractor.class);

    private static final String VALUE = "([A-Za-z][A-Za-z .'\\-]*)";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ALPHABETIC_TOKEN = Pattern.compile("[A-Za-z][A-Za-z.'\\-]*");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");
    private static final double MIN_ALPHABETIC_SHARE = 0.8;

    /** Tokens that start another field; a name value ends before them. */
    private static final Set<String> FIELD_LABELS = Set.of(
            "DOB", "D.O.B", "D.O.B.", "YOB", "GENDER", "SEX", "MALE", "FEMALE", "AADHAAR", "AADHAR",
            "UID", "VID", "DATE", "BIRTH", "YEAR", "ADDRESS", "MOBILE", "PHONE");

    /** Tokens of printed card furniture that never belong to a name. */
    private static final Set<String> BOILERPLATE = Set.of(
            "GOVERNMENT", "INDIA", "AADHAAR", "AADHAR", "UNIQUE", "IDENTIFICATION", "AUTHORITY",
            "ENROLMENT", "ENROLLMENT", "ADDRESS", "MALE", "FEMALE", "GENDER", "DOB", "BIRTH", "YEAR",
            "DATE", "ISSUE", "DOWNLOAD", "WHOM", "CONCERN", "IDENTITY", "CITIZENSHIP", "PROOF", "MOBILE");

    private final int maxNameLength;
    private final List<ExtractionRule> rules;

    public NameExtractor(VerificationProperties properties) {
        this.maxNameLength = properties.matching().maxNameLength();
        this.rules = List.of(
                ExtractionRule.of("labelled-name",
                        Pattern.compile("^(?:(?:Full\\s+)?Name|नाम)(?:\\s*/\\s*(?:Name|नाम))?(?:\\s*[:;\\-]+\\s*|\\s+)"
                                + VALUE, FLAGS),
                        this::clean),
                ExtractionRule.of("addressee-name",
                        Pattern.compile("^(?-i:To)[:,]?\\s+" + VALUE + "$", FLAGS),
                        this::clean),
                // mid-line honorifics usually introduce a relative, as in "S/O Shri ..."
                ExtractionRule.of("honorific-name",
                        Pattern.compile("^(?:Mr|Ms|Mrs|Shri|Smt|Km)\\.?\\s+" + VALUE, FLAGS),
                        this::clean));
    }

    @Override
    public String field() {
        return "name";
    }

    @Override
    protected List<ExtractionRule> rules() {
        return rules;
    }

    @Override
    protected Optional<FieldCandidate> fallback(String text, ClaimedSpans claimed) {
        FieldCandidate best = null;
        double bestShare = 0.0;
        int offset = 0;
        for (String line : text.split("\n", -1)) {
            int start = offset;
            int end = offset + line.length();
            offset = end + 1;
            if (HAS_DIGIT.matcher(line).find() || claimed.overlaps(start, end)) {
                continue;
            }
            String[] tokens = WHITESPACE.split(line.trim());
            List<String> alphabetic = new ArrayList<>();
            for (String token : tokens) {
                if (ALPHABETIC_TOKEN.matcher(token).matches()) {
                    alphabetic.add(token);
                }
            }
            double share = tokens.length == 0 ? 0.0 : (double) alphabetic.size() / tokens.length;
            if (alphabetic.size() < 2 || share < MIN_ALPHABETIC_SHARE || share <= bestShare) {
                continue;
            }
            if (containsAny(alphabetic, BOILERPLATE)) {
                continue;
            }
            Optional<String> value = clean(String.join(" ", alphabetic));
            if (value.isPresent()) {
                best = new FieldCandidate(value.get(), start, end, "name-like-line");
                bestShare = share;
            }
        }
        if (best != null) {
            log.debug("Field name taken from a name-like line at [{}, {})", best.start(), best.end());
            claimed.claim(best);
        }
        return Optional.ofNullable(best);
    }

    private Optional<String> clean(String captured) {
        List<String> kept = new ArrayList<>();
        for (String token : WHITESPACE.split(captured.trim())) {
            String upper = token.toUpperCase(Locale.ROOT);
            if (FIELD_LABELS.contains(upper)) {
                break;
            }
            String stripped = upper.replaceAll("^[.'\\-]+|[.'\\-]+$", "");
            if (!stripped.isEmpty()) {
                kept.add(stripped);
            }
        }
        String name = String.join(" ", kept);
        if (name.isEmpty() || name.length() > maxNameLength) {
            return Optional.empty();
        }
        if (kept.stream().noneMatch(token -> token.chars().filter(Character::isLetter).count() >= 2)) {
            return Optional.empty();
        }
        if (containsAny(kept, BOILERPLATE)) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    private static boolean containsAny(List<String> tokens, Set<String> words) {
        for (String token : tokens) {
            if (words.contains(token.toUpperCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
