package com.aadhaar.verifier.service.extraction;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One step of an extractor cascade: a pattern whose first capture group holds the value, and a
 * transform that cleans the captured text or rejects it by returning an empty result.
 *
 * @param name identifies the rule in logs and in {@link FieldCandidate#rule()}
 * @param pattern pattern with the value in group 1
 * @param transform cleans a captured value, empty when the capture is not acceptable
 * @param rejectAdjacent also reject matches that sit right next to an already claimed span
 */
public record ExtractionRule(
        String name,
        Pattern pattern,
        Function<String, Optional<String>> transform,
        boolean rejectAdjacent) {

    public ExtractionRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(transform, "transform");
    }

    public static ExtractionRule of(String name, Pattern pattern, Function<String, Optional<String>> transform) {
        return new ExtractionRule(name, pattern, transform, false);
    }

    /**
     * Scans {@code text} left to right and returns the first accepted match that does not collide
     * with a claimed span.
     */
    public Optional<FieldCandidate> firstMatch(String text, ClaimedSpans claimed) {
        Matcher matcher = pattern.matcher(text);
        int from = 0;
        while (from <= text.length() && matcher.find(from)) {
            int start = matcher.start(1);
            int end = matcher.end(1);
            boolean collides = rejectAdjacent
                    ? claimed.touches(text, start, end)
                    : claimed.overlaps(start, end);
            if (!collides) {
                Optional<String> value = transform.apply(matcher.group(1));
                if (value.isPresent()) {
                    return Optional.of(new FieldCandidate(value.get(), start, end, name));
                }
            }
            from = matcher.start() + 1;
        }
        return Optional.empty();
    }
}
