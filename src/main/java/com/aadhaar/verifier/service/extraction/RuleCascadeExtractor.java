package com.aadhaar.verifier.service.extraction;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extractor that tries its rules in declaration order and stops at the first one that yields a
 * value.
 */
public abstract class RuleCascadeExtractor implements FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(RuleCascadeExtractor.class);

    protected abstract List<ExtractionRule> rules();

    @Override
    public Optional<FieldCandidate> extract(String text, ClaimedSpans claimed) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (ExtractionRule rule : rules()) {
            Optional<FieldCandidate> candidate = rule.firstMatch(text, claimed);
            if (candidate.isPresent()) {
                log.debug("Field {} matched by rule {} at [{}, {})", field(), rule.name(),
                        candidate.get().start(), candidate.get().end());
                claimed.claim(candidate.get());
                return candidate;
            }
        }
        return fallback(text, claimed);
    }

    /**
     * Last resort once every rule has failed. Implementations claim the span of what they return.
     */
    protected Optional<FieldCandidate> fallback(String text, ClaimedSpans claimed) {
        return Optional.empty();
    }
}
