package com.aadhaar.verifier.service.extraction;

import java.util.Optional;

/**
 * Locates a single field in normalized OCR text.
 */
public interface FieldExtractor {

    String field();

    /**
     * @param text output of the text normalizer
     * @param claimed spans taken by extractors that ran earlier; a successful extraction claims
     *                its own span
     */
    Optional<FieldCandidate> extract(String text, ClaimedSpans claimed);
}
