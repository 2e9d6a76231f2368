package com.aadhaar.verifier.service.extraction;

/**
 * Value located by an extractor together with the span of normalized text it came from.
 *
 * @param value cleaned value
 * @param start inclusive start offset of the matched text
 * @param end exclusive end offset of the matched text
 * @param rule name of the extraction rule that produced the value
 */
public record FieldCandidate(String value, int start, int end, String rule) {
}
