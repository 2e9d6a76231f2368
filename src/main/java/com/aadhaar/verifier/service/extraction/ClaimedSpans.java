package com.aadhaar.verifier.service.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Text spans already assigned to a field during one extraction run. Not thread-safe; each run
 * creates its own instance.
 */
public final class ClaimedSpans {

    private static final Pattern SEPARATOR_GAP = Pattern.compile("[ \\-/.]?");

    private final List<Span> spans = new ArrayList<>();

    public void claim(FieldCandidate candidate) {
        spans.add(new Span(candidate.start(), candidate.end()));
    }

    public boolean overlaps(int start, int end) {
        for (Span span : spans) {
            if (start < span.end() && span.start() < end) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return whether {@code [start, end)} overlaps a claimed span or is separated from one by at
     *         most a single separator character
     */
    public boolean touches(String text, int start, int end) {
        if (overlaps(start, end)) {
            return true;
        }
        for (Span span : spans) {
            if (span.end() <= start && SEPARATOR_GAP.matcher(text.substring(span.end(), start)).matches()) {
                return true;
            }
            if (end <= span.start() && SEPARATOR_GAP.matcher(text.substring(end, span.start())).matches()) {
                return true;
            }
        }
        return false;
    }

    private record Span(int start, int end) {
    }
}
