package com.aadhaar.verifier.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class DobExtractorTest {

    private final DobExtractor extractor = new DobExtractor();

    @Test
    void extractsLabelledDate() {
        ClaimedSpans claimed = new ClaimedSpans();
        String text = "Name: JOHN DOE\nDOB: 15-08-1995\nAadhaar: 1234 5678 9012";

        Optional<FieldCandidate> candidate = extractor.extract(text, claimed);

        assertThat(candidate).isPresent();
        assertThat(candidate.get().value()).isEqualTo("15-08-1995");
        assertThat(candidate.get().rule()).isEqualTo("labelled-date");
        assertThat(text.substring(candidate.get().start(), candidate.get().end())).isEqualTo("15-08-1995");
        assertThat(claimed.overlaps(candidate.get().start(), candidate.get().end())).isTrue();
    }

    @Test
    void prefersLabelledDateOverEarlierUnlabelledDate() {
        Optional<FieldCandidate> candidate =
                extractor.extract("Issued: 01/02/2015\nDate of Birth: 15/08/1995", new ClaimedSpans());

        assertThat(candidate).map(FieldCandidate::value).contains("15/08/1995");
    }

    @Test
    void readsBilingualLabel() {
        Optional<FieldCandidate> candidate =
                extractor.extract("जन्म तिथि / DOB : 12/03/2005", new ClaimedSpans());

        assertThat(candidate).map(FieldCandidate::value).contains("12/03/2005");
        assertThat(candidate).map(FieldCandidate::rule).contains("labelled-date");
    }

    @Test
    void extractsLabelledTextualDate() {
        Optional<FieldCandidate> candidate =
                extractor.extract("Date of Birth: 15 Aug 1995", new ClaimedSpans());

        assertThat(candidate).map(FieldCandidate::value).contains("15 Aug 1995");
    }

    @Test
    void fallsBackToUnlabelledYearFirstDate() {
        Optional<FieldCandidate> candidate = extractor.extract("Born 1995-08-15 in Pune", new ClaimedSpans());

        assertThat(candidate).map(FieldCandidate::value).contains("1995-08-15");
        assertThat(candidate).map(FieldCandidate::rule).contains("year-first-date");
    }

    @Test
    void fallsBackToMonthFirstTextualDate() {
        Optional<FieldCandidate> candidate = extractor.extract("born on Aug 15, 1995", new ClaimedSpans());

        assertThat(candidate).map(FieldCandidate::value).contains("Aug 15, 1995");
        assertThat(candidate).map(FieldCandidate::rule).contains("month-name-day-date");
    }

    @Test
    void doesNotReadIdNumberAsDate() {
        assertThat(extractor.extract("Aadhaar: 1234 5678 9012", new ClaimedSpans())).isEmpty();
    }

    @Test
    void returnsEmptyWhenNoDateIsPresent() {
        assertThat(extractor.extract("JOHN DOE\nMale", new ClaimedSpans())).isEmpty();
        assertThat(extractor.extract("", new ClaimedSpans())).isEmpty();
    }
}
