package com.aadhaar.verifier.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.aadhaar.verifier.config.VerificationProperties;
import com.aadhaar.verifier.model.CanonicalDate;
import com.aadhaar.verifier.model.ExtractedFields;
import com.aadhaar.verifier.service.date.DateNormalizer;
import com.aadhaar.verifier.service.normalizer.TextNormalizer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FieldExtractionServiceTest {

    private final TextNormalizer normalizer = new TextNormalizer();
    private FieldExtractionService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2023-08-20T00:00:00Z"), ZoneOffset.UTC);
        service = new FieldExtractionService(
                new DobExtractor(),
                new IdNumberExtractor(),
                new NameExtractor(VerificationProperties.defaults()),
                new DateNormalizer(clock));
    }

    @Test
    void extractsAllThreeFields() {
        ExtractedFields fields = service.extract(
                normalizer.normalize("Name: JOHN DOE\nDOB: 15-08-1995\nAadhaar: 1234 5678 9012"));

        assertThat(fields.name()).contains("JOHN DOE");
        assertThat(fields.dob()).contains(new CanonicalDate(1995, 8, 15));
        assertThat(fields.idNumber()).contains("123456789012");
        assertThat(fields.rawDob()).contains("15-08-1995");
    }

    @Test
    void readsFieldsFromNoisyCardText() {
        String ocr = """
                GOVERNMENT OF INDIA
                | Rahul   Kumar
                जन्म तिथि / DOB :
                12/03/2005
                पुरुष / Male
                2345 6789 0123
                मेरा आधार, मेरी पहचान
                """;

        ExtractedFields fields = service.extract(normalizer.normalize(ocr));

        assertThat(fields.name()).contains("RAHUL KUMAR");
        assertThat(fields.dob()).contains(new CanonicalDate(2005, 3, 12));
        assertThat(fields.idNumber()).contains("234567890123");
    }

    @Test
    void keepsRawDateWhenItIsNotACalendarDate() {
        ExtractedFields fields = service.extract(
                normalizer.normalize("Name: JOHN DOE\nDOB: 31-04-1995\nAadhaar: 1234 5678 9012"));

        assertThat(fields.dob()).isEmpty();
        assertThat(fields.rawDob()).contains("31-04-1995");
        assertThat(fields.name()).contains("JOHN DOE");
        assertThat(fields.idNumber()).contains("123456789012");
    }

    @Test
    void normalizesDateWithMixedSeparators() {
        ExtractedFields fields = service.extract(normalizer.normalize("DOB: 15/08-1995"));

        assertThat(fields.rawDob()).contains("15/08-1995");
        assertThat(fields.dob()).contains(new CanonicalDate(1995, 8, 15));
    }

    @Test
    void returnsNoFieldsForBlankText() {
        assertThat(service.extract("")).isEqualTo(ExtractedFields.none());
        assertThat(service.extract("   ").isEmpty()).isTrue();
    }

    @Test
    void returnsNoFieldsForGarbage() {
        ExtractedFields fields = service.extract(normalizer.normalize("~~ 7 ## @@ 42 !!"));

        assertThat(fields.isEmpty()).isTrue();
    }
}
