package com.aadhaar.verifier.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aadhaar.verifier.config.VerificationProperties;
import com.aadhaar.verifier.exception.InvalidDateException;
import com.aadhaar.verifier.exception.InvalidInputException;
import com.aadhaar.verifier.model.CanonicalDate;
import com.aadhaar.verifier.model.ReferenceRecord;
import com.aadhaar.verifier.model.VerificationReport;
import com.aadhaar.verifier.service.age.AgeCalculator;
import com.aadhaar.verifier.service.date.DateNormalizer;
import com.aadhaar.verifier.service.extraction.DobExtractor;
import com.aadhaar.verifier.service.extraction.FieldExtractionService;
import com.aadhaar.verifier.service.extraction.IdNumberExtractor;
import com.aadhaar.verifier.service.extraction.NameExtractor;
import com.aadhaar.verifier.service.matching.MatchEngine;
import com.aadhaar.verifier.service.normalizer.TextNormalizer;
import com.aadhaar.verifier.service.report.VerificationReportBuilder;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VerificationEngineTest {

    private static final String CARD_TEXT = "Name: JOHN DOE\nDOB: 15-08-1995\nAadhaar: 1234 5678 9012";
    private static final ReferenceRecord JOHN = new ReferenceRecord("John Doe", "15/08/1995", "1234 5678 9012");
    private static final LocalDate AS_OF = LocalDate.of(2023, 8, 20);

    private VerificationEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2023-08-20T00:00:00Z"), ZoneOffset.UTC);
        VerificationProperties properties = VerificationProperties.defaults();
        DateNormalizer dates = new DateNormalizer(clock);
        engine = new VerificationEngine(
                new TextNormalizer(),
                new FieldExtractionService(new DobExtractor(), new IdNumberExtractor(),
                        new NameExtractor(properties), dates),
                new MatchEngine(properties, dates),
                new VerificationReportBuilder(new AgeCalculator(properties)),
                clock);
    }

    @Test
    void verifiesMatchingCard() {
        VerificationReport report = engine.verify(CARD_TEXT, JOHN, AS_OF);

        assertThat(report.allMatch()).isTrue();
        assertThat(report.name().similarityScore()).isEqualTo(1.0);
        assertThat(report.extracted().name()).contains("JOHN DOE");
        assertThat(report.extracted().dob()).contains(new CanonicalDate(1995, 8, 15));
        assertThat(report.extracted().idNumber()).contains("123456789012");
        assertThat(report.ageYears()).hasValue(28);
        assertThat(report.isTeen()).contains(false);
    }

    @Test
    void reportsNameMismatchForDifferentPerson() {
        ReferenceRecord jane = new ReferenceRecord("Jane Smith", "15/08/1995", "1234 5678 9012");

        VerificationReport report = engine.verify(CARD_TEXT, jane, AS_OF);

        assertThat(report.name().matched()).isFalse();
        assertThat(report.name().similarityScore()).isLessThan(0.5);
        assertThat(report.dob().matched()).isTrue();
        assertThat(report.idNumber().matched()).isTrue();
        assertThat(report.allMatch()).isFalse();
    }

    @Test
    void elevenDigitNumberIsNotExtracted() {
        VerificationReport report = engine.verify(
                "Name: JOHN DOE\nDOB: 15-08-1995\nAadhaar: 1234 5678 901", JOHN, AS_OF);

        assertThat(report.extracted().idNumber()).isEmpty();
        assertThat(report.idNumber().matched()).isFalse();
        assertThat(report.allMatch()).isFalse();
    }

    @Test
    void omitsAgeWhenNoDateOfBirthFound() {
        VerificationReport report = engine.verify("Name: JOHN DOE\nAadhaar: 1234 5678 9012", JOHN, AS_OF);

        assertThat(report.dob().matched()).isFalse();
        assertThat(report.age()).isEmpty();
        assertThat(report.ageYears()).isEmpty();
        assertThat(report.isTeen()).isEmpty();
    }

    @Test
    void computesAgeAtCurrentDateByDefault() {
        VerificationReport report = engine.verify(CARD_TEXT, JOHN);

        assertThat(report.ageYears()).hasValue(28);
    }

    @Test
    void classifiesTeenFromNoisyCardText() {
        String ocr = """
                GOVERNMENT OF INDIA
                Rahul Kumar
                जन्म तिथि / DOB : 12/03/2005
                पुरुष / Male
                2345 6789 0123
                """;
        ReferenceRecord rahul = new ReferenceRecord("Rahul Kumar", "12-03-2005", "2345-6789-0123");

        VerificationReport report = engine.verify(ocr, rahul, AS_OF);

        assertThat(report.allMatch()).isTrue();
        assertThat(report.ageYears()).hasValue(18);
        assertThat(report.isTeen()).contains(true);
    }

    @Test
    void emptyTextYieldsReportWithNothingMatched() {
        VerificationReport report = engine.verify("", JOHN, AS_OF);

        assertThat(report.extracted().isEmpty()).isTrue();
        assertThat(report.name().matched()).isFalse();
        assertThat(report.dob().matched()).isFalse();
        assertThat(report.idNumber().matched()).isFalse();
        assertThat(report.age()).isEmpty();
    }

    @Test
    void rejectsNullArguments() {
        assertThatThrownBy(() -> engine.verify(null, JOHN, AS_OF)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.verify(CARD_TEXT, null, AS_OF)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.verify(CARD_TEXT, JOHN, null)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsReferenceDateBeforeBirth() {
        assertThatThrownBy(() -> engine.verify(CARD_TEXT, JOHN, LocalDate.of(1990, 1, 1)))
                .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void sameInputGivesSameReport() {
        assertThat(engine.verify(CARD_TEXT, JOHN, AS_OF)).isEqualTo(engine.verify(CARD_TEXT, JOHN, AS_OF));
    }
}
