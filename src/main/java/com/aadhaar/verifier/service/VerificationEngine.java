package com.aadhaar.verifier.service;

import com.aadhaar.verifier.exception.InvalidInputException;
import com.aadhaar.verifier.model.ExtractedFields;
import com.aadhaar.verifier.model.FieldMatch;
import com.aadhaar.verifier.model.ReferenceRecord;
import com.aadhaar.verifier.model.VerificationReport;
import com.aadhaar.verifier.service.extraction.FieldExtractionService;
import com.aadhaar.verifier.service.matching.MatchEngine;
import com.aadhaar.verifier.service.normalizer.TextNormalizer;
import com.aadhaar.verifier.service.report.VerificationReportBuilder;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the verification core: OCR text in, report out. Holds no per-run state, so a
 * single instance serves concurrent callers.
 */
@Service
public class VerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    private final TextNormalizer textNormalizer;
    private final FieldExtractionService extractionService;
    private final MatchEngine matchEngine;
    private final VerificationReportBuilder reportBuilder;
    private final Clock clock;

    public VerificationEngine(TextNormalizer textNormalizer,
                              FieldExtractionService extractionService,
                              MatchEngine matchEngine,
                              VerificationReportBuilder reportBuilder,
                              Clock clock) {
        this.textNormalizer = textNormalizer;
        this.extractionService = extractionService;
        this.matchEngine = matchEngine;
        this.reportBuilder = reportBuilder;
        this.clock = clock;
    }

    public VerificationReport verify(String rawOcrText, ReferenceRecord reference) {
        return verify(rawOcrText, reference, LocalDate.now(clock));
    }

    /**
     * @param rawOcrText text recognized on the document, possibly empty
     * @param reference values the document is expected to carry
     * @param asOf date the age is computed at
     * @throws InvalidInputException if any argument is {@code null}
     * @throws com.aadhaar.verifier.exception.InvalidDateException if {@code asOf} precedes the
     *         date of birth found on the document
     */
    public VerificationReport verify(String rawOcrText, ReferenceRecord reference, LocalDate asOf) {
        if (rawOcrText == null) {
            throw new InvalidInputException("OCR text must not be null");
        }
        if (reference == null) {
            throw new InvalidInputException("Reference record must not be null");
        }
        if (asOf == null) {
            throw new InvalidInputException("Reference date must not be null");
        }

        String normalized = textNormalizer.normalize(rawOcrText);
        ExtractedFields extracted = extractionService.extract(normalized);

        FieldMatch name = matchEngine.matchName(extracted.name(), reference.name());
        FieldMatch dob = matchEngine.matchDob(extracted.dob(), reference.dob());
        FieldMatch idNumber = matchEngine.matchIdNumber(extracted.idNumber(), reference.idNumber());

        VerificationReport report = reportBuilder.build(extracted, name, dob, idNumber, asOf);
        log.info("Verification finished: allMatch={}, name={}, dob={}, id={}, age={}",
                report.allMatch(), name.matched(), dob.matched(), idNumber.matched(),
                report.ageYears().isPresent() ? report.ageYears().getAsInt() : "n/a");
        return report;
    }
}
