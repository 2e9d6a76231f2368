package com.aadhaar.verifier.service.extraction;

import com.aadhaar.verifier.model.CanonicalDate;
import com.aadhaar.verifier.model.ExtractedFields;
import com.aadhaar.verifier.service.date.DateNormalizer;
import com.aadhaar.verifier.util.IdNumbers;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the extractors over normalized text in priority order: date of birth, ID number, name. A
 * span taken by an earlier extractor is unavailable to the later ones.
 */
@Service
public class FieldExtractionService {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractionService.class);

    private final DobExtractor dobExtractor;
    private final IdNumberExtractor idNumberExtractor;
    private final NameExtractor nameExtractor;
    private final DateNormalizer dateNormalizer;

    public FieldExtractionService(DobExtractor dobExtractor,
                                  IdNumberExtractor idNumberExtractor,
                                  NameExtractor nameExtractor,
                                  DateNormalizer dateNormalizer) {
        this.dobExtractor = dobExtractor;
        this.idNumberExtractor = idNumberExtractor;
        this.nameExtractor = nameExtractor;
        this.dateNormalizer = dateNormalizer;
    }

    public ExtractedFields extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return ExtractedFields.none();
        }
        ClaimedSpans claimed = new ClaimedSpans();

        Optional<String> rawDob = dobExtractor.extract(normalizedText, claimed).map(FieldCandidate::value);
        Optional<CanonicalDate> dob = rawDob.flatMap(dateNormalizer::tryNormalize);
        Optional<String> idNumber = idNumberExtractor.extract(normalizedText, claimed).map(FieldCandidate::value);
        Optional<String> name = nameExtractor.extract(normalizedText, claimed).map(FieldCandidate::value);

        log.debug("Extracted name present: {}, dob: {} (raw {}), id: {}",
                name.isPresent(),
                dob.map(CanonicalDate::format).orElse("absent"),
                rawDob.orElse("absent"),
                idNumber.map(IdNumbers::mask).orElse("absent"));
        return new ExtractedFields(name, dob, idNumber, rawDob);
    }
}
