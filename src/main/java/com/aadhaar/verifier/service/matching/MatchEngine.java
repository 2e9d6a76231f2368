package com.aadhaar.verifier.service.matching;

import com.aadhaar.verifier.config.VerificationProperties;
import com.aadhaar.verifier.model.CanonicalDate;
import com.aadhaar.verifier.model.FieldMatch;
import com.aadhaar.verifier.service.date.DateNormalizer;
import com.aadhaar.verifier.util.AadhaarChecksum;
import com.aadhaar.verifier.util.IdNumbers;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares extracted fields with the caller's reference values. Each comparison stands alone and a
 * malformed value on either side is a mismatch, never an error.
 */
@Component
public class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final DateNormalizer dateNormalizer;
    private final double nameThreshold;
    private final boolean checksumValidation;

    public MatchEngine(VerificationProperties properties, DateNormalizer dateNormalizer) {
        this.dateNormalizer = dateNormalizer;
        this.nameThreshold = properties.matching().nameThreshold();
        this.checksumValidation = properties.idNumber().checksumValidation();
    }

    public FieldMatch matchName(Optional<String> extracted, String expected) {
        if (extracted.isEmpty() || expected == null || expected.isBlank()) {
            return FieldMatch.mismatch(extracted, expected);
        }
        double similarity = NameSimilarity.score(extracted.get(), expected);
        boolean matched = similarity >= nameThreshold;
        log.debug("Name similarity {} against threshold {}", similarity, nameThreshold);
        return new FieldMatch(matched, similarity, extracted, expected);
    }

    public FieldMatch matchName(String extracted, String expected) {
        return matchName(Optional.ofNullable(extracted), expected);
    }

    public FieldMatch matchDob(Optional<CanonicalDate> extracted, String expected) {
        Optional<String> shown = extracted.map(CanonicalDate::format);
        if (extracted.isEmpty()) {
            return FieldMatch.mismatch(shown, expected);
        }
        Optional<CanonicalDate> reference = dateNormalizer.tryNormalize(expected);
        if (reference.isEmpty()) {
            return FieldMatch.mismatch(shown, expected);
        }
        return FieldMatch.exact(extracted.get().equals(reference.get()), shown, expected);
    }

    public FieldMatch matchIdNumber(Optional<String> extracted, String expected) {
        if (extracted.isEmpty()) {
            return FieldMatch.mismatch(extracted, expected);
        }
        String found = IdNumbers.digitsOnly(extracted.get());
        String reference = IdNumbers.digitsOnly(expected);
        if (!IdNumbers.isWellFormed(found) || !IdNumbers.isWellFormed(reference)) {
            log.debug("ID comparison skipped: {} and {} digits", found.length(), reference.length());
            return FieldMatch.mismatch(extracted, expected);
        }
        if (checksumValidation && !(AadhaarChecksum.isValid(found) && AadhaarChecksum.isValid(reference))) {
            log.debug("ID comparison failed checksum validation for {}", IdNumbers.mask(found));
            return FieldMatch.mismatch(extracted, expected);
        }
        return FieldMatch.exact(found.equals(reference), extracted, expected);
    }

    public double nameThreshold() {
        return nameThreshold;
    }
}
