package com.aadhaar.verifier.config;

import com.aadhaar.verifier.service.age.TeenPolicy;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Every tunable of the verification engine. Sections left out of the configuration fall back to
 * the defaults declared here.
 */
@ConfigurationProperties(prefix = "verification")
public record VerificationProperties(
        Matching matching,
        Age age,
        IdNumber idNumber,
        Ocr ocr) {

    public static final double DEFAULT_NAME_THRESHOLD = 0.80;
    public static final int DEFAULT_MAX_NAME_LENGTH = 40;

    /**
     * Teen classification used when none is configured: the 13 to 19 band.
     */
    public static final TeenPolicy DEFAULT_TEEN_POLICY = TeenPolicy.TEEN_BAND;

    public static final List<Integer> DEFAULT_PAGE_SEG_MODES = List.of(6, 4, 11);

    public VerificationProperties {
        matching = matching == null ? Matching.defaults() : matching;
        age = age == null ? Age.defaults() : age;
        idNumber = idNumber == null ? IdNumber.defaults() : idNumber;
        ocr = ocr == null ? Ocr.defaults() : ocr;
    }

    public static VerificationProperties defaults() {
        return new VerificationProperties(null, null, null, null);
    }

    public record Matching(
            @DefaultValue("0.80") double nameThreshold,
            @DefaultValue("40") int maxNameLength) {

        public Matching {
            if (nameThreshold <= 0.0 || nameThreshold > 1.0) {
                throw new IllegalArgumentException("Name threshold must lie in (0,1]: " + nameThreshold);
            }
            if (maxNameLength <= 0) {
                throw new IllegalArgumentException("Maximum name length must be positive: " + maxNameLength);
            }
        }

        public static Matching defaults() {
            return new Matching(DEFAULT_NAME_THRESHOLD, DEFAULT_MAX_NAME_LENGTH);
        }
    }

    public record Age(TeenPolicy teenPolicy) {

        public Age {
            teenPolicy = teenPolicy == null ? DEFAULT_TEEN_POLICY : teenPolicy;
        }

        public static Age defaults() {
            return new Age(DEFAULT_TEEN_POLICY);
        }
    }

    /**
     * @param checksumValidation also require the Aadhaar leading-digit rule and Verhoeff check digit
     *                           on both sides of an ID comparison
     */
    public record IdNumber(@DefaultValue("false") boolean checksumValidation) {

        public static IdNumber defaults() {
            return new IdNumber(false);
        }
    }

    public record Ocr(
            @DefaultValue("eng") String language,
            String datapath,
            List<Integer> pageSegModes,
            String whitelist) {

        public Ocr {
            language = language == null || language.isBlank() ? "eng" : language;
            pageSegModes = pageSegModes == null || pageSegModes.isEmpty()
                    ? DEFAULT_PAGE_SEG_MODES
                    : List.copyOf(pageSegModes);
        }

        public static Ocr defaults() {
            return new Ocr("eng", null, DEFAULT_PAGE_SEG_MODES, null);
        }
    }
}
