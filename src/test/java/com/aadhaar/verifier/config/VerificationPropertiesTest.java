package com.aadhaar.verifier.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aadhaar.verifier.service.age.TeenPolicy;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class VerificationPropertiesTest {

    @Test
    void fallsBackToDefaultsForMissingSections() {
        VerificationProperties properties = bind(Map.of("verification.ocr.language", "eng+hin"));

        assertThat(properties.matching().nameThreshold()).isEqualTo(VerificationProperties.DEFAULT_NAME_THRESHOLD);
        assertThat(properties.matching().maxNameLength()).isEqualTo(40);
        assertThat(properties.age().teenPolicy()).isEqualTo(TeenPolicy.TEEN_BAND);
        assertThat(properties.idNumber().checksumValidation()).isFalse();
        assertThat(properties.ocr().language()).isEqualTo("eng+hin");
        assertThat(properties.ocr().pageSegModes()).containsExactly(6, 4, 11);
    }

    @Test
    void bindsConfiguredValues() {
        VerificationProperties properties = bind(Map.of(
                "verification.matching.name-threshold", "0.9",
                "verification.age.teen-policy", "UNDER_EIGHTEEN",
                "verification.id-number.checksum-validation", "true",
                "verification.ocr.page-seg-modes", "3,6"));

        assertThat(properties.matching().nameThreshold()).isEqualTo(0.9);
        assertThat(properties.age().teenPolicy()).isEqualTo(TeenPolicy.UNDER_EIGHTEEN);
        assertThat(properties.idNumber().checksumValidation()).isTrue();
        assertThat(properties.ocr().pageSegModes()).isEqualTo(List.of(3, 6));
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> new VerificationProperties.Matching(1.5, 40))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VerificationProperties.Matching(0.0, 40))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static VerificationProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("verification", VerificationProperties.class);
    }
}
