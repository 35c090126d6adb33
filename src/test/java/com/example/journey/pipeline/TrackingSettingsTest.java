package com.example.journey.pipeline;

import com.example.journey.config.JourneyProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackingSettingsTest {

    @Test
    void defaultsComeFromProperties() {
        TrackingSettings settings = TrackingSettings.defaults();

        assertThat(settings.getDetectionConfidence()).isEqualTo(0.55);
        assertThat(settings.getSimilarityThreshold()).isEqualTo(0.62);
        assertThat(settings.getIouThreshold()).isEqualTo(0.3);
        assertThat(settings.getMaxAge()).isEqualTo(15);
        assertThat(settings.getInactivityTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.getCrossingDebounce()).isEqualTo(Duration.ofMillis(750));
    }

    @Test
    void propertiesOverrideDefaults() {
        JourneyProperties properties = new JourneyProperties();
        properties.getSession().setInactivityTimeout(Duration.ofSeconds(30));
        properties.getTracking().setMaxAge(5);

        TrackingSettings settings = TrackingSettings.from(properties);
        assertThat(settings.getInactivityTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.getMaxAge()).isEqualTo(5);
    }

    @Test
    void validateRejectsOutOfRangeValues() {
        TrackingSettings base = TrackingSettings.defaults();

        assertThatThrownBy(() -> base.toBuilder().detectionConfidence(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.toBuilder().maxAge(-1).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.toBuilder().inactivityTimeout(Duration.ZERO).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.toBuilder().crossingDebounce(Duration.ofMillis(-1)).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(base.toBuilder().crossingDebounce(Duration.ZERO).build().validate()).isNotNull();
    }
}
