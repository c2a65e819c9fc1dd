package com.kpisentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineSettingsTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        EngineSettings settings = EngineSettings.builder().build();

        assertThat(settings.isLimsupAlertEnabled()).isFalse();
        assertThat(settings.isSendFuturePredictions()).isFalse();
        assertThat(settings.getParallelism()).isEqualTo(1);
        assertThat(settings.getFitTimeout()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should reject zero parallelism and non-positive timeouts")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> EngineSettings.builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> EngineSettings.builder().fitTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fitTimeout");
    }
}
