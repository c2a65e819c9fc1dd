package com.kpisentinel.core.config;

import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ModelParameters;
import com.kpisentinel.core.model.SeasonalityMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ModelParametersLoader}.
 */
class ModelParametersLoaderTest {

    @Test
    @DisplayName("Should load test metrics from classpath")
    void shouldLoadFromClasspath() {
        ModelParametersConfig config = ModelParametersLoader.fromClasspath("test-metrics.yml");

        assertThat(config.getMetrics()).hasSize(3);

        ModelParameters sessions = config.find("daily_sessions").orElseThrow();
        assertThat(sessions.forecastMethod()).isEqualTo(ForecastMethod.SEASONAL_DECOMPOSITION);
        assertThat(sessions.getConfidenceInterval()).isEqualTo(90);
        assertThat(sessions.seasonality()).isEqualTo(SeasonalityMode.ADDITIVE);
        assertThat(sessions.getChangePointSensitivity()).isEqualTo(0.05);

        ModelParameters conversion = config.find("conversion_rate").orElseThrow();
        assertThat(conversion.forecastMethod()).isEqualTo(ForecastMethod.AUTOREGRESSIVE);
        assertThat(conversion.getIsRelated()).isTrue();

        ModelParameters errors = config.find("checkout_errors").orElseThrow();
        assertThat(errors.forecastMethod()).isEqualTo(ForecastMethod.CONSTRAINT);
        assertThat(errors.getSendAlert()).isFalse();
    }

    @Test
    @DisplayName("Should report every invalid entry and duplicate kpi together")
    void shouldReportAllErrors() {
        assertThatThrownBy(() -> ModelParametersLoader.fromClasspath("invalid-metrics.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed")
                .hasMessageContaining("[1, 99]")
                .hasMessageContaining("holt-winters")
                .hasMessageContaining("configured more than once");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ModelParametersLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String path = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> ModelParametersLoader.fromFile(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(path);
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dup.yml");
        Files.writeString(file, "metrics:\n  - kpi: a\n    kpi: b\n    method: constraint\n");

        assertThatThrownBy(() -> ModelParametersLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should return an empty configuration for an empty file")
    void shouldAcceptEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThat(ModelParametersLoader.fromFile(file.toString()).getMetrics()).isEmpty();
    }
}
