package com.kpisentinel.core.config;

import com.kpisentinel.core.model.ModelParameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Top-level POJO for the metrics YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * metrics:
 *   - kpi: sessions
 *     method: seasonal-decomposition
 *     confidenceInterval: 95
 *     seasonalityMode: multiplicative
 *     changePointSensitivity: 0.5
 *   - kpi: checkout_down
 *     method: constraint
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every entry is valid and
 * that no metric is configured twice.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelParametersConfig {

    private List<ModelParameters> metrics = new ArrayList<>();

    /**
     * @return unmodifiable list of metric parameters, in file order
     */
    public List<ModelParameters> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    /**
     * Set the metrics list (used by SnakeYAML during deserialization).
     *
     * @param metrics the metric parameters
     */
    public void setMetrics(List<ModelParameters> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    /**
     * @param kpi metric identifier
     * @return the parameters configured for {@code kpi}
     */
    public Optional<ModelParameters> find(String kpi) {
        return metrics.stream()
                .filter(p -> Objects.equals(p.getKpi(), kpi))
                .findFirst();
    }

    /**
     * Validate every entry and the uniqueness of {@code kpi}.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < metrics.size(); i++) {
            ModelParameters params = Objects.requireNonNull(metrics.get(i),
                    "Metric at index " + i + " is null");
            try {
                params.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (params.getKpi() != null && !seen.add(params.getKpi())) {
                errors.add("Metric '" + params.getKpi() + "' is configured more than once");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Metrics configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "ModelParametersConfig{metrics=" + metrics + '}';
    }
}
