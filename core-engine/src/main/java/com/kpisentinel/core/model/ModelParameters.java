package com.kpisentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Forecasting and alerting parameters for a single metric, loaded from the
 * metrics YAML file.
 *
 * <pre>
 * - kpi: sessions
 *   method: seasonal-decomposition
 *   confidenceInterval: 95
 *   seasonalityMode: multiplicative
 *   changePointSensitivity: 0.5
 *   isRelated: false
 *   sendAlert: true
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared method are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelParameters {

    /** Default confidence level for the autoregressive band. */
    public static final int DEFAULT_CONFIDENCE_INTERVAL = 95;

    /** Metric identifier; matches a column of the metric frame. */
    private String kpi;

    /** Method name: seasonal-decomposition, autoregressive or constraint. */
    private String method;

    /** Confidence level in percent (1-99). */
    private Integer confidenceInterval;

    private String seasonalityMode = "multiplicative";

    /** Higher values let the trend bend more easily. */
    private double changePointSensitivity = 0.5;

    /** Route the prediction through the registered adjustments. */
    private boolean isRelated;

    /** When false, a detected alert is recorded but not surfaced. */
    private boolean sendAlert = true;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared method are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (kpi == null || kpi.isBlank()) {
            errors.add("Metric 'kpi' is required");
        }
        if (method == null || method.isBlank()) {
            errors.add("Metric '" + kpi + "' requires 'method'");
        } else {
            try {
                ForecastMethod resolved = ForecastMethod.fromConfig(method);
                if (resolved == ForecastMethod.SEASONAL_DECOMPOSITION && confidenceInterval == null) {
                    errors.add("Metric '" + kpi + "' requires 'confidenceInterval' for "
                            + resolved.getConfigName());
                }
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (confidenceInterval != null && (confidenceInterval < 1 || confidenceInterval > 99)) {
            errors.add("Metric '" + kpi + "' requires 'confidenceInterval' in [1, 99], got: "
                    + confidenceInterval);
        }
        try {
            SeasonalityMode.fromConfig(seasonalityMode);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (!(changePointSensitivity > 0)) {
            errors.add("Metric '" + kpi + "' requires 'changePointSensitivity' > 0, got: "
                    + changePointSensitivity);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ModelParameters: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    public ForecastMethod forecastMethod() {
        return ForecastMethod.fromConfig(method);
    }

    public SeasonalityMode seasonality() {
        return SeasonalityMode.fromConfig(seasonalityMode);
    }

    /**
     * @return configured confidence level, or
     *         {@value #DEFAULT_CONFIDENCE_INTERVAL} when absent
     */
    public int confidenceLevel() {
        return confidenceInterval != null ? confidenceInterval : DEFAULT_CONFIDENCE_INTERVAL;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getKpi() {
        return kpi;
    }

    public void setKpi(String kpi) {
        this.kpi = kpi;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public Integer getConfidenceInterval() {
        return confidenceInterval;
    }

    public void setConfidenceInterval(Integer confidenceInterval) {
        this.confidenceInterval = confidenceInterval;
    }

    public String getSeasonalityMode() {
        return seasonalityMode;
    }

    public void setSeasonalityMode(String seasonalityMode) {
        this.seasonalityMode = seasonalityMode;
    }

    public double getChangePointSensitivity() {
        return changePointSensitivity;
    }

    public void setChangePointSensitivity(double changePointSensitivity) {
        this.changePointSensitivity = changePointSensitivity;
    }

    public boolean getIsRelated() {
        return isRelated;
    }

    public void setIsRelated(boolean isRelated) {
        this.isRelated = isRelated;
    }

    public boolean getSendAlert() {
        return sendAlert;
    }

    public void setSendAlert(boolean sendAlert) {
        this.sendAlert = sendAlert;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelParameters that))
            return false;
        return Objects.equals(kpi, that.kpi) && Objects.equals(method, that.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kpi, method);
    }

    @Override
    public String toString() {
        return "ModelParameters{" +
                "kpi='" + kpi + '\'' +
                ", method='" + method + '\'' +
                ", confidenceInterval=" + confidenceInterval +
                ", seasonalityMode='" + seasonalityMode + '\'' +
                ", changePointSensitivity=" + changePointSensitivity +
                ", isRelated=" + isRelated +
                ", sendAlert=" + sendAlert +
                '}';
    }
}
