package com.kpisentinel.core.model;

import java.util.Objects;

/**
 * Rendered row of the alerts table, as handed to reporting and persistence.
 *
 * <p>
 * Schema: Metric, AlertState, Prediction (text), Real (text), LowerBound,
 * UpperBound, Detail. Bounds are {@code null} for constraint metrics.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRow {

    private final String kpi;
    private final String metric;
    private final AlertState alertState;
    private final String prediction;
    private final String real;
    private final Double lowerBound;
    private final Double upperBound;
    private final String detail;

    public AlertRow(String kpi, String metric, AlertState alertState, String prediction, String real,
            Double lowerBound, Double upperBound, String detail) {
        this.kpi = Objects.requireNonNull(kpi, "kpi must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.alertState = Objects.requireNonNull(alertState, "alertState must not be null");
        this.prediction = prediction;
        this.real = real;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.detail = detail;
    }

    public String getKpi() {
        return kpi;
    }

    public String getMetric() {
        return metric;
    }

    public AlertState getAlertState() {
        return alertState;
    }

    public String getPrediction() {
        return prediction;
    }

    public String getReal() {
        return real;
    }

    public Double getLowerBound() {
        return lowerBound;
    }

    public Double getUpperBound() {
        return upperBound;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRow that))
            return false;
        return kpi.equals(that.kpi)
                && alertState == that.alertState
                && Objects.equals(prediction, that.prediction)
                && Objects.equals(real, that.real)
                && Objects.equals(lowerBound, that.lowerBound)
                && Objects.equals(upperBound, that.upperBound)
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kpi, alertState, prediction, real, lowerBound, upperBound, detail);
    }

    @Override
    public String toString() {
        return metric + " | " + alertState + " | " + prediction + " | " + real
                + " | " + (lowerBound == null ? "-" : lowerBound)
                + " | " + (upperBound == null ? "-" : upperBound)
                + " | " + detail;
    }
}
