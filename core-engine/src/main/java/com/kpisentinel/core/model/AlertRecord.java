package com.kpisentinel.core.model;

import java.util.Objects;

/**
 * Decision taken for one metric in one run.
 *
 * <p>
 * Values are kept numeric; rendering to text happens in the formatting step.
 * {@code prediction}, {@code lowerBound} and {@code upperBound} are
 * {@code null} for the constraint method, {@code actual} is {@code null} when
 * the metric was not reported on the evaluation date.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code kpi}, {@code method}, {@code valueType},
 * {@code state} and {@code detail} are required; omitting any of them throws
 * a {@link NullPointerException} at build time. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRecord {

    private final String kpi;
    private final ForecastMethod method;
    private final ValueType valueType;
    private final AlertState state;
    private final Double prediction;
    private final Double actual;
    private final Double lowerBound;
    private final Double upperBound;
    private final String detail;

    private AlertRecord(Builder builder) {
        this.kpi = Objects.requireNonNull(builder.kpi, "kpi must not be null");
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.valueType = Objects.requireNonNull(builder.valueType, "valueType must not be null");
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        this.detail = Objects.requireNonNull(builder.detail, "detail must not be null");
        this.prediction = builder.prediction;
        this.actual = builder.actual;
        this.lowerBound = builder.lowerBound;
        this.upperBound = builder.upperBound;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertRecord} instances.
     */
    public static class Builder {
        private String kpi;
        private ForecastMethod method;
        private ValueType valueType;
        private AlertState state;
        private Double prediction;
        private Double actual;
        private Double lowerBound;
        private Double upperBound;
        private String detail;

        public Builder kpi(String kpi) {
            this.kpi = kpi;
            return this;
        }

        public Builder method(ForecastMethod method) {
            this.method = method;
            return this;
        }

        public Builder valueType(ValueType valueType) {
            this.valueType = valueType;
            return this;
        }

        public Builder state(AlertState state) {
            this.state = state;
            return this;
        }

        public Builder prediction(Double prediction) {
            this.prediction = prediction;
            return this;
        }

        public Builder actual(Double actual) {
            this.actual = actual;
            return this;
        }

        public Builder lowerBound(Double lowerBound) {
            this.lowerBound = lowerBound;
            return this;
        }

        public Builder upperBound(Double upperBound) {
            this.upperBound = upperBound;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public AlertRecord build() {
            return new AlertRecord(this);
        }
    }

    public String getKpi() {
        return kpi;
    }

    /**
     * @return the metric identifier with underscores shown as spaces
     */
    public String getMetric() {
        return kpi.replace('_', ' ');
    }

    public ForecastMethod getMethod() {
        return method;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public AlertState getState() {
        return state;
    }

    public Double getPrediction() {
        return prediction;
    }

    public Double getActual() {
        return actual;
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

    public boolean isAlert() {
        return state == AlertState.ALERT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRecord that))
            return false;
        return kpi.equals(that.kpi)
                && method == that.method
                && state == that.state
                && Objects.equals(prediction, that.prediction)
                && Objects.equals(actual, that.actual)
                && Objects.equals(lowerBound, that.lowerBound)
                && Objects.equals(upperBound, that.upperBound)
                && detail.equals(that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kpi, method, state, prediction, actual, lowerBound, upperBound, detail);
    }

    @Override
    public String toString() {
        return "AlertRecord{" +
                "kpi='" + kpi + '\'' +
                ", state=" + state +
                ", prediction=" + prediction +
                ", actual=" + actual +
                ", band=[" + lowerBound + ", " + upperBound + ']' +
                ", detail='" + detail + '\'' +
                '}';
    }
}
