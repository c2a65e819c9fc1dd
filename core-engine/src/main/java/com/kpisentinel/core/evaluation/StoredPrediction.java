package com.kpisentinel.core.evaluation;

import com.kpisentinel.core.model.ForecastRow;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A forecast row as persisted, together with the date it was issued.
 *
 * @since 1.0.0
 */
public final class StoredPrediction {

    private final LocalDate issuedOn;
    private final LocalDate date;
    private final String metric;
    private final double prediction;

    public StoredPrediction(LocalDate issuedOn, LocalDate date, String metric, double prediction) {
        this.issuedOn = Objects.requireNonNull(issuedOn, "issuedOn must not be null");
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.prediction = prediction;
    }

    public static StoredPrediction of(LocalDate issuedOn, ForecastRow row) {
        return new StoredPrediction(issuedOn, row.getDate(), row.getMetric(), row.getPrediction());
    }

    public LocalDate getIssuedOn() {
        return issuedOn;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getMetric() {
        return metric;
    }

    public double getPrediction() {
        return prediction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoredPrediction that)) {
            return false;
        }
        return Double.compare(prediction, that.prediction) == 0
                && issuedOn.equals(that.issuedOn)
                && date.equals(that.date)
                && metric.equals(that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(issuedOn, date, metric, prediction);
    }

    @Override
    public String toString() {
        return "StoredPrediction{issuedOn=" + issuedOn + ", date=" + date + ", metric='" + metric
                + "', prediction=" + prediction + '}';
    }
}
