package com.kpisentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One row of the forecast table: the prediction of a metric for a date.
 *
 * @since 1.0.0
 */
public final class ForecastRow {

    private final LocalDate date;
    private final String metric;
    private final double prediction;

    public ForecastRow(LocalDate date, String metric, double prediction) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.prediction = prediction;
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
        if (this == o)
            return true;
        if (!(o instanceof ForecastRow that))
            return false;
        return date.equals(that.date) && metric.equals(that.metric)
                && Double.compare(prediction, that.prediction) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, metric, prediction);
    }

    @Override
    public String toString() {
        return date + " | " + metric + " | " + prediction;
    }
}
