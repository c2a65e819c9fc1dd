package com.kpisentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Forecast for one day: point prediction and confidence band.
 *
 * @since 1.0.0
 */
public final class ForecastPoint {

    private final LocalDate date;
    private final double prediction;
    private final double lowerBound;
    private final double upperBound;

    public ForecastPoint(LocalDate date, double prediction, double lowerBound, double upperBound) {
        this.date = Objects.requireNonNull(date, "Forecast date must not be null");
        this.prediction = prediction;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getPrediction() {
        return prediction;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastPoint that))
            return false;
        return date.equals(that.date)
                && Double.compare(prediction, that.prediction) == 0
                && Double.compare(lowerBound, that.lowerBound) == 0
                && Double.compare(upperBound, that.upperBound) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, prediction, lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return "ForecastPoint{" + date + ", prediction=" + prediction
                + ", band=[" + lowerBound + ", " + upperBound + "]}";
    }
}
