package com.kpisentinel.core.decision;

import java.util.Objects;

/**
 * Point prediction with its confidence band for a single evaluation date.
 *
 * @since 1.0.0
 */
public final class PredictionBand {

    private final double prediction;
    private final double lowerBound;
    private final double upperBound;

    public PredictionBand(double prediction, double lowerBound, double upperBound) {
        this.prediction = prediction;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
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

    /**
     * Apply the non-negativity rules, in order:
     * <ol>
     * <li>a negative prediction becomes 0</li>
     * <li>a zero prediction forces the lower bound to 0</li>
     * <li>negative bounds become 0</li>
     * </ol>
     *
     * @return the clamped band
     */
    public PredictionBand clamped() {
        double p = prediction < 0 ? 0.0 : prediction;
        double lower = lowerBound < 0 || p == 0 ? 0.0 : lowerBound;
        double upper = upperBound < 0 ? 0.0 : upperBound;
        return new PredictionBand(p, lower, upper);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PredictionBand that)) {
            return false;
        }
        return Double.compare(prediction, that.prediction) == 0
                && Double.compare(lowerBound, that.lowerBound) == 0
                && Double.compare(upperBound, that.upperBound) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prediction, lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return "PredictionBand{prediction=" + prediction + ", lower=" + lowerBound + ", upper=" + upperBound + '}';
    }
}
