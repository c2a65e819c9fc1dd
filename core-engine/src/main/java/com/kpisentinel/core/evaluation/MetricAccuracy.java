package com.kpisentinel.core.evaluation;

import java.util.Objects;

/**
 * Mean absolute percentage error of one metric's stored forecast.
 *
 * @since 1.0.0
 */
public final class MetricAccuracy {

    private final String metric;
    private final double mape;
    private final int samples;

    public MetricAccuracy(String metric, double mape, int samples) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.mape = mape;
        this.samples = samples;
    }

    public String getMetric() {
        return metric;
    }

    /**
     * @return MAPE in percent
     */
    public double getMape() {
        return mape;
    }

    /**
     * @return number of (prediction, actual) pairs the error is based on
     */
    public int getSamples() {
        return samples;
    }

    @Override
    public String toString() {
        return "MetricAccuracy{metric='" + metric + "', mape=" + mape + ", samples=" + samples + '}';
    }
}
