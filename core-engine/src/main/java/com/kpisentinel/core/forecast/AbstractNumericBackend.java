package com.kpisentinel.core.forecast;

import com.kpisentinel.core.model.ForecastPoint;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.ModelParameters;

import java.util.Objects;

/**
 * Shared plumbing of the backends that produce numeric forecasts.
 */
abstract class AbstractNumericBackend implements ForecastBackend {

    protected final String metric;
    protected final int confidenceLevel;

    protected AbstractNumericBackend(ModelParameters params) {
        Objects.requireNonNull(params, "ModelParameters must not be null");
        this.metric = Objects.requireNonNull(params.getKpi(), "Metric name must not be null");
        this.confidenceLevel = params.confidenceLevel();
        if (confidenceLevel < 1 || confidenceLevel > 99) {
            throw new IllegalArgumentException("confidenceInterval must be in [1, 99] for metric '"
                    + metric + "', got: " + confidenceLevel);
        }
    }

    /**
     * @param history   modeling window
     * @param minimum   minimum number of observations the model needs
     * @return the values as primitives
     * @throws ForecastException if a value is missing or the window is too short
     */
    protected double[] requireComplete(MetricSeries history, int minimum) {
        Objects.requireNonNull(history, "History must not be null");
        if (history.size() < minimum) {
            throw new ForecastException("Metric '" + metric + "' needs at least " + minimum
                    + " observations, got " + history.size());
        }
        double[] y = new double[history.size()];
        for (int i = 0; i < y.length; i++) {
            Double v = history.valueAt(i);
            if (v == null) {
                throw new ForecastException("Metric '" + metric + "' has a missing value on "
                        + history.getDates().get(i) + " after imputation");
            }
            y[i] = v;
        }
        return y;
    }

    /**
     * Abort the fit once the worker running it has been interrupted.
     *
     * @throws ForecastException if the current thread is interrupted
     */
    protected void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ForecastException("Metric '" + metric + "': fit cancelled");
        }
    }

    protected ForecastPoint checkedPoint(ForecastPoint point) {
        if (!Double.isFinite(point.getPrediction())
                || !Double.isFinite(point.getLowerBound())
                || !Double.isFinite(point.getUpperBound())) {
            throw new ForecastException("Metric '" + metric + "' produced a non-finite forecast on "
                    + point.getDate());
        }
        return point;
    }
}
