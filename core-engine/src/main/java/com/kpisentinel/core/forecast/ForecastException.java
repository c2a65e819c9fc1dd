package com.kpisentinel.core.forecast;

/**
 * Raised when a forecasting backend cannot produce a forecast for a metric
 * (too little data, singular system, non-finite output).
 *
 * <p>
 * The failure is local to one metric; the engine turns it into a degraded
 * alert record and continues with the others.
 * </p>
 */
public class ForecastException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
