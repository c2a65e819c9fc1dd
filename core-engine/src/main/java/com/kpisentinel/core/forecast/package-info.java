/**
 * Pluggable forecasting backends.
 *
 * <p>
 * All backends implement {@link com.kpisentinel.core.forecast.ForecastBackend}
 * and are instantiated via
 * {@link com.kpisentinel.core.forecast.ForecastBackendFactory}:
 * </p>
 * <ul>
 * <li>{@link com.kpisentinel.core.forecast.SeasonalDecompositionBackend}:
 * change-point trend with weekly seasonality</li>
 * <li>{@link com.kpisentinel.core.forecast.AutoRegressiveBackend}: trend plus
 * AR model with weekly seasonal lag</li>
 * <li>{@link com.kpisentinel.core.forecast.ConstraintBackend}: no forecast</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.kpisentinel.core.forecast;
