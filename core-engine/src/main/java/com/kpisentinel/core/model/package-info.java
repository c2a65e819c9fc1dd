/**
 * Domain model classes for KPI Sentinel.
 *
 * <ul>
 * <li>{@link com.kpisentinel.core.model.TimeSeriesFrame} and
 * {@link com.kpisentinel.core.model.ObservationRow}: daily metric history and
 * the day being judged</li>
 * <li>{@link com.kpisentinel.core.model.ModelParameters}: per-metric
 * configuration POJO</li>
 * <li>{@link com.kpisentinel.core.model.ForecastResult}: backend output</li>
 * <li>{@link com.kpisentinel.core.model.AlertRecord} and
 * {@link com.kpisentinel.core.model.AlertRow}: decision and its rendered
 * row</li>
 * <li>{@link com.kpisentinel.core.model.ForecastRow}: forward-looking
 * prediction row</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.kpisentinel.core.model;
