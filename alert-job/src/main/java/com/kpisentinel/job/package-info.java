/**
 * Runnable daily job around the detection engine.
 *
 * <ul>
 * <li>{@link com.kpisentinel.job.KpiSentinelJob}: entry point</li>
 * <li>{@link com.kpisentinel.job.JobConfig}: environment-driven settings</li>
 * <li>{@link com.kpisentinel.job.MetricCsvReader}: metric history input</li>
 * <li>{@link com.kpisentinel.job.KafkaAlertPublisher}: alert output</li>
 * <li>{@link com.kpisentinel.job.ForecastStore}: issued forecasts</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.kpisentinel.job;
