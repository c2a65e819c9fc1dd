/**
 * Configuration loading and validation for KPI Sentinel.
 *
 * <p>
 * Per-metric parameters are defined in YAML and loaded by
 * {@link com.kpisentinel.core.config.ModelParametersLoader} into a
 * {@link com.kpisentinel.core.config.ModelParametersConfig}. Run-wide switches
 * live in {@link com.kpisentinel.core.config.EngineSettings}.
 * </p>
 *
 * @since 1.0.0
 */
package com.kpisentinel.core.config;
