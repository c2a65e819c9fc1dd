package com.kpisentinel.core.model;

import java.util.Locale;

/**
 * Forecasting method configured for a metric.
 *
 * <p>
 * Configuration names are case-insensitive. The names used by earlier metric
 * files ({@code prophet}, {@code arima}) are accepted as aliases.
 * </p>
 *
 * @since 1.0.0
 */
public enum ForecastMethod {

    /** Trend plus weekly seasonality with a confidence band. */
    SEASONAL_DECOMPOSITION("seasonal-decomposition", "prophet"),

    /** Autoregressive model with trend and weekly seasonal lag. */
    AUTOREGRESSIVE("autoregressive", "arima"),

    /** Zero/one violation flag, no forecast. */
    CONSTRAINT("constraint", "constraint");

    private final String configName;
    private final String alias;

    ForecastMethod(String configName, String alias) {
        this.configName = configName;
        this.alias = alias;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * @return {@code true} for methods that produce a numeric forecast
     */
    public boolean isNumeric() {
        return this != CONSTRAINT;
    }

    /**
     * Resolve a configured method name.
     *
     * @param name method name or alias
     * @return matching method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ForecastMethod fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ForecastMethod method : values()) {
                if (method.configName.equals(normalized) || method.alias.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unknown forecast method: '" + name
                + "'. Supported: seasonal-decomposition, autoregressive, constraint");
    }
}
