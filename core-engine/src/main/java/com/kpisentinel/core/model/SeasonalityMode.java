package com.kpisentinel.core.model;

import java.util.Locale;

/**
 * How the weekly seasonal component combines with the trend.
 *
 * @since 1.0.0
 */
public enum SeasonalityMode {

    ADDITIVE,
    MULTIPLICATIVE;

    /**
     * @param name {@code additive} or {@code multiplicative}, any case
     * @return matching mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SeasonalityMode fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (SeasonalityMode mode : values()) {
                if (mode.name().equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown seasonality mode: '" + name
                + "'. Supported: additive, multiplicative");
    }
}
