package com.kpisentinel.core.model;

/**
 * Native numeric representation of a metric column.
 *
 * <p>
 * Counts (sessions, orders) are {@link #INTEGER}; ratios and amounts are
 * {@link #DECIMAL}. The type drives imputation rounding, prediction rounding
 * and how values are rendered in the alerts table.
 * </p>
 *
 * @since 1.0.0
 */
public enum ValueType {

    INTEGER,
    DECIMAL;

    /**
     * Infer the type of a column from its observed values.
     *
     * @param values column values, {@code null} entries are ignored
     * @return {@link #INTEGER} when every non-null value is integral,
     *         {@link #DECIMAL} otherwise (including an all-null column)
     */
    public static ValueType infer(Double[] values) {
        boolean seen = false;
        for (Double v : values) {
            if (v == null) {
                continue;
            }
            seen = true;
            if (v != Math.rint(v) || Double.isInfinite(v)) {
                return DECIMAL;
            }
        }
        return seen ? INTEGER : DECIMAL;
    }
}
