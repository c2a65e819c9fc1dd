package com.kpisentinel.core.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One metric column of a {@link TimeSeriesFrame}, paired with the frame's
 * dates.
 *
 * <p>
 * Values are nullable; {@code null} marks a missing observation. Instances
 * are immutable: the value array is copied on the way in and on the way out.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final String name;
    private final ValueType valueType;
    private final List<LocalDate> dates;
    private final Double[] values;

    /**
     * @param name      metric identifier
     * @param valueType native representation of the values
     * @param dates     ascending dates, one per value
     * @param values    values aligned with {@code dates}, nullable entries
     * @throws IllegalArgumentException if dates and values differ in length
     */
    public MetricSeries(String name, ValueType valueType, List<LocalDate> dates, Double[] values) {
        this.name = Objects.requireNonNull(name, "Metric name must not be null");
        this.valueType = Objects.requireNonNull(valueType, "Value type must not be null");
        Objects.requireNonNull(dates, "Dates must not be null");
        Objects.requireNonNull(values, "Values must not be null");
        if (dates.size() != values.length) {
            throw new IllegalArgumentException("Metric '" + name + "' has " + values.length
                    + " values for " + dates.size() + " dates");
        }
        this.dates = Collections.unmodifiableList(dates);
        this.values = values.clone();
    }

    public String getName() {
        return name;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    /**
     * @return a copy of the values
     */
    public Double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public Double valueAt(int index) {
        return values[index];
    }

    /**
     * @return {@code true} if no value in the series is defined
     */
    public boolean isEntirelyMissing() {
        for (Double v : values) {
            if (v != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Return a series with the same name, type and dates but new values.
     *
     * @param newValues replacement values
     * @return new series
     */
    public MetricSeries withValues(Double[] newValues) {
        return new MetricSeries(name, valueType, dates, newValues);
    }

    @Override
    public String toString() {
        return "MetricSeries{name='" + name + '\'' + ", valueType=" + valueType
                + ", values=" + Arrays.toString(values) + '}';
    }
}
