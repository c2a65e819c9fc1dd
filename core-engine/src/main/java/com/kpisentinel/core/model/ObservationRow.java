package com.kpisentinel.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The actual values observed on the evaluation date, one per metric.
 *
 * <p>
 * A {@code null} value means the metric was not reported for that day.
 * </p>
 *
 * @since 1.0.0
 */
public final class ObservationRow {

    private final LocalDate date;
    private final Map<String, Double> actuals;

    public ObservationRow(LocalDate date, Map<String, Double> actuals) {
        this.date = Objects.requireNonNull(date, "Observation date must not be null");
        Objects.requireNonNull(actuals, "Actual values must not be null");
        this.actuals = Collections.unmodifiableMap(new LinkedHashMap<>(actuals));
    }

    public LocalDate getDate() {
        return date;
    }

    /**
     * @param metric metric identifier
     * @return the actual value, or {@code null} if missing or unknown
     */
    public Double actual(String metric) {
        return actuals.get(metric);
    }

    public Map<String, Double> getActuals() {
        return actuals;
    }

    @Override
    public String toString() {
        return "ObservationRow{date=" + date + ", actuals=" + actuals + '}';
    }
}
