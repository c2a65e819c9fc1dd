package com.kpisentinel.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Daily frame of metric values: one {@code date} axis and one nullable column
 * per metric.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>dates are ascending, unique and consecutive (exactly one row per
 * calendar day)</li>
 * <li>every column has one value per date</li>
 * <li>column order is the metric iteration order of the run</li>
 * </ul>
 *
 * <p>
 * The frame is immutable; transformations return new frames.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesFrame {

    private final List<LocalDate> dates;
    private final Map<String, MetricSeries> columns;

    private TimeSeriesFrame(List<LocalDate> dates, Map<String, MetricSeries> columns) {
        this.dates = dates;
        this.columns = columns;
    }

    /**
     * Build a frame from a date axis and per-metric values.
     *
     * @param dates   consecutive ascending dates
     * @param columns metric columns in iteration order
     * @return validated frame
     * @throws IllegalArgumentException if the dates are not consecutive or a
     *                                  column does not match the date axis
     */
    public static TimeSeriesFrame of(List<LocalDate> dates, List<MetricSeries> columns) {
        Objects.requireNonNull(dates, "Dates must not be null");
        Objects.requireNonNull(columns, "Columns must not be null");
        List<LocalDate> axis = List.copyOf(dates);
        for (int i = 1; i < axis.size(); i++) {
            if (!axis.get(i).equals(axis.get(i - 1).plusDays(1))) {
                throw new IllegalArgumentException("Frame dates must be consecutive days, found "
                        + axis.get(i - 1) + " followed by " + axis.get(i));
            }
        }
        Map<String, MetricSeries> byName = new LinkedHashMap<>();
        for (MetricSeries column : columns) {
            if (!column.getDates().equals(axis)) {
                throw new IllegalArgumentException("Column '" + column.getName()
                        + "' is not aligned with the frame dates");
            }
            if (byName.put(column.getName(), column) != null) {
                throw new IllegalArgumentException("Duplicate metric column: " + column.getName());
            }
        }
        return new TimeSeriesFrame(axis, Collections.unmodifiableMap(byName));
    }

    /**
     * Convenience factory from raw value arrays; value types are inferred.
     *
     * @param dates  consecutive ascending dates
     * @param values metric name to values, in iteration order
     * @return validated frame
     */
    public static TimeSeriesFrame ofValues(List<LocalDate> dates, Map<String, Double[]> values) {
        List<MetricSeries> columns = new ArrayList<>();
        values.forEach((name, v) -> columns.add(new MetricSeries(name, ValueType.infer(v), dates, v)));
        return of(dates, columns);
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    /**
     * @return metric names in iteration order
     */
    public List<String> getMetrics() {
        return List.copyOf(columns.keySet());
    }

    public List<MetricSeries> getColumns() {
        return List.copyOf(columns.values());
    }

    public Optional<MetricSeries> column(String metric) {
        return Optional.ofNullable(columns.get(metric));
    }

    public int rowCount() {
        return dates.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty();
    }

    /**
     * @return the last date of the frame
     * @throws IllegalStateException if the frame is empty
     */
    public LocalDate lastDate() {
        if (dates.isEmpty()) {
            throw new IllegalStateException("Frame has no rows");
        }
        return dates.get(dates.size() - 1);
    }

    /**
     * Split the most recent row out as the observation to be judged.
     *
     * @return the last row's actual values
     * @throws IllegalStateException if the frame is empty
     */
    public ObservationRow lastRow() {
        LocalDate date = lastDate();
        int index = dates.size() - 1;
        Map<String, Double> actuals = new LinkedHashMap<>();
        columns.forEach((name, column) -> actuals.put(name, column.valueAt(index)));
        return new ObservationRow(date, actuals);
    }

    /**
     * @return this frame without its most recent row (the modeling window)
     * @throws IllegalStateException if the frame is empty
     */
    public TimeSeriesFrame withoutLastRow() {
        if (dates.isEmpty()) {
            throw new IllegalStateException("Frame has no rows");
        }
        int keep = dates.size() - 1;
        List<LocalDate> head = dates.subList(0, keep);
        List<MetricSeries> trimmed = new ArrayList<>();
        for (MetricSeries column : columns.values()) {
            Double[] values = new Double[keep];
            for (int i = 0; i < keep; i++) {
                values[i] = column.valueAt(i);
            }
            trimmed.add(new MetricSeries(column.getName(), column.getValueType(), head, values));
        }
        return of(head, trimmed);
    }

    /**
     * Replace every column through the given mapper, keeping order.
     *
     * @param mapper column transformation
     * @return new frame
     */
    public TimeSeriesFrame mapColumns(UnaryOperator<MetricSeries> mapper) {
        List<MetricSeries> mapped = new ArrayList<>();
        for (MetricSeries column : columns.values()) {
            mapped.add(mapper.apply(column));
        }
        return of(dates, mapped);
    }

    @Override
    public String toString() {
        return "TimeSeriesFrame{rows=" + dates.size() + ", metrics=" + columns.keySet() + '}';
    }
}
