package com.kpisentinel.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of a forecast backend for one metric.
 *
 * <p>
 * Points are indexed by date for constant-time lookup and kept in ascending
 * date order. Only dates on or after the evaluation date carry meaning for
 * callers; earlier points are in-sample fits.
 * </p>
 *
 * <p>
 * The constraint method produces a {@linkplain #constraintSentinel() sentinel}
 * result without any points.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastResult {

    private static final ForecastResult CONSTRAINT_SENTINEL =
            new ForecastResult(ForecastMethod.CONSTRAINT, Collections.emptyMap());

    private final ForecastMethod method;
    private final Map<LocalDate, ForecastPoint> points;

    private ForecastResult(ForecastMethod method, Map<LocalDate, ForecastPoint> points) {
        this.method = method;
        this.points = points;
    }

    /**
     * @param method numeric method that produced the points
     * @param points points in ascending date order
     * @return indexed result
     * @throws IllegalArgumentException if points are not strictly ascending
     */
    public static ForecastResult of(ForecastMethod method, List<ForecastPoint> points) {
        Objects.requireNonNull(method, "Forecast method must not be null");
        Objects.requireNonNull(points, "Forecast points must not be null");
        Map<LocalDate, ForecastPoint> indexed = new LinkedHashMap<>();
        LocalDate previous = null;
        for (ForecastPoint point : points) {
            if (previous != null && !point.getDate().isAfter(previous)) {
                throw new IllegalArgumentException("Forecast points must be in ascending date order, found "
                        + point.getDate() + " after " + previous);
            }
            indexed.put(point.getDate(), point);
            previous = point.getDate();
        }
        return new ForecastResult(method, Collections.unmodifiableMap(indexed));
    }

    public static ForecastResult constraintSentinel() {
        return CONSTRAINT_SENTINEL;
    }

    public ForecastMethod getMethod() {
        return method;
    }

    public boolean isSentinel() {
        return method == ForecastMethod.CONSTRAINT;
    }

    public Optional<ForecastPoint> pointAt(LocalDate date) {
        return Optional.ofNullable(points.get(date));
    }

    /**
     * @param from first date to include
     * @return points dated on or after {@code from}, ascending
     */
    public List<ForecastPoint> pointsFrom(LocalDate from) {
        List<ForecastPoint> result = new ArrayList<>();
        for (ForecastPoint point : points.values()) {
            if (!point.getDate().isBefore(from)) {
                result.add(point);
            }
        }
        return result;
    }

    public List<ForecastPoint> getPoints() {
        return List.copyOf(points.values());
    }

    public int size() {
        return points.size();
    }

    @Override
    public String toString() {
        return "ForecastResult{method=" + method + ", points=" + points.size() + '}';
    }
}
