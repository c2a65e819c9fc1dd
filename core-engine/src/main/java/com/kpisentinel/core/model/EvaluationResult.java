package com.kpisentinel.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Final output of one engine run: the formatted alerts table and, when
 * requested, the forecast table.
 *
 * @since 1.0.0
 */
public final class EvaluationResult {

    private final LocalDate evaluationDate;
    private final List<AlertRecord> records;
    private final List<AlertRow> alerts;
    private final List<ForecastRow> forecast;

    public EvaluationResult(LocalDate evaluationDate, List<AlertRecord> records, List<AlertRow> alerts,
            List<ForecastRow> forecast) {
        this.evaluationDate = Objects.requireNonNull(evaluationDate, "evaluationDate must not be null");
        this.records = List.copyOf(records);
        this.alerts = List.copyOf(alerts);
        this.forecast = forecast != null ? List.copyOf(forecast) : null;
    }

    public LocalDate getEvaluationDate() {
        return evaluationDate;
    }

    /**
     * @return the unformatted decisions, in metric order
     */
    public List<AlertRecord> getRecords() {
        return records;
    }

    /**
     * @return the alerts table, in metric order
     */
    public List<AlertRow> getAlerts() {
        return alerts;
    }

    /**
     * @return only the rows in state {@link AlertState#ALERT}
     */
    public List<AlertRow> onlyAlerts() {
        return alerts.stream()
                .filter(row -> row.getAlertState() == AlertState.ALERT)
                .toList();
    }

    /**
     * @return the forecast table, or empty if future predictions were not
     *         requested
     */
    public Optional<List<ForecastRow>> getForecast() {
        return Optional.ofNullable(forecast);
    }

    @Override
    public String toString() {
        return "EvaluationResult{date=" + evaluationDate + ", alerts=" + alerts.size()
                + ", forecastRows=" + (forecast == null ? "n/a" : forecast.size()) + '}';
    }
}
