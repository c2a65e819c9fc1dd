package com.kpisentinel.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.kpisentinel.core.model.AlertRow;
import com.kpisentinel.core.model.AlertState;

import java.time.LocalDate;
import java.util.Objects;

/**
 * JSON payload published for one row of the alerts table.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "runDate", "kpi", "metric", "alertState", "prediction", "real",
        "lowerBound", "upperBound", "detail" })
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class AlertMessage {

    private final LocalDate runDate;
    private final AlertRow row;

    public AlertMessage(LocalDate runDate, AlertRow row) {
        this.runDate = Objects.requireNonNull(runDate, "runDate must not be null");
        this.row = Objects.requireNonNull(row, "row must not be null");
    }

    public LocalDate getRunDate() {
        return runDate;
    }

    public String getKpi() {
        return row.getKpi();
    }

    public String getMetric() {
        return row.getMetric();
    }

    public AlertState getAlertState() {
        return row.getAlertState();
    }

    public String getPrediction() {
        return row.getPrediction();
    }

    public String getReal() {
        return row.getReal();
    }

    public Double getLowerBound() {
        return row.getLowerBound();
    }

    public Double getUpperBound() {
        return row.getUpperBound();
    }

    public String getDetail() {
        return row.getDetail();
    }
}
