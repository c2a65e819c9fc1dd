package com.kpisentinel.core.table;

import com.kpisentinel.core.model.ForecastPoint;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.ForecastRow;
import com.kpisentinel.core.model.ValueType;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collects the forward-looking rows of every numeric metric into the forecast
 * table.
 *
 * <p>
 * Rows are appended per metric in the order {@link #add} is called; within a
 * metric they run from the evaluation date to the end of the forecast,
 * ascending. Negative predictions become 0 and integer metrics are rounded.
 * Sentinel results contribute nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastTableAssembler {

    private final LocalDate evaluationDate;
    private final List<ForecastRow> rows = new ArrayList<>();

    public ForecastTableAssembler(LocalDate evaluationDate) {
        this.evaluationDate = Objects.requireNonNull(evaluationDate, "evaluationDate must not be null");
    }

    /**
     * @param metric    kpi id written in the metric column
     * @param valueType native type of the metric
     * @param forecast  backend output
     * @return this assembler
     */
    public ForecastTableAssembler add(String metric, ValueType valueType, ForecastResult forecast) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(forecast, "forecast must not be null");
        if (forecast.isSentinel()) {
            return this;
        }
        for (ForecastPoint point : forecast.pointsFrom(evaluationDate)) {
            double prediction = Math.max(0.0, point.getPrediction());
            if (valueType == ValueType.INTEGER) {
                prediction = Math.round(prediction);
            }
            rows.add(new ForecastRow(point.getDate(), metric, prediction));
        }
        return this;
    }

    public List<ForecastRow> build() {
        return Collections.unmodifiableList(new ArrayList<>(rows));
    }
}
