package com.kpisentinel.core.forecast;

import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.MetricSeries;

import java.time.LocalDate;

/**
 * Backend for zero/one constraint metrics: nothing is fitted, the decision is
 * taken on the actual value alone.
 *
 * @since 1.0.0
 */
public class ConstraintBackend implements ForecastBackend {

    @Override
    public ForecastResult forecast(MetricSeries history, LocalDate evaluationDate) {
        return ForecastResult.constraintSentinel();
    }

    @Override
    public ForecastMethod getMethod() {
        return ForecastMethod.CONSTRAINT;
    }
}
