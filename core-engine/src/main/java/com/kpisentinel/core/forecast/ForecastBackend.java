package com.kpisentinel.core.forecast;

import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.MetricSeries;

import java.time.LocalDate;

/**
 * Contract for all forecasting backends.
 *
 * <p>
 * A backend is bound to one metric's parameters and is stateless between
 * calls, so fits for different metrics may run concurrently on separate
 * instances.
 * </p>
 */
public interface ForecastBackend {

    /**
     * Fit the cleaned history and forecast through the end of the evaluation
     * date's month.
     *
     * @param history        imputed modeling window, no missing values
     * @param evaluationDate day whose actual value will be judged
     * @return forecast covering at least {@code evaluationDate} through the
     *         last day of its month
     * @throws ForecastException if the model cannot be fitted
     */
    ForecastResult forecast(MetricSeries history, LocalDate evaluationDate);

    /**
     * @return the method implemented by this backend
     */
    ForecastMethod getMethod();
}
