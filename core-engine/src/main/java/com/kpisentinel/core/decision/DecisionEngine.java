package com.kpisentinel.core.decision;

import com.kpisentinel.core.model.AlertRecord;
import com.kpisentinel.core.model.AlertState;
import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ForecastPoint;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.ModelParameters;
import com.kpisentinel.core.model.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the actual value and the forecast of one metric into an
 * {@link AlertRecord}.
 *
 * <h3>Policy</h3>
 * <ol>
 * <li>Missing actual: {@link AlertState#MISSING_DATA}. Numeric prediction and
 * bounds are still recorded.</li>
 * <li>Numeric methods: the band for the evaluation date goes through the
 * adjustment chain (only for {@code isRelated} metrics) and the
 * non-negativity clamp. An actual strictly below the lower bound is a
 * decreasing alert; strictly above the upper bound an increasing alert, if
 * upper alerts are enabled.</li>
 * <li>Constraint: any non-zero actual is a violation.</li>
 * <li>{@code sendAlert = false} turns every non-missing verdict into
 * {@link AlertState#DISABLED}.</li>
 * </ol>
 *
 * <p>
 * Instances are stateless apart from their settings. The "alerts so far" list
 * is passed in by the caller so that decisions stay reproducible.
 * </p>
 *
 * @since 1.0.0
 */
public class DecisionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionEngine.class);

    public static final String DETAIL_DECREASING = "Decreasing tendency";
    public static final String DETAIL_INCREASING = "Increasing tendency";
    public static final String DETAIL_NO_ALERT = "No alert";
    public static final String DETAIL_CONSTRAINT = "Constraint violated";
    public static final String DETAIL_MISSING = "Missing data";
    public static final String DETAIL_UNAVAILABLE = "Forecast unavailable";

    static final int DECIMAL_SCALE = 3;

    private final boolean limsupAlertEnabled;
    private final List<PredictionAdjustment> adjustments;

    public DecisionEngine(boolean limsupAlertEnabled) {
        this(limsupAlertEnabled, PredictionAdjustments.registered());
    }

    public DecisionEngine(boolean limsupAlertEnabled, List<PredictionAdjustment> adjustments) {
        this.limsupAlertEnabled = limsupAlertEnabled;
        this.adjustments = List.copyOf(Objects.requireNonNull(adjustments, "adjustments must not be null"));
    }

    /**
     * Decide the state of one metric.
     *
     * @param params         metric parameters
     * @param valueType      native type of the metric
     * @param actual         observed value on the evaluation date, or
     *                       {@code null} if missing
     * @param forecast       backend output for the metric
     * @param evaluationDate date being judged
     * @param alertsSoFar    records decided earlier in this run
     * @return the immutable record
     */
    public AlertRecord decide(ModelParameters params, ValueType valueType, Double actual,
            ForecastResult forecast, LocalDate evaluationDate, List<AlertRecord> alertsSoFar) {
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(forecast, "forecast must not be null");

        ForecastMethod method = params.forecastMethod();
        AlertRecord.Builder builder = AlertRecord.builder()
                .kpi(params.getKpi())
                .method(method)
                .valueType(valueType);

        AlertState state;
        String detail;

        if (method.isNumeric()) {
            Optional<ForecastPoint> point = forecast.pointAt(evaluationDate);
            if (point.isEmpty()) {
                LOG.warn("Metric [{}]: forecast has no point for {}", params.getKpi(), evaluationDate);
                return unavailable(params, valueType, actual);
            }
            PredictionBand band = new PredictionBand(point.get().getPrediction(),
                    point.get().getLowerBound(), point.get().getUpperBound());
            if (params.getIsRelated()) {
                band = applyAdjustments(alertsSoFar, params.getKpi(), band);
            }
            band = band.clamped();
            builder.prediction(round(band.getPrediction(), valueType))
                    .lowerBound(band.getLowerBound())
                    .upperBound(band.getUpperBound());

            if (actual == null) {
                state = AlertState.MISSING_DATA;
                detail = DETAIL_MISSING;
            } else if (actual < band.getLowerBound()) {
                state = AlertState.ALERT;
                detail = DETAIL_DECREASING;
            } else if (actual > band.getUpperBound() && limsupAlertEnabled) {
                state = AlertState.ALERT;
                detail = DETAIL_INCREASING;
            } else {
                state = AlertState.NO_ALERT;
                detail = DETAIL_NO_ALERT;
            }
        } else {
            if (actual == null) {
                state = AlertState.MISSING_DATA;
                detail = DETAIL_MISSING;
            } else if (actual != 0) {
                state = AlertState.ALERT;
                detail = DETAIL_CONSTRAINT;
            } else {
                state = AlertState.NO_ALERT;
                detail = DETAIL_NO_ALERT;
            }
        }

        if (!params.getSendAlert() && state != AlertState.MISSING_DATA) {
            LOG.debug("Metric [{}]: alerting disabled, {} recorded as DISABLED", params.getKpi(), state);
            state = AlertState.DISABLED;
        }

        return builder.state(state)
                .actual(roundActual(actual, valueType, method))
                .detail(detail)
                .build();
    }

    /**
     * Degraded record for a metric whose forecast could not be produced. A
     * missing actual still reads "Missing data", as it does with a forecast.
     */
    public AlertRecord unavailable(ModelParameters params, ValueType valueType, Double actual) {
        return AlertRecord.builder()
                .kpi(params.getKpi())
                .method(params.forecastMethod())
                .valueType(valueType)
                .state(AlertState.MISSING_DATA)
                .actual(roundActual(actual, valueType, params.forecastMethod()))
                .detail(actual == null ? DETAIL_MISSING : DETAIL_UNAVAILABLE)
                .build();
    }

    private PredictionBand applyAdjustments(List<AlertRecord> alertsSoFar, String metric, PredictionBand band) {
        List<AlertRecord> view = List.copyOf(alertsSoFar);
        PredictionBand current = band;
        for (PredictionAdjustment adjustment : adjustments) {
            current = Objects.requireNonNull(adjustment.adjust(view, metric, current),
                    "Prediction adjustment returned null for metric '" + metric + "'");
        }
        return current;
    }

    // ---------------------------------------------------------------
    // Rounding
    // ---------------------------------------------------------------

    static double round(double value, ValueType valueType) {
        if (valueType == ValueType.INTEGER) {
            return Math.round(value);
        }
        return BigDecimal.valueOf(value).setScale(DECIMAL_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    private static Double roundActual(Double actual, ValueType valueType, ForecastMethod method) {
        if (actual == null || !method.isNumeric()) {
            return actual;
        }
        if (valueType == ValueType.INTEGER) {
            return (double) actual.longValue();
        }
        return round(actual, valueType);
    }
}
