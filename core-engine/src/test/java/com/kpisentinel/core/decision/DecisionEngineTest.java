package com.kpisentinel.core.decision;

import com.kpisentinel.core.model.AlertRecord;
import com.kpisentinel.core.model.AlertState;
import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ForecastPoint;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.ModelParameters;
import com.kpisentinel.core.model.ValueType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DecisionEngine}.
 */
class DecisionEngineTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 14);

    private final DecisionEngine engine = new DecisionEngine(false);

    @Test
    @DisplayName("Should alert on an actual below the lower bound")
    void shouldAlertOnDecrease() {
        AlertRecord record = decide(engine, numeric("orders"), ValueType.INTEGER, 79.0, band(100, 80, 120));

        assertThat(record.getState()).isEqualTo(AlertState.ALERT);
        assertThat(record.getDetail()).isEqualTo("Decreasing tendency");
        assertThat(record.getPrediction()).isEqualTo(100.0);
        assertThat(record.getLowerBound()).isEqualTo(80.0);
        assertThat(record.getUpperBound()).isEqualTo(120.0);
    }

    @Test
    @DisplayName("Should not alert on values equal to a bound")
    void shouldTreatBoundsAsInside() {
        DecisionEngine withLimsup = new DecisionEngine(true);

        assertThat(decide(withLimsup, numeric("orders"), ValueType.INTEGER, 80.0, band(100, 80, 120)).getState())
                .isEqualTo(AlertState.NO_ALERT);
        assertThat(decide(withLimsup, numeric("orders"), ValueType.INTEGER, 120.0, band(100, 80, 120)).getDetail())
                .isEqualTo("No alert");
    }

    @Test
    @DisplayName("Should alert above the upper bound only when enabled")
    void shouldAlertOnIncreaseOnlyWhenEnabled() {
        AlertRecord disabled = decide(engine, numeric("orders"), ValueType.INTEGER, 121.0, band(100, 80, 120));
        AlertRecord enabled = decide(new DecisionEngine(true), numeric("orders"), ValueType.INTEGER, 121.0,
                band(100, 80, 120));

        assertThat(disabled.getState()).isEqualTo(AlertState.NO_ALERT);
        assertThat(enabled.getState()).isEqualTo(AlertState.ALERT);
        assertThat(enabled.getDetail()).isEqualTo("Increasing tendency");
    }

    @Test
    @DisplayName("Should clamp a negative prediction and its lower bound to zero")
    void shouldClampNegativePrediction() {
        AlertRecord record = decide(engine, numeric("orders"), ValueType.DECIMAL, 0.0, band(-5, -10, 3));

        assertThat(record.getPrediction()).isEqualTo(0.0);
        assertThat(record.getLowerBound()).isEqualTo(0.0);
        assertThat(record.getUpperBound()).isEqualTo(3.0);
        assertThat(record.getState()).isEqualTo(AlertState.NO_ALERT);
    }

    @Test
    @DisplayName("Should force the lower bound to zero when the prediction is zero")
    void shouldZeroLowerBoundForZeroPrediction() {
        AlertRecord record = decide(engine, numeric("orders"), ValueType.DECIMAL, 0.5, band(0, 1, 4));

        assertThat(record.getLowerBound()).isEqualTo(0.0);
        assertThat(record.getState()).isEqualTo(AlertState.NO_ALERT);
    }

    @Test
    @DisplayName("Should report missing data but keep prediction and bounds")
    void shouldReportMissingData() {
        AlertRecord record = decide(engine, numeric("orders"), ValueType.INTEGER, null, band(100.4, 80, 120));

        assertThat(record.getState()).isEqualTo(AlertState.MISSING_DATA);
        assertThat(record.getDetail()).isEqualTo("Missing data");
        assertThat(record.getActual()).isNull();
        assertThat(record.getPrediction()).isEqualTo(100.0);
        assertThat(record.getLowerBound()).isEqualTo(80.0);
    }

    @Test
    @DisplayName("Should disable an alerting metric with sendAlert=false")
    void shouldDisableWhenSendAlertIsFalse() {
        ModelParameters params = numeric("orders");
        params.setSendAlert(false);

        AlertRecord alert = decide(engine, params, ValueType.INTEGER, 10.0, band(100, 80, 120));
        AlertRecord quiet = decide(engine, params, ValueType.INTEGER, 100.0, band(100, 80, 120));
        AlertRecord missing = decide(engine, params, ValueType.INTEGER, null, band(100, 80, 120));

        assertThat(alert.getState()).isEqualTo(AlertState.DISABLED);
        assertThat(alert.getActual()).isEqualTo(10.0);
        assertThat(alert.getPrediction()).isEqualTo(100.0);
        assertThat(quiet.getState()).isEqualTo(AlertState.DISABLED);
        assertThat(missing.getState()).isEqualTo(AlertState.MISSING_DATA);
    }

    @Test
    @DisplayName("Should flag any non-zero constraint value")
    void shouldFlagConstraintViolations() {
        ModelParameters params = new ModelParameters();
        params.setKpi("payment_outage");
        params.setMethod("constraint");
        ForecastResult sentinel = ForecastResult.constraintSentinel();

        AlertRecord violated = engine.decide(params, ValueType.INTEGER, 1.0, sentinel, DATE, List.of());
        AlertRecord clean = engine.decide(params, ValueType.INTEGER, 0.0, sentinel, DATE, List.of());
        AlertRecord missing = engine.decide(params, ValueType.INTEGER, null, sentinel, DATE, List.of());

        assertThat(violated.getState()).isEqualTo(AlertState.ALERT);
        assertThat(violated.getDetail()).isEqualTo("Constraint violated");
        assertThat(violated.getPrediction()).isNull();
        assertThat(violated.getLowerBound()).isNull();
        assertThat(clean.getState()).isEqualTo(AlertState.NO_ALERT);
        assertThat(missing.getState()).isEqualTo(AlertState.MISSING_DATA);
    }

    @Test
    @DisplayName("Should round integer metrics to whole numbers and decimal metrics to three places")
    void shouldRoundByValueType() {
        AlertRecord integer = decide(engine, numeric("orders"), ValueType.INTEGER, 95.0, band(100.5, 80, 120));
        AlertRecord decimal = decide(engine, numeric("rate"), ValueType.DECIMAL, 0.123456, band(0.12345, 0.1, 0.2));

        assertThat(integer.getPrediction()).isEqualTo(101.0);
        assertThat(integer.getActual()).isEqualTo(95.0);
        assertThat(decimal.getPrediction()).isEqualTo(0.123);
        assertThat(decimal.getActual()).isEqualTo(0.123);
    }

    @Test
    @DisplayName("Should apply adjustments to related metrics only, with earlier decisions visible")
    void shouldApplyAdjustmentsToRelatedMetrics() {
        List<List<AlertRecord>> seen = new ArrayList<>();
        PredictionAdjustment widen = (alertsSoFar, metric, band) -> {
            seen.add(alertsSoFar);
            return new PredictionBand(band.getPrediction(), band.getLowerBound() - 50, band.getUpperBound());
        };
        DecisionEngine adjusting = new DecisionEngine(false, List.of(widen));
        AlertRecord earlier = decide(adjusting, numeric("sessions"), ValueType.INTEGER, 1.0, band(100, 80, 120));

        ModelParameters related = numeric("orders");
        related.setIsRelated(true);
        AlertRecord record = adjusting.decide(related, ValueType.INTEGER, 40.0,
                ForecastResult.of(ForecastMethod.AUTOREGRESSIVE, List.of(new ForecastPoint(DATE, 100, 80, 120))),
                DATE, List.of(earlier));

        assertThat(earlier.getState()).isEqualTo(AlertState.ALERT);
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0)).containsExactly(earlier);
        assertThat(record.getLowerBound()).isEqualTo(30.0);
        assertThat(record.getState()).isEqualTo(AlertState.NO_ALERT);
    }

    @Test
    @DisplayName("Should degrade when the forecast has no point for the evaluation date")
    void shouldDegradeWithoutPoint() {
        ForecastResult other = ForecastResult.of(ForecastMethod.AUTOREGRESSIVE,
                List.of(new ForecastPoint(DATE.plusDays(1), 1, 0, 2)));

        AlertRecord record = engine.decide(numeric("orders"), ValueType.INTEGER, 5.0, other, DATE, List.of());

        assertThat(record.getState()).isEqualTo(AlertState.MISSING_DATA);
        assertThat(record.getDetail()).isEqualTo(DecisionEngine.DETAIL_UNAVAILABLE);
        assertThat(record.getActual()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should report missing data before an unusable forecast")
    void shouldPreferMissingDataWithoutPoint() {
        ForecastResult other = ForecastResult.of(ForecastMethod.AUTOREGRESSIVE,
                List.of(new ForecastPoint(DATE.plusDays(1), 1, 0, 2)));

        AlertRecord record = engine.decide(numeric("orders"), ValueType.INTEGER, null, other, DATE, List.of());

        assertThat(record.getState()).isEqualTo(AlertState.MISSING_DATA);
        assertThat(record.getDetail()).isEqualTo(DecisionEngine.DETAIL_MISSING);
        assertThat(record.getActual()).isNull();
    }

    private static AlertRecord decide(DecisionEngine engine, ModelParameters params, ValueType type, Double actual,
            ForecastPoint point) {
        return engine.decide(params, type, actual,
                ForecastResult.of(ForecastMethod.AUTOREGRESSIVE, List.of(point)), DATE, List.of());
    }

    private static ForecastPoint band(double prediction, double lower, double upper) {
        return new ForecastPoint(DATE, prediction, lower, upper);
    }

    private static ModelParameters numeric(String kpi) {
        ModelParameters params = new ModelParameters();
        params.setKpi(kpi);
        params.setMethod("autoregressive");
        return params;
    }
}
