package com.kpisentinel.core.engine;

import com.kpisentinel.core.config.EngineSettings;
import com.kpisentinel.core.decision.PredictionAdjustment;
import com.kpisentinel.core.decision.PredictionAdjustments;
import com.kpisentinel.core.forecast.ForecastBackend;
import com.kpisentinel.core.forecast.ForecastBackendFactory;
import com.kpisentinel.core.forecast.ForecastException;
import com.kpisentinel.core.model.AlertRecord;
import com.kpisentinel.core.model.AlertRow;
import com.kpisentinel.core.model.AlertState;
import com.kpisentinel.core.model.EvaluationResult;
import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ForecastPoint;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.ForecastRow;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.ModelParameters;
import com.kpisentinel.core.model.TimeSeriesFrame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertDetectionEngine}, mostly with stub backends.
 */
class AlertDetectionEngineTest {

    private static final LocalDate START = LocalDate.of(2024, 4, 1);
    private static final int HISTORY_DAYS = 14;
    private static final LocalDate EVALUATION = START.plusDays(HISTORY_DAYS);

    @Test
    @DisplayName("Should decide every metric in configuration order")
    void shouldDecideEveryMetric() {
        TimeSeriesFrame frame = frame(Map.of("orders", 60.0, "outage", 1.0));
        List<ModelParameters> params = List.of(params("orders", "autoregressive"), params("outage", "constraint"));

        EvaluationResult result = engine(settings(false), stubs()).run(frame, params);

        assertThat(result.getEvaluationDate()).isEqualTo(EVALUATION);
        assertThat(result.getRecords()).extracting(AlertRecord::getKpi).containsExactly("orders", "outage");
        assertThat(result.getAlerts()).extracting(AlertRow::getAlertState)
                .containsExactly(AlertState.ALERT, AlertState.ALERT);
        assertThat(result.getAlerts().get(0).getDetail()).isEqualTo("Decreasing tendency");
        assertThat(result.getAlerts().get(0).getPrediction()).isEqualTo("100");
        assertThat(result.getAlerts().get(1).getReal()).isEqualTo("Yes");
        assertThat(result.onlyAlerts()).hasSize(2);
        assertThat(result.getForecast()).isEmpty();
    }

    @Test
    @DisplayName("Should assemble the forecast table when future predictions are requested")
    void shouldAssembleForecastTable() {
        TimeSeriesFrame frame = frame(Map.of("orders", 100.0, "outage", 0.0));
        List<ModelParameters> params = List.of(params("orders", "autoregressive"), params("outage", "constraint"));

        EvaluationResult result = engine(settings(true), stubs()).run(frame, params);

        List<ForecastRow> forecast = result.getForecast().orElseThrow();
        assertThat(forecast).hasSize(16);
        assertThat(forecast.get(0)).isEqualTo(new ForecastRow(EVALUATION, "orders", 100.0));
        assertThat(forecast).extracting(ForecastRow::getMetric).containsOnly("orders");
        assertThat(result.onlyAlerts()).isEmpty();
    }

    @Test
    @DisplayName("Should degrade failing and timed-out metrics without stopping the run")
    void shouldDegradeFailingMetrics() {
        TimeSeriesFrame frame = frame(Map.of("broken", 5.0, "slow", 5.0, "orders", 100.0));
        List<ModelParameters> params = List.of(params("broken", "autoregressive"),
                params("slow", "autoregressive"), params("orders", "autoregressive"));
        EngineSettings settings = EngineSettings.builder()
                .parallelism(3)
                .fitTimeout(Duration.ofMillis(300))
                .sendFuturePredictions(true)
                .build();

        EvaluationResult result = engine(settings, stubs()).run(frame, params);

        assertThat(result.getRecords()).extracting(AlertRecord::getState)
                .containsExactly(AlertState.MISSING_DATA, AlertState.NO_ALERT, AlertState.MISSING_DATA);
        assertThat(result.getRecords().get(0).getDetail()).isEqualTo("Forecast unavailable");
        assertThat(result.getRecords().get(2).getDetail()).isEqualTo("Forecast unavailable");
        assertThat(result.getForecast().orElseThrow()).extracting(ForecastRow::getMetric).containsOnly("orders");
    }

    @Test
    @DisplayName("Should keep later metrics on time when a fit ignores its timeout")
    void shouldIsolateFitThatIgnoresTimeout() {
        TimeSeriesFrame frame = frame(Map.of("a_stuck", 100.0, "b_orders", 100.0, "c_orders", 100.0));
        List<ModelParameters> params = List.of(params("a_stuck", "autoregressive"),
                params("b_orders", "autoregressive"), params("c_orders", "autoregressive"));
        EngineSettings settings = EngineSettings.builder()
                .parallelism(1)
                .fitTimeout(Duration.ofMillis(300))
                .build();

        EvaluationResult result = engine(settings, stubs()).run(frame, params);

        assertThat(result.getRecords()).extracting(AlertRecord::getState)
                .containsExactly(AlertState.MISSING_DATA, AlertState.NO_ALERT, AlertState.NO_ALERT);
        assertThat(result.getRecords().get(0).getDetail()).isEqualTo("Forecast unavailable");
    }

    @Test
    @DisplayName("Should reject two parameter entries for the same metric")
    void shouldRejectDuplicateParameters() {
        TimeSeriesFrame frame = frame(Map.of("orders", 100.0));
        List<ModelParameters> params = List.of(params("orders", "autoregressive"), params("orders", "constraint"));

        assertThatThrownBy(() -> engine(settings(false), stubs()).run(frame, params))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate")
                .hasMessageContaining("orders");
    }

    @Test
    @DisplayName("Should report a missing observation as missing data")
    void shouldReportMissingObservation() {
        Map<String, Double> observed = new LinkedHashMap<>();
        observed.put("orders", null);
        TimeSeriesFrame frame = frame(observed);

        EvaluationResult result = engine(settings(false), stubs())
                .run(frame, List.of(params("orders", "autoregressive")));

        AlertRow row = result.getAlerts().get(0);
        assertThat(row.getAlertState()).isEqualTo(AlertState.MISSING_DATA);
        assertThat(row.getReal()).isEqualTo("No data");
        assertThat(row.getPrediction()).isEqualTo("100");
    }

    @Test
    @DisplayName("Should let adjustments see earlier decisions in metric order")
    void shouldPassEarlierDecisionsToAdjustments() {
        List<String> seenBefore = Collections.synchronizedList(new ArrayList<>());
        PredictionAdjustment recorder = (alertsSoFar, metric, band) -> {
            alertsSoFar.forEach(r -> seenBefore.add(metric + "<-" + r.getKpi()));
            return band;
        };
        TimeSeriesFrame frame = frame(Map.of("a", 100.0, "b", 100.0, "c", 100.0));
        List<ModelParameters> params = new ArrayList<>();
        for (String kpi : List.of("a", "b", "c")) {
            ModelParameters p = params(kpi, "autoregressive");
            p.setIsRelated(true);
            params.add(p);
        }
        EngineSettings settings = EngineSettings.builder().parallelism(3).build();

        new AlertDetectionEngine(settings, List.of(recorder), stubs()).run(frame, params);

        assertThat(seenBefore).containsExactly("b<-a", "c<-a", "c<-b");
    }

    @Test
    @DisplayName("Should abort when a metric has no history at all")
    void shouldAbortOnEmptyHistory() {
        List<LocalDate> dates = dates();
        Double[] values = new Double[dates.size()];
        values[values.length - 1] = 3.0;
        TimeSeriesFrame frame = TimeSeriesFrame.ofValues(dates, Map.of("orders", values));

        assertThatThrownBy(() -> engine(settings(false), stubs()).run(frame, List.of(params("orders", "autoregressive"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("orders");
    }

    @Test
    @DisplayName("Should abort when a metric has no parameters and ignore parameters without data")
    void shouldRequireParametersForEveryMetric() {
        TimeSeriesFrame frame = frame(Map.of("orders", 100.0));

        assertThatThrownBy(() -> engine(settings(false), stubs()).run(frame, List.of(params("other", "constraint"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No model parameters");

        EvaluationResult result = engine(settings(false), stubs())
                .run(frame, List.of(params("orders", "autoregressive"), params("other", "constraint")));
        assertThat(result.getRecords()).hasSize(1);
    }

    @Test
    @DisplayName("Should abort on an unknown method")
    void shouldAbortOnUnknownMethod() {
        TimeSeriesFrame frame = frame(Map.of("orders", 100.0));

        assertThatThrownBy(() -> engine(settings(false), stubs()).run(frame, List.of(params("orders", "holt-winters"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("holt-winters");
    }

    @Test
    @DisplayName("Should run end to end with the built-in backends")
    void shouldRunWithBuiltInBackends() {
        List<LocalDate> dates = new ArrayList<>();
        Double[] sessions = new Double[43];
        Double[] outage = new Double[43];
        for (int i = 0; i < 43; i++) {
            dates.add(START.plusDays(i));
            sessions[i] = 1000.0 + 10 * i + (i % 7 == 0 ? 150 : 0);
            outage[i] = 0.0;
        }
        sessions[20] = null;
        outage[42] = 1.0;
        Map<String, Double[]> values = new LinkedHashMap<>();
        values.put("daily_sessions", sessions);
        values.put("payment_outage", outage);
        TimeSeriesFrame frame = TimeSeriesFrame.ofValues(dates, values);
        ModelParameters sd = params("daily_sessions", "seasonal-decomposition");
        sd.setConfidenceInterval(95);
        sd.setSeasonalityMode("additive");

        EvaluationResult result = new AlertDetectionEngine(settings(true))
                .run(frame, List.of(sd, params("payment_outage", "constraint")));

        assertThat(result.getEvaluationDate()).isEqualTo(LocalDate.of(2024, 5, 13));
        assertThat(result.getAlerts()).extracting(AlertRow::getMetric)
                .containsExactly("daily sessions", "payment outage");
        assertThat(result.getAlerts().get(1).getAlertState()).isEqualTo(AlertState.ALERT);
        assertThat(result.getForecast().orElseThrow()).hasSize(19)
                .allSatisfy(row -> assertThat(row.getPrediction()).isNotNegative());
    }

    // ---------------------------------------------------------------
    // Fixtures
    // ---------------------------------------------------------------

    private static AlertDetectionEngine engine(EngineSettings settings,
            Function<ModelParameters, ForecastBackend> backends) {
        return new AlertDetectionEngine(settings, PredictionAdjustments.registered(), backends);
    }

    private static EngineSettings settings(boolean futurePredictions) {
        return EngineSettings.builder()
                .limsupAlertEnabled(true)
                .sendFuturePredictions(futurePredictions)
                .build();
    }

    /**
     * "broken" throws, "slow" never finishes in time, "a_stuck" spins past its
     * timeout without looking at interrupts, constraints return the sentinel
     * and every other metric predicts a flat 100 within [80, 120].
     */
    private static Function<ModelParameters, ForecastBackend> stubs() {
        return params -> {
            if (params.forecastMethod() == ForecastMethod.CONSTRAINT) {
                return ForecastBackendFactory.create(params);
            }
            return new StubBackend(params.getKpi());
        };
    }

    private static final class StubBackend implements ForecastBackend {
        private final String metric;

        private StubBackend(String metric) {
            this.metric = metric;
        }

        @Override
        public ForecastResult forecast(MetricSeries history, LocalDate evaluationDate) {
            if (metric.equals("broken")) {
                throw new ForecastException("did not converge");
            }
            if (metric.equals("slow")) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new ForecastException("interrupted");
            }
            if (metric.equals("a_stuck")) {
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(900);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
            }
            List<ForecastPoint> points = new ArrayList<>();
            for (LocalDate d = evaluationDate; !d.isAfter(LocalDate.of(2024, 4, 30)); d = d.plusDays(1)) {
                points.add(new ForecastPoint(d, 100, 80, 120));
            }
            return ForecastResult.of(ForecastMethod.AUTOREGRESSIVE, points);
        }

        @Override
        public ForecastMethod getMethod() {
            return ForecastMethod.AUTOREGRESSIVE;
        }
    }

    private static List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 0; i <= HISTORY_DAYS; i++) {
            dates.add(START.plusDays(i));
        }
        return dates;
    }

    /**
     * Flat history of 100 per metric followed by the given observation;
     * metrics are ordered by name.
     */
    private static TimeSeriesFrame frame(Map<String, Double> observed) {
        List<LocalDate> dates = dates();
        Map<String, Double[]> values = new LinkedHashMap<>();
        new TreeMap<>(observed).forEach((metric, actual) -> {
            Double[] column = new Double[dates.size()];
            Arrays.fill(column, 100.0);
            column[column.length - 1] = actual;
            values.put(metric, column);
        });
        return TimeSeriesFrame.ofValues(dates, values);
    }

    private static ModelParameters params(String kpi, String method) {
        ModelParameters params = new ModelParameters();
        params.setKpi(kpi);
        params.setMethod(method);
        return params;
    }
}
