package com.kpisentinel.core.engine;

import com.kpisentinel.core.config.EngineSettings;
import com.kpisentinel.core.decision.DecisionEngine;
import com.kpisentinel.core.decision.PredictionAdjustment;
import com.kpisentinel.core.decision.PredictionAdjustments;
import com.kpisentinel.core.format.ResultFormatter;
import com.kpisentinel.core.forecast.ForecastBackend;
import com.kpisentinel.core.forecast.ForecastBackendFactory;
import com.kpisentinel.core.imputation.Imputer;
import com.kpisentinel.core.model.AlertRecord;
import com.kpisentinel.core.model.AlertRow;
import com.kpisentinel.core.model.EvaluationResult;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.ForecastRow;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.ModelParameters;
import com.kpisentinel.core.model.ObservationRow;
import com.kpisentinel.core.model.TimeSeriesFrame;
import com.kpisentinel.core.table.ForecastTableAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs one evaluation of every configured metric.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>The most recent row of the frame is split out as the observation; the
 * rest is the modeling window.</li>
 * <li>The window is cleaned: outliers removed, gaps filled.</li>
 * <li>One backend per metric is fitted, at most
 * {@link EngineSettings#getParallelism()} at a time. Each fit has its own
 * {@link EngineSettings#getFitTimeout()} deadline counted from its start; a
 * fit past its deadline is interrupted and its slot goes to the next metric,
 * so a fit that ignores the interrupt cannot hold up the others. Results are
 * collected in metric order.</li>
 * <li>Decisions are taken sequentially in metric order, so adjustments see a
 * deterministic list of earlier decisions.</li>
 * <li>The alerts table is formatted and the forecast table assembled.</li>
 * </ol>
 *
 * <h3>Failures</h3>
 * <p>
 * Fatal for the whole run ({@link IllegalStateException} or
 * {@link IllegalArgumentException}): a frame metric without parameters, an
 * unknown method, invalid parameters, a metric whose cleaned history is
 * entirely missing. A backend that throws or exceeds its timeout only
 * degrades its own metric to a "Forecast unavailable" record.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDetectionEngine.class);

    private final EngineSettings settings;
    private final DecisionEngine decisionEngine;
    private final Function<ModelParameters, ForecastBackend> backendFactory;
    private final Imputer imputer = new Imputer();

    public AlertDetectionEngine(EngineSettings settings) {
        this(settings, PredictionAdjustments.registered(), ForecastBackendFactory::create);
    }

    /**
     * @param settings       run-wide settings
     * @param adjustments    adjustment chain for related metrics
     * @param backendFactory creates the backend of a metric
     */
    public AlertDetectionEngine(EngineSettings settings, List<PredictionAdjustment> adjustments,
            Function<ModelParameters, ForecastBackend> backendFactory) {
        this.settings = Objects.requireNonNull(settings, "EngineSettings must not be null");
        this.decisionEngine = new DecisionEngine(settings.isLimsupAlertEnabled(), adjustments);
        this.backendFactory = Objects.requireNonNull(backendFactory, "Backend factory must not be null");
    }

    /**
     * @param frame      history including the observation row as its last row
     * @param parameters one entry per metric of the frame
     * @return the formatted result
     * @throws IllegalStateException    on missing parameters or an entirely
     *                                  missing history
     * @throws IllegalArgumentException on an unknown method or invalid
     *                                  parameters
     */
    public EvaluationResult run(TimeSeriesFrame frame, List<ModelParameters> parameters) {
        Objects.requireNonNull(frame, "Frame must not be null");
        Objects.requireNonNull(parameters, "Model parameters must not be null");
        if (frame.rowCount() < 2) {
            throw new IllegalStateException("Frame needs at least one history row and the observation row, got "
                    + frame.rowCount() + " row(s)");
        }

        Map<String, ModelParameters> byMetric = resolveParameters(frame, parameters);

        ObservationRow observation = frame.lastRow();
        LocalDate evaluationDate = observation.getDate();
        TimeSeriesFrame history = imputer.fillGaps(imputer.removeOutliers(frame.withoutLastRow()));

        for (MetricSeries column : history.getColumns()) {
            if (column.isEntirelyMissing()) {
                throw new IllegalStateException("Metric '" + column.getName()
                        + "' has no data in the modeling window ending " + history.lastDate());
            }
        }

        Map<String, ForecastBackend> backends = new LinkedHashMap<>();
        byMetric.forEach((metric, params) -> backends.put(metric, backendFactory.apply(params)));

        LOG.info("Evaluating {} metric(s) for {} on {} history day(s)",
                byMetric.size(), evaluationDate, history.rowCount());

        Map<String, ForecastResult> forecasts = fitAll(history, backends, evaluationDate);

        List<AlertRecord> records = new ArrayList<>();
        ForecastTableAssembler assembler = new ForecastTableAssembler(evaluationDate);
        for (Map.Entry<String, ModelParameters> entry : byMetric.entrySet()) {
            String metric = entry.getKey();
            ModelParameters params = entry.getValue();
            MetricSeries column = history.column(metric).orElseThrow();
            Double actual = observation.actual(metric);
            ForecastResult forecast = forecasts.get(metric);

            AlertRecord record;
            if (forecast == null) {
                record = decisionEngine.unavailable(params, column.getValueType(), actual);
            } else {
                record = decisionEngine.decide(params, column.getValueType(), actual, forecast,
                        evaluationDate, records);
                assembler.add(metric, column.getValueType(), forecast);
            }
            if (record.isAlert()) {
                LOG.info("Alert: metric={} detail={}", metric, record.getDetail());
            }
            records.add(record);
        }

        List<AlertRow> alerts = ResultFormatter.format(records);
        List<ForecastRow> forecastTable = settings.isSendFuturePredictions() ? assembler.build() : null;
        EvaluationResult result = new EvaluationResult(evaluationDate, records, alerts, forecastTable);
        LOG.info("Run for {} finished: {} alert(s) out of {} metric(s)",
                evaluationDate, result.onlyAlerts().size(), records.size());
        return result;
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private static Map<String, ModelParameters> resolveParameters(TimeSeriesFrame frame,
            List<ModelParameters> parameters) {
        Map<String, ModelParameters> byKpi = new LinkedHashMap<>();
        for (ModelParameters params : parameters) {
            if (byKpi.put(params.getKpi(), params) != null) {
                throw new IllegalStateException("Duplicate model parameters for metric '"
                        + params.getKpi() + "'");
            }
        }
        Map<String, ModelParameters> byMetric = new LinkedHashMap<>();
        for (String metric : frame.getMetrics()) {
            ModelParameters params = byKpi.remove(metric);
            if (params == null) {
                throw new IllegalStateException("No model parameters configured for metric '" + metric + "'");
            }
            // unknown method is reported as such before the general validation
            params.forecastMethod();
            params.validate();
            byMetric.put(metric, params);
        }
        if (!byKpi.isEmpty()) {
            LOG.warn("Model parameters for {} have no data column and are ignored", byKpi.keySet());
        }
        return byMetric;
    }

    private Map<String, ForecastResult> fitAll(TimeSeriesFrame history, Map<String, ForecastBackend> backends,
            LocalDate evaluationDate) {
        ExecutorService workers = Executors.newCachedThreadPool(new FitThreadFactory("forecast-fit-"));
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(
                new FitThreadFactory("forecast-watchdog-"));
        Semaphore slots = new Semaphore(settings.getParallelism());
        long timeoutMillis = settings.getFitTimeout().toMillis();
        try {
            Map<String, CompletableFuture<ForecastResult>> outcomes = new LinkedHashMap<>();
            for (Map.Entry<String, ForecastBackend> entry : backends.entrySet()) {
                String metric = entry.getKey();
                MetricSeries series = history.column(metric).orElseThrow();
                acquire(slots, metric);
                outcomes.put(metric, submitFit(workers, watchdog, slots, metric,
                        () -> entry.getValue().forecast(series, evaluationDate), timeoutMillis));
            }

            Map<String, ForecastResult> results = new LinkedHashMap<>();
            for (Map.Entry<String, CompletableFuture<ForecastResult>> entry : outcomes.entrySet()) {
                String metric = entry.getKey();
                try {
                    results.put(metric, entry.getValue().get());
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof TimeoutException) {
                        LOG.warn("Metric [{}]: forecast timed out after {} ms", metric, timeoutMillis);
                    } else {
                        LOG.error("Metric [{}]: forecast failed, continuing with next metric", metric, e.getCause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for forecast of metric '"
                            + metric + "'", e);
                }
            }
            return results;
        } finally {
            watchdog.shutdownNow();
            workers.shutdownNow();
        }
    }

    /**
     * Run one fit on its own worker. The deadline starts when the fit starts;
     * when it passes, the outcome fails with a {@link TimeoutException}, the
     * worker is interrupted and its slot is handed to the next metric even if
     * the fit never returns.
     */
    private static CompletableFuture<ForecastResult> submitFit(ExecutorService workers,
            ScheduledExecutorService watchdog, Semaphore slots, String metric,
            Supplier<ForecastResult> fit, long timeoutMillis) {
        CompletableFuture<ForecastResult> outcome = new CompletableFuture<>();
        AtomicBoolean slotHeld = new AtomicBoolean(true);
        Runnable releaseSlot = () -> {
            if (slotHeld.compareAndSet(true, false)) {
                slots.release();
            }
        };
        workers.execute(() -> {
            Thread worker = Thread.currentThread();
            ScheduledFuture<?> deadline = watchdog.schedule(() -> {
                if (outcome.completeExceptionally(new TimeoutException(
                        "Forecast of metric '" + metric + "' exceeded " + timeoutMillis + " ms"))) {
                    worker.interrupt();
                    releaseSlot.run();
                }
            }, timeoutMillis, TimeUnit.MILLISECONDS);
            try {
                outcome.complete(fit.get());
            } catch (RuntimeException | Error e) {
                outcome.completeExceptionally(e);
            } finally {
                deadline.cancel(false);
                releaseSlot.run();
            }
        });
        return outcome;
    }

    private static void acquire(Semaphore slots, String metric) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted before fitting metric '" + metric + "'", e);
        }
    }

    private static final class FitThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private FitThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
