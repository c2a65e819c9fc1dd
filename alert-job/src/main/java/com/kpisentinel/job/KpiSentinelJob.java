package com.kpisentinel.job;

import com.kpisentinel.core.config.ModelParametersConfig;
import com.kpisentinel.core.config.ModelParametersLoader;
import com.kpisentinel.core.engine.AlertDetectionEngine;
import com.kpisentinel.core.evaluation.MetricAccuracy;
import com.kpisentinel.core.evaluation.PredictionEvaluator;
import com.kpisentinel.core.model.AlertRow;
import com.kpisentinel.core.model.EvaluationResult;
import com.kpisentinel.core.model.ModelParameters;
import com.kpisentinel.core.model.TimeSeriesFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point of the daily KPI Sentinel run.
 *
 * <h3>Steps</h3>
 *
 * <pre>
 *   metric history CSV
 *     → window ending on (today - pastDays)
 *     → AlertDetectionEngine
 *     → alerts table → log, Kafka
 *     → forecast table → forecast store (previous forecast scored first)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class KpiSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(KpiSentinelJob.class);

    private KpiSentinelJob() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting KPI Sentinel with config: {}", config);

        LocalDate evaluationDate = LocalDate.now().minusDays(config.getPastDays());
        run(config, evaluationDate);
    }

    /**
     * Execute one run.
     *
     * @param config         job configuration
     * @param evaluationDate date whose observations are judged
     * @return the engine result
     */
    static EvaluationResult run(JobConfig config, LocalDate evaluationDate) {
        // 1. Load metric parameters
        List<ModelParameters> parameters = loadParameters(config).getMetrics();
        if (parameters.isEmpty()) {
            throw new IllegalStateException("No metrics configured. Provide them via "
                    + ModelParametersLoader.ENV_MODEL_PARAMS_PATH + " or a classpath "
                    + ModelParametersLoader.DEFAULT_RESOURCE + " file.");
        }

        // 2. Read the history window
        List<String> kpis = new ArrayList<>();
        parameters.forEach(p -> kpis.add(p.getKpi()));
        TimeSeriesFrame frame = new MetricCsvReader().read(Path.of(config.getMetricsInputPath()),
                evaluationDate, config.getHistoryDays(), kpis);

        // 3. Detect
        EvaluationResult result = new AlertDetectionEngine(config.engineSettings()).run(frame, parameters);
        AlertTableLogger tableLogger = new AlertTableLogger();
        tableLogger.log(result);

        // 4. Score the previous forecast, then store the new one
        ForecastStore store = new ForecastStore(Path.of(config.getForecastStorePath()));
        if (config.isEvaluatePredictions()) {
            List<MetricAccuracy> accuracy = new PredictionEvaluator().evaluate(store.readAll(), frame);
            tableLogger.logAccuracy(accuracy);
        }
        result.getForecast().ifPresent(forecast -> store.append(evaluationDate, forecast));

        // 5. Publish
        if (config.isPublishAlerts()) {
            List<AlertRow> rows = config.isPublishOnlyAlerts() ? result.onlyAlerts() : result.getAlerts();
            try (KafkaAlertPublisher publisher = KafkaAlertPublisher.create(config)) {
                publisher.publish(evaluationDate, rows);
            }
        }
        return result;
    }

    private static ModelParametersConfig loadParameters(JobConfig config) {
        String path = config.getModelParamsPath();
        if (path != null && !path.isBlank()) {
            return ModelParametersLoader.fromFile(path);
        }
        return ModelParametersLoader.load();
    }
}
