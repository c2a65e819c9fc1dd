package com.kpisentinel.job;

import com.kpisentinel.core.evaluation.MetricAccuracy;
import com.kpisentinel.core.model.AlertRow;
import com.kpisentinel.core.model.EvaluationResult;
import com.kpisentinel.core.model.ForecastRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Writes the final tables of a run to the log.
 */
public class AlertTableLogger {

    private static final Logger LOG = LoggerFactory.getLogger(AlertTableLogger.class);

    static final String ROW_FORMAT = "%-32s %-12s %14s %14s %14s %14s  %s";

    public void log(EvaluationResult result) {
        List<AlertRow> rows = result.getAlerts();
        LOG.info("Alerts table for {} ({} row(s), {} alert(s))",
                result.getEvaluationDate(), rows.size(), result.onlyAlerts().size());
        LOG.info(String.format(Locale.ROOT, ROW_FORMAT, "Metric", "AlertState", "Prediction", "Real",
                "LowerBound", "UpperBound", "Detail"));
        for (AlertRow row : rows) {
            LOG.info(formatRow(row));
        }
        result.getForecast().ifPresent(this::logForecast);
    }

    public void logAccuracy(List<MetricAccuracy> accuracy) {
        for (MetricAccuracy a : accuracy) {
            LOG.info("Forecast accuracy: metric={} mape={}% samples={}",
                    a.getMetric(), String.format(Locale.ROOT, "%.2f", a.getMape()), a.getSamples());
        }
    }

    static String formatRow(AlertRow row) {
        return String.format(Locale.ROOT, ROW_FORMAT, row.getMetric(), row.getAlertState(),
                text(row.getPrediction()), text(row.getReal()),
                bound(row.getLowerBound()), bound(row.getUpperBound()), row.getDetail());
    }

    private void logForecast(List<ForecastRow> forecast) {
        LOG.info("Forecast table: {} row(s)", forecast.size());
        if (LOG.isDebugEnabled()) {
            for (ForecastRow row : forecast) {
                LOG.debug("{} {} {}", row.getDate(), row.getMetric(), row.getPrediction());
            }
        }
    }

    private static String text(String value) {
        return value == null ? "-" : value;
    }

    private static String bound(Double value) {
        return value == null ? "-" : String.format(Locale.ROOT, "%.3f", value);
    }
}
