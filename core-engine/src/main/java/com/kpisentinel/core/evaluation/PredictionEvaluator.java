package com.kpisentinel.core.evaluation;

import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.TimeSeriesFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores the most recently issued forecast against the values that have
 * since been observed.
 *
 * <p>
 * Only rows of the latest issue date are used. A row counts when the frame
 * holds a non-zero actual for its (date, metric); others are skipped. Metrics
 * without any usable row are left out of the result.
 * </p>
 *
 * @since 1.0.0
 */
public class PredictionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(PredictionEvaluator.class);

    /**
     * @param stored  persisted forecast rows, any issue dates
     * @param actuals observed values
     * @return per-metric accuracy, in order of first appearance in
     *         {@code stored}
     */
    public List<MetricAccuracy> evaluate(List<StoredPrediction> stored, TimeSeriesFrame actuals) {
        Objects.requireNonNull(stored, "stored predictions must not be null");
        Objects.requireNonNull(actuals, "actuals must not be null");

        LocalDate latest = null;
        for (StoredPrediction p : stored) {
            if (latest == null || p.getIssuedOn().isAfter(latest)) {
                latest = p.getIssuedOn();
            }
        }
        if (latest == null) {
            LOG.info("No stored predictions to evaluate");
            return List.of();
        }
        LocalDate issuedOn = latest;

        Map<LocalDate, Integer> rowIndex = new LinkedHashMap<>();
        List<LocalDate> dates = actuals.getDates();
        for (int i = 0; i < dates.size(); i++) {
            rowIndex.put(dates.get(i), i);
        }

        Map<String, double[]> sums = new LinkedHashMap<>();
        for (StoredPrediction p : stored) {
            if (!p.getIssuedOn().equals(issuedOn)) {
                continue;
            }
            double[] acc = sums.computeIfAbsent(p.getMetric(), k -> new double[2]);
            Integer index = rowIndex.get(p.getDate());
            Optional<MetricSeries> column = actuals.column(p.getMetric());
            if (index == null || column.isEmpty()) {
                continue;
            }
            Double actual = column.get().valueAt(index);
            if (actual == null || actual == 0) {
                continue;
            }
            acc[0] += Math.abs(p.getPrediction() - actual) / Math.abs(actual) * 100.0;
            acc[1] += 1;
        }

        List<MetricAccuracy> result = new ArrayList<>();
        sums.forEach((metric, acc) -> {
            if (acc[1] > 0) {
                result.add(new MetricAccuracy(metric, acc[0] / acc[1], (int) acc[1]));
            } else {
                LOG.debug("Metric [{}]: no observed values for the forecast issued on {}", metric, issuedOn);
            }
        });
        LOG.info("Evaluated forecast issued on {} for {} metric(s)", issuedOn, result.size());
        return result;
    }
}
