package com.kpisentinel.core.imputation;

import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.TimeSeriesFrame;
import com.kpisentinel.core.model.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Cleans the modeling window before it is handed to the forecast backends.
 *
 * <p>
 * Apply {@link #removeOutliers(TimeSeriesFrame)} first, then
 * {@link #fillGaps(TimeSeriesFrame)}, once per run. Both work column by column
 * and never look at the observation row, which is split out beforehand.
 * </p>
 *
 * <h3>Outliers</h3>
 * <p>
 * A value further than {@value #OUTLIER_SIGMAS} population standard deviations
 * from the column mean becomes missing. Statistics are recomputed and the check
 * repeated until no more values are dropped. This departs from the single
 * sweep used by earlier versions of the job: after one sweep a value can
 * still be an outlier against the narrowed statistics, so a second call
 * would change the column. Iterating makes the step idempotent.
 * </p>
 *
 * <h3>Gaps</h3>
 * <p>
 * A missing value is replaced by the mean of the non-missing values in the
 * trailing window of {@value #WINDOW_DAYS} rows ending at its position, or 0
 * when the window holds no value. Integer columns receive rounded fills. A
 * column without any value is left as is.
 * </p>
 *
 * @since 1.0.0
 */
public class Imputer {

    private static final Logger LOG = LoggerFactory.getLogger(Imputer.class);

    static final double OUTLIER_SIGMAS = 3.0;
    static final int WINDOW_DAYS = 7;

    /**
     * @param frame modeling window
     * @return frame with outliers turned into missing values
     */
    public TimeSeriesFrame removeOutliers(TimeSeriesFrame frame) {
        Objects.requireNonNull(frame, "Frame must not be null");
        return frame.mapColumns(this::removeOutliers);
    }

    /**
     * @param frame modeling window
     * @return frame without missing values, except for all-missing columns
     */
    public TimeSeriesFrame fillGaps(TimeSeriesFrame frame) {
        Objects.requireNonNull(frame, "Frame must not be null");
        return frame.mapColumns(this::fillGaps);
    }

    MetricSeries removeOutliers(MetricSeries series) {
        Double[] values = series.getValues();
        int removed = 0;
        boolean changed;
        do {
            changed = false;
            double sum = 0;
            int count = 0;
            for (Double v : values) {
                if (v != null) {
                    sum += v;
                    count++;
                }
            }
            if (count == 0) {
                break;
            }
            double mean = sum / count;
            double squared = 0;
            for (Double v : values) {
                if (v != null) {
                    squared += (v - mean) * (v - mean);
                }
            }
            double limit = OUTLIER_SIGMAS * Math.sqrt(squared / count);
            for (int i = 0; i < values.length; i++) {
                if (values[i] != null && Math.abs(values[i] - mean) > limit) {
                    values[i] = null;
                    removed++;
                    changed = true;
                }
            }
        } while (changed);

        if (removed > 0) {
            LOG.debug("Metric [{}]: {} outlier(s) removed", series.getName(), removed);
        }
        return series.withValues(values);
    }

    MetricSeries fillGaps(MetricSeries series) {
        if (series.isEntirelyMissing()) {
            LOG.warn("Metric [{}] has no values in the modeling window - nothing to impute", series.getName());
            return series;
        }
        Double[] original = series.getValues();
        Double[] filled = original.clone();
        int gaps = 0;
        for (int i = 0; i < original.length; i++) {
            if (original[i] != null) {
                continue;
            }
            double sum = 0;
            int count = 0;
            for (int j = Math.max(0, i - WINDOW_DAYS + 1); j <= i; j++) {
                if (original[j] != null) {
                    sum += original[j];
                    count++;
                }
            }
            double fill = count == 0 ? 0.0 : sum / count;
            if (series.getValueType() == ValueType.INTEGER) {
                fill = Math.round(fill);
            }
            filled[i] = fill;
            gaps++;
        }

        if (gaps > 0) {
            LOG.debug("Metric [{}]: {} gap(s) filled with a {}-day moving average",
                    series.getName(), gaps, WINDOW_DAYS);
        }
        return series.withValues(filled);
    }
}
