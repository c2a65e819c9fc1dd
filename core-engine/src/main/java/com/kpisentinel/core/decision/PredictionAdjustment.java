package com.kpisentinel.core.decision;

import com.kpisentinel.core.model.AlertRecord;

import java.util.List;

/**
 * Post-processing hook for metrics flagged {@code isRelated}.
 *
 * <p>
 * An adjustment may look at the decisions already taken during the current
 * run (for example to widen the band of a metric that depends on another one
 * already in alert) and return a modified band. Adjustments run before the
 * non-negativity clamp.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredictionAdjustment {

    /**
     * @param alertsSoFar decisions taken earlier in this run, in metric order
     * @param metric      kpi being decided
     * @param band        prediction and bounds for the evaluation date
     * @return the band to use; never {@code null}
     */
    PredictionBand adjust(List<AlertRecord> alertsSoFar, String metric, PredictionBand band);
}
