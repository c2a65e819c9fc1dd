package com.kpisentinel.core.decision;

import java.util.List;

/**
 * The statically registered adjustment chain.
 *
 * <p>
 * Adjustments apply in list order. With nothing registered the chain is the
 * identity. Register new adjustments by adding them to {@link #REGISTERED}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PredictionAdjustments {

    /** Leaves the band unchanged. */
    public static final PredictionAdjustment IDENTITY = (alertsSoFar, metric, band) -> band;

    private static final List<PredictionAdjustment> REGISTERED = List.of();

    private PredictionAdjustments() {
        // utility class
    }

    /**
     * @return the registered adjustments, or a single {@link #IDENTITY} when
     *         none is registered
     */
    public static List<PredictionAdjustment> registered() {
        return REGISTERED.isEmpty() ? List.of(IDENTITY) : REGISTERED;
    }
}
