package com.kpisentinel.core.model;

/**
 * Verdict for one metric in one run.
 *
 * @since 1.0.0
 */
public enum AlertState {

    /** Actual value inside the band, or constraint satisfied. */
    NO_ALERT,

    /** Actual value outside the band, or constraint violated. */
    ALERT,

    /** No actual value (or no forecast) for the evaluation date. */
    MISSING_DATA,

    /** Alerting switched off for the metric; values still recorded. */
    DISABLED
}
