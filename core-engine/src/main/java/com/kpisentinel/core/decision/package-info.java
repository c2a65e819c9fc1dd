/**
 * Alert decision policy: per-metric verdicts, the prediction adjustment hook
 * and the non-negativity clamp.
 */
package com.kpisentinel.core.decision;
