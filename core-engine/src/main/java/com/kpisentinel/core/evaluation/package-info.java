/** Accuracy of previously issued forecasts. */
package com.kpisentinel.core.evaluation;
