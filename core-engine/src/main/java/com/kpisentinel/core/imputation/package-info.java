/**
 * Outlier removal and gap filling of the metric history.
 */
package com.kpisentinel.core.imputation;
