package com.kpisentinel.job;

/**
 * One line of the long-format metric history file
 * ({@code date,metric,value}). Values stay textual until validated.
 */
class MetricCsvRow {

    private String date;
    private String metric;
    private String value;

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
