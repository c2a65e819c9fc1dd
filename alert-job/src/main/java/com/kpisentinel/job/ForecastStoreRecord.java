package com.kpisentinel.job;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * CSV line of the forecast store.
 */
@JsonPropertyOrder({ "issuedOn", "date", "metric", "prediction" })
class ForecastStoreRecord {

    private String issuedOn;
    private String date;
    private String metric;
    private double prediction;

    public ForecastStoreRecord() {
    }

    ForecastStoreRecord(String issuedOn, String date, String metric, double prediction) {
        this.issuedOn = issuedOn;
        this.date = date;
        this.metric = metric;
        this.prediction = prediction;
    }

    public String getIssuedOn() {
        return issuedOn;
    }

    public void setIssuedOn(String issuedOn) {
        this.issuedOn = issuedOn;
    }

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

    public double getPrediction() {
        return prediction;
    }

    public void setPrediction(double prediction) {
        this.prediction = prediction;
    }
}
