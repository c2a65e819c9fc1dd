package com.kpisentinel.core.format;

import com.kpisentinel.core.model.AlertRecord;
import com.kpisentinel.core.model.AlertRow;
import com.kpisentinel.core.model.ForecastMethod;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link AlertRecord}s into the textual alerts table.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>numbers are written in plain decimal notation; a fractional part made
 * only of zeros is dropped ({@code "7.00"} becomes {@code "7"},
 * {@code "7.05"} is kept)</li>
 * <li>a missing actual is written {@value #NO_DATA}</li>
 * <li>constraint metrics show {@code "Yes"}/{@code "No"} as actual,
 * {@code "No"} as prediction and no bounds</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ResultFormatter {

    public static final String NO_DATA = "No data";
    static final String YES = "Yes";
    static final String NO = "No";

    private ResultFormatter() {
        // utility class
    }

    public static List<AlertRow> format(List<AlertRecord> records) {
        List<AlertRow> rows = new ArrayList<>(records.size());
        for (AlertRecord record : records) {
            rows.add(format(record));
        }
        return rows;
    }

    public static AlertRow format(AlertRecord record) {
        if (record.getMethod() == ForecastMethod.CONSTRAINT) {
            String real = record.getActual() == null ? NO_DATA
                    : record.getActual() != 0 ? YES : NO;
            return new AlertRow(record.getKpi(), record.getMetric(), record.getState(), NO, real,
                    null, null, record.getDetail());
        }
        String prediction = record.getPrediction() == null ? null : removeDecimals(plain(record.getPrediction()));
        String real = record.getActual() == null ? NO_DATA : removeDecimals(plain(record.getActual()));
        return new AlertRow(record.getKpi(), record.getMetric(), record.getState(), prediction, real,
                record.getLowerBound(), record.getUpperBound(), record.getDetail());
    }

    /**
     * Drop the fractional part of a plain decimal string when all its digits
     * are zero.
     *
     * @param value plain decimal text
     * @return the text, possibly without its fractional part
     */
    public static String removeDecimals(String value) {
        int dot = value.indexOf('.');
        if (dot < 0) {
            return value;
        }
        int digitSum = 0;
        for (int i = dot + 1; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isDigit(c)) {
                return value;
            }
            digitSum += c - '0';
        }
        return digitSum == 0 ? value.substring(0, dot) : value;
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }
}
