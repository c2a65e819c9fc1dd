package com.kpisentinel.job;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.TimeSeriesFrame;
import com.kpisentinel.core.model.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the metric history from a long-format CSV file into a
 * {@link TimeSeriesFrame}.
 *
 * <h3>Format</h3>
 *
 * <pre>
 * date,metric,value
 * 2024-05-01,daily_sessions,15320
 * 2024-05-01,conversion_rate,0.031
 * </pre>
 * <p>
 * Dates are ISO ({@code yyyy-MM-dd}) or basic ({@code yyyyMMdd}). An empty
 * value or {@code NaN} is a missing observation.
 * </p>
 *
 * <h3>Window</h3>
 * <p>
 * The frame spans {@code historyDays} consecutive days ending on the
 * evaluation date; days without a row are missing values and rows outside the
 * window are ignored. A metric with more than one row for the same date is
 * left out of the frame with a warning.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(MetricCsvReader.class);

    private final CsvMapper mapper;

    public MetricCsvReader() {
        this.mapper = CsvMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    /**
     * @param path           CSV file
     * @param evaluationDate last day of the window
     * @param historyDays    number of days in the window, evaluation date
     *                       included
     * @param metrics        metrics to read, in the order they should appear in
     *                       the frame
     * @return the frame; configured metrics without any row are left out
     * @throws UncheckedIOException  if the file cannot be read
     * @throws IllegalStateException if a row has an invalid date or value
     */
    public TimeSeriesFrame read(Path path, LocalDate evaluationDate, int historyDays, Collection<String> metrics) {
        Objects.requireNonNull(path, "Input path must not be null");
        Objects.requireNonNull(evaluationDate, "Evaluation date must not be null");
        if (historyDays < 1) {
            throw new IllegalArgumentException("historyDays must be >= 1, got: " + historyDays);
        }
        Set<String> wanted = new LinkedHashSet<>(metrics);
        LocalDate start = evaluationDate.minusDays(historyDays - 1L);

        Map<String, Map<LocalDate, Double>> observed = new HashMap<>();
        Set<String> duplicated = new LinkedHashSet<>();
        Set<String> unconfigured = new LinkedHashSet<>();

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<MetricCsvRow> rows = mapper.readerFor(MetricCsvRow.class).with(schema)
                        .readValues(reader)) {
            int line = 1;
            while (rows.hasNext()) {
                MetricCsvRow row = rows.next();
                line++;
                String metric = row.getMetric();
                if (metric == null || metric.isBlank()) {
                    throw new IllegalStateException("Missing metric name at " + path + ":" + line);
                }
                if (!wanted.contains(metric)) {
                    unconfigured.add(metric);
                    continue;
                }
                LocalDate date = parseDate(row.getDate(), path, line);
                if (date.isBefore(start) || date.isAfter(evaluationDate)) {
                    continue;
                }
                Map<LocalDate, Double> values = observed.computeIfAbsent(metric, k -> new HashMap<>());
                if (values.containsKey(date)) {
                    duplicated.add(metric);
                }
                values.put(date, parseValue(row.getValue(), path, line));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metric history from " + path, e);
        }

        if (!unconfigured.isEmpty()) {
            LOG.warn("Metrics {} in {} have no parameters and are skipped", unconfigured, path);
        }

        List<LocalDate> dates = new ArrayList<>(historyDays);
        for (int i = 0; i < historyDays; i++) {
            dates.add(start.plusDays(i));
        }

        List<MetricSeries> columns = new ArrayList<>();
        for (String metric : wanted) {
            if (duplicated.contains(metric)) {
                LOG.warn("Metric [{}] has duplicated dates in {} and is excluded from the analysis", metric, path);
                continue;
            }
            Map<LocalDate, Double> values = observed.get(metric);
            if (values == null) {
                LOG.warn("Metric [{}] has no rows between {} and {}", metric, start, evaluationDate);
                continue;
            }
            Double[] column = new Double[historyDays];
            for (int i = 0; i < historyDays; i++) {
                column[i] = values.get(dates.get(i));
            }
            columns.add(new MetricSeries(metric, ValueType.infer(column), dates, column));
        }

        LOG.info("Read {} metric(s) over {} day(s) ending {} from {}",
                columns.size(), historyDays, evaluationDate, path);
        return TimeSeriesFrame.of(dates, columns);
    }

    private static LocalDate parseDate(String text, Path path, int line) {
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Missing date at " + path + ":" + line);
        }
        String trimmed = text.trim();
        try {
            return trimmed.length() == 8
                    ? LocalDate.parse(trimmed, DateTimeFormatter.BASIC_ISO_DATE)
                    : LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid date '" + text + "' at " + path + ":" + line, e);
        }
    }

    private static Double parseValue(String text, Path path, int line) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            Double value = Double.valueOf(text.trim());
            return value.isNaN() ? null : value;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value '" + text + "' at " + path + ":" + line, e);
        }
    }
}
