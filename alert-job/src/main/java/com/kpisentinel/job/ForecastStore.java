package com.kpisentinel.job;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.kpisentinel.core.evaluation.StoredPrediction;
import com.kpisentinel.core.model.ForecastRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only CSV store of issued forecasts
 * ({@code issuedOn,date,metric,prediction}).
 *
 * @since 1.0.0
 */
public class ForecastStore {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastStore.class);

    private final Path path;
    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema = mapper.schemaFor(ForecastStoreRecord.class);

    public ForecastStore(Path path) {
        this.path = Objects.requireNonNull(path, "Store path must not be null");
    }

    /**
     * Append a forecast table; the header is written when the file is new.
     *
     * @param issuedOn evaluation date of the run that produced the table
     * @param rows     forecast rows
     * @throws UncheckedIOException if the file cannot be written
     */
    public void append(LocalDate issuedOn, List<ForecastRow> rows) {
        Objects.requireNonNull(issuedOn, "issuedOn must not be null");
        List<ForecastStoreRecord> records = new ArrayList<>(rows.size());
        for (ForecastRow row : rows) {
            records.add(new ForecastStoreRecord(issuedOn.toString(), row.getDate().toString(),
                    row.getMetric(), row.getPrediction()));
        }
        try {
            boolean header = !Files.exists(path) || Files.size(path) == 0;
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                    SequenceWriter sequence = mapper.writer(header ? schema.withHeader() : schema.withoutHeader())
                            .writeValues(writer)) {
                sequence.writeAll(records);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append forecast to " + path, e);
        }
        LOG.info("Stored {} forecast row(s) issued on {} in {}", records.size(), issuedOn, path);
    }

    /**
     * @return every stored prediction, or an empty list if the store does not
     *         exist yet
     * @throws UncheckedIOException  if the file cannot be read
     * @throws IllegalStateException if a stored date is malformed
     */
    public List<StoredPrediction> readAll() {
        if (!Files.exists(path)) {
            LOG.info("Forecast store {} does not exist yet", path);
            return List.of();
        }
        List<StoredPrediction> predictions = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<ForecastStoreRecord> records = mapper.readerFor(ForecastStoreRecord.class)
                        .with(schema.withHeader())
                        .readValues(reader)) {
            while (records.hasNext()) {
                ForecastStoreRecord record = records.next();
                predictions.add(new StoredPrediction(LocalDate.parse(record.getIssuedOn()),
                        LocalDate.parse(record.getDate()), record.getMetric(), record.getPrediction()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read forecast store " + path, e);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Malformed date in forecast store " + path, e);
        }
        return predictions;
    }
}
