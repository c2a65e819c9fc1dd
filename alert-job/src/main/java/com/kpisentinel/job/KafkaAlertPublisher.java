package com.kpisentinel.job;

import com.kpisentinel.core.model.AlertRow;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Publishes the alerts table to Kafka, one JSON record per row keyed by the
 * metric id.
 *
 * <p>
 * Every row is attempted. Failures are logged per record; once the producer
 * has been flushed the call fails if any record could not be delivered.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaAlertPublisher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaAlertPublisher.class);

    private final Producer<String, byte[]> producer;
    private final String topic;
    private final AlertSerializer serializer;

    public KafkaAlertPublisher(Producer<String, byte[]> producer, String topic, AlertSerializer serializer) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
    }

    /**
     * @param config job configuration
     * @return publisher backed by a real {@link KafkaProducer}
     */
    public static KafkaAlertPublisher create(JobConfig config) {
        Producer<String, byte[]> producer = new KafkaProducer<>(config.kafkaProducerProperties(),
                new StringSerializer(), new ByteArraySerializer());
        return new KafkaAlertPublisher(producer, config.getKafkaAlertTopic(), new AlertSerializer());
    }

    /**
     * @param runDate evaluation date of the run
     * @param rows    rows to publish
     * @return number of records delivered
     * @throws IllegalStateException if one or more records failed
     */
    public int publish(LocalDate runDate, List<AlertRow> rows) {
        Objects.requireNonNull(runDate, "runDate must not be null");
        int failures = 0;
        Map<String, Future<RecordMetadata>> pending = new LinkedHashMap<>();

        for (AlertRow row : rows) {
            byte[] payload = serializer.serialize(new AlertMessage(runDate, row));
            if (payload.length == 0) {
                failures++;
                continue;
            }
            try {
                pending.put(row.getKpi(), producer.send(new ProducerRecord<>(topic, row.getKpi(), payload)));
            } catch (KafkaException e) {
                LOG.error("Failed to send alert for metric [{}]", row.getKpi(), e);
                failures++;
            }
        }
        producer.flush();

        int delivered = 0;
        for (Map.Entry<String, Future<RecordMetadata>> entry : pending.entrySet()) {
            try {
                entry.getValue().get();
                delivered++;
            } catch (ExecutionException e) {
                LOG.error("Alert for metric [{}] was not delivered", entry.getKey(), e.getCause());
                failures++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while publishing alerts", e);
            }
        }

        if (failures > 0) {
            throw new IllegalStateException(failures + " of " + rows.size()
                    + " alert record(s) could not be published to " + topic);
        }
        LOG.info("Published {} alert record(s) for {} to topic {}", delivered, runDate, topic);
        return delivered;
    }

    @Override
    public void close() {
        producer.close();
    }
}
