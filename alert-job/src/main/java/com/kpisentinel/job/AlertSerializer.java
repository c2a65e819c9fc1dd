package com.kpisentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link AlertMessage} to JSON bytes for the Kafka alerts topic.
 */
public class AlertSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(AlertSerializer.class);

    private final ObjectMapper mapper;

    public AlertSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param message alert to serialize
     * @return JSON bytes, or an empty array if serialization failed
     */
    public byte[] serialize(AlertMessage message) {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize alert for metric [{}]: {}", message.getKpi(), e.getMessage(), e);
            return new byte[0];
        }
    }
}
