package com.caffe.emergency.service;

import com.caffe.emergency.exception.PersistenceException;
import com.caffe.emergency.model.Alert;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON form of the alert snapshot stored with every ledger record.
 */
@Component
@Slf4j
public class AlertSnapshotCodec {

    private final ObjectMapper objectMapper;

    public AlertSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String write(Alert alert) {
        try {
            return objectMapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("serialize alert " + alert.getId(), e);
        }
    }

    /**
     * @return the snapshot, or empty when the payload is missing or unreadable
     */
    public Optional<Alert> read(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(payload, Alert.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable alert snapshot: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
