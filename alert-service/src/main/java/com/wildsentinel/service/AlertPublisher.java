package com.wildsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildsentinel.core.model.Alert;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Publishes promoted alerts as JSON to the Kafka alerts topic, keyed by
 * camera so that one camera's alerts stay in partition order.
 *
 * @since 1.0.0
 */
public class AlertPublisher implements Consumer<Alert>, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertPublisher.class);

    private final Producer<String, byte[]> producer;
    private final String topic;
    private final ObjectMapper mapper;

    public AlertPublisher(Producer<String, byte[]> producer, String topic, ObjectMapper mapper) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public void accept(Alert alert) {
        byte[] value;
        try {
            value = mapper.writeValueAsBytes(alert);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize alert {}: {}", alert.getId(), e.getMessage(), e);
            return;
        }
        producer.send(new ProducerRecord<>(topic, alert.getCameraId(), value), (metadata, error) -> {
            if (error != null) {
                LOG.error("Failed to publish alert {} to '{}': {}", alert.getId(), topic, error.getMessage());
            }
        });
    }

    @Override
    public void close() {
        producer.flush();
        producer.close();
    }
}
