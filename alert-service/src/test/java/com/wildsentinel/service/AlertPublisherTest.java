package com.wildsentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertState;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.Severity;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertPublisher}.
 */
class AlertPublisherTest {

    private static final Instant NOW = Instant.parse("2024-06-01T23:30:00Z");

    private final ObjectMapper mapper = ServiceJson.newMapper();
    private MockProducer<String, byte[]> producer;
    private AlertPublisher publisher;

    @BeforeEach
    void setUp() {
        producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
        publisher = new AlertPublisher(producer, "wildlife-alerts", mapper);
    }

    @Test
    @DisplayName("Should publish the alert as JSON keyed by camera")
    void shouldPublishKeyedByCamera() throws Exception {
        Alert alert = promoted("d-1", "cam-7");

        publisher.accept(alert);

        List<ProducerRecord<String, byte[]>> sent = producer.history();
        assertThat(sent).hasSize(1);
        ProducerRecord<String, byte[]> record = sent.get(0);
        assertThat(record.topic()).isEqualTo("wildlife-alerts");
        assertThat(record.key()).isEqualTo("cam-7");

        JsonNode body = mapper.readTree(record.value());
        assertThat(body.get("id").asText()).isEqualTo(alert.getId());
        assertThat(body.get("species").asText()).isEqualTo("wolf");
        assertThat(body.get("severity").asText()).isEqualTo("CRITICAL");
    }

    @Test
    @DisplayName("Should keep publishing after a broker error")
    void shouldSurviveSendFailure() {
        producer = new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
        publisher = new AlertPublisher(producer, "wildlife-alerts", mapper);

        publisher.accept(promoted("d-1", "cam-1"));
        producer.errorNext(new IllegalStateException("broker down"));
        publisher.accept(promoted("d-2", "cam-1"));
        producer.completeNext();

        assertThat(producer.history()).hasSize(2);
    }

    @Test
    @DisplayName("Should flush and close the producer on close()")
    void shouldFlushOnClose() {
        publisher.accept(promoted("d-1", "cam-1"));

        publisher.close();

        assertThat(producer.flushed()).isTrue();
        assertThat(producer.closed()).isTrue();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Alert promoted(String detectionId, String cameraId) {
        DetectionEvent event = DetectionEvent.builder()
                .detectionId(detectionId)
                .species("wolf")
                .baseConfidence(0.9)
                .cameraId(cameraId)
                .timestamp(NOW)
                .build();
        Alert alert = Alert.builder().detection(event).severity(Severity.CRITICAL).createdAt(NOW).build();
        alert.transitionTo(AlertState.PROMOTED);
        return alert;
    }
}
