package com.wildsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildsentinel.core.model.DetectionEvent;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka poll loop that turns detection records into {@link DetectionEvent}s.
 * <p>
 * Malformed messages are logged and dropped, ensuring that a single bad
 * record does not stop ingestion. Well-formed events go to the sink even when
 * incomplete; field validation happens in the pipeline, where rejections are
 * recorded.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConsumer implements Runnable, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionConsumer.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final Consumer<String, byte[]> consumer;
    private final String topic;
    private final ObjectMapper mapper;
    private final java.util.function.Consumer<DetectionEvent> sink;
    private final EngineMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(true);

    /**
     * @param sink receives every decoded event, e.g. {@code pipeline::submit}
     */
    public DetectionConsumer(Consumer<String, byte[]> consumer,
            String topic,
            ObjectMapper mapper,
            java.util.function.Consumer<DetectionEvent> sink,
            EngineMetrics metrics) {
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public void run() {
        subscribe();
        try {
            while (running.get()) {
                pollOnce();
            }
        } catch (WakeupException e) {
            if (running.get()) {
                throw e;
            }
        } finally {
            consumer.close();
            LOG.info("Detection consumer on '{}' stopped", topic);
        }
    }

    void subscribe() {
        consumer.subscribe(List.of(topic));
        LOG.info("Subscribed to detection topic '{}'", topic);
    }

    /**
     * @return number of events handed to the sink
     */
    int pollOnce() {
        ConsumerRecords<String, byte[]> records = consumer.poll(POLL_TIMEOUT);
        int delivered = 0;
        for (ConsumerRecord<String, byte[]> record : records) {
            DetectionEvent event = decode(record);
            if (event != null) {
                sink.accept(event);
                delivered++;
            }
        }
        return delivered;
    }

    private DetectionEvent decode(ConsumerRecord<String, byte[]> record) {
        byte[] message = record.value();
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(message, DetectionEvent.class);
        } catch (IOException e) {
            metrics.incrementRejected();
            LOG.warn("Failed to deserialize detection at {}-{}@{}, skipping: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            return null;
        }
    }

    /**
     * Stop the poll loop. Safe to call from any thread.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            consumer.wakeup();
        }
    }
}
