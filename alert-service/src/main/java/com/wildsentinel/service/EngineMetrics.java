package com.wildsentinel.service;

import com.wildsentinel.core.evaluation.EvaluationResult;
import com.wildsentinel.core.model.DeliveryReceipt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Micrometer metric definitions for the alert service.
 * <p>
 * Meters are registered against whatever {@link MeterRegistry} is passed in;
 * in production that is a Prometheus registry scraped through
 * {@code GET /metrics}.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code sentinel.detections.total{outcome}}: evaluated detections by
 *   outcome</li>
 *   <li>{@code sentinel.detections.rejected}: events rejected at ingress</li>
 *   <li>{@code sentinel.deliveries.total{status}}: delivery receipts by
 *   status</li>
 *   <li>{@code sentinel.evaluation.latency}: per-detection evaluation
 *   time</li>
 *   <li>{@code sentinel.parameters.version}: published parameter snapshot
 *   version</li>
 * </ul>
 */
public class EngineMetrics {

    private final MeterRegistry registry;
    private final Map<EvaluationResult.Outcome, Counter> outcomes = new EnumMap<>(EvaluationResult.Outcome.class);
    private final Map<DeliveryReceipt.Status, Counter> deliveries = new EnumMap<>(DeliveryReceipt.Status.class);
    private final Counter rejected;
    private final Counter processingFailures;
    private final Timer evaluationLatency;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        for (EvaluationResult.Outcome outcome : EvaluationResult.Outcome.values()) {
            outcomes.put(outcome, Counter.builder("sentinel.detections.total")
                    .description("Evaluated detections by outcome")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(registry));
        }
        for (DeliveryReceipt.Status status : DeliveryReceipt.Status.values()) {
            deliveries.put(status, Counter.builder("sentinel.deliveries.total")
                    .description("Delivery receipts by status")
                    .tag("status", status.name().toLowerCase())
                    .register(registry));
        }
        this.rejected = Counter.builder("sentinel.detections.rejected")
                .description("Detections rejected at ingress")
                .register(registry);
        this.processingFailures = Counter.builder("sentinel.detections.failed")
                .description("Detections whose processing failed unexpectedly")
                .register(registry);
        this.evaluationLatency = Timer.builder("sentinel.evaluation.latency")
                .description("Time to evaluate one detection")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordOutcome(EvaluationResult.Outcome outcome) {
        outcomes.get(outcome).increment();
    }

    public void recordDelivery(DeliveryReceipt.Status status) {
        deliveries.get(status).increment();
    }

    public void incrementRejected() {
        rejected.increment();
    }

    public void incrementProcessingFailures() {
        processingFailures.increment();
    }

    public void recordLatency(Duration duration) {
        evaluationLatency.record(duration);
    }

    /**
     * Register a gauge that samples {@code value} on each scrape.
     */
    public void gauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value).description(description).register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
