package com.wildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Alert produced by the classifier for one scored detection.
 *
 * <p>
 * Filtered detections also become an {@code Alert} in state
 * {@link AlertState#FILTERED}: it is the audit record, never shown to users
 * by default and never dispatched.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code detection}, {@code severity} and
 * {@code createdAt} are required; omitting any of them throws
 * {@link NullPointerException} at build time. The id is assigned at build
 * time when not supplied.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Mutable fields are guarded by the instance monitor: the pipeline,
 * the dispatcher and API callers may touch the same alert concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final Instant createdAt;

    private DetectionEvent detection;
    private Severity severity;
    private int priority;
    private double compositeConfidence;
    private double temporalConsistency;
    private double sizeValidationScore;
    private double environmentalScore;
    private double anomalyScore;
    private double falsePositiveScore;
    private boolean filtered;
    private String filterReason;
    private String duplicateOf;
    private String correlationGroup;
    private AlertState state = AlertState.CREATED;

    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private String resolvedBy;
    private Instant resolvedAt;

    private final List<DeliveryReceipt> deliveryReceipts = new ArrayList<>();

    private Alert(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.detection = Objects.requireNonNull(b.detection, "detection must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.priority = b.priority;
        this.falsePositiveScore = b.falsePositiveScore;
        if (b.scores != null) {
            applyScores(b.scores);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private DetectionEvent detection;
        private ScoredDetection scores;
        private Severity severity;
        private int priority;
        private double falsePositiveScore;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Set the scored detection; also sets the detection itself.
         */
        public Builder scoredDetection(ScoredDetection scores) {
            this.scores = scores;
            this.detection = scores.getEvent();
            return this;
        }

        public Builder detection(DetectionEvent detection) {
            this.detection = detection;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder falsePositiveScore(double falsePositiveScore) {
            this.falsePositiveScore = falsePositiveScore;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // State transitions
    // ---------------------------------------------------------------

    /**
     * Move to {@code target}.
     *
     * @throws InvalidStateTransitionException if the lifecycle forbids it
     */
    public synchronized void transitionTo(AlertState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, state, target);
        }
        state = target;
    }

    /**
     * Mark the alert filtered with a human-readable reason.
     */
    public synchronized void markFiltered(String reason) {
        transitionTo(AlertState.FILTERED);
        this.filtered = true;
        this.filterReason = Objects.requireNonNull(reason, "filter reason must not be null");
    }

    /**
     * Mark the alert as a duplicate of an earlier one.
     */
    public synchronized void markDuplicateOf(String originalId) {
        transitionTo(AlertState.DUPLICATE);
        this.duplicateOf = Objects.requireNonNull(originalId, "originalId must not be null");
    }

    /**
     * Record that the dispatch round finished. A user may already have
     * acknowledged or resolved the alert meanwhile; that state is kept.
     *
     * @return {@code true} if the alert moved to DELIVERED
     */
    public synchronized boolean markDelivered() {
        if (state != AlertState.DISPATCHING) {
            return false;
        }
        state = AlertState.DELIVERED;
        return true;
    }

    /**
     * Acknowledge the alert. Acknowledging an alert that is already
     * acknowledged or resolved changes nothing.
     *
     * @return {@code true} if the state changed
     * @throws InvalidStateTransitionException if the alert is filtered, a
     *                                         duplicate, or not yet promoted
     */
    public synchronized boolean acknowledge(String userId, Instant at) {
        if (state == AlertState.ACKNOWLEDGED || state == AlertState.RESOLVED) {
            return false;
        }
        transitionTo(AlertState.ACKNOWLEDGED);
        this.acknowledgedBy = userId;
        this.acknowledgedAt = at;
        return true;
    }

    /**
     * Resolve the alert. Resolving a resolved alert changes nothing.
     *
     * @return {@code true} if the state changed
     * @throws InvalidStateTransitionException if the alert is filtered, a
     *                                         duplicate, or not yet promoted
     */
    public synchronized boolean resolve(String userId, Instant at) {
        if (state == AlertState.RESOLVED) {
            return false;
        }
        transitionTo(AlertState.RESOLVED);
        this.resolvedBy = userId;
        this.resolvedAt = at;
        return true;
    }

    /**
     * Replace the scores of this alert with those of a later, more confident
     * evaluation of the same physical detection.
     */
    public synchronized void supersede(ScoredDetection scores, Severity severity, int priority,
            double falsePositiveScore) {
        this.detection = scores.getEvent();
        applyScores(scores);
        this.severity = severity;
        this.priority = priority;
        this.falsePositiveScore = falsePositiveScore;
    }

    public synchronized void addDeliveryReceipt(DeliveryReceipt receipt) {
        deliveryReceipts.add(Objects.requireNonNull(receipt, "receipt must not be null"));
    }

    public synchronized void setCorrelationGroup(String correlationGroup) {
        this.correlationGroup = correlationGroup;
    }

    private void applyScores(ScoredDetection scores) {
        this.compositeConfidence = scores.getCompositeConfidence();
        this.temporalConsistency = scores.getTemporalConsistency();
        this.sizeValidationScore = scores.getSizeValidationScore();
        this.environmentalScore = scores.getEnvironmentalScore();
        this.anomalyScore = scores.getAnomalyScore();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    /**
     * @return the upstream detection id this alert was raised for
     */
    public synchronized String getDetectionRef() {
        return detection.getDetectionId();
    }

    @JsonIgnore
    public synchronized DetectionEvent getDetection() {
        return detection;
    }

    public synchronized String getSpecies() {
        return detection.getSpecies();
    }

    public synchronized String getCameraId() {
        return detection.getCameraId();
    }

    public synchronized Instant getDetectedAt() {
        return detection.getTimestamp();
    }

    public synchronized String getImageUrl() {
        return detection.getImageUrl();
    }

    public synchronized Severity getSeverity() {
        return severity;
    }

    public synchronized int getPriority() {
        return priority;
    }

    public synchronized double getCompositeConfidence() {
        return compositeConfidence;
    }

    public synchronized double getTemporalConsistency() {
        return temporalConsistency;
    }

    public synchronized double getSizeValidationScore() {
        return sizeValidationScore;
    }

    public synchronized double getEnvironmentalScore() {
        return environmentalScore;
    }

    public synchronized double getAnomalyScore() {
        return anomalyScore;
    }

    public synchronized double getFalsePositiveScore() {
        return falsePositiveScore;
    }

    public synchronized boolean isFiltered() {
        return filtered;
    }

    public synchronized String getFilterReason() {
        return filterReason;
    }

    public synchronized String getDuplicateOf() {
        return duplicateOf;
    }

    public synchronized String getCorrelationGroup() {
        return correlationGroup;
    }

    public synchronized AlertState getState() {
        return state;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public synchronized Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public synchronized String getResolvedBy() {
        return resolvedBy;
    }

    public synchronized Instant getResolvedAt() {
        return resolvedAt;
    }

    /**
     * @return snapshot copy of the delivery receipts recorded so far
     */
    public synchronized List<DeliveryReceipt> getDeliveryReceipts() {
        return Collections.unmodifiableList(new ArrayList<>(deliveryReceipts));
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id.equals(alert.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public synchronized String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", species='" + detection.getSpecies() + '\'' +
                ", cameraId='" + detection.getCameraId() + '\'' +
                ", severity=" + severity +
                ", state=" + state +
                ", falsePositiveScore=" + String.format("%.3f", falsePositiveScore) +
                '}';
    }
}
