package com.wildsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Record of one delivery attempt (or deliberate non-attempt) of an alert to
 * one user over one channel.
 *
 * @since 1.0.0
 */
public final class DeliveryReceipt implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Outcome of a delivery attempt. */
    public enum Status {
        DELIVERED,
        FAILED,
        /** Breaker open; the send was not attempted. */
        SHORT_CIRCUITED,
        /** Per-camera rate limit exhausted; recorded but not sent. */
        RATE_LIMITED,
        /** Held back by quiet hours; sent when the window ends. */
        QUEUED,
        /** Accumulated into a digest. */
        BATCHED
    }

    private final String userId;
    private final ChannelType channel;
    private final Status status;
    private final int attempts;
    private final String detail;
    private final Instant recordedAt;

    public DeliveryReceipt(String userId, ChannelType channel, Status status, int attempts,
            String detail, Instant recordedAt) {
        this.userId = userId;
        this.channel = channel;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.attempts = attempts;
        this.detail = detail;
        this.recordedAt = Objects.requireNonNull(recordedAt, "recordedAt must not be null");
    }

    public String getUserId() {
        return userId;
    }

    public ChannelType getChannel() {
        return channel;
    }

    public Status getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getDetail() {
        return detail;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public String toString() {
        return "DeliveryReceipt{" +
                "userId='" + userId + '\'' +
                ", channel=" + channel +
                ", status=" + status +
                ", attempts=" + attempts +
                ", detail='" + detail + '\'' +
                '}';
    }
}
