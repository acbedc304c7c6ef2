package com.wildsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One user's verdict on one alert. Append-only: conflicting verdicts from
 * different users (or the same user twice) are all kept.
 *
 * @since 1.0.0
 */
public final class FeedbackRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String alertId;
    private final String userId;
    private final boolean falsePositive;
    private final Integer rating;
    private final String notes;
    private final Instant createdAt;

    public FeedbackRecord(String alertId, String userId, boolean falsePositive, Integer rating,
            String notes, Instant createdAt) {
        this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.falsePositive = falsePositive;
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new IllegalArgumentException("rating must be in [1, 5], got: " + rating);
        }
        this.rating = rating;
        this.notes = notes;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public String getAlertId() {
        return alertId;
    }

    public String getUserId() {
        return userId;
    }

    public boolean isFalsePositive() {
        return falsePositive;
    }

    public Integer getRating() {
        return rating;
    }

    public String getNotes() {
        return notes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "FeedbackRecord{" +
                "alertId='" + alertId + '\'' +
                ", userId='" + userId + '\'' +
                ", falsePositive=" + falsePositive +
                ", rating=" + rating +
                ", createdAt=" + createdAt +
                '}';
    }
}
