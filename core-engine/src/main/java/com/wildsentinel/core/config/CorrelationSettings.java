package com.wildsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Tuning for correlation and deduplication.
 *
 * @since 1.0.0
 */
public class CorrelationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int correlationWindowSeconds = 600;

    void validate(List<String> errors) {
        if (correlationWindowSeconds < 1) {
            errors.add("'correlationWindowSeconds' must be >= 1, got: " + correlationWindowSeconds);
        }
    }

    public Duration window() {
        return Duration.ofSeconds(correlationWindowSeconds);
    }

    public int getCorrelationWindowSeconds() {
        return correlationWindowSeconds;
    }

    public void setCorrelationWindowSeconds(int correlationWindowSeconds) {
        this.correlationWindowSeconds = correlationWindowSeconds;
    }
}
