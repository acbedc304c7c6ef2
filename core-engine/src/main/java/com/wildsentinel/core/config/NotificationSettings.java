package com.wildsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Tuning for the notification dispatcher: rate limits, circuit breakers,
 * retries, send timeouts and digest batching.
 *
 * @since 1.0.0
 */
public class NotificationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Sustained per-camera token-bucket rate. */
    private int maxAlertsPerHour = 50;
    /** Short-window burst allowance per camera. */
    private int burstCapacity = 20;
    private int burstWindowSeconds = 60;

    /** Consecutive failures that open a channel's breaker. */
    private int breakerFailureThreshold = 5;
    private int breakerCooldownSeconds = 60;

    private int retryMaxAttempts = 3;
    private long retryInitialBackoffMillis = 500;
    private double retryBackoffMultiplier = 2.0;

    private int sendTimeoutSeconds = 5;

    /** Pending digest entries that force a flush. */
    private int batchSize = 10;
    private int batchIntervalSeconds = 300;

    void validate(List<String> errors) {
        if (maxAlertsPerHour < 1) {
            errors.add("'maxAlertsPerHour' must be >= 1, got: " + maxAlertsPerHour);
        }
        if (burstCapacity < 1) {
            errors.add("'burstCapacity' must be >= 1, got: " + burstCapacity);
        }
        if (burstWindowSeconds < 1) {
            errors.add("'burstWindowSeconds' must be >= 1, got: " + burstWindowSeconds);
        }
        if (breakerFailureThreshold < 1) {
            errors.add("'breakerFailureThreshold' must be >= 1, got: " + breakerFailureThreshold);
        }
        if (breakerCooldownSeconds < 1) {
            errors.add("'breakerCooldownSeconds' must be >= 1, got: " + breakerCooldownSeconds);
        }
        if (retryMaxAttempts < 1) {
            errors.add("'retryMaxAttempts' must be >= 1, got: " + retryMaxAttempts);
        }
        if (retryInitialBackoffMillis < 1 || retryBackoffMultiplier < 1.0) {
            errors.add("Retry backoff requires initial >= 1 ms and multiplier >= 1.0");
        }
        if (sendTimeoutSeconds < 1) {
            errors.add("'sendTimeoutSeconds' must be >= 1, got: " + sendTimeoutSeconds);
        }
        if (batchSize < 1) {
            errors.add("'batchSize' must be >= 1, got: " + batchSize);
        }
        if (batchIntervalSeconds < 1) {
            errors.add("'batchIntervalSeconds' must be >= 1, got: " + batchIntervalSeconds);
        }
    }

    public Duration breakerCooldown() {
        return Duration.ofSeconds(breakerCooldownSeconds);
    }

    public Duration sendTimeout() {
        return Duration.ofSeconds(sendTimeoutSeconds);
    }

    public Duration batchInterval() {
        return Duration.ofSeconds(batchIntervalSeconds);
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    public void setMaxAlertsPerHour(int maxAlertsPerHour) {
        this.maxAlertsPerHour = maxAlertsPerHour;
    }

    public int getBurstCapacity() {
        return burstCapacity;
    }

    public void setBurstCapacity(int burstCapacity) {
        this.burstCapacity = burstCapacity;
    }

    public int getBurstWindowSeconds() {
        return burstWindowSeconds;
    }

    public void setBurstWindowSeconds(int burstWindowSeconds) {
        this.burstWindowSeconds = burstWindowSeconds;
    }

    public int getBreakerFailureThreshold() {
        return breakerFailureThreshold;
    }

    public void setBreakerFailureThreshold(int breakerFailureThreshold) {
        this.breakerFailureThreshold = breakerFailureThreshold;
    }

    public int getBreakerCooldownSeconds() {
        return breakerCooldownSeconds;
    }

    public void setBreakerCooldownSeconds(int breakerCooldownSeconds) {
        this.breakerCooldownSeconds = breakerCooldownSeconds;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public void setRetryMaxAttempts(int retryMaxAttempts) {
        this.retryMaxAttempts = retryMaxAttempts;
    }

    public long getRetryInitialBackoffMillis() {
        return retryInitialBackoffMillis;
    }

    public void setRetryInitialBackoffMillis(long retryInitialBackoffMillis) {
        this.retryInitialBackoffMillis = retryInitialBackoffMillis;
    }

    public double getRetryBackoffMultiplier() {
        return retryBackoffMultiplier;
    }

    public void setRetryBackoffMultiplier(double retryBackoffMultiplier) {
        this.retryBackoffMultiplier = retryBackoffMultiplier;
    }

    public int getSendTimeoutSeconds() {
        return sendTimeoutSeconds;
    }

    public void setSendTimeoutSeconds(int sendTimeoutSeconds) {
        this.sendTimeoutSeconds = sendTimeoutSeconds;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getBatchIntervalSeconds() {
        return batchIntervalSeconds;
    }

    public void setBatchIntervalSeconds(int batchIntervalSeconds) {
        this.batchIntervalSeconds = batchIntervalSeconds;
    }
}
