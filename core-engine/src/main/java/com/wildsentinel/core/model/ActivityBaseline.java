package com.wildsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Exponentially weighted mean and variance of the detection rate observed for
 * one {@code (cameraId, species, hourOfDay)} bucket.
 *
 * <p>
 * Instances are immutable; {@link #observe(double, double, long)} returns the
 * updated baseline. Variance is never negative.
 * </p>
 *
 * <p>
 * A bucket only sees observations on days the species shows up in that
 * hour. {@link #decayedTo(long, double)} folds a zero observation in for
 * every idle day since the last one, so a rarely used hour drifts toward a
 * near-zero mean instead of keeping the rate of its last sighting.
 * </p>
 *
 * @since 1.0.0
 */
public final class ActivityBaseline implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Marks a baseline whose observations carry no day. */
    public static final long NO_DAY = Long.MIN_VALUE;

    /** Idle days folded in at most; the mean is effectively zero long before. */
    static final int MAX_DECAY_DAYS = 366;

    private final Key key;
    private final double mean;
    private final double variance;
    private final long sampleCount;
    /** Epoch day of the latest observation, or {@link #NO_DAY}. */
    private final long lastObservedDay;

    /**
     * Baseline bucket key.
     */
    public record Key(String cameraId, String species, int hourOfDay) implements Serializable {
        public Key {
            Objects.requireNonNull(cameraId, "cameraId must not be null");
            Objects.requireNonNull(species, "species must not be null");
            if (hourOfDay < 0 || hourOfDay > 23) {
                throw new IllegalArgumentException("hourOfDay must be in [0, 23], got: " + hourOfDay);
            }
        }
    }

    private ActivityBaseline(Key key, double mean, double variance, long sampleCount, long lastObservedDay) {
        this.key = key;
        this.mean = mean;
        this.variance = Math.max(0.0, variance);
        this.sampleCount = sampleCount;
        this.lastObservedDay = lastObservedDay;
    }

    /**
     * @return a baseline with no observations
     */
    public static ActivityBaseline empty(Key key) {
        return new ActivityBaseline(Objects.requireNonNull(key, "key must not be null"), 0.0, 0.0, 0, NO_DAY);
    }

    /**
     * Fold one observation into the baseline without moving its day.
     *
     * <p>
     * The first observation seeds the mean; later ones move mean and
     * variance toward the observation by {@code alpha}.
     * </p>
     *
     * @param value observed rate
     * @param alpha smoothing factor in (0, 1]
     * @return updated baseline
     */
    public ActivityBaseline observe(double value, double alpha) {
        return observe(value, alpha, lastObservedDay);
    }

    /**
     * Fold one observation made on {@code epochDay} into the baseline. Call
     * {@link #decayedTo(long, double)} first to account for idle days.
     *
     * @param value    observed rate
     * @param alpha    smoothing factor in (0, 1]
     * @param epochDay local day of the observation
     * @return updated baseline
     */
    public ActivityBaseline observe(double value, double alpha, long epochDay) {
        checkAlpha(alpha);
        long day = Math.max(epochDay, lastObservedDay);
        if (sampleCount == 0) {
            return new ActivityBaseline(key, value, 0.0, 1, day);
        }
        double diff = value - mean;
        double increment = alpha * diff;
        double newMean = mean + increment;
        double newVariance = (1 - alpha) * (variance + diff * increment);
        return new ActivityBaseline(key, newMean, newVariance, sampleCount + 1, day);
    }

    /**
     * Fold a zero observation in for each day strictly between the last
     * observed day and {@code epochDay}.
     *
     * @return this baseline if no whole day has passed, or it has never
     *         been observed on a known day
     */
    public ActivityBaseline decayedTo(long epochDay, double alpha) {
        checkAlpha(alpha);
        if (sampleCount == 0 || lastObservedDay == NO_DAY || epochDay - lastObservedDay <= 1) {
            return this;
        }
        long idleDays = Math.min(epochDay - lastObservedDay - 1, MAX_DECAY_DAYS);
        ActivityBaseline decayed = this;
        for (long i = 0; i < idleDays; i++) {
            decayed = decayed.observe(0.0, alpha);
        }
        return new ActivityBaseline(key, decayed.mean, decayed.variance, decayed.sampleCount, epochDay - 1);
    }

    private static void checkAlpha(double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1], got: " + alpha);
        }
    }

    public Key getKey() {
        return key;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getStdDev() {
        return Math.sqrt(variance);
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public long getLastObservedDay() {
        return lastObservedDay;
    }

    @Override
    public String toString() {
        return "ActivityBaseline{" +
                "key=" + key +
                ", mean=" + String.format("%.3f", mean) +
                ", stdDev=" + String.format("%.3f", getStdDev()) +
                ", samples=" + sampleCount +
                '}';
    }
}
