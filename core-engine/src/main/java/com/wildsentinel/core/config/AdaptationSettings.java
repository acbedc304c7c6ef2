package com.wildsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Tuning for the feedback adaptation loop.
 *
 * @since 1.0.0
 */
public class AdaptationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int intervalMinutes = 60;
    private int trailingWindowDays = 7;
    /** Feedback records a camera/species key needs before it is adapted. */
    private int minSamples = 5;
    /** Largest change to a filter threshold in one recomputation. */
    private double maxThresholdStep = 0.15;
    private double minThreshold = 0.3;
    private double maxThreshold = 0.9;
    /** False-positive rate the loop steers towards. */
    private double targetFalsePositiveRate = 0.2;
    private double weightStep = 0.02;
    private double minWeight = 0.05;
    private double maxWeight = 0.6;

    void validate(List<String> errors) {
        if (intervalMinutes < 1) {
            errors.add("'intervalMinutes' must be >= 1, got: " + intervalMinutes);
        }
        if (trailingWindowDays < 1) {
            errors.add("'trailingWindowDays' must be >= 1, got: " + trailingWindowDays);
        }
        if (minSamples < 1) {
            errors.add("'minSamples' must be >= 1, got: " + minSamples);
        }
        if (maxThresholdStep <= 0 || maxThresholdStep > 0.5) {
            errors.add("'maxThresholdStep' must be in (0, 0.5], got: " + maxThresholdStep);
        }
        if (!(0 < minThreshold && minThreshold < maxThreshold && maxThreshold < 1)) {
            errors.add("Threshold bounds must satisfy 0 < minThreshold < maxThreshold < 1");
        }
        if (targetFalsePositiveRate <= 0 || targetFalsePositiveRate >= 1) {
            errors.add("'targetFalsePositiveRate' must be in (0, 1), got: " + targetFalsePositiveRate);
        }
        if (weightStep < 0 || !(0 < minWeight && minWeight < maxWeight && maxWeight <= 1)) {
            errors.add("Weight tuning requires weightStep >= 0 and 0 < minWeight < maxWeight <= 1");
        }
    }

    public Duration interval() {
        return Duration.ofMinutes(intervalMinutes);
    }

    public Duration trailingWindow() {
        return Duration.ofDays(trailingWindowDays);
    }

    public int getIntervalMinutes() {
        return intervalMinutes;
    }

    public void setIntervalMinutes(int intervalMinutes) {
        this.intervalMinutes = intervalMinutes;
    }

    public int getTrailingWindowDays() {
        return trailingWindowDays;
    }

    public void setTrailingWindowDays(int trailingWindowDays) {
        this.trailingWindowDays = trailingWindowDays;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getMaxThresholdStep() {
        return maxThresholdStep;
    }

    public void setMaxThresholdStep(double maxThresholdStep) {
        this.maxThresholdStep = maxThresholdStep;
    }

    public double getMinThreshold() {
        return minThreshold;
    }

    public void setMinThreshold(double minThreshold) {
        this.minThreshold = minThreshold;
    }

    public double getMaxThreshold() {
        return maxThreshold;
    }

    public void setMaxThreshold(double maxThreshold) {
        this.maxThreshold = maxThreshold;
    }

    public double getTargetFalsePositiveRate() {
        return targetFalsePositiveRate;
    }

    public void setTargetFalsePositiveRate(double targetFalsePositiveRate) {
        this.targetFalsePositiveRate = targetFalsePositiveRate;
    }

    public double getWeightStep() {
        return weightStep;
    }

    public void setWeightStep(double weightStep) {
        this.weightStep = weightStep;
    }

    public double getMinWeight() {
        return minWeight;
    }

    public void setMinWeight(double minWeight) {
        this.minWeight = minWeight;
    }

    public double getMaxWeight() {
        return maxWeight;
    }

    public void setMaxWeight(double maxWeight) {
        this.maxWeight = maxWeight;
    }
}
