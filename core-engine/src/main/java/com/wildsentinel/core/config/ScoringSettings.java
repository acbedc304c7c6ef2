package com.wildsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Tuning for the confidence scorer.
 *
 * <p>
 * The four weights are the starting point of the ensemble; the adaptation
 * loop nudges them at runtime.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoringSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double baseWeight = 0.4;
    private double temporalWeight = 0.25;
    private double sizeWeight = 0.15;
    private double environmentalWeight = 0.2;

    /** Number of most recent frames considered for temporal consistency. */
    private int temporalFrames = 5;
    /** How far back (seconds) a frame may be to count as recent. */
    private int temporalWindowSeconds = 10;
    /** Minimum confidence for a past frame to count as corroborating. */
    private double temporalLowThreshold = 0.3;

    /** Width of the linear decay band outside the expected size range, relative to the bound. */
    private double sizeTolerance = 0.5;

    /** Score for a species seen in one of its active periods. */
    private double activePeriodScore = 0.95;
    /** Score for a species seen in one of its inactive periods. */
    private double inactivePeriodScore = 0.1;
    /** Score for a period the species profile says nothing about. */
    private double unlistedPeriodScore = 0.6;
    /** Inactive-period score when the sighting is corroborated by other frames. */
    private double corroboratedInactiveScore = 0.35;
    /** Penalty applied when the temperature is below the species' activity floor. */
    private double coldPenalty = 0.2;

    void validate(List<String> errors) {
        double[] weights = { baseWeight, temporalWeight, sizeWeight, environmentalWeight };
        double sum = 0;
        for (double w : weights) {
            if (w < 0) {
                errors.add("Scoring weights must be >= 0");
            }
            sum += w;
        }
        if (sum <= 0) {
            errors.add("Scoring weights must not all be zero");
        }
        if (temporalFrames < 1) {
            errors.add("'temporalFrames' must be >= 1, got: " + temporalFrames);
        }
        if (temporalWindowSeconds < 1) {
            errors.add("'temporalWindowSeconds' must be >= 1, got: " + temporalWindowSeconds);
        }
        if (sizeTolerance <= 0) {
            errors.add("'sizeTolerance' must be > 0, got: " + sizeTolerance);
        }
    }

    public double getBaseWeight() {
        return baseWeight;
    }

    public void setBaseWeight(double baseWeight) {
        this.baseWeight = baseWeight;
    }

    public double getTemporalWeight() {
        return temporalWeight;
    }

    public void setTemporalWeight(double temporalWeight) {
        this.temporalWeight = temporalWeight;
    }

    public double getSizeWeight() {
        return sizeWeight;
    }

    public void setSizeWeight(double sizeWeight) {
        this.sizeWeight = sizeWeight;
    }

    public double getEnvironmentalWeight() {
        return environmentalWeight;
    }

    public void setEnvironmentalWeight(double environmentalWeight) {
        this.environmentalWeight = environmentalWeight;
    }

    public int getTemporalFrames() {
        return temporalFrames;
    }

    public void setTemporalFrames(int temporalFrames) {
        this.temporalFrames = temporalFrames;
    }

    public int getTemporalWindowSeconds() {
        return temporalWindowSeconds;
    }

    public void setTemporalWindowSeconds(int temporalWindowSeconds) {
        this.temporalWindowSeconds = temporalWindowSeconds;
    }

    public double getTemporalLowThreshold() {
        return temporalLowThreshold;
    }

    public void setTemporalLowThreshold(double temporalLowThreshold) {
        this.temporalLowThreshold = temporalLowThreshold;
    }

    public double getSizeTolerance() {
        return sizeTolerance;
    }

    public void setSizeTolerance(double sizeTolerance) {
        this.sizeTolerance = sizeTolerance;
    }

    public double getActivePeriodScore() {
        return activePeriodScore;
    }

    public void setActivePeriodScore(double activePeriodScore) {
        this.activePeriodScore = activePeriodScore;
    }

    public double getInactivePeriodScore() {
        return inactivePeriodScore;
    }

    public void setInactivePeriodScore(double inactivePeriodScore) {
        this.inactivePeriodScore = inactivePeriodScore;
    }

    public double getUnlistedPeriodScore() {
        return unlistedPeriodScore;
    }

    public void setUnlistedPeriodScore(double unlistedPeriodScore) {
        this.unlistedPeriodScore = unlistedPeriodScore;
    }

    public double getCorroboratedInactiveScore() {
        return corroboratedInactiveScore;
    }

    public void setCorroboratedInactiveScore(double corroboratedInactiveScore) {
        this.corroboratedInactiveScore = corroboratedInactiveScore;
    }

    public double getColdPenalty() {
        return coldPenalty;
    }

    public void setColdPenalty(double coldPenalty) {
        this.coldPenalty = coldPenalty;
    }
}
