package com.wildsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A {@link DetectionEvent} together with its corroboration sub-scores.
 *
 * <p>
 * Lives for the duration of one evaluation. The anomaly fields are attached
 * after scoring through {@link #withAnomaly(double, boolean, double)}, which
 * returns a new instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoredDetection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DetectionEvent event;
    private final double compositeConfidence;
    private final double temporalConsistency;
    private final double sizeValidationScore;
    private final double environmentalScore;
    private final double anomalyScore;
    private final boolean temporalAnomaly;
    /** How far the anomaly baseline can be trusted, 0..1. */
    private final double baselineReliability;

    public ScoredDetection(DetectionEvent event,
            double compositeConfidence,
            double temporalConsistency,
            double sizeValidationScore,
            double environmentalScore) {
        this(event, compositeConfidence, temporalConsistency, sizeValidationScore,
                environmentalScore, 0.0, false, 0.0);
    }

    private ScoredDetection(DetectionEvent event,
            double compositeConfidence,
            double temporalConsistency,
            double sizeValidationScore,
            double environmentalScore,
            double anomalyScore,
            boolean temporalAnomaly,
            double baselineReliability) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.compositeConfidence = compositeConfidence;
        this.temporalConsistency = temporalConsistency;
        this.sizeValidationScore = sizeValidationScore;
        this.environmentalScore = environmentalScore;
        this.anomalyScore = anomalyScore;
        this.temporalAnomaly = temporalAnomaly;
        this.baselineReliability = baselineReliability;
    }

    /**
     * @param anomalyScore        0..1, higher is more anomalous
     * @param temporalAnomaly     whether the hour-of-day bucket is novel
     * @param baselineReliability 0..1 trust in the baseline behind the score
     * @return a copy carrying the anomaly assessment
     */
    public ScoredDetection withAnomaly(double anomalyScore, boolean temporalAnomaly,
            double baselineReliability) {
        return new ScoredDetection(event, compositeConfidence, temporalConsistency,
                sizeValidationScore, environmentalScore, anomalyScore, temporalAnomaly,
                baselineReliability);
    }

    public DetectionEvent getEvent() {
        return event;
    }

    public double getCompositeConfidence() {
        return compositeConfidence;
    }

    public double getTemporalConsistency() {
        return temporalConsistency;
    }

    public double getSizeValidationScore() {
        return sizeValidationScore;
    }

    public double getEnvironmentalScore() {
        return environmentalScore;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    public boolean isTemporalAnomaly() {
        return temporalAnomaly;
    }

    public double getBaselineReliability() {
        return baselineReliability;
    }

    @Override
    public String toString() {
        return "ScoredDetection{" +
                "species='" + event.getSpecies() + '\'' +
                ", cameraId='" + event.getCameraId() + '\'' +
                ", composite=" + String.format("%.3f", compositeConfidence) +
                ", temporal=" + String.format("%.3f", temporalConsistency) +
                ", size=" + String.format("%.3f", sizeValidationScore) +
                ", environmental=" + String.format("%.3f", environmentalScore) +
                ", anomaly=" + String.format("%.3f", anomalyScore) +
                '}';
    }
}
