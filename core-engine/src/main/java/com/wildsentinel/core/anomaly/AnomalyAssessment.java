package com.wildsentinel.core.anomaly;

/**
 * Result of scoring one detection against its activity baseline.
 *
 * @param observedRate        detections of the pair in the trailing rate
 *                            window, including this one
 * @param zScore              signed distance from the baseline mean
 * @param anomalyScore        0..1, higher is more anomalous
 * @param temporalAnomaly     whether the hour-of-day bucket has no real
 *                            history for an otherwise established pair
 * @param baselineReliability 0..1, how much history backs the baseline
 * @since 1.0.0
 */
public record AnomalyAssessment(double observedRate,
        double zScore,
        double anomalyScore,
        boolean temporalAnomaly,
        double baselineReliability) {
}
