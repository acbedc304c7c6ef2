package com.wildsentinel.core.analytics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated accuracy metrics for a period.
 *
 * <p>
 * Ratios are {@code 0.0} when there is no feedback to compute them from;
 * check {@code feedbackCount} before reading them.
 * </p>
 *
 * @since 1.0.0
 */
public record AccuracyReport(Instant from,
        Instant to,
        String cameraId,
        long totalAlerts,
        long promotedAlerts,
        long filteredAlerts,
        long duplicateAlerts,
        long acknowledgedAlerts,
        long resolvedAlerts,
        long feedbackCount,
        long truePositives,
        long falsePositives,
        double precision,
        double falsePositiveRate,
        double accuracy,
        double averageCompositeConfidence,
        Map<String, SpeciesBreakdown> bySpecies,
        List<Long> hourlyDistribution) {

    /**
     * Per-species slice of the report.
     */
    public record SpeciesBreakdown(long total,
            long promoted,
            long filtered,
            long truePositives,
            long falsePositives,
            double precision,
            double averageCompositeConfidence) {
    }
}
