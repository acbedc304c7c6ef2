package com.wildsentinel.core.classification;

import com.wildsentinel.core.model.Severity;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of classifying one scored detection: filter or promote, plus the
 * severity and priority it would carry.
 *
 * @since 1.0.0
 */
public final class ClassificationDecision implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean filtered;
    private final String filterReason;
    private final Severity severity;
    private final int priority;
    private final double falsePositiveScore;
    private final double threshold;

    private ClassificationDecision(boolean filtered, String filterReason, Severity severity,
            int priority, double falsePositiveScore, double threshold) {
        this.filtered = filtered;
        this.filterReason = filterReason;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.priority = priority;
        this.falsePositiveScore = falsePositiveScore;
        this.threshold = threshold;
    }

    static ClassificationDecision promote(Severity severity, int priority, double fp, double threshold) {
        return new ClassificationDecision(false, null, severity, priority, fp, threshold);
    }

    static ClassificationDecision filter(String reason, Severity severity, int priority, double fp,
            double threshold) {
        return new ClassificationDecision(true, Objects.requireNonNull(reason, "reason must not be null"),
                severity, priority, fp, threshold);
    }

    public boolean isFiltered() {
        return filtered;
    }

    /**
     * @return human-readable reason, {@code null} when promoted
     */
    public String getFilterReason() {
        return filterReason;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getPriority() {
        return priority;
    }

    public double getFalsePositiveScore() {
        return falsePositiveScore;
    }

    /** Threshold the false-positive score was compared against. */
    public double getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        return "ClassificationDecision{" +
                "filtered=" + filtered +
                ", severity=" + severity +
                ", priority=" + priority +
                ", falsePositiveScore=" + falsePositiveScore +
                ", threshold=" + threshold +
                (filterReason != null ? ", reason='" + filterReason + '\'' : "") +
                '}';
    }
}
