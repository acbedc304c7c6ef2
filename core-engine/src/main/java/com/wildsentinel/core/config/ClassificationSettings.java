package com.wildsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Tuning for the alert classifier: severity cut-offs, the default
 * false-positive threshold and the contextual checks that must fail before
 * an event is filtered.
 *
 * @since 1.0.0
 */
public class ClassificationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double emergencyConfidence = 0.85;
    private double criticalConfidence = 0.75;
    private double warningConfidence = 0.5;

    /** Filter threshold used until feedback has produced a learned one. */
    private double defaultFalsePositiveThreshold = 0.6;
    /** How strongly a trusted anomaly lowers the false-positive score. */
    private double anomalyDiscount = 0.4;

    private double minTemporalConsistency = 0.3;
    private double minSizeScore = 0.3;
    private double minEnvironmentalScore = 0.3;

    private double minTemperature = -5.0;
    private double maxTemperature = 40.0;
    private double maxWindSpeed = 40.0;
    private double minVisibility = 10.0;

    void validate(List<String> errors) {
        if (!(warningConfidence <= criticalConfidence && criticalConfidence <= emergencyConfidence)) {
            errors.add("Severity confidences must satisfy warning <= critical <= emergency");
        }
        if (defaultFalsePositiveThreshold <= 0 || defaultFalsePositiveThreshold >= 1) {
            errors.add("'defaultFalsePositiveThreshold' must be in (0, 1), got: "
                    + defaultFalsePositiveThreshold);
        }
        if (anomalyDiscount < 0 || anomalyDiscount > 1) {
            errors.add("'anomalyDiscount' must be in [0, 1], got: " + anomalyDiscount);
        }
        if (minTemperature >= maxTemperature) {
            errors.add("'minTemperature' must be below 'maxTemperature'");
        }
    }

    public double getEmergencyConfidence() {
        return emergencyConfidence;
    }

    public void setEmergencyConfidence(double emergencyConfidence) {
        this.emergencyConfidence = emergencyConfidence;
    }

    public double getCriticalConfidence() {
        return criticalConfidence;
    }

    public void setCriticalConfidence(double criticalConfidence) {
        this.criticalConfidence = criticalConfidence;
    }

    public double getWarningConfidence() {
        return warningConfidence;
    }

    public void setWarningConfidence(double warningConfidence) {
        this.warningConfidence = warningConfidence;
    }

    public double getDefaultFalsePositiveThreshold() {
        return defaultFalsePositiveThreshold;
    }

    public void setDefaultFalsePositiveThreshold(double defaultFalsePositiveThreshold) {
        this.defaultFalsePositiveThreshold = defaultFalsePositiveThreshold;
    }

    public double getAnomalyDiscount() {
        return anomalyDiscount;
    }

    public void setAnomalyDiscount(double anomalyDiscount) {
        this.anomalyDiscount = anomalyDiscount;
    }

    public double getMinTemporalConsistency() {
        return minTemporalConsistency;
    }

    public void setMinTemporalConsistency(double minTemporalConsistency) {
        this.minTemporalConsistency = minTemporalConsistency;
    }

    public double getMinSizeScore() {
        return minSizeScore;
    }

    public void setMinSizeScore(double minSizeScore) {
        this.minSizeScore = minSizeScore;
    }

    public double getMinEnvironmentalScore() {
        return minEnvironmentalScore;
    }

    public void setMinEnvironmentalScore(double minEnvironmentalScore) {
        this.minEnvironmentalScore = minEnvironmentalScore;
    }

    public double getMinTemperature() {
        return minTemperature;
    }

    public void setMinTemperature(double minTemperature) {
        this.minTemperature = minTemperature;
    }

    public double getMaxTemperature() {
        return maxTemperature;
    }

    public void setMaxTemperature(double maxTemperature) {
        this.maxTemperature = maxTemperature;
    }

    public double getMaxWindSpeed() {
        return maxWindSpeed;
    }

    public void setMaxWindSpeed(double maxWindSpeed) {
        this.maxWindSpeed = maxWindSpeed;
    }

    public double getMinVisibility() {
        return minVisibility;
    }

    public void setMinVisibility(double minVisibility) {
        this.minVisibility = minVisibility;
    }
}
