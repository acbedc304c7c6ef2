package com.wildsentinel.core.config;

import com.wildsentinel.core.model.AlertRule;
import com.wildsentinel.core.model.Severity;

import java.io.Serializable;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Defaults applied to newly created {@link AlertRule}s before the caller's
 * own values are merged in.
 *
 * <p>
 * Quiet-hour times are {@code HH:mm} strings; quote them in YAML so they are
 * not read as sexagesimal integers.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefaults implements Serializable {

    private static final long serialVersionUID = 1L;

    private double minConfidence = 0.7;
    private Set<Severity> severityLevels = EnumSet.noneOf(Severity.class);
    private boolean quietHoursEnabled;
    private String quietHoursStart = "22:00";
    private String quietHoursEnd = "06:00";
    private boolean batchAlerts;
    private boolean suppressFalsePositives = true;

    /**
     * @return a fresh rule pre-populated with these defaults
     */
    public AlertRule newRule() {
        AlertRule rule = new AlertRule();
        rule.setMinConfidence(minConfidence);
        rule.setSeverityLevels(severityLevels);
        rule.setQuietHoursEnabled(quietHoursEnabled);
        rule.setQuietHoursStart(LocalTime.parse(quietHoursStart));
        rule.setQuietHoursEnd(LocalTime.parse(quietHoursEnd));
        rule.setBatchAlerts(batchAlerts);
        rule.setSuppressFalsePositives(suppressFalsePositives);
        return rule;
    }

    void validate(List<String> errors) {
        if (minConfidence < 0 || minConfidence > 1) {
            errors.add("'ruleDefaults.minConfidence' must be in [0, 1], got: " + minConfidence);
        }
        checkTime("quietHoursStart", quietHoursStart, errors);
        checkTime("quietHoursEnd", quietHoursEnd, errors);
    }

    private static void checkTime(String field, String value, List<String> errors) {
        if (value == null) {
            errors.add("'ruleDefaults." + field + "' is required");
            return;
        }
        try {
            LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            errors.add("'ruleDefaults." + field + "' must be HH:mm, got: " + value);
        }
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public Set<Severity> getSeverityLevels() {
        return severityLevels;
    }

    public void setSeverityLevels(Set<Severity> severityLevels) {
        this.severityLevels = severityLevels == null || severityLevels.isEmpty()
                ? EnumSet.noneOf(Severity.class)
                : EnumSet.copyOf(severityLevels);
    }

    public boolean isQuietHoursEnabled() {
        return quietHoursEnabled;
    }

    public void setQuietHoursEnabled(boolean quietHoursEnabled) {
        this.quietHoursEnabled = quietHoursEnabled;
    }

    public String getQuietHoursStart() {
        return quietHoursStart;
    }

    public void setQuietHoursStart(String quietHoursStart) {
        this.quietHoursStart = quietHoursStart;
    }

    public String getQuietHoursEnd() {
        return quietHoursEnd;
    }

    public void setQuietHoursEnd(String quietHoursEnd) {
        this.quietHoursEnd = quietHoursEnd;
    }

    public boolean isBatchAlerts() {
        return batchAlerts;
    }

    public void setBatchAlerts(boolean batchAlerts) {
        this.batchAlerts = batchAlerts;
    }

    public boolean isSuppressFalsePositives() {
        return suppressFalsePositives;
    }

    public void setSuppressFalsePositives(boolean suppressFalsePositives) {
        this.suppressFalsePositives = suppressFalsePositives;
    }
}
