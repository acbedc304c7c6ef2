package com.wildsentinel.service;

import com.wildsentinel.core.analytics.AccuracyAnalytics;
import com.wildsentinel.core.analytics.AccuracyReport;
import com.wildsentinel.core.config.RuleDefaults;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertRule;
import com.wildsentinel.core.model.FeedbackRecord;
import com.wildsentinel.core.repository.AlertQuery;
import com.wildsentinel.core.repository.AlertRepository;
import com.wildsentinel.core.repository.AlertRuleRepository;
import com.wildsentinel.core.repository.FeedbackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Operations behind the REST surface.
 *
 * <p>
 * Acknowledge and resolve are idempotent: repeating them returns the alert
 * unchanged. Both fail with
 * {@link com.wildsentinel.core.model.InvalidStateTransitionException} for
 * filtered and duplicate alerts, which are audit records only.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertService {

    private static final Logger LOG = LoggerFactory.getLogger(AlertService.class);

    private final AlertRepository alerts;
    private final FeedbackRepository feedback;
    private final AlertRuleRepository rules;
    private final RuleDefaults ruleDefaults;
    private final AccuracyAnalytics analytics;
    private final Clock clock;

    public AlertService(AlertRepository alerts,
            FeedbackRepository feedback,
            AlertRuleRepository rules,
            RuleDefaults ruleDefaults,
            AccuracyAnalytics analytics,
            Clock clock) {
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.feedback = Objects.requireNonNull(feedback, "feedback must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.ruleDefaults = Objects.requireNonNull(ruleDefaults, "ruleDefaults must not be null");
        this.analytics = Objects.requireNonNull(analytics, "analytics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    public List<Alert> listAlerts(AlertQuery query) {
        return alerts.find(query);
    }

    public Alert getAlert(String alertId) {
        return alerts.findById(alertId)
                .orElseThrow(() -> new AlertNotFoundException("Alert not found: " + alertId));
    }

    public Alert acknowledge(String alertId, String userId) {
        Alert alert = getAlert(alertId);
        if (alert.acknowledge(userId, clock.instant())) {
            alerts.save(alert);
            LOG.info("Alert {} acknowledged by {}", alertId, userId);
        }
        return alert;
    }

    public Alert resolve(String alertId, String userId) {
        Alert alert = getAlert(alertId);
        if (alert.resolve(userId, clock.instant())) {
            alerts.save(alert);
            LOG.info("Alert {} resolved by {}", alertId, userId);
        }
        return alert;
    }

    /**
     * Append a feedback record to an existing alert.
     *
     * @param rating optional 1..5 rating
     * @throws IllegalArgumentException if {@code rating} is out of range
     */
    public FeedbackRecord submitFeedback(String alertId, String userId, boolean falsePositive,
            Integer rating, String notes) {
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new IllegalArgumentException("rating must be in [1, 5], got: " + rating);
        }
        Alert alert = getAlert(alertId);
        FeedbackRecord record = new FeedbackRecord(alert.getId(), userId, falsePositive, rating, notes,
                clock.instant());
        feedback.append(record);
        LOG.info("Feedback on alert {} ({} on {}) by {}: falsePositive={}", alert.getId(), alert.getSpecies(),
                alert.getCameraId(), userId, falsePositive);
        return record;
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    /**
     * @return a new, unsaved rule carrying the configured defaults; request
     *         bodies are merged onto it
     */
    public AlertRule ruleTemplate() {
        return ruleDefaults.newRule();
    }

    public List<AlertRule> listRules(String userId) {
        return rules.findByUser(userId);
    }

    /**
     * Look up a rule owned by {@code userId}. Rules of other users are
     * reported as missing.
     */
    public AlertRule getRule(String ruleId, String userId) {
        return rules.findById(ruleId)
                .filter(r -> Objects.equals(r.getUserId(), userId))
                .orElseThrow(() -> new AlertNotFoundException("Alert rule not found: " + ruleId));
    }

    public AlertRule createRule(AlertRule rule, String userId) {
        rule.setId(UUID.randomUUID().toString());
        rule.setUserId(userId);
        validate(rule);
        rules.save(rule);
        LOG.info("Created alert rule {} for {}", rule.getId(), userId);
        return rule;
    }

    /**
     * Replace an existing rule with {@code updated}. The id and owner are
     * kept from the stored rule.
     */
    public AlertRule updateRule(String ruleId, AlertRule updated, String userId) {
        AlertRule existing = getRule(ruleId, userId);
        updated.setId(existing.getId());
        updated.setUserId(existing.getUserId());
        validate(updated);
        rules.save(updated);
        LOG.info("Updated alert rule {} for {}", ruleId, userId);
        return updated;
    }

    private static void validate(AlertRule rule) {
        try {
            rule.validate();
        } catch (IllegalStateException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Analytics
    // ---------------------------------------------------------------

    public AccuracyReport analytics(int days, String cameraId) {
        return analytics.report(days, cameraId);
    }
}
