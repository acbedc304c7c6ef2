package com.wildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-user notification preferences, optionally scoped to one camera.
 *
 * <p>
 * Empty filter sets mean "no restriction". Call {@link #validate()} after
 * construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Alerts above this false-positive score are skipped when suppression is on. */
    public static final double SUPPRESSION_FALSE_POSITIVE_SCORE = 0.7;

    private String id;
    private String userId;
    /** {@code null} applies the rule to every camera. */
    private String cameraId;
    private boolean active = true;

    private Set<String> speciesFilter = new LinkedHashSet<>();
    private double minConfidence = 0.7;
    private Set<Severity> severityLevels = EnumSet.noneOf(Severity.class);
    /** Hours of day (0-23) during which the rule applies. */
    private Set<Integer> allowedHours = new LinkedHashSet<>();
    /** ISO days of week (1 = Monday … 7 = Sunday). */
    private Set<Integer> daysOfWeek = new LinkedHashSet<>();

    private Set<ChannelType> channels = EnumSet.noneOf(ChannelType.class);
    private String email;
    private String webhookUrl;
    private String chatWebhookUrl;

    private boolean quietHoursEnabled;
    private LocalTime quietHoursStart;
    private LocalTime quietHoursEnd;
    private String timezone = "UTC";

    private boolean batchAlerts;
    private boolean suppressFalsePositives = true;

    // ---------------------------------------------------------------
    // Matching
    // ---------------------------------------------------------------

    /**
     * Decide whether this rule wants to hear about {@code alert}.
     *
     * @param alert a promoted alert
     * @return {@code true} if every configured criterion accepts the alert
     */
    public boolean matches(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (!active) {
            return false;
        }
        if (cameraId != null && !cameraId.equals(alert.getCameraId())) {
            return false;
        }
        if (!speciesFilter.isEmpty()
                && !speciesFilter.contains(normalizeSpecies(alert.getSpecies()))) {
            return false;
        }
        if (!severityLevels.isEmpty() && !severityLevels.contains(alert.getSeverity())) {
            return false;
        }
        if (alert.getCompositeConfidence() < minConfidence && !alert.getSeverity().isUrgent()) {
            return false;
        }
        ZonedDateTime local = alert.getDetectedAt().atZone(zone());
        if (!allowedHours.isEmpty() && !allowedHours.contains(local.getHour())) {
            return false;
        }
        if (!daysOfWeek.isEmpty() && !daysOfWeek.contains(local.getDayOfWeek().getValue())) {
            return false;
        }
        return !(suppressFalsePositives
                && alert.getFalsePositiveScore() > SUPPRESSION_FALSE_POSITIVE_SCORE);
    }

    /**
     * @param now the instant to test
     * @return whether {@code now} falls inside this rule's quiet window
     */
    public boolean isInQuietHours(Instant now) {
        if (!quietHoursEnabled || quietHoursStart == null || quietHoursEnd == null) {
            return false;
        }
        LocalTime t = now.atZone(zone()).toLocalTime();
        if (quietHoursStart.isBefore(quietHoursEnd)) {
            return !t.isBefore(quietHoursStart) && t.isBefore(quietHoursEnd);
        }
        // Window wraps midnight, e.g. 22:00 - 06:00
        return !t.isBefore(quietHoursStart) || t.isBefore(quietHoursEnd);
    }

    @JsonIgnore
    public ZoneId zone() {
        try {
            return timezone == null ? ZoneOffset.UTC : ZoneId.of(timezone);
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (userId == null || userId.isBlank()) {
            errors.add("'userId' is required");
        }
        if (minConfidence < 0 || minConfidence > 1) {
            errors.add("'minConfidence' must be in [0, 1], got: " + minConfidence);
        }
        for (Integer hour : allowedHours) {
            if (hour == null || hour < 0 || hour > 23) {
                errors.add("'allowedHours' entries must be in [0, 23], got: " + hour);
            }
        }
        for (Integer day : daysOfWeek) {
            if (day == null || day < 1 || day > 7) {
                errors.add("'daysOfWeek' entries must be in [1, 7], got: " + day);
            }
        }
        if (channels.contains(ChannelType.EMAIL) && (email == null || email.isBlank())) {
            errors.add("EMAIL channel requires 'email'");
        }
        if (channels.contains(ChannelType.WEBHOOK) && (webhookUrl == null || webhookUrl.isBlank())) {
            errors.add("WEBHOOK channel requires 'webhookUrl'");
        }
        if (channels.contains(ChannelType.CHAT) && (chatWebhookUrl == null || chatWebhookUrl.isBlank())) {
            errors.add("CHAT channel requires 'chatWebhookUrl'");
        }
        if (quietHoursEnabled && (quietHoursStart == null || quietHoursEnd == null)) {
            errors.add("Quiet hours require 'quietHoursStart' and 'quietHoursEnd'");
        }
        try {
            if (timezone != null) {
                ZoneId.of(timezone);
            }
        } catch (DateTimeException e) {
            errors.add("Unknown 'timezone': " + timezone);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AlertRule: " + String.join("; ", errors));
        }
    }

    /**
     * @return the delivery address configured for {@code channel}, or
     *         {@code null}
     */
    public String addressFor(ChannelType channel) {
        return switch (channel) {
            case EMAIL -> email;
            case WEBHOOK -> webhookUrl;
            case CHAT -> chatWebhookUrl;
        };
    }

    private static String normalizeSpecies(String species) {
        return species == null ? "" : species.trim().toLowerCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getCameraId() {
        return cameraId;
    }

    public void setCameraId(String cameraId) {
        this.cameraId = cameraId;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Set<String> getSpeciesFilter() {
        return Collections.unmodifiableSet(speciesFilter);
    }

    /**
     * Set the species filter, normalised to lowercase.
     */
    public void setSpeciesFilter(Set<String> speciesFilter) {
        this.speciesFilter = speciesFilter == null
                ? new LinkedHashSet<>()
                : speciesFilter.stream()
                        .map(AlertRule::normalizeSpecies)
                        .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public Set<Severity> getSeverityLevels() {
        return Collections.unmodifiableSet(severityLevels);
    }

    public void setSeverityLevels(Set<Severity> severityLevels) {
        this.severityLevels = severityLevels == null || severityLevels.isEmpty()
                ? EnumSet.noneOf(Severity.class)
                : EnumSet.copyOf(severityLevels);
    }

    public Set<Integer> getAllowedHours() {
        return Collections.unmodifiableSet(allowedHours);
    }

    public void setAllowedHours(Set<Integer> allowedHours) {
        this.allowedHours = allowedHours == null ? new LinkedHashSet<>() : new LinkedHashSet<>(allowedHours);
    }

    public Set<Integer> getDaysOfWeek() {
        return Collections.unmodifiableSet(daysOfWeek);
    }

    public void setDaysOfWeek(Set<Integer> daysOfWeek) {
        this.daysOfWeek = daysOfWeek == null ? new LinkedHashSet<>() : new LinkedHashSet<>(daysOfWeek);
    }

    public Set<ChannelType> getChannels() {
        return Collections.unmodifiableSet(channels);
    }

    public void setChannels(Set<ChannelType> channels) {
        this.channels = channels == null || channels.isEmpty()
                ? EnumSet.noneOf(ChannelType.class)
                : EnumSet.copyOf(channels);
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public String getChatWebhookUrl() {
        return chatWebhookUrl;
    }

    public void setChatWebhookUrl(String chatWebhookUrl) {
        this.chatWebhookUrl = chatWebhookUrl;
    }

    public boolean isQuietHoursEnabled() {
        return quietHoursEnabled;
    }

    public void setQuietHoursEnabled(boolean quietHoursEnabled) {
        this.quietHoursEnabled = quietHoursEnabled;
    }

    public LocalTime getQuietHoursStart() {
        return quietHoursStart;
    }

    public void setQuietHoursStart(LocalTime quietHoursStart) {
        this.quietHoursStart = quietHoursStart;
    }

    public LocalTime getQuietHoursEnd() {
        return quietHoursEnd;
    }

    public void setQuietHoursEnd(LocalTime quietHoursEnd) {
        this.quietHoursEnd = quietHoursEnd;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
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

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, userId);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", userId='" + userId + '\'' +
                ", cameraId='" + cameraId + '\'' +
                ", speciesFilter=" + speciesFilter +
                ", minConfidence=" + minConfidence +
                ", severityLevels=" + severityLevels +
                ", channels=" + channels +
                ", quietHoursEnabled=" + quietHoursEnabled +
                ", batchAlerts=" + batchAlerts +
                '}';
    }
}
