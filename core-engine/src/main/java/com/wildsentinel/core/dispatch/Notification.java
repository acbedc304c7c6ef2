package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.ChannelType;
import com.wildsentinel.core.model.Severity;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Message addressed to one user over one channel: either a single alert or
 * a digest of several alerts of the same severity.
 *
 * @since 1.0.0
 */
public final class Notification {

    private final String userId;
    private final ChannelType channel;
    private final String address;
    private final Severity severity;
    private final List<Alert> alerts;
    private final boolean digest;

    private Notification(String userId, ChannelType channel, String address, Severity severity,
            List<Alert> alerts, boolean digest) {
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.address = Objects.requireNonNull(address, "address must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.alerts = List.copyOf(alerts);
        this.digest = digest;
        if (this.alerts.isEmpty()) {
            throw new IllegalArgumentException("A notification needs at least one alert");
        }
    }

    public static Notification single(Alert alert, String userId, ChannelType channel, String address) {
        return new Notification(userId, channel, address, alert.getSeverity(), List.of(alert), false);
    }

    public static Notification digest(String userId, ChannelType channel, String address,
            Severity severity, List<Alert> alerts) {
        return new Notification(userId, channel, address, severity, alerts, true);
    }

    /**
     * @return one-line headline, e.g. {@code [CRITICAL] wolf detected at cam-7}
     */
    public String title() {
        if (digest) {
            return "[" + severity + "] " + alerts.size() + " wildlife alerts";
        }
        Alert alert = alerts.get(0);
        return "[" + severity + "] " + alert.getSpecies() + " detected at " + alert.getCameraId();
    }

    /**
     * @return plain-text body listing every alert
     */
    public String body() {
        StringBuilder sb = new StringBuilder();
        for (Alert alert : alerts) {
            sb.append(String.format(Locale.ROOT,
                    "%s detected at camera %s on %s (confidence %.0f%%, alert %s)",
                    alert.getSpecies(), alert.getCameraId(), alert.getDetectedAt(),
                    alert.getCompositeConfidence() * 100, alert.getId()));
            if (alert.getImageUrl() != null) {
                sb.append(" image: ").append(alert.getImageUrl());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String getUserId() {
        return userId;
    }

    public ChannelType getChannel() {
        return channel;
    }

    public String getAddress() {
        return address;
    }

    public Severity getSeverity() {
        return severity;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public boolean isDigest() {
        return digest;
    }

    @Override
    public String toString() {
        return "Notification{" +
                "userId='" + userId + '\'' +
                ", channel=" + channel +
                ", severity=" + severity +
                ", alerts=" + alerts.size() +
                ", digest=" + digest +
                '}';
    }
}
