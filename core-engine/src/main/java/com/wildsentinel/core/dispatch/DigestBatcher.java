package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.ChannelType;
import com.wildsentinel.core.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates same-severity alerts per user and channel into digests.
 *
 * <p>
 * A digest is released when it reaches {@code batchSize} alerts, or by
 * {@link #drainDue(Instant)} once its oldest entry has waited
 * {@code interval}.
 * </p>
 *
 * @since 1.0.0
 */
public class DigestBatcher {

    private record BatchKey(String userId, ChannelType channel, Severity severity) {
    }

    private static final class Pending {
        private final String address;
        private final Instant openedAt;
        private final List<Alert> alerts = new ArrayList<>();

        Pending(String address, Instant openedAt) {
            this.address = address;
            this.openedAt = openedAt;
        }
    }

    private final int batchSize;
    private final Duration interval;
    private final Map<BatchKey, Pending> pending = new LinkedHashMap<>();

    public DigestBatcher(int batchSize, Duration interval) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }
        this.batchSize = batchSize;
        this.interval = interval;
    }

    /**
     * Add an alert to its batch.
     *
     * @return the full digest if this alert completed the batch
     */
    public synchronized Optional<Notification> add(String userId, ChannelType channel, String address,
            Alert alert, Instant now) {
        BatchKey key = new BatchKey(userId, channel, alert.getSeverity());
        Pending batch = pending.computeIfAbsent(key, k -> new Pending(address, now));
        batch.alerts.add(alert);
        if (batch.alerts.size() >= batchSize) {
            pending.remove(key);
            return Optional.of(toDigest(key, batch));
        }
        return Optional.empty();
    }

    /**
     * Remove and return every batch whose oldest alert has waited at least
     * the batch interval.
     */
    public synchronized List<Notification> drainDue(Instant now) {
        List<Notification> due = new ArrayList<>();
        Iterator<Map.Entry<BatchKey, Pending>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<BatchKey, Pending> e = it.next();
            if (!e.getValue().openedAt.plus(interval).isAfter(now)) {
                due.add(toDigest(e.getKey(), e.getValue()));
                it.remove();
            }
        }
        return due;
    }

    /**
     * Remove and return every pending batch regardless of age.
     */
    public synchronized List<Notification> drainAll() {
        List<Notification> all = new ArrayList<>();
        pending.forEach((key, batch) -> all.add(toDigest(key, batch)));
        pending.clear();
        return all;
    }

    public synchronized int pendingAlerts() {
        return pending.values().stream().mapToInt(p -> p.alerts.size()).sum();
    }

    private static Notification toDigest(BatchKey key, Pending batch) {
        return Notification.digest(key.userId(), key.channel(), batch.address, key.severity(), batch.alerts);
    }
}
