package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.config.NotificationSettings;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertRule;
import com.wildsentinel.core.model.AlertState;
import com.wildsentinel.core.model.ChannelType;
import com.wildsentinel.core.model.DeliveryReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Delivers promoted, non-duplicate alerts to the users whose rules match.
 *
 * <h3>Per alert</h3>
 * <ol>
 * <li>Select the matching {@link AlertRule}s; none means nothing to do.</li>
 * <li>Take one token from the camera's rate limiter. Without a token every
 * user/channel pair gets a {@code RATE_LIMITED} receipt and nothing is
 * sent.</li>
 * <li>Move the alert to {@link AlertState#DISPATCHING}.</li>
 * <li>For each user/channel pair: non-urgent alerts in quiet hours are
 * queued ({@code QUEUED}); non-urgent alerts for users who batch go to the
 * digest batcher ({@code BATCHED}); the rest are sent now.</li>
 * <li>Sends run concurrently on the send executor through the
 * {@link ChannelGateway}; the round waits for all of them and records the
 * receipts.</li>
 * </ol>
 *
 * <p>
 * An alert moves to DELIVERED on its first {@code DELIVERED} receipt, whether
 * that comes from the dispatch round itself or from a later flush of a
 * quiet-hour queue or digest. Until then it stays DISPATCHING.
 * </p>
 *
 * <p>
 * {@link #flushDue()} must be called periodically to release quiet-hour
 * queues and due digests.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Map<ChannelType, NotificationChannel> channels = new EnumMap<>(ChannelType.class);
    private final ChannelGateway gateway;
    private final CameraRateLimiter rateLimiter;
    private final DigestBatcher batcher;
    private final QuietHoursQueue quietQueue = new QuietHoursQueue();
    private final ExecutorService sendExecutor;
    private final Clock clock;

    public NotificationDispatcher(NotificationSettings settings,
            Collection<? extends NotificationChannel> channels,
            ChannelGateway gateway,
            CameraRateLimiter rateLimiter,
            ExecutorService sendExecutor,
            Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.type(), channel);
        }
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.sendExecutor = Objects.requireNonNull(sendExecutor, "sendExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.batcher = new DigestBatcher(settings.getBatchSize(), settings.batchInterval());
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    /**
     * Run one dispatch round for {@code alert}.
     *
     * @param alert promoted, non-duplicate alert
     * @param rules candidate rules; only matching ones are used
     */
    public DispatchReport dispatch(Alert alert, Collection<AlertRule> rules) {
        Objects.requireNonNull(alert, "alert must not be null");
        Instant now = clock.instant();
        if (alert.getState() != AlertState.PROMOTED) {
            // Acknowledged or resolved before dispatch got to it
            LOG.debug("Skipping dispatch of alert {} in state {}", alert.getId(), alert.getState());
            return new DispatchReport(alert.getId(), false, List.of());
        }

        List<AlertRule> matching = rules.stream().filter(r -> r.matches(alert)).toList();
        if (matching.isEmpty()) {
            LOG.debug("No rule matches alert {} ({} on {})", alert.getId(), alert.getSpecies(), alert.getCameraId());
            return new DispatchReport(alert.getId(), false, List.of());
        }

        List<DeliveryReceipt> receipts = new ArrayList<>();
        if (!rateLimiter.tryAcquire(alert.getCameraId())) {
            for (AlertRule rule : matching) {
                for (ChannelType channel : rule.getChannels()) {
                    DeliveryReceipt receipt = new DeliveryReceipt(rule.getUserId(), channel,
                            DeliveryReceipt.Status.RATE_LIMITED, 0, "camera rate limit", now);
                    alert.addDeliveryReceipt(receipt);
                    receipts.add(receipt);
                }
            }
            return new DispatchReport(alert.getId(), true, receipts);
        }

        alert.transitionTo(AlertState.DISPATCHING);
        boolean urgent = alert.getSeverity().isUrgent();
        List<Notification> toSend = new ArrayList<>();

        for (AlertRule rule : matching) {
            for (ChannelType channel : rule.getChannels()) {
                if (!urgent && rule.isInQuietHours(now)) {
                    quietQueue.defer(alert, rule, channel, now);
                    receipts.add(record(alert, rule.getUserId(), channel, DeliveryReceipt.Status.QUEUED,
                            "quiet hours", now));
                } else {
                    route(alert, rule, channel, urgent, now, toSend, receipts);
                }
            }
        }

        receipts.addAll(send(toSend));
        boolean pending = receipts.stream().anyMatch(r -> r.getStatus() == DeliveryReceipt.Status.DELIVERED
                || r.getStatus() == DeliveryReceipt.Status.QUEUED
                || r.getStatus() == DeliveryReceipt.Status.BATCHED);
        if (!pending) {
            LOG.warn("No channel accepted alert {} ({} on {})", alert.getId(), alert.getSpecies(), alert.getCameraId());
        }
        return new DispatchReport(alert.getId(), false, receipts);
    }

    /**
     * Release quiet-hour queues whose window has ended and digests that are
     * due, and send them.
     *
     * @return receipts of the sends performed
     */
    public List<DeliveryReceipt> flushDue() {
        Instant now = clock.instant();
        List<Notification> toSend = new ArrayList<>();
        List<DeliveryReceipt> receipts = new ArrayList<>();
        for (QuietHoursQueue.Deferred d : quietQueue.releaseDue(now)) {
            route(d.alert(), d.rule(), d.channel(), false, now, toSend, receipts);
        }
        toSend.addAll(batcher.drainDue(now));
        receipts.addAll(send(toSend));
        return receipts;
    }

    /**
     * Send every pending digest regardless of age. Used on shutdown.
     */
    public List<DeliveryReceipt> flushAll() {
        return send(batcher.drainAll());
    }

    public int queuedForQuietHours() {
        return quietQueue.size();
    }

    public int pendingInDigests() {
        return batcher.pendingAlerts();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void route(Alert alert, AlertRule rule, ChannelType channel, boolean urgent, Instant now,
            List<Notification> toSend, List<DeliveryReceipt> receipts) {
        String address = rule.addressFor(channel);
        if (address == null || !channels.containsKey(channel)) {
            receipts.add(record(alert, rule.getUserId(), channel, DeliveryReceipt.Status.FAILED,
                    "permanent: channel not configured", now));
            return;
        }
        if (!urgent && rule.isBatchAlerts()) {
            receipts.add(record(alert, rule.getUserId(), channel, DeliveryReceipt.Status.BATCHED,
                    "added to digest", now));
            batcher.add(rule.getUserId(), channel, address, alert, now).ifPresent(toSend::add);
            return;
        }
        toSend.add(Notification.single(alert, rule.getUserId(), channel, address));
    }

    private List<DeliveryReceipt> send(List<Notification> notifications) {
        if (notifications.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<DeliveryReceipt>> futures = new ArrayList<>();
        for (Notification n : notifications) {
            NotificationChannel channel = channels.get(n.getChannel());
            futures.add(CompletableFuture.supplyAsync(() -> gateway.deliver(channel, n), sendExecutor));
        }
        List<DeliveryReceipt> receipts = new ArrayList<>();
        for (int i = 0; i < notifications.size(); i++) {
            DeliveryReceipt receipt = futures.get(i).join();
            for (Alert alert : notifications.get(i).getAlerts()) {
                alert.addDeliveryReceipt(receipt);
                if (receipt.getStatus() == DeliveryReceipt.Status.DELIVERED && alert.markDelivered()) {
                    LOG.debug("Alert {} delivered via {}", alert.getId(), receipt.getChannel());
                }
            }
            receipts.add(receipt);
        }
        return receipts;
    }

    private static DeliveryReceipt record(Alert alert, String userId, ChannelType channel,
            DeliveryReceipt.Status status, String detail, Instant now) {
        DeliveryReceipt receipt = new DeliveryReceipt(userId, channel, status, 0, detail, now);
        alert.addDeliveryReceipt(receipt);
        return receipt;
    }
}
