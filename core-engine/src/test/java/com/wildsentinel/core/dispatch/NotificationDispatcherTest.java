package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.MutableClock;
import com.wildsentinel.core.config.NotificationSettings;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertRule;
import com.wildsentinel.core.model.AlertState;
import com.wildsentinel.core.model.ChannelType;
import com.wildsentinel.core.model.DeliveryReceipt;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.ScoredDetection;
import com.wildsentinel.core.model.Severity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NotificationDispatcher}.
 */
class NotificationDispatcherTest {

    private static final Instant NOON = Instant.parse("2024-06-01T12:00:00Z");
    private static final String HOOK = "https://hooks.example.org/ranger-1";

    private MutableClock clock;
    private NotificationSettings settings;
    private RecordingChannel webhook;
    private ExecutorService sendExecutor;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOON);
        settings = new NotificationSettings();
        settings.setRetryInitialBackoffMillis(1);
        webhook = new RecordingChannel(ChannelType.WEBHOOK);
        sendExecutor = Executors.newFixedThreadPool(2);
        dispatcher = newDispatcher();
    }

    @AfterEach
    void tearDown() {
        sendExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Should do nothing when no rule matches")
    void shouldSkipWithoutMatchingRule() {
        AlertRule rule = rule("ranger-1");
        rule.setSpeciesFilter(Set.of("bear"));
        Alert alert = promoted("cam-1", Severity.WARNING);

        DispatchReport report = dispatcher.dispatch(alert, List.of(rule));

        assertThat(report.receipts()).isEmpty();
        assertThat(report.rateLimited()).isFalse();
        assertThat(alert.getState()).isEqualTo(AlertState.PROMOTED);
        assertThat(webhook.sent).isEmpty();
    }

    @Test
    @DisplayName("Should deliver to every matching user and mark the alert delivered")
    void shouldDeliverToMatchingUsers() {
        Alert alert = promoted("cam-1", Severity.WARNING);

        DispatchReport report = dispatcher.dispatch(alert, List.of(rule("ranger-1"), rule("ranger-2")));

        assertThat(report.count(DeliveryReceipt.Status.DELIVERED)).isEqualTo(2);
        assertThat(alert.getState()).isEqualTo(AlertState.DELIVERED);
        assertThat(alert.getDeliveryReceipts()).hasSize(2);
        assertThat(webhook.sent).extracting(Notification::getUserId)
                .containsExactlyInAnyOrder("ranger-1", "ranger-2");
        assertThat(webhook.sent.get(0).getAddress()).isEqualTo(HOOK);
    }

    @Test
    @DisplayName("Should skip an alert that was acknowledged before dispatch")
    void shouldSkipAcknowledgedAlert() {
        Alert alert = promoted("cam-1", Severity.WARNING);
        alert.acknowledge("ranger-1", NOON);

        DispatchReport report = dispatcher.dispatch(alert, List.of(rule("ranger-1")));

        assertThat(report.receipts()).isEmpty();
        assertThat(alert.getState()).isEqualTo(AlertState.ACKNOWLEDGED);
        assertThat(webhook.sent).isEmpty();
    }

    @Test
    @DisplayName("Should fail a channel that has no sender configured")
    void shouldFailUnconfiguredChannel() {
        AlertRule rule = rule("ranger-1");
        rule.setChannels(EnumSet.of(ChannelType.EMAIL));
        rule.setEmail("ranger@example.org");
        Alert alert = promoted("cam-1", Severity.WARNING);

        DispatchReport report = dispatcher.dispatch(alert, List.of(rule));

        assertThat(report.receipts()).singleElement().satisfies(r -> {
            assertThat(r.getStatus()).isEqualTo(DeliveryReceipt.Status.FAILED);
            assertThat(r.getDetail()).isEqualTo("permanent: channel not configured");
        });
        assertThat(alert.getState()).isEqualTo(AlertState.DISPATCHING);
    }

    @Test
    @DisplayName("Should record RATE_LIMITED receipts once the camera budget is spent")
    void shouldRateLimitPerCamera() {
        settings.setMaxAlertsPerHour(2);
        dispatcher = newDispatcher();
        List<AlertRule> rules = List.of(rule("ranger-1"));

        dispatcher.dispatch(promoted("cam-1", Severity.WARNING), rules);
        dispatcher.dispatch(promoted("cam-1", Severity.WARNING), rules);
        Alert third = promoted("cam-1", Severity.WARNING);
        DispatchReport report = dispatcher.dispatch(third, rules);

        assertThat(report.rateLimited()).isTrue();
        assertThat(report.count(DeliveryReceipt.Status.RATE_LIMITED)).isEqualTo(1);
        assertThat(third.getState()).isEqualTo(AlertState.PROMOTED);
        assertThat(third.getDeliveryReceipts()).extracting(DeliveryReceipt::getStatus)
                .containsExactly(DeliveryReceipt.Status.RATE_LIMITED);
        assertThat(webhook.sent).hasSize(2);

        // another camera still has budget
        assertThat(dispatcher.dispatch(promoted("cam-2", Severity.WARNING), rules).rateLimited()).isFalse();
    }

    @Nested
    @DisplayName("Quiet hours")
    class QuietHours {

        private AlertRule quietRule;

        @BeforeEach
        void setUpQuietRule() {
            quietRule = rule("ranger-1");
            quietRule.setQuietHoursEnabled(true);
            quietRule.setQuietHoursStart(LocalTime.of(22, 0));
            quietRule.setQuietHoursEnd(LocalTime.of(6, 0));
            clock.set(Instant.parse("2024-06-01T23:00:00Z"));
        }

        @Test
        @DisplayName("Should hold non-urgent alerts until the window ends")
        void shouldQueueDuringQuietHours() {
            Alert alert = promoted("cam-1", Severity.WARNING);

            DispatchReport report = dispatcher.dispatch(alert, List.of(quietRule));

            assertThat(report.count(DeliveryReceipt.Status.QUEUED)).isEqualTo(1);
            assertThat(webhook.sent).isEmpty();
            assertThat(alert.getState()).isEqualTo(AlertState.DISPATCHING);
            assertThat(dispatcher.queuedForQuietHours()).isEqualTo(1);
            assertThat(dispatcher.flushDue()).isEmpty();
            assertThat(alert.getState()).isEqualTo(AlertState.DISPATCHING);

            clock.set(Instant.parse("2024-06-02T06:30:00Z"));
            List<DeliveryReceipt> released = dispatcher.flushDue();

            assertThat(released).extracting(DeliveryReceipt::getStatus)
                    .containsExactly(DeliveryReceipt.Status.DELIVERED);
            assertThat(webhook.sent).hasSize(1);
            assertThat(dispatcher.queuedForQuietHours()).isZero();
            assertThat(alert.getState()).isEqualTo(AlertState.DELIVERED);
        }

        @Test
        @DisplayName("Should keep a queued alert undelivered when the released send fails")
        void shouldStayDispatchingWhenReleasedSendFails() {
            Alert alert = promoted("cam-1", Severity.WARNING);
            dispatcher.dispatch(alert, List.of(quietRule));
            webhook.failWith(new PermanentDeliveryException("410 gone"));

            clock.set(Instant.parse("2024-06-02T06:30:00Z"));
            List<DeliveryReceipt> released = dispatcher.flushDue();

            assertThat(released).extracting(DeliveryReceipt::getStatus)
                    .containsExactly(DeliveryReceipt.Status.FAILED);
            assertThat(alert.getState()).isEqualTo(AlertState.DISPATCHING);
        }

        @Test
        @DisplayName("Should send urgent alerts straight through")
        void shouldBypassQuietHoursForUrgent() {
            Alert alert = promoted("cam-1", Severity.CRITICAL);

            DispatchReport report = dispatcher.dispatch(alert, List.of(quietRule));

            assertThat(report.count(DeliveryReceipt.Status.DELIVERED)).isEqualTo(1);
            assertThat(webhook.sent).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Digest batching")
    class Batching {

        private AlertRule batchingRule;

        @BeforeEach
        void setUpBatchingRule() {
            settings.setBatchSize(2);
            settings.setBatchIntervalSeconds(300);
            dispatcher = newDispatcher();
            batchingRule = rule("ranger-1");
            batchingRule.setBatchAlerts(true);
        }

        @Test
        @DisplayName("Should send one digest when the batch fills up")
        void shouldSendDigestWhenFull() {
            Alert firstAlert = promoted("cam-1", Severity.WARNING);
            DispatchReport first = dispatcher.dispatch(firstAlert, List.of(batchingRule));

            assertThat(first.count(DeliveryReceipt.Status.BATCHED)).isEqualTo(1);
            assertThat(webhook.sent).isEmpty();
            assertThat(dispatcher.pendingInDigests()).isEqualTo(1);
            assertThat(firstAlert.getState()).isEqualTo(AlertState.DISPATCHING);

            DispatchReport second = dispatcher.dispatch(promoted("cam-2", Severity.WARNING), List.of(batchingRule));

            assertThat(second.count(DeliveryReceipt.Status.DELIVERED)).isEqualTo(1);
            assertThat(firstAlert.getState()).isEqualTo(AlertState.DELIVERED);
            assertThat(webhook.sent).singleElement().satisfies(n -> {
                assertThat(n.isDigest()).isTrue();
                assertThat(n.getAlerts()).hasSize(2);
            });
        }

        @Test
        @DisplayName("Should send a partial digest once its interval elapses")
        void shouldSendDigestWhenDue() {
            Alert alert = promoted("cam-1", Severity.INFO);
            dispatcher.dispatch(alert, List.of(batchingRule));

            clock.advance(Duration.ofSeconds(299));
            assertThat(dispatcher.flushDue()).isEmpty();

            clock.advance(Duration.ofSeconds(1));
            assertThat(dispatcher.flushDue()).hasSize(1);
            assertThat(webhook.sent).hasSize(1);
            assertThat(alert.getDeliveryReceipts()).extracting(DeliveryReceipt::getStatus)
                    .containsExactly(DeliveryReceipt.Status.BATCHED, DeliveryReceipt.Status.DELIVERED);
            assertThat(alert.getState()).isEqualTo(AlertState.DELIVERED);
        }

        @Test
        @DisplayName("Should flush every pending digest on shutdown")
        void shouldFlushAll() {
            Alert info = promoted("cam-1", Severity.INFO);
            Alert warning = promoted("cam-1", Severity.WARNING);
            dispatcher.dispatch(info, List.of(batchingRule));
            dispatcher.dispatch(warning, List.of(batchingRule));

            assertThat(dispatcher.flushAll()).hasSize(2);
            assertThat(dispatcher.pendingInDigests()).isZero();
            assertThat(info.getState()).isEqualTo(AlertState.DELIVERED);
            assertThat(warning.getState()).isEqualTo(AlertState.DELIVERED);
        }

        @Test
        @DisplayName("Should never batch urgent alerts")
        void shouldNotBatchUrgent() {
            DispatchReport report = dispatcher.dispatch(promoted("cam-1", Severity.EMERGENCY), List.of(batchingRule));

            assertThat(report.count(DeliveryReceipt.Status.DELIVERED)).isEqualTo(1);
            assertThat(dispatcher.pendingInDigests()).isZero();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private NotificationDispatcher newDispatcher() {
        return new NotificationDispatcher(settings, List.of(webhook), new ChannelGateway(settings, clock),
                new CameraRateLimiter(settings, clock), sendExecutor, clock);
    }

    private static AlertRule rule(String userId) {
        AlertRule rule = new AlertRule();
        rule.setId("rule-" + userId);
        rule.setUserId(userId);
        rule.setChannels(EnumSet.of(ChannelType.WEBHOOK));
        rule.setWebhookUrl(HOOK);
        return rule;
    }

    private Alert promoted(String cameraId, Severity severity) {
        DetectionEvent event = DetectionEvent.builder()
                .species("wolf")
                .baseConfidence(0.9)
                .cameraId(cameraId)
                .timestamp(clock.instant())
                .build();
        Alert alert = Alert.builder()
                .scoredDetection(new ScoredDetection(event, 0.9, 1.0, 1.0, 0.95))
                .severity(severity)
                .falsePositiveScore(0.1)
                .createdAt(clock.instant())
                .build();
        alert.transitionTo(AlertState.PROMOTED);
        return alert;
    }

    private static final class RecordingChannel implements NotificationChannel {

        private final ChannelType type;
        private final List<Notification> sent = new CopyOnWriteArrayList<>();
        private volatile DeliveryException failure;

        RecordingChannel(ChannelType type) {
            this.type = type;
        }

        void failWith(DeliveryException failure) {
            this.failure = failure;
        }

        @Override
        public ChannelType type() {
            return type;
        }

        @Override
        public void send(Notification notification) throws DeliveryException {
            if (failure != null) {
                throw failure;
            }
            sent.add(notification);
        }
    }
}
