package com.wildsentinel.core.analytics;

import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertState;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.FeedbackRecord;
import com.wildsentinel.core.model.ScoredDetection;
import com.wildsentinel.core.model.Severity;
import com.wildsentinel.core.repository.InMemoryAlertRepository;
import com.wildsentinel.core.repository.InMemoryFeedbackRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AccuracyAnalytics}.
 */
class AccuracyAnalyticsTest {

    private static final Instant NOW = Instant.parse("2024-06-02T12:00:00Z");

    private InMemoryAlertRepository alerts;
    private InMemoryFeedbackRepository feedback;
    private AccuracyAnalytics analytics;

    @BeforeEach
    void setUp() {
        alerts = new InMemoryAlertRepository();
        feedback = new InMemoryFeedbackRepository();
        analytics = new AccuracyAnalytics(alerts, feedback, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should compute precision, false-positive rate and accuracy from feedback")
    void shouldComputeOverallMetrics() {
        seed();

        AccuracyReport report = analytics.report(7, null);

        assertThat(report.totalAlerts()).isEqualTo(5);
        assertThat(report.promotedAlerts()).isEqualTo(3);
        assertThat(report.filteredAlerts()).isEqualTo(1);
        assertThat(report.duplicateAlerts()).isEqualTo(1);
        assertThat(report.acknowledgedAlerts()).isEqualTo(1);
        assertThat(report.resolvedAlerts()).isEqualTo(1);
        assertThat(report.feedbackCount()).isEqualTo(4);
        assertThat(report.truePositives()).isEqualTo(2);
        assertThat(report.falsePositives()).isEqualTo(1);
        assertThat(report.precision()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(report.falsePositiveRate()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(report.accuracy()).isCloseTo(0.75, within(1e-9));
        assertThat(report.from()).isEqualTo(NOW.minusSeconds(7 * 86_400));
        assertThat(report.to()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should break the metrics down per species")
    void shouldBreakDownBySpecies() {
        seed();

        AccuracyReport report = analytics.report(7, null);

        assertThat(report.bySpecies()).containsOnlyKeys("deer", "wolf");
        AccuracyReport.SpeciesBreakdown wolf = report.bySpecies().get("wolf");
        assertThat(wolf.total()).isEqualTo(3);
        assertThat(wolf.promoted()).isEqualTo(3);
        assertThat(wolf.truePositives()).isEqualTo(2);
        assertThat(wolf.falsePositives()).isEqualTo(1);
        AccuracyReport.SpeciesBreakdown deer = report.bySpecies().get("deer");
        assertThat(deer.filtered()).isEqualTo(1);
        assertThat(deer.promoted()).isZero();
        assertThat(deer.precision()).isZero();
    }

    @Test
    @DisplayName("Should count detections per UTC hour")
    void shouldBuildHourlyDistribution() {
        seed();

        AccuracyReport report = analytics.report(7, null);

        assertThat(report.hourlyDistribution()).hasSize(24);
        assertThat(report.hourlyDistribution().get(2)).isEqualTo(3L);
        assertThat(report.hourlyDistribution().get(14)).isEqualTo(2L);
        assertThat(report.hourlyDistribution().stream().mapToLong(Long::longValue).sum()).isEqualTo(5L);
    }

    @Test
    @DisplayName("Should restrict the report to one camera")
    void shouldFilterByCamera() {
        seed();

        AccuracyReport report = analytics.report(7, "cam-2");

        assertThat(report.cameraId()).isEqualTo("cam-2");
        assertThat(report.totalAlerts()).isEqualTo(2);
        assertThat(report.bySpecies()).containsOnlyKeys("deer");
    }

    @Test
    @DisplayName("Should report zero ratios when there is nothing to rate")
    void shouldHandleEmptyPeriod() {
        AccuracyReport report = analytics.report(1, null);

        assertThat(report.totalAlerts()).isZero();
        assertThat(report.precision()).isZero();
        assertThat(report.falsePositiveRate()).isZero();
        assertThat(report.accuracy()).isZero();
        assertThat(report.averageCompositeConfidence()).isZero();
    }

    @ParameterizedTest(name = "days = {0}")
    @ValueSource(ints = { 0, -1, 366 })
    @DisplayName("Should reject periods outside 1 to 365 days")
    void shouldRejectBadPeriod(int days) {
        assertThatThrownBy(() -> analytics.report(days, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("days must be in [1, 365]");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void seed() {
        Alert accurate = alert("cam-1", "wolf", "2024-06-01T02:00:00Z");
        accurate.transitionTo(AlertState.PROMOTED);
        rate(accurate, false);

        Alert wrong = alert("cam-1", "wolf", "2024-06-01T02:10:00Z");
        wrong.transitionTo(AlertState.PROMOTED);
        rate(wrong, true);

        Alert resolved = alert("cam-1", "wolf", "2024-06-01T02:30:00Z");
        resolved.transitionTo(AlertState.PROMOTED);
        resolved.acknowledge("ranger-1", NOW.minusSeconds(600));
        resolved.resolve("ranger-1", NOW.minusSeconds(300));
        rate(resolved, false);

        Alert filtered = alert("cam-2", "deer", "2024-06-01T14:00:00Z");
        filtered.markFiltered("low temporal consistency");
        rate(filtered, true);

        Alert duplicate = alert("cam-2", "deer", "2024-06-01T14:05:00Z");
        duplicate.transitionTo(AlertState.PROMOTED);
        duplicate.markDuplicateOf("earlier");

        Alert outsidePeriod = alert("cam-1", "wolf", "2024-05-20T02:00:00Z");
        outsidePeriod.transitionTo(AlertState.PROMOTED);

        for (Alert a : new Alert[] { accurate, wrong, resolved, filtered, duplicate, outsidePeriod }) {
            alerts.save(a);
        }
    }

    private void rate(Alert alert, boolean falsePositive) {
        feedback.append(new FeedbackRecord(alert.getId(), "ranger-1", falsePositive, null, null,
                NOW.minusSeconds(3600)));
    }

    private static Alert alert(String cameraId, String species, String at) {
        Instant ts = Instant.parse(at);
        DetectionEvent event = DetectionEvent.builder()
                .species(species)
                .baseConfidence(0.8)
                .cameraId(cameraId)
                .timestamp(ts)
                .build();
        return Alert.builder()
                .scoredDetection(new ScoredDetection(event, 0.8, 1.0, 1.0, 0.95))
                .severity(Severity.WARNING)
                .createdAt(ts)
                .build();
    }
}
