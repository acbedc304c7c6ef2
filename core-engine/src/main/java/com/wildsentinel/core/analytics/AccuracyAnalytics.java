package com.wildsentinel.core.analytics;

import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertState;
import com.wildsentinel.core.model.FeedbackRecord;
import com.wildsentinel.core.repository.AlertRepository;
import com.wildsentinel.core.repository.FeedbackRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes feedback-based accuracy metrics over a trailing period.
 *
 * <h3>Definitions</h3>
 * <ul>
 * <li><b>Precision</b>: accurate feedback / all feedback on user-visible
 * alerts.</li>
 * <li><b>False-positive rate</b>: false-positive feedback / all feedback on
 * user-visible alerts.</li>
 * <li><b>Accuracy</b>: feedback agreeing with the engine's decision (visible
 * and accurate, or filtered and false positive) / all feedback.</li>
 * </ul>
 * <p>
 * Every feedback record counts; conflicting feedback is not collapsed.
 * Hourly distribution uses the UTC hour of detection.
 * </p>
 *
 * @since 1.0.0
 */
public class AccuracyAnalytics {

    public static final int MAX_DAYS = 365;

    private final AlertRepository alerts;
    private final FeedbackRepository feedback;
    private final Clock clock;

    public AccuracyAnalytics(AlertRepository alerts, FeedbackRepository feedback, Clock clock) {
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.feedback = Objects.requireNonNull(feedback, "feedback must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param days     trailing period length, 1..365
     * @param cameraId restrict to one camera, or {@code null} for all
     */
    public AccuracyReport report(int days, String cameraId) {
        if (days < 1 || days > MAX_DAYS) {
            throw new IllegalArgumentException("days must be in [1, " + MAX_DAYS + "], got: " + days);
        }
        Instant to = clock.instant();
        Instant from = to.minus(Duration.ofDays(days));

        List<Alert> inPeriod = alerts.findCreatedBetween(from, to).stream()
                .filter(a -> cameraId == null || cameraId.equals(a.getCameraId()))
                .toList();
        Map<String, List<FeedbackRecord>> feedbackByAlert = feedback.findSince(from).stream()
                .collect(Collectors.groupingBy(FeedbackRecord::getAlertId));

        Tally overall = new Tally();
        Map<String, Tally> bySpecies = new TreeMap<>();
        long[] hourly = new long[24];
        long acknowledged = 0;
        long resolved = 0;
        long duplicates = 0;

        for (Alert alert : inPeriod) {
            List<FeedbackRecord> records = feedbackByAlert.getOrDefault(alert.getId(), List.of());
            overall.add(alert, records);
            bySpecies.computeIfAbsent(alert.getSpecies(), s -> new Tally()).add(alert, records);
            hourly[alert.getDetectedAt().atZone(ZoneOffset.UTC).getHour()]++;
            AlertState state = alert.getState();
            if (state == AlertState.DUPLICATE) {
                duplicates++;
            }
            if (alert.getAcknowledgedAt() != null) {
                acknowledged++;
            }
            if (state == AlertState.RESOLVED) {
                resolved++;
            }
        }

        Map<String, AccuracyReport.SpeciesBreakdown> species = new TreeMap<>();
        bySpecies.forEach((name, t) -> species.put(name, new AccuracyReport.SpeciesBreakdown(
                t.total, t.promoted, t.filtered, t.truePositives, t.falsePositives,
                t.precision(), t.averageComposite())));

        return new AccuracyReport(from, to, cameraId,
                overall.total, overall.promoted, overall.filtered, duplicates, acknowledged, resolved,
                overall.feedback, overall.truePositives, overall.falsePositives,
                overall.precision(), overall.falsePositiveRate(), overall.accuracy(),
                overall.averageComposite(),
                Collections.unmodifiableMap(species),
                Arrays.stream(hourly).boxed().toList());
    }

    private static final class Tally {
        long total;
        long promoted;
        long filtered;
        long feedback;
        long truePositives;
        long falsePositives;
        long agreeing;
        double compositeSum;

        void add(Alert alert, List<FeedbackRecord> records) {
            total++;
            compositeSum += alert.getCompositeConfidence();
            AlertState state = alert.getState();
            boolean visible = state != AlertState.FILTERED && state != AlertState.DUPLICATE;
            if (state == AlertState.FILTERED) {
                filtered++;
            } else if (visible) {
                promoted++;
            }
            for (FeedbackRecord r : records) {
                feedback++;
                if (visible) {
                    if (r.isFalsePositive()) {
                        falsePositives++;
                    } else {
                        truePositives++;
                        agreeing++;
                    }
                } else if (state == AlertState.FILTERED && r.isFalsePositive()) {
                    agreeing++;
                }
            }
        }

        double precision() {
            long rated = truePositives + falsePositives;
            return rated == 0 ? 0.0 : (double) truePositives / rated;
        }

        double falsePositiveRate() {
            long rated = truePositives + falsePositives;
            return rated == 0 ? 0.0 : (double) falsePositives / rated;
        }

        double accuracy() {
            return feedback == 0 ? 0.0 : (double) agreeing / feedback;
        }

        double averageComposite() {
            return total == 0 ? 0.0 : compositeSum / total;
        }
    }
}
