package com.wildsentinel.core.adaptation;

import com.wildsentinel.core.config.AdaptationSettings;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.FeedbackRecord;
import com.wildsentinel.core.repository.AlertRepository;
import com.wildsentinel.core.repository.FeedbackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Learns filter thresholds and ensemble weights from user feedback.
 *
 * <p>
 * Runs off the hot path on a timer ({@link #run()}). Each run aggregates the
 * feedback of the trailing window and publishes a new
 * {@link ParameterSnapshot}. Recomputation is relative to the configured
 * defaults, so repeated runs over the same feedback converge instead of
 * drifting.
 * </p>
 *
 * <h3>Thresholds</h3>
 * <p>
 * Per camera/species key with at least {@code minSamples} feedback records:
 * the false-positive rate is compared with the target rate. Too many false
 * positives lower the key's false-positive threshold (stricter filtering);
 * mostly accurate feedback raises it (more permissive). The change is at
 * most {@code maxThresholdStep} and the result stays within the configured
 * bounds. A key whose feedback has aged out of the window, or dropped below
 * {@code minSamples}, reverts to the default threshold.
 * </p>
 *
 * <h3>Weights</h3>
 * <p>
 * When both accurate and false-positive feedback exist, each sub-score whose
 * mean is clearly higher on accurate alerts gains {@code weightStep}, and
 * one clearly higher on false positives loses it. Weights are clamped and
 * renormalised.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * Any failure leaves the previous snapshot in effect; nothing partial is
 * ever published.
 * </p>
 *
 * @since 1.0.0
 */
public class FeedbackAdaptationLoop implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(FeedbackAdaptationLoop.class);

    /** Smallest sub-score mean difference that justifies a weight nudge. */
    static final double WEIGHT_SIGNAL = 0.05;

    private record Sample(Alert alert, boolean falsePositive) {
    }

    private final AdaptationSettings settings;
    private final ParameterSnapshot.Weights baselineWeights;
    private final FeedbackRepository feedback;
    private final AlertRepository alerts;
    private final ParameterRegistry registry;
    private final Clock clock;

    /**
     * @param baselineWeights configured weights the nudges are applied to
     */
    public FeedbackAdaptationLoop(AdaptationSettings settings,
            ParameterSnapshot.Weights baselineWeights,
            FeedbackRepository feedback,
            AlertRepository alerts,
            ParameterRegistry registry,
            Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.baselineWeights = Objects.requireNonNull(baselineWeights, "baselineWeights must not be null")
                .normalized();
        this.feedback = Objects.requireNonNull(feedback, "feedback must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Scheduled entry point. Never throws.
     */
    @Override
    public void run() {
        try {
            recompute();
        } catch (RuntimeException e) {
            LOG.error("Parameter recomputation failed - keeping snapshot v{}",
                    registry.current().getVersion(), e);
        }
    }

    /**
     * Recompute and publish parameters.
     *
     * @return the snapshot in effect afterwards
     */
    public ParameterSnapshot recompute() {
        Instant now = clock.instant();
        Instant since = now.minus(settings.trailingWindow());
        ParameterSnapshot current = registry.current();

        List<Sample> samples = new ArrayList<>();
        for (FeedbackRecord record : feedback.findSince(since)) {
            Optional<Alert> alert = alerts.findById(record.getAlertId());
            if (alert.isEmpty()) {
                LOG.debug("Feedback for unknown alert {} skipped", record.getAlertId());
                continue;
            }
            samples.add(new Sample(alert.get(), record.isFalsePositive()));
        }

        Map<String, Double> thresholds = recomputeThresholds(samples, current);
        ParameterSnapshot.Weights weights = recomputeWeights(samples);

        if (thresholds.equals(current.getThresholds()) && sameWeights(weights, current.getWeights())) {
            LOG.debug("Feedback since {} leaves parameters unchanged (v{})", since, current.getVersion());
            return current;
        }
        ParameterSnapshot next = current.next(weights, thresholds, now);
        validate(next);
        registry.publish(next);
        return registry.current();
    }

    // ---------------------------------------------------------------
    // Thresholds
    // ---------------------------------------------------------------

    private Map<String, Double> recomputeThresholds(List<Sample> samples, ParameterSnapshot current) {
        Map<String, List<Sample>> byKey = new LinkedHashMap<>();
        for (Sample s : samples) {
            byKey.computeIfAbsent(ParameterSnapshot.key(s.alert().getCameraId(), s.alert().getSpecies()),
                    k -> new ArrayList<>()).add(s);
        }

        // Keys without enough feedback in the window fall back to the default
        Map<String, Double> thresholds = new HashMap<>();
        double target = settings.getTargetFalsePositiveRate();
        for (Map.Entry<String, List<Sample>> e : byKey.entrySet()) {
            List<Sample> keySamples = e.getValue();
            if (keySamples.size() < settings.getMinSamples()) {
                continue;
            }
            long falsePositives = keySamples.stream().filter(Sample::falsePositive).count();
            double fpRate = (double) falsePositives / keySamples.size();
            double error = fpRate >= target
                    ? (fpRate - target) / (1.0 - target)
                    : (fpRate - target) / target;
            double threshold = clamp(current.getDefaultThreshold() - settings.getMaxThresholdStep() * error,
                    settings.getMinThreshold(), settings.getMaxThreshold());
            thresholds.put(e.getKey(), threshold);
            LOG.info("Adapted FP threshold for {}: {} ({} sample(s), fp rate {})",
                    e.getKey(), threshold, keySamples.size(), fpRate);
        }
        return thresholds;
    }

    // ---------------------------------------------------------------
    // Weights
    // ---------------------------------------------------------------

    private ParameterSnapshot.Weights recomputeWeights(List<Sample> samples) {
        List<Alert> accurate = samples.stream().filter(s -> !s.falsePositive()).map(Sample::alert).toList();
        List<Alert> falsePositive = samples.stream().filter(Sample::falsePositive).map(Sample::alert).toList();
        if (accurate.isEmpty() || falsePositive.isEmpty() || samples.size() < settings.getMinSamples()) {
            return baselineWeights;
        }
        double base = nudge(baselineWeights.base(), accurate, falsePositive,
                a -> a.getDetection().getBaseConfidence());
        double temporal = nudge(baselineWeights.temporal(), accurate, falsePositive, Alert::getTemporalConsistency);
        double size = nudge(baselineWeights.size(), accurate, falsePositive, Alert::getSizeValidationScore);
        double environmental = nudge(baselineWeights.environmental(), accurate, falsePositive,
                Alert::getEnvironmentalScore);
        return new ParameterSnapshot.Weights(base, temporal, size, environmental).normalized();
    }

    private double nudge(double weight, List<Alert> accurate, List<Alert> falsePositive,
            ToDoubleFunction<Alert> signal) {
        double diff = mean(accurate, signal) - mean(falsePositive, signal);
        double step = Math.abs(diff) < WEIGHT_SIGNAL ? 0.0 : Math.signum(diff) * settings.getWeightStep();
        return clamp(weight + step, settings.getMinWeight(), settings.getMaxWeight());
    }

    private static double mean(List<Alert> alerts, ToDoubleFunction<Alert> signal) {
        return alerts.stream().mapToDouble(signal).average().orElse(0.0);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void validate(ParameterSnapshot next) {
        for (Map.Entry<String, Double> e : next.getThresholds().entrySet()) {
            double t = e.getValue();
            if (Double.isNaN(t) || t <= 0 || t >= 1) {
                throw new IllegalStateException("Computed threshold out of range for " + e.getKey() + ": " + t);
            }
        }
        ParameterSnapshot.Weights w = next.getWeights();
        double sum = w.base() + w.temporal() + w.size() + w.environmental();
        if (Double.isNaN(sum) || Math.abs(sum - 1.0) > 1e-6) {
            throw new IllegalStateException("Computed weights do not sum to 1: " + w);
        }
    }

    private static boolean sameWeights(ParameterSnapshot.Weights a, ParameterSnapshot.Weights b) {
        return Math.abs(a.base() - b.base()) < 1e-9
                && Math.abs(a.temporal() - b.temporal()) < 1e-9
                && Math.abs(a.size() - b.size()) < 1e-9
                && Math.abs(a.environmental() - b.environmental()) < 1e-9;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
