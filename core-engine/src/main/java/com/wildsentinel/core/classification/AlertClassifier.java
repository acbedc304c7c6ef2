package com.wildsentinel.core.classification;

import com.wildsentinel.core.adaptation.ParameterSnapshot;
import com.wildsentinel.core.config.ClassificationSettings;
import com.wildsentinel.core.config.SpeciesCatalog;
import com.wildsentinel.core.config.SpeciesProfile;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.ScoredDetection;
import com.wildsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a scored detection into a filter-or-promote decision.
 *
 * <h3>False-positive score</h3>
 * <pre>
 * fp = (1 - c) * (1 - anomalyDiscount * anomaly * reliability * c)
 * </pre>
 * <p>
 * where {@code c} is the composite confidence. A trusted anomaly lowers the
 * score because rare sightings are not noise, but only in proportion to how
 * much the scorer believes the sighting. The score is strictly decreasing in
 * {@code c}.
 * </p>
 *
 * <h3>Filtering</h3>
 * <p>
 * A detection is filtered only when {@code fp} exceeds the camera/species
 * threshold from the parameter snapshot <em>and</em> at least one contextual
 * check fails. The reason always lists the failed checks.
 * </p>
 *
 * <h3>Severity</h3>
 * <p>
 * Highest match wins: EMERGENCY (critical-danger species, c &ge; 0.85),
 * CRITICAL (dangerous species, c &ge; 0.75), WARNING (c &ge; 0.5 or rare
 * species), INFO otherwise. Priority is
 * {@code basePriority * (0.5 + 0.5 * c)}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(AlertClassifier.class);

    private final ClassificationSettings settings;
    private final SpeciesCatalog catalog;

    public AlertClassifier(ClassificationSettings settings, SpeciesCatalog catalog) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * @param scored detection with anomaly fields attached
     * @param params parameter snapshot for this evaluation
     */
    public ClassificationDecision classify(ScoredDetection scored, ParameterSnapshot params) {
        Objects.requireNonNull(scored, "scored must not be null");
        Objects.requireNonNull(params, "params must not be null");
        DetectionEvent event = scored.getEvent();

        double composite = scored.getCompositeConfidence();
        double fp = falsePositiveScore(scored);
        Severity severity = severityFor(event.getSpecies(), composite);
        int priority = priorityFor(severity, composite);
        double threshold = params.thresholdFor(event.getCameraId(), event.getSpecies());

        if (fp > threshold) {
            List<String> failures = failedChecks(scored);
            if (!failures.isEmpty()) {
                String reason = String.format(Locale.ROOT,
                        "False-positive score %.2f exceeds threshold %.2f: %s",
                        fp, threshold, String.join("; ", failures));
                return ClassificationDecision.filter(reason, severity, priority, fp, threshold);
            }
            LOG.debug("{} on {} above FP threshold ({} > {}) but context checks pass - promoting",
                    event.getSpecies(), event.getCameraId(), fp, threshold);
        }
        return ClassificationDecision.promote(severity, priority, fp, threshold);
    }

    double falsePositiveScore(ScoredDetection scored) {
        double c = scored.getCompositeConfidence();
        double discount = settings.getAnomalyDiscount()
                * scored.getAnomalyScore()
                * scored.getBaselineReliability()
                * c;
        return Math.max(0.0, Math.min(1.0, (1.0 - c) * (1.0 - discount)));
    }

    Severity severityFor(String species, double composite) {
        SpeciesProfile profile = catalog.profileFor(species);
        SpeciesProfile.DangerLevel danger = profile.getDangerLevel();
        if (danger == SpeciesProfile.DangerLevel.CRITICAL_DANGER
                && composite >= settings.getEmergencyConfidence()) {
            return Severity.EMERGENCY;
        }
        if (danger != SpeciesProfile.DangerLevel.NONE && composite >= settings.getCriticalConfidence()) {
            return Severity.CRITICAL;
        }
        if (composite >= settings.getWarningConfidence() || profile.isRare()) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    static int priorityFor(Severity severity, double composite) {
        return (int) Math.round(severity.getBasePriority() * (0.5 + 0.5 * composite));
    }

    private List<String> failedChecks(ScoredDetection scored) {
        DetectionEvent event = scored.getEvent();
        List<String> failures = new ArrayList<>();

        Optional<Double> temperature = event.getNumericContext(DetectionEvent.CONTEXT_TEMPERATURE);
        if (temperature.isPresent()
                && (temperature.get() < settings.getMinTemperature()
                        || temperature.get() > settings.getMaxTemperature())) {
            failures.add(String.format(Locale.ROOT, "extreme temperature %.1f outside [%.1f, %.1f]",
                    temperature.get(), settings.getMinTemperature(), settings.getMaxTemperature()));
        }
        event.getNumericContext(DetectionEvent.CONTEXT_WIND_SPEED)
                .filter(wind -> wind > settings.getMaxWindSpeed())
                .ifPresent(wind -> failures.add(String.format(Locale.ROOT,
                        "excessive wind %.1f > %.1f", wind, settings.getMaxWindSpeed())));
        event.getNumericContext(DetectionEvent.CONTEXT_VISIBILITY)
                .filter(vis -> vis < settings.getMinVisibility())
                .ifPresent(vis -> failures.add(String.format(Locale.ROOT,
                        "low visibility %.1f < %.1f", vis, settings.getMinVisibility())));

        double temporal = scored.getTemporalConsistency();
        if (temporal < settings.getMinTemporalConsistency()) {
            failures.add(temporal == 0.0
                    ? "low temporal consistency 0.00: isolated single-frame detection"
                    : String.format(Locale.ROOT, "low temporal consistency %.2f < %.2f",
                            temporal, settings.getMinTemporalConsistency()));
        }
        if (scored.getSizeValidationScore() < settings.getMinSizeScore()) {
            failures.add(String.format(Locale.ROOT, "implausible size for %s (score %.2f)",
                    event.getSpecies(), scored.getSizeValidationScore()));
        }
        if (scored.getEnvironmentalScore() < settings.getMinEnvironmentalScore()) {
            failures.add(String.format(Locale.ROOT, "implausible time or conditions for %s (score %.2f)",
                    event.getSpecies(), scored.getEnvironmentalScore()));
        }
        return failures;
    }
}
