package com.wildsentinel.core.scoring;

import com.wildsentinel.core.adaptation.ParameterSnapshot;
import com.wildsentinel.core.config.DayPeriod;
import com.wildsentinel.core.config.ScoringSettings;
import com.wildsentinel.core.config.SpeciesCatalog;
import com.wildsentinel.core.config.SpeciesProfile;
import com.wildsentinel.core.context.CameraMetadata;
import com.wildsentinel.core.context.ContextStore;
import com.wildsentinel.core.model.BoundingBox;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.ScoredDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ensemble confidence scorer.
 *
 * <p>
 * Combines the model's base confidence with three corroborating signals:
 * </p>
 * <ul>
 * <li><b>Temporal consistency</b> - share of the camera's last N frames
 * (within a short window) that saw the same species above a low
 * threshold; 0 for an isolated single frame.</li>
 * <li><b>Size validation</b> - bounding-box area against the species'
 * expected range; 1.0 inside, decaying linearly to 0 across a tolerance
 * band outside.</li>
 * <li><b>Environmental plausibility</b> - period of day and temperature
 * against the species profile; a neutral 0.5 when no context is
 * supplied.</li>
 * </ul>
 *
 * <p>
 * The weights come from the {@link ParameterSnapshot} handed in by the
 * caller, so one evaluation always sees one consistent weight set.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless apart from its collaborators; safe to share between workers.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfidenceScorer {

    private static final Logger LOG = LoggerFactory.getLogger(ConfidenceScorer.class);

    /** Sub-score used when a signal is unavailable. */
    public static final double NEUTRAL = 0.5;

    private final ScoringSettings settings;
    private final SpeciesCatalog catalog;
    private final ContextStore context;

    public ConfidenceScorer(ScoringSettings settings, SpeciesCatalog catalog, ContextStore context) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * Score one detection.
     *
     * @param event  validated detection
     * @param params parameter snapshot for this evaluation
     * @return scored detection, anomaly fields unset
     */
    public ScoredDetection score(DetectionEvent event, ParameterSnapshot params) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(params, "params must not be null");

        SpeciesProfile profile = catalog.profileFor(event.getSpecies());
        Optional<CameraMetadata> camera = context.cameraMetadata(event.getCameraId());

        double temporal = temporalConsistency(event);
        double size = sizeValidation(event.getBoundingBox(), profile, camera);
        double environmental = environmentalPlausibility(event, profile, temporal,
                camera.map(CameraMetadata::getZoneId).orElse(ZoneOffset.UTC));

        ParameterSnapshot.Weights w = params.getWeights();
        double composite = clamp(w.base() * clamp(event.getBaseConfidence())
                + w.temporal() * temporal
                + w.size() * size
                + w.environmental() * environmental);

        LOG.debug("Scored {} on {}: composite={} temporal={} size={} env={} (params v{})",
                event.getSpecies(), event.getCameraId(), composite, temporal, size, environmental,
                params.getVersion());
        return new ScoredDetection(event, composite, temporal, size, environmental);
    }

    // ---------------------------------------------------------------
    // Sub-scores
    // ---------------------------------------------------------------

    double temporalConsistency(DetectionEvent event) {
        Instant ts = event.getTimestamp();
        Instant since = ts.minus(Duration.ofSeconds(settings.getTemporalWindowSeconds()));
        List<DetectionEvent> frames = context.recentDetections(
                event.getCameraId(), since, ts, settings.getTemporalFrames());
        if (frames.isEmpty()) {
            return 0.0;
        }
        long matching = frames.stream()
                .filter(f -> f.getSpecies().equalsIgnoreCase(event.getSpecies()))
                .filter(f -> f.getBaseConfidence() >= settings.getTemporalLowThreshold())
                .count();
        return (double) matching / frames.size();
    }

    double sizeValidation(BoundingBox box, SpeciesProfile profile, Optional<CameraMetadata> camera) {
        if (box == null) {
            return NEUTRAL;
        }
        double area = box.normalizedArea(
                camera.map(CameraMetadata::getFrameWidth).orElse(0),
                camera.map(CameraMetadata::getFrameHeight).orElse(0));
        if (area > 1.0) {
            // Pixel box with no frame size to normalise against
            return NEUTRAL;
        }
        double min = profile.getMinSize();
        double max = profile.getMaxSize();
        if (area >= min && area <= max) {
            return 1.0;
        }
        double tolerance = settings.getSizeTolerance();
        if (area < min) {
            double band = min * tolerance;
            return band <= 0 ? 0.0 : clamp(1.0 - (min - area) / band);
        }
        double band = max * tolerance;
        return band <= 0 ? 0.0 : clamp(1.0 - (area - max) / band);
    }

    double environmentalPlausibility(DetectionEvent event, SpeciesProfile profile,
            double temporal, ZoneId zone) {
        if (!event.hasEnvironmentalContext()) {
            return NEUTRAL;
        }
        DayPeriod period = event.getStringContext(DetectionEvent.CONTEXT_TIME_OF_DAY)
                .flatMap(DayPeriod::parse)
                .orElseGet(() -> DayPeriod.ofHour(event.getTimestamp().atZone(zone).getHour()));

        String name = period.configName();
        double score;
        if (profile.getActivePeriods().contains(name)) {
            score = settings.getActivePeriodScore();
        } else if (profile.getInactivePeriods().contains(name)) {
            score = temporal >= 0.5
                    ? settings.getCorroboratedInactiveScore()
                    : settings.getInactivePeriodScore();
        } else {
            score = settings.getUnlistedPeriodScore();
        }

        double floor = profile.getMinActiveTemperature();
        if (!Double.isNaN(floor)) {
            Optional<Double> temperature = event.getNumericContext(DetectionEvent.CONTEXT_TEMPERATURE);
            if (temperature.isPresent() && temperature.get() < floor) {
                score -= settings.getColdPenalty();
            }
        }
        return clamp(score);
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
