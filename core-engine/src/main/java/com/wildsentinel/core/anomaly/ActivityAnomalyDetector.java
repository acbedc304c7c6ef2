package com.wildsentinel.core.anomaly;

import com.wildsentinel.core.config.AnomalySettings;
import com.wildsentinel.core.context.CameraMetadata;
import com.wildsentinel.core.context.ContextStore;
import com.wildsentinel.core.model.ActivityBaseline;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.ScoredDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;

/**
 * Activity anomaly detector.
 *
 * <p>
 * Scores how unusual the current detection rate of a camera/species pair is
 * compared with the exponentially smoothed history of the same hour of day.
 * </p>
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Count the pair's detections in the trailing rate window (this one
 * included).</li>
 * <li>{@code z = (observed - mean) / max(stdDev, epsilon)};
 * {@code score = min(|z| / saturationZ, 1.0)}.</li>
 * <li>Idle days since the bucket's last sighting count as zero observations,
 * so an hour the species rarely uses decays toward a zero mean.</li>
 * <li>An hour bucket with near-zero history on an otherwise established pair
 * is a <em>temporal anomaly</em> and scores 1.0 regardless of z.</li>
 * <li>While the pair has fewer than {@code minSamples} observations the score
 * is capped at {@code coldStartCap}.</li>
 * <li>The baseline is updated <strong>after</strong> scoring so the current
 * sample never masks its own anomaly.</li>
 * </ol>
 *
 * <h3>State</h3>
 * <p>
 * All state lives in the {@link BaselineStore}. Callers must not evaluate
 * two detections of the same camera concurrently; the pipeline's per-camera
 * lanes guarantee this.
 * </p>
 *
 * @since 1.0.0
 */
public class ActivityAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ActivityAnomalyDetector.class);

    private final AnomalySettings settings;
    private final BaselineStore baselines;
    private final ContextStore context;

    public ActivityAnomalyDetector(AnomalySettings settings, BaselineStore baselines, ContextStore context) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.baselines = Objects.requireNonNull(baselines, "baselines must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * Score the detection, update its baseline and attach the result.
     *
     * @param scored output of the confidence scorer
     * @return a copy of {@code scored} carrying the anomaly fields
     */
    public ScoredDetection apply(ScoredDetection scored) {
        AnomalyAssessment assessment = assess(scored.getEvent());
        return scored.withAnomaly(assessment.anomalyScore(), assessment.temporalAnomaly(),
                assessment.baselineReliability());
    }

    /**
     * Score one detection and fold it into the baseline.
     */
    public AnomalyAssessment assess(DetectionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        String cameraId = event.getCameraId();
        String species = event.getSpecies().trim().toLowerCase(Locale.ROOT);
        Instant ts = event.getTimestamp();

        ZonedDateTime local = ts.atZone(context.cameraMetadata(cameraId)
                .map(CameraMetadata::getZoneId)
                .orElse(ZoneOffset.UTC));
        int hour = local.getHour();
        long day = local.toLocalDate().toEpochDay();
        double alpha = settings.smoothingAlpha();
        ActivityBaseline.Key key = new ActivityBaseline.Key(cameraId, species, hour);

        Instant windowStart = ts.minus(Duration.ofMinutes(settings.getRateWindowMinutes()));
        double observed = context.countDetections(cameraId, species, windowStart, ts) + 1.0;

        ActivityBaseline stored = baselines.get(key);
        ActivityBaseline baseline = stored.decayedTo(day, alpha);
        long pairSamples = baselines.totalSamples(cameraId, species)
                + baseline.getSampleCount() - stored.getSampleCount();

        double z = baseline.getSampleCount() == 0
                ? 0.0
                : (observed - baseline.getMean()) / Math.max(baseline.getStdDev(), settings.getStdDevEpsilon());
        double score = Math.min(Math.abs(z) / settings.getSaturationZ(), 1.0);

        boolean established = pairSamples >= settings.getMinSamples();
        boolean temporalAnomaly = established
                && (baseline.getSampleCount() == 0 || baseline.getMean() < settings.getNearZeroMean());
        if (temporalAnomaly) {
            score = 1.0;
        }
        if (!established) {
            score = Math.min(score, settings.getColdStartCap());
        }
        double reliability = Math.min(1.0, (double) pairSamples / settings.getMinSamples());

        // Update after scoring, never before
        baselines.update(key, b -> b.decayedTo(day, alpha).observe(observed, alpha, day));

        if (temporalAnomaly || score >= 1.0) {
            LOG.info("Anomalous activity: {} on {} at hour {} (observed={}, z={}, temporal={})",
                    species, cameraId, hour, observed, z, temporalAnomaly);
        }
        return new AnomalyAssessment(observed, z, score, temporalAnomaly, reliability);
    }
}
