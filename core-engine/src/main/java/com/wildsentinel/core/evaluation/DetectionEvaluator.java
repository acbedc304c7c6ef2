package com.wildsentinel.core.evaluation;

import com.wildsentinel.core.adaptation.ParameterRegistry;
import com.wildsentinel.core.adaptation.ParameterSnapshot;
import com.wildsentinel.core.anomaly.ActivityAnomalyDetector;
import com.wildsentinel.core.classification.AlertClassifier;
import com.wildsentinel.core.classification.ClassificationDecision;
import com.wildsentinel.core.correlation.CorrelationEngine;
import com.wildsentinel.core.correlation.CorrelationOutcome;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertState;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.ScoredDetection;
import com.wildsentinel.core.repository.AlertRepository;
import com.wildsentinel.core.scoring.ConfidenceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs one detection through scoring, anomaly detection, classification and
 * correlation, and persists the resulting alert.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>Validate and normalise the event ({@link DetectionValidator}).</li>
 * <li>Take the current {@link ParameterSnapshot}; the whole evaluation uses
 * it.</li>
 * <li>Score, attach the anomaly assessment, classify.</li>
 * <li>Filtered: persist as a FILTERED audit record.<br>
 * Promoted: correlate (which may mark it DUPLICATE) and persist.</li>
 * <li>Record the event in the detection history for later temporal
 * scoring.</li>
 * </ol>
 *
 * <h3>Corrections</h3>
 * <p>
 * An event whose {@code detectionId} already has an alert is a correction.
 * If its composite confidence is higher, the existing alert's scores,
 * severity and priority are superseded in place; otherwise it is ignored.
 * Filtered and duplicate alerts are never revived by a correction.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEvaluator.class);

    private final ConfidenceScorer scorer;
    private final ActivityAnomalyDetector anomalyDetector;
    private final AlertClassifier classifier;
    private final CorrelationEngine correlation;
    private final AlertRepository alerts;
    private final ParameterRegistry parameters;
    private final Consumer<DetectionEvent> history;
    private final Clock clock;

    /**
     * @param history receives every evaluated event, e.g.
     *                {@code InMemoryContextStore::record}
     */
    public DetectionEvaluator(ConfidenceScorer scorer,
            ActivityAnomalyDetector anomalyDetector,
            AlertClassifier classifier,
            CorrelationEngine correlation,
            AlertRepository alerts,
            ParameterRegistry parameters,
            Consumer<DetectionEvent> history,
            Clock clock) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.anomalyDetector = Objects.requireNonNull(anomalyDetector, "anomalyDetector must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Evaluate one raw detection.
     *
     * @throws InvalidDetectionException if the event fails validation
     */
    public EvaluationResult evaluate(DetectionEvent raw) {
        DetectionEvent event = DetectionValidator.validate(raw);
        ParameterSnapshot params = parameters.current();

        Optional<Alert> existing = alerts.findByDetectionId(event.getDetectionId());
        if (existing.isPresent()) {
            return correct(existing.get(), event, params);
        }

        ScoredDetection scored = anomalyDetector.apply(scorer.score(event, params));
        ClassificationDecision decision = classifier.classify(scored, params);
        Alert alert = Alert.builder()
                .scoredDetection(scored)
                .severity(decision.getSeverity())
                .priority(decision.getPriority())
                .falsePositiveScore(decision.getFalsePositiveScore())
                .createdAt(clock.instant())
                .build();
        history.accept(event);

        if (decision.isFiltered()) {
            alert.markFiltered(decision.getFilterReason());
            alerts.save(alert);
            LOG.info("Filtered {} on {} at {}: {}", event.getSpecies(), event.getCameraId(),
                    event.getTimestamp(), decision.getFilterReason());
            return new EvaluationResult(EvaluationResult.Outcome.FILTERED, alert, decision, null);
        }

        alert.transitionTo(AlertState.PROMOTED);
        CorrelationOutcome outcome = correlation.correlate(alert);
        alerts.save(alert);
        if (outcome.isDuplicate()) {
            return new EvaluationResult(EvaluationResult.Outcome.DUPLICATE, alert, decision, outcome);
        }
        LOG.info("Promoted {} alert {} for {} on {} (composite={}, fp={})", alert.getSeverity(), alert.getId(),
                event.getSpecies(), event.getCameraId(), scored.getCompositeConfidence(),
                decision.getFalsePositiveScore());
        return new EvaluationResult(EvaluationResult.Outcome.PROMOTED, alert, decision, outcome);
    }

    private EvaluationResult correct(Alert alert, DetectionEvent event, ParameterSnapshot params) {
        AlertState state = alert.getState();
        // Corrections do not touch the anomaly baseline: the sighting was already counted
        ScoredDetection scored = scorer.score(event, params)
                .withAnomaly(alert.getAnomalyScore(), false, 0.0);
        if (state == AlertState.FILTERED || state == AlertState.DUPLICATE
                || scored.getCompositeConfidence() <= alert.getCompositeConfidence()) {
            LOG.info("Ignoring correction for detection {} (alert {} {}, composite {} vs {})",
                    event.getDetectionId(), alert.getId(), state,
                    scored.getCompositeConfidence(), alert.getCompositeConfidence());
            return new EvaluationResult(EvaluationResult.Outcome.CORRECTION_IGNORED, alert, null, null);
        }
        ClassificationDecision decision = classifier.classify(scored, params);
        alert.supersede(scored, decision.getSeverity(), decision.getPriority(), decision.getFalsePositiveScore());
        alerts.save(alert);
        LOG.info("Correction superseded alert {}: severity {} composite {}",
                alert.getId(), decision.getSeverity(), scored.getCompositeConfidence());
        return new EvaluationResult(EvaluationResult.Outcome.SUPERSEDED, alert, decision, null);
    }
}
