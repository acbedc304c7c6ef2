package com.wildsentinel.core.evaluation;

import com.wildsentinel.core.MutableClock;
import com.wildsentinel.core.adaptation.ParameterRegistry;
import com.wildsentinel.core.adaptation.ParameterSnapshot;
import com.wildsentinel.core.anomaly.ActivityAnomalyDetector;
import com.wildsentinel.core.anomaly.InMemoryBaselineStore;
import com.wildsentinel.core.classification.AlertClassifier;
import com.wildsentinel.core.config.EngineConfig;
import com.wildsentinel.core.config.EngineConfigLoader;
import com.wildsentinel.core.context.InMemoryContextStore;
import com.wildsentinel.core.correlation.CorrelationEngine;
import com.wildsentinel.core.model.AlertState;
import com.wildsentinel.core.model.BoundingBox;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.Severity;
import com.wildsentinel.core.repository.AlertQuery;
import com.wildsentinel.core.repository.InMemoryAlertRepository;
import com.wildsentinel.core.scoring.ConfidenceScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DetectionEvaluator}, wired with the in-memory stores.
 */
class DetectionEvaluatorTest {

    private static final Instant NIGHT = Instant.parse("2024-06-01T23:30:00Z");

    private InMemoryContextStore context;
    private InMemoryAlertRepository alerts;
    private DetectionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfigLoader.fromClasspath("engine.yml");
        MutableClock clock = new MutableClock(NIGHT);
        context = new InMemoryContextStore();
        alerts = new InMemoryAlertRepository();
        evaluator = new DetectionEvaluator(
                new ConfidenceScorer(config.getScoring(), config.speciesCatalog(), context),
                new ActivityAnomalyDetector(config.getAnomaly(), new InMemoryBaselineStore(), context),
                new AlertClassifier(config.getClassification(), config.speciesCatalog()),
                new CorrelationEngine(config.getCorrelation()),
                alerts,
                new ParameterRegistry(ParameterSnapshot.initial(config, NIGHT)),
                context::record,
                clock);
    }

    @Test
    @DisplayName("Should promote a consistent night-time wolf sighting")
    void shouldPromoteWolf() {
        recordPriorWolfFrames();

        EvaluationResult result = evaluator.evaluate(wolf("d-1", 0.9, NIGHT));

        assertThat(result.outcome()).isEqualTo(EvaluationResult.Outcome.PROMOTED);
        assertThat(result.isDispatchable()).isTrue();
        assertThat(result.alert().getState()).isEqualTo(AlertState.PROMOTED);
        assertThat(result.alert().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.alert().getCompositeConfidence()).isCloseTo(0.95, within(1e-9));
        assertThat(result.correlation().isDuplicate()).isFalse();
        assertThat(alerts.findByDetectionId("d-1")).containsSame(result.alert());
    }

    @Test
    @DisplayName("Should keep a filtered sighting as an audit record only")
    void shouldPersistFilteredAlert() {
        DetectionEvent deer = DetectionEvent.builder()
                .detectionId("d-deer")
                .species("Deer")
                .baseConfidence(0.5)
                .cameraId("cam-1")
                .timestamp(NIGHT)
                .build();

        EvaluationResult result = evaluator.evaluate(deer);

        assertThat(result.outcome()).isEqualTo(EvaluationResult.Outcome.FILTERED);
        assertThat(result.isDispatchable()).isFalse();
        assertThat(result.correlation()).isNull();
        assertThat(result.alert().getFilterReason())
                .contains("isolated single-frame detection");
        assertThat(alerts.findByDetectionId("d-deer")).isPresent();
        assertThat(alerts.find(AlertQuery.all())).isEmpty();
        assertThat(alerts.find(AlertQuery.all().includeFiltered(true))).hasSize(1);
    }

    @Test
    @DisplayName("Should record every evaluated detection in the history")
    void shouldRecordHistory() {
        evaluator.evaluate(wolf("d-1", 0.9, NIGHT));

        assertThat(context.recentDetections("cam-1", NIGHT.minusSeconds(1), NIGHT.plusSeconds(1), 5))
                .extracting(DetectionEvent::getDetectionId)
                .containsExactly("d-1");
    }

    @Test
    @DisplayName("Should mark a repeat sighting within the window as a duplicate")
    void shouldDetectDuplicate() {
        recordPriorWolfFrames();
        EvaluationResult first = evaluator.evaluate(wolf("d-1", 0.9, NIGHT));

        EvaluationResult second = evaluator.evaluate(wolf("d-2", 0.9, NIGHT.plusSeconds(60)));

        assertThat(second.outcome()).isEqualTo(EvaluationResult.Outcome.DUPLICATE);
        assertThat(second.isDispatchable()).isFalse();
        assertThat(second.alert().getDuplicateOf()).isEqualTo(first.alert().getId());
        assertThat(alerts.findByDetectionId("d-2")).isPresent();
    }

    @Test
    @DisplayName("Should supersede an alert when a correction raises its confidence")
    void shouldSupersedeOnBetterCorrection() {
        recordPriorWolfFrames();
        EvaluationResult original = evaluator.evaluate(wolf("d-1", 0.7, NIGHT));
        double before = original.alert().getCompositeConfidence();

        EvaluationResult corrected = evaluator.evaluate(wolf("d-1", 0.9, NIGHT));

        assertThat(corrected.outcome()).isEqualTo(EvaluationResult.Outcome.SUPERSEDED);
        assertThat(corrected.alert()).isSameAs(original.alert());
        assertThat(corrected.alert().getCompositeConfidence()).isGreaterThan(before);
        assertThat(corrected.alert().getDetection().getBaseConfidence()).isEqualTo(0.9);
        assertThat(corrected.isDispatchable()).isFalse();
    }

    @Test
    @DisplayName("Should ignore a correction that does not raise confidence")
    void shouldIgnoreWeakerCorrection() {
        recordPriorWolfFrames();
        EvaluationResult original = evaluator.evaluate(wolf("d-1", 0.9, NIGHT));

        EvaluationResult corrected = evaluator.evaluate(wolf("d-1", 0.5, NIGHT));

        assertThat(corrected.outcome()).isEqualTo(EvaluationResult.Outcome.CORRECTION_IGNORED);
        assertThat(corrected.decision()).isNull();
        assertThat(original.alert().getDetection().getBaseConfidence()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Should never revive a filtered alert through a correction")
    void shouldNotReviveFiltered() {
        DetectionEvent.Builder deer = DetectionEvent.builder()
                .detectionId("d-deer")
                .species("deer")
                .cameraId("cam-1")
                .timestamp(NIGHT);
        evaluator.evaluate(deer.baseConfidence(0.5).build());

        EvaluationResult corrected = evaluator.evaluate(deer.baseConfidence(1.0).build());

        assertThat(corrected.outcome()).isEqualTo(EvaluationResult.Outcome.CORRECTION_IGNORED);
        assertThat(corrected.alert().getState()).isEqualTo(AlertState.FILTERED);
    }

    @Test
    @DisplayName("Should reject an invalid detection before scoring it")
    void shouldRejectInvalidDetection() {
        DetectionEvent invalid = DetectionEvent.builder().species("wolf").timestamp(NIGHT).build();

        assertThatThrownBy(() -> evaluator.evaluate(invalid))
                .isInstanceOf(InvalidDetectionException.class)
                .hasMessageContaining("'cameraId' is required");
        assertThat(alerts.find(AlertQuery.all().includeFiltered(true))).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void recordPriorWolfFrames() {
        context.record(wolf("prior-1", 0.85, NIGHT.minusSeconds(4)));
        context.record(wolf("prior-2", 0.88, NIGHT.minusSeconds(2)));
    }

    private static DetectionEvent wolf(String detectionId, double confidence, Instant at) {
        return DetectionEvent.builder()
                .detectionId(detectionId)
                .species("wolf")
                .baseConfidence(confidence)
                .cameraId("cam-1")
                .timestamp(at)
                .boundingBox(BoundingBox.normalized(0.2, 0.2, 0.3, 0.3))
                .environmentalContext(Map.of("temperature", 8))
                .build();
    }
}
