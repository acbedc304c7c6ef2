package com.wildsentinel.core.classification;

import com.wildsentinel.core.adaptation.ParameterSnapshot;
import com.wildsentinel.core.config.ClassificationSettings;
import com.wildsentinel.core.config.EngineConfig;
import com.wildsentinel.core.config.EngineConfigLoader;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.ScoredDetection;
import com.wildsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AlertClassifier}.
 */
class AlertClassifierTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private AlertClassifier classifier;
    private ParameterSnapshot params;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfigLoader.fromClasspath("engine.yml");
        classifier = new AlertClassifier(new ClassificationSettings(), config.speciesCatalog());
        params = ParameterSnapshot.initial(config, NOW);
    }

    @Nested
    @DisplayName("Severity")
    class SeverityAssignment {

        @ParameterizedTest(name = "{0} at {1} -> {2}")
        @CsvSource({
                "bear, 0.90, EMERGENCY",
                "grizzly, 0.85, EMERGENCY",
                "bear, 0.80, CRITICAL",
                "wolf, 0.95, CRITICAL",
                "wolf, 0.60, WARNING",
                "deer, 0.60, WARNING",
                "deer, 0.40, INFO",
                "lynx, 0.30, WARNING",
                "badger, 0.30, INFO"
        })
        @DisplayName("Should map species danger and confidence to a severity")
        void shouldAssignSeverity(String species, double composite, Severity expected) {
            assertThat(classifier.severityFor(species, composite)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should rank priority by severity first, then confidence")
        void shouldOrderPriorities() {
            assertThat(AlertClassifier.priorityFor(Severity.EMERGENCY, 0.85))
                    .isGreaterThan(AlertClassifier.priorityFor(Severity.CRITICAL, 1.0));
            assertThat(AlertClassifier.priorityFor(Severity.CRITICAL, 0.75))
                    .isGreaterThan(AlertClassifier.priorityFor(Severity.WARNING, 1.0));
            assertThat(AlertClassifier.priorityFor(Severity.WARNING, 0.9))
                    .isGreaterThan(AlertClassifier.priorityFor(Severity.WARNING, 0.6));
            assertThat(AlertClassifier.priorityFor(Severity.WARNING, 1.0)).isEqualTo(100);
            assertThat(AlertClassifier.priorityFor(Severity.INFO, 0.0)).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("False-positive score")
    class FalsePositiveScore {

        @Test
        @DisplayName("Should be the complement of confidence without anomaly evidence")
        void shouldComplementConfidence() {
            assertThat(classifier.falsePositiveScore(scored("raccoon", 0.42, 0.2, 1.0, 0.1)))
                    .isCloseTo(0.58, within(1e-9));
        }

        @Test
        @DisplayName("Should be discounted by reliable anomaly evidence")
        void shouldDiscountReliableAnomaly() {
            ScoredDetection anomalous = scored("raccoon", 0.42, 0.2, 1.0, 0.1).withAnomaly(1.0, true, 1.0);

            assertThat(classifier.falsePositiveScore(anomalous)).isCloseTo(0.58 * (1 - 0.168), within(1e-9));
        }

        @Test
        @DisplayName("Should ignore anomaly evidence from an unreliable baseline")
        void shouldIgnoreUnreliableAnomaly() {
            ScoredDetection anomalous = scored("raccoon", 0.42, 0.2, 1.0, 0.1).withAnomaly(1.0, false, 0.0);

            assertThat(classifier.falsePositiveScore(anomalous)).isCloseTo(0.58, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("Should promote a confident, consistent wolf as CRITICAL")
        void shouldPromoteWolf() {
            ClassificationDecision decision = classifier.classify(scored("wolf", 0.95, 1.0, 1.0, 0.95), params);

            assertThat(decision.isFiltered()).isFalse();
            assertThat(decision.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(decision.getFalsePositiveScore()).isCloseTo(0.05, within(1e-9));
            assertThat(decision.getThreshold()).isEqualTo(0.6);
        }

        @Test
        @DisplayName("Should filter an isolated single-frame deer and say why")
        void shouldFilterIsolatedDeer() {
            ClassificationDecision decision = classifier.classify(scored("deer", 0.295, 0.0, 1.0, 0.6), params);

            assertThat(decision.isFiltered()).isTrue();
            assertThat(decision.getFalsePositiveScore()).isCloseTo(0.705, within(1e-9));
            assertThat(decision.getFilterReason())
                    .startsWith("False-positive score ")
                    .contains("exceeds threshold 0.60")
                    .endsWith("low temporal consistency 0.00: isolated single-frame detection");
        }

        @Test
        @DisplayName("Should filter a zero-confidence detection")
        void shouldFilterZeroConfidence() {
            ClassificationDecision decision = classifier.classify(scored("wolf", 0.0, 0.0, 0.0, 0.1), params);

            assertThat(decision.isFiltered()).isTrue();
            assertThat(decision.getFalsePositiveScore()).isEqualTo(1.0);
            assertThat(decision.getFilterReason()).contains("implausible size for wolf (score 0.00)");
        }

        @Test
        @DisplayName("Should promote above the threshold when every context check passes")
        void shouldPromoteWhenContextChecksPass() {
            ClassificationDecision decision = classifier.classify(scored("deer", 0.3, 1.0, 1.0, 0.95), params);

            assertThat(decision.getFalsePositiveScore()).isGreaterThan(decision.getThreshold());
            assertThat(decision.isFiltered()).isFalse();
        }

        @Test
        @DisplayName("Should promote a daytime raccoon under the default threshold")
        void shouldPromoteRaccoonUnderDefaultThreshold() {
            ClassificationDecision decision = classifier.classify(scored("raccoon", 0.42, 0.2, 1.0, 0.1), params);

            assertThat(decision.isFiltered()).isFalse();
            assertThat(decision.getSeverity()).isEqualTo(Severity.INFO);
        }

        @Test
        @DisplayName("Should filter the same raccoon once its threshold has been learned down")
        void shouldFilterRaccoonUnderLearnedThreshold() {
            ParameterSnapshot learned = params.next(params.getWeights(), Map.of("cam-1|raccoon", 0.45), NOW);

            ClassificationDecision decision = classifier.classify(scored("raccoon", 0.42, 0.2, 1.0, 0.1), learned);

            assertThat(decision.isFiltered()).isTrue();
            assertThat(decision.getThreshold()).isEqualTo(0.45);
            assertThat(decision.getFilterReason())
                    .contains("exceeds threshold 0.45")
                    .contains("low temporal consistency 0.20 < 0.30")
                    .contains("implausible time or conditions for raccoon (score 0.10)");
        }

        @Test
        @DisplayName("Should list weather checks that fail")
        void shouldReportWeatherChecks() {
            DetectionEvent event = event("deer").toBuilder()
                    .environmentalContext(Map.of("temperature", -10, "windSpeed", 55, "visibility", 4))
                    .build();

            ClassificationDecision decision = classifier.classify(
                    new ScoredDetection(event, 0.2, 1.0, 1.0, 0.95), params);

            assertThat(decision.isFiltered()).isTrue();
            assertThat(decision.getFilterReason())
                    .contains("extreme temperature -10.0 outside [-5.0, 40.0]")
                    .contains("excessive wind 55.0 > 40.0")
                    .contains("low visibility 4.0 < 10.0");
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ScoredDetection scored(String species, double composite, double temporal, double size,
            double environmental) {
        return new ScoredDetection(event(species), composite, temporal, size, environmental);
    }

    private static DetectionEvent event(String species) {
        return DetectionEvent.builder()
                .detectionId("d-1")
                .species(species)
                .baseConfidence(0.5)
                .cameraId("cam-1")
                .timestamp(NOW)
                .build();
    }
}
