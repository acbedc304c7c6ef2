package com.wildsentinel.core.adaptation;

import com.wildsentinel.core.config.EngineConfig;
import com.wildsentinel.core.config.ScoringSettings;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, versioned set of learned scoring parameters: the ensemble
 * weights and the per camera/species false-positive thresholds.
 *
 * <p>
 * One evaluation reads one snapshot from start to finish. The adaptation
 * loop never mutates a snapshot; it publishes a successor through
 * {@link ParameterRegistry}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParameterSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Ensemble weights, always normalised to sum to 1.
     */
    public record Weights(double base, double temporal, double size, double environmental)
            implements Serializable {

        public Weights {
            double sum = base + temporal + size + environmental;
            if (base < 0 || temporal < 0 || size < 0 || environmental < 0 || sum <= 0) {
                throw new IllegalArgumentException("Weights must be non-negative and not all zero");
            }
        }

        /**
         * @return these weights scaled to sum to exactly 1
         */
        public Weights normalized() {
            double sum = base + temporal + size + environmental;
            return new Weights(base / sum, temporal / sum, size / sum, environmental / sum);
        }

        public static Weights of(ScoringSettings settings) {
            return new Weights(settings.getBaseWeight(), settings.getTemporalWeight(),
                    settings.getSizeWeight(), settings.getEnvironmentalWeight()).normalized();
        }
    }

    private final long version;
    private final Weights weights;
    private final double defaultThreshold;
    private final Map<String, Double> thresholds;
    private final Instant publishedAt;

    public ParameterSnapshot(long version, Weights weights, double defaultThreshold,
            Map<String, Double> thresholds, Instant publishedAt) {
        this.version = version;
        this.weights = Objects.requireNonNull(weights, "weights must not be null").normalized();
        this.defaultThreshold = defaultThreshold;
        this.thresholds = Map.copyOf(Objects.requireNonNull(thresholds, "thresholds must not be null"));
        this.publishedAt = Objects.requireNonNull(publishedAt, "publishedAt must not be null");
    }

    /**
     * @return version 1, built from the static configuration
     */
    public static ParameterSnapshot initial(EngineConfig config, Instant now) {
        return new ParameterSnapshot(1L, Weights.of(config.getScoring()),
                config.getClassification().getDefaultFalsePositiveThreshold(), Map.of(), now);
    }

    /**
     * @return the successor snapshot carrying the given parameters
     */
    public ParameterSnapshot next(Weights newWeights, Map<String, Double> newThresholds, Instant now) {
        return new ParameterSnapshot(version + 1, newWeights, defaultThreshold, newThresholds, now);
    }

    /**
     * @return the learned false-positive threshold for the pair, or the
     *         configured default
     */
    public double thresholdFor(String cameraId, String species) {
        return thresholds.getOrDefault(key(cameraId, species), defaultThreshold);
    }

    /**
     * Canonical key for a camera/species pair.
     */
    public static String key(String cameraId, String species) {
        return cameraId + "|" + (species == null ? "" : species.trim().toLowerCase(Locale.ROOT));
    }

    public long getVersion() {
        return version;
    }

    public Weights getWeights() {
        return weights;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public Map<String, Double> getThresholds() {
        return thresholds;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    @Override
    public String toString() {
        return "ParameterSnapshot{" +
                "version=" + version +
                ", weights=" + weights +
                ", defaultThreshold=" + defaultThreshold +
                ", thresholds=" + thresholds +
                ", publishedAt=" + publishedAt +
                '}';
    }
}
