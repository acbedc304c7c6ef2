package com.wildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw species sighting reported by the upstream classifier.
 *
 * <p>
 * Instances are immutable. The builder does not reject missing fields:
 * ingress validation is the job of
 * {@link com.wildsentinel.core.evaluation.DetectionValidator}, which reports
 * every problem at once instead of failing on the first.
 * </p>
 *
 * <h3>Environmental context</h3>
 * <p>
 * Free-form key/value pairs (e.g. {@code temperature}, {@code timeOfDay},
 * {@code weather}, {@code windSpeed}, {@code visibility}). Any of them may be
 * absent; scoring falls back to neutral values.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = DetectionEvent.Builder.class)
public final class DetectionEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CONTEXT_TEMPERATURE = "temperature";
    public static final String CONTEXT_TIME_OF_DAY = "timeOfDay";
    public static final String CONTEXT_WEATHER = "weather";
    public static final String CONTEXT_WIND_SPEED = "windSpeed";
    public static final String CONTEXT_VISIBILITY = "visibility";

    private final String detectionId;
    private final String species;
    private final double baseConfidence;
    private final BoundingBox boundingBox;
    private final String cameraId;
    private final Instant timestamp;
    private final Map<String, Object> environmentalContext;
    private final String imageUrl;

    private DetectionEvent(Builder b) {
        this.detectionId = b.detectionId;
        this.species = b.species;
        this.baseConfidence = b.baseConfidence;
        this.boundingBox = b.boundingBox;
        this.cameraId = b.cameraId;
        this.timestamp = b.timestamp;
        this.environmentalContext = b.environmentalContext != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.environmentalContext))
                : Collections.emptyMap();
        this.imageUrl = b.imageUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this event's values
     */
    public Builder toBuilder() {
        return new Builder()
                .detectionId(detectionId)
                .species(species)
                .baseConfidence(baseConfidence)
                .boundingBox(boundingBox)
                .cameraId(cameraId)
                .timestamp(timestamp)
                .environmentalContext(environmentalContext)
                .imageUrl(imageUrl);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getDetectionId() {
        return detectionId;
    }

    public String getSpecies() {
        return species;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    public String getCameraId() {
        return cameraId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getEnvironmentalContext() {
        return environmentalContext;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    /**
     * @return {@code true} if no environmental context was supplied at all
     */
    @JsonIgnore
    public boolean hasEnvironmentalContext() {
        return !environmentalContext.isEmpty();
    }

    /**
     * Retrieve a numeric context value, coercing common JSON number types.
     *
     * @param key the context key
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericContext(String key) {
        Object raw = environmentalContext.get(key);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * @param key the context key
     * @return optional containing the string form of the value
     */
    public Optional<String> getStringContext(String key) {
        Object raw = environmentalContext.get(key);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder, also used by Jackson when reading detections off the
     * wire.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String detectionId;
        private String species;
        private double baseConfidence = Double.NaN;
        private BoundingBox boundingBox;
        private String cameraId;
        private Instant timestamp;
        private Map<String, Object> environmentalContext;
        private String imageUrl;

        public Builder detectionId(String detectionId) {
            this.detectionId = detectionId;
            return this;
        }

        public Builder species(String species) {
            this.species = species;
            return this;
        }

        public Builder baseConfidence(double baseConfidence) {
            this.baseConfidence = baseConfidence;
            return this;
        }

        public Builder boundingBox(BoundingBox boundingBox) {
            this.boundingBox = boundingBox;
            return this;
        }

        public Builder cameraId(String cameraId) {
            this.cameraId = cameraId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder environmentalContext(Map<String, Object> environmentalContext) {
            this.environmentalContext = environmentalContext;
            return this;
        }

        public Builder imageUrl(String imageUrl) {
            this.imageUrl = imageUrl;
            return this;
        }

        public DetectionEvent build() {
            return new DetectionEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionEvent that))
            return false;
        return Double.compare(baseConfidence, that.baseConfidence) == 0
                && Objects.equals(detectionId, that.detectionId)
                && Objects.equals(species, that.species)
                && Objects.equals(cameraId, that.cameraId)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectionId, species, baseConfidence, cameraId, timestamp);
    }

    @Override
    public String toString() {
        return "DetectionEvent{" +
                "detectionId='" + detectionId + '\'' +
                ", species='" + species + '\'' +
                ", baseConfidence=" + baseConfidence +
                ", cameraId='" + cameraId + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
