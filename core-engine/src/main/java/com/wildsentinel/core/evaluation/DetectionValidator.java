package com.wildsentinel.core.evaluation;

import com.wildsentinel.core.model.BoundingBox;
import com.wildsentinel.core.model.DetectionEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Ingress validation for {@link DetectionEvent}s.
 *
 * <p>
 * Collects every problem before failing so the rejected-event log shows the
 * whole picture. A valid event is returned normalised: species trimmed and
 * lowercased, and a detection id assigned when the producer sent none.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionValidator {

    private DetectionValidator() {
    }

    /**
     * @return the normalised event
     * @throws InvalidDetectionException listing every problem found
     */
    public static DetectionEvent validate(DetectionEvent event) {
        if (event == null) {
            throw new InvalidDetectionException(List.of("event is null"));
        }
        List<String> problems = new ArrayList<>();
        if (event.getSpecies() == null || event.getSpecies().isBlank()) {
            problems.add("'species' is required");
        }
        if (event.getCameraId() == null || event.getCameraId().isBlank()) {
            problems.add("'cameraId' is required");
        }
        if (event.getTimestamp() == null) {
            problems.add("'timestamp' is required");
        }
        double confidence = event.getBaseConfidence();
        if (Double.isNaN(confidence)) {
            problems.add("'baseConfidence' is required");
        } else if (confidence < 0 || confidence > 1) {
            problems.add("'baseConfidence' must be in [0, 1], got: " + confidence);
        }
        BoundingBox box = event.getBoundingBox();
        if (box != null && (box.getWidth() < 0 || box.getHeight() < 0)) {
            problems.add("'boundingBox' must have non-negative width and height");
        }
        if (!problems.isEmpty()) {
            throw new InvalidDetectionException(problems);
        }

        DetectionEvent.Builder normalized = event.toBuilder()
                .species(event.getSpecies().trim().toLowerCase(Locale.ROOT));
        if (event.getDetectionId() == null || event.getDetectionId().isBlank()) {
            normalized.detectionId(UUID.randomUUID().toString());
        }
        return normalized.build();
    }
}
