package com.wildsentinel.core.context;

import com.wildsentinel.core.model.DetectionEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of recent detection history and camera metadata.
 *
 * <p>
 * Implementations may sit on top of a remote store; callers on the hot path
 * wrap them in {@link TimeLimitedContextStore} so a slow read degrades to
 * neutral defaults instead of stalling the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public interface ContextStore {

    /**
     * Recent detections from one camera, newest first.
     *
     * @param cameraId camera to read
     * @param since    inclusive lower bound on the detection timestamp
     * @param before   exclusive upper bound on the detection timestamp
     * @param limit    maximum number of events to return
     */
    List<DetectionEvent> recentDetections(String cameraId, Instant since, Instant before, int limit);

    /**
     * Number of detections of {@code species} on {@code cameraId} with a
     * timestamp in {@code [since, until]}.
     */
    long countDetections(String cameraId, String species, Instant since, Instant until);

    /**
     * @return metadata for the camera, or empty if it is unknown
     */
    Optional<CameraMetadata> cameraMetadata(String cameraId);
}
