package com.wildsentinel.core.context;

import com.wildsentinel.core.model.DetectionEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link ContextStore} holding the last few hundred detections
 * per camera.
 *
 * <h3>Memory Management</h3>
 * <p>
 * Each camera keeps at most {@code historyPerCamera} events; the oldest
 * event is evicted on overflow.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Each camera's history is guarded by its own deque monitor, so cameras
 * never contend with each other.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryContextStore implements ContextStore {

    public static final int DEFAULT_HISTORY_PER_CAMERA = 500;

    private final int historyPerCamera;
    private final Map<String, Deque<DetectionEvent>> history = new ConcurrentHashMap<>();
    private final Map<String, CameraMetadata> cameras = new ConcurrentHashMap<>();

    public InMemoryContextStore() {
        this(DEFAULT_HISTORY_PER_CAMERA);
    }

    public InMemoryContextStore(int historyPerCamera) {
        if (historyPerCamera < 1) {
            throw new IllegalArgumentException("historyPerCamera must be >= 1, got: " + historyPerCamera);
        }
        this.historyPerCamera = historyPerCamera;
    }

    /**
     * Append an evaluated detection to its camera's history.
     */
    public void record(DetectionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        Deque<DetectionEvent> deque = history.computeIfAbsent(event.getCameraId(), k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(event);
            while (deque.size() > historyPerCamera) {
                deque.pollFirst();
            }
        }
    }

    public void registerCamera(CameraMetadata metadata) {
        cameras.put(metadata.getCameraId(), metadata);
    }

    @Override
    public List<DetectionEvent> recentDetections(String cameraId, Instant since, Instant before, int limit) {
        Deque<DetectionEvent> deque = history.get(cameraId);
        if (deque == null || limit <= 0) {
            return List.of();
        }
        List<DetectionEvent> result = new ArrayList<>();
        synchronized (deque) {
            Iterator<DetectionEvent> it = deque.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                DetectionEvent e = it.next();
                Instant ts = e.getTimestamp();
                if (!ts.isBefore(since) && ts.isBefore(before)) {
                    result.add(e);
                }
            }
        }
        return result;
    }

    @Override
    public long countDetections(String cameraId, String species, Instant since, Instant until) {
        Deque<DetectionEvent> deque = history.get(cameraId);
        if (deque == null) {
            return 0;
        }
        long count = 0;
        synchronized (deque) {
            for (DetectionEvent e : deque) {
                Instant ts = e.getTimestamp();
                if (e.getSpecies().equalsIgnoreCase(species) && !ts.isBefore(since) && !ts.isAfter(until)) {
                    count++;
                }
            }
        }
        return count;
    }

    @Override
    public Optional<CameraMetadata> cameraMetadata(String cameraId) {
        return Optional.ofNullable(cameras.get(cameraId));
    }
}
