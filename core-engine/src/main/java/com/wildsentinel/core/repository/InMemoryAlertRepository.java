package com.wildsentinel.core.repository;

import com.wildsentinel.core.model.Alert;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link AlertRepository}.
 *
 * @since 1.0.0
 */
public class InMemoryAlertRepository implements AlertRepository {

    private static final Comparator<Alert> NEWEST_FIRST =
            Comparator.comparing(Alert::getCreatedAt).reversed().thenComparing(Alert::getId);

    private final Map<String, Alert> byId = new ConcurrentHashMap<>();
    private final Map<String, String> byDetectionId = new ConcurrentHashMap<>();

    @Override
    public void save(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        byId.put(alert.getId(), alert);
        String detectionId = alert.getDetectionRef();
        if (detectionId != null) {
            byDetectionId.putIfAbsent(detectionId, alert.getId());
        }
    }

    @Override
    public Optional<Alert> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<Alert> findByDetectionId(String detectionId) {
        String id = byDetectionId.get(detectionId);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<Alert> find(AlertQuery query) {
        return byId.values().stream()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .skip(query.getOffset())
                .limit(query.getLimit())
                .toList();
    }

    @Override
    public List<Alert> findCreatedBetween(Instant from, Instant to) {
        return byId.values().stream()
                .filter(a -> !a.getCreatedAt().isBefore(from) && a.getCreatedAt().isBefore(to))
                .sorted(NEWEST_FIRST)
                .toList();
    }
}
