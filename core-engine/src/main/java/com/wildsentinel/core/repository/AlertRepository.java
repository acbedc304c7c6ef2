package com.wildsentinel.core.repository;

import com.wildsentinel.core.model.Alert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for alerts, including filtered audit records.
 *
 * @since 1.0.0
 */
public interface AlertRepository {

    void save(Alert alert);

    Optional<Alert> findById(String id);

    /**
     * @return the alert created for the detection, if any
     */
    Optional<Alert> findByDetectionId(String detectionId);

    /**
     * @return matching alerts, newest first, paged
     */
    List<Alert> find(AlertQuery query);

    /**
     * @return alerts created in {@code [from, to)}, any state
     */
    List<Alert> findCreatedBetween(Instant from, Instant to);
}
