package com.wildsentinel.core.repository;

import com.wildsentinel.core.model.FeedbackRecord;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Heap-backed, append-only {@link FeedbackRepository}. Conflicting feedback
 * for one alert is kept side by side.
 *
 * @since 1.0.0
 */
public class InMemoryFeedbackRepository implements FeedbackRepository {

    private final List<FeedbackRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(FeedbackRecord record) {
        records.add(Objects.requireNonNull(record, "record must not be null"));
    }

    @Override
    public List<FeedbackRecord> findByAlertId(String alertId) {
        return records.stream().filter(r -> r.getAlertId().equals(alertId)).toList();
    }

    @Override
    public List<FeedbackRecord> findSince(Instant since) {
        return records.stream().filter(r -> !r.getCreatedAt().isBefore(since)).toList();
    }
}
