package com.wildsentinel.core.repository;

import com.wildsentinel.core.model.FeedbackRecord;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of user feedback.
 *
 * @since 1.0.0
 */
public interface FeedbackRepository {

    void append(FeedbackRecord record);

    List<FeedbackRecord> findByAlertId(String alertId);

    /**
     * @return records created at or after {@code since}
     */
    List<FeedbackRecord> findSince(Instant since);
}
