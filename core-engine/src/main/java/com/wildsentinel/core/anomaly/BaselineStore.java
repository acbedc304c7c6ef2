package com.wildsentinel.core.anomaly;

import com.wildsentinel.core.model.ActivityBaseline;

import java.util.function.UnaryOperator;

/**
 * Storage for {@link ActivityBaseline}s keyed by camera, species and hour of
 * day.
 *
 * @since 1.0.0
 */
public interface BaselineStore {

    /**
     * @return the stored baseline, or an empty one
     */
    ActivityBaseline get(ActivityBaseline.Key key);

    /**
     * Atomically replace the baseline for {@code key} with
     * {@code update.apply(current)}.
     */
    ActivityBaseline update(ActivityBaseline.Key key, UnaryOperator<ActivityBaseline> update);

    /**
     * @return observations recorded for the pair across all hours of the day
     */
    long totalSamples(String cameraId, String species);
}
