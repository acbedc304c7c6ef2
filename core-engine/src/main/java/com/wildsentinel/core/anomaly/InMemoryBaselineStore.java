package com.wildsentinel.core.anomaly;

import com.wildsentinel.core.model.ActivityBaseline;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link BaselineStore} backed by a {@link ConcurrentHashMap}; updates to one
 * key are atomic through {@link ConcurrentHashMap#compute}.
 *
 * @since 1.0.0
 */
public class InMemoryBaselineStore implements BaselineStore {

    private final Map<ActivityBaseline.Key, ActivityBaseline> baselines = new ConcurrentHashMap<>();

    @Override
    public ActivityBaseline get(ActivityBaseline.Key key) {
        ActivityBaseline baseline = baselines.get(key);
        return baseline != null ? baseline : ActivityBaseline.empty(key);
    }

    @Override
    public ActivityBaseline update(ActivityBaseline.Key key, UnaryOperator<ActivityBaseline> update) {
        return baselines.compute(key,
                (k, current) -> update.apply(current != null ? current : ActivityBaseline.empty(k)));
    }

    @Override
    public long totalSamples(String cameraId, String species) {
        long total = 0;
        for (int hour = 0; hour < 24; hour++) {
            ActivityBaseline baseline = baselines.get(new ActivityBaseline.Key(cameraId, species, hour));
            if (baseline != null) {
                total += baseline.getSampleCount();
            }
        }
        return total;
    }
}
