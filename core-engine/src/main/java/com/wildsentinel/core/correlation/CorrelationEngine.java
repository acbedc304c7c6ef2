package com.wildsentinel.core.correlation;

import com.wildsentinel.core.config.CorrelationSettings;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Correlation and deduplication of promoted alerts.
 *
 * <h3>Index</h3>
 * <p>
 * A short-lived index keyed by {@code camera|species} holds the most recent
 * original (non-duplicate) alert for that pair. Entries older than the
 * correlation window, measured on detection timestamps, are ignored and
 * swept.
 * </p>
 *
 * <h3>Decisions</h3>
 * <ul>
 * <li><b>Duplicate</b> - same camera and species within the window: the new
 * alert is marked {@code duplicateOf} the indexed one and moves to
 * {@link AlertState#DUPLICATE}. Duplicates do not extend the window.</li>
 * <li><b>Related</b> - same species on another camera, or another species on
 * the same camera, within the window: all of them share a correlation group.
 * Grouping never suppresses dispatch.</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The duplicate check and index insert for one key happen inside a single
 * {@link ConcurrentHashMap#compute}, so two racing detections of the same
 * pair always yield exactly one original. Group assignment runs under a
 * separate lock after that.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationEngine.class);

    private record Entry(Alert alert, String cameraId, String species, Instant detectedAt) {
    }

    private final Duration window;
    private final Map<String, Entry> index = new ConcurrentHashMap<>();
    private final Object groupLock = new Object();

    public CorrelationEngine(CorrelationSettings settings) {
        this.window = Objects.requireNonNull(settings, "settings must not be null").window();
    }

    /**
     * Correlate a freshly promoted alert.
     *
     * @param alert alert in state {@link AlertState#PROMOTED}
     * @return the decision; a duplicate has already been transitioned
     */
    public CorrelationOutcome correlate(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        String cameraId = alert.getCameraId();
        String species = normalize(alert.getSpecies());
        Instant at = alert.getDetectedAt();

        AtomicReference<Entry> original = new AtomicReference<>();
        index.compute(key(cameraId, species), (k, existing) -> {
            if (existing != null && withinWindow(existing.detectedAt(), at)
                    && !existing.alert().getId().equals(alert.getId())) {
                original.set(existing);
                return existing;
            }
            return new Entry(alert, cameraId, species, at);
        });

        Entry earlier = original.get();
        if (earlier != null) {
            alert.markDuplicateOf(earlier.alert().getId());
            LOG.info("Alert {} ({} on {}) is a duplicate of {}",
                    alert.getId(), species, cameraId, earlier.alert().getId());
            return CorrelationOutcome.duplicate(earlier.alert().getId());
        }
        return group(alert, cameraId, species, at);
    }

    /**
     * Drop index entries older than the window relative to {@code now}.
     * Groups already assigned are left as they are.
     *
     * @return number of entries removed
     */
    public int evictExpired(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, Entry>> it = index.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> e = it.next();
            if (Duration.between(e.getValue().detectedAt(), now).compareTo(window) > 0) {
                // Only remove the exact entry we looked at
                if (index.remove(e.getKey(), e.getValue())) {
                    removed++;
                }
            }
        }
        return removed;
    }

    /** Number of live index entries. */
    public int size() {
        return index.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private CorrelationOutcome group(Alert alert, String cameraId, String species, Instant at) {
        synchronized (groupLock) {
            List<Alert> related = new ArrayList<>();
            for (Entry e : index.values()) {
                if (e.alert() == alert || !withinWindow(e.detectedAt(), at)) {
                    continue;
                }
                boolean sameSpeciesElsewhere = e.species().equals(species) && !e.cameraId().equals(cameraId);
                boolean sameCameraOtherSpecies = e.cameraId().equals(cameraId) && !e.species().equals(species);
                if (sameSpeciesElsewhere || sameCameraOtherSpecies) {
                    related.add(e.alert());
                }
            }
            if (related.isEmpty()) {
                return CorrelationOutcome.distinct(null, List.of());
            }

            String group = related.stream()
                    .map(Alert::getCorrelationGroup)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElseGet(() -> UUID.randomUUID().toString());
            List<String> relatedIds = new ArrayList<>();
            for (Alert other : related) {
                if (other.getCorrelationGroup() == null) {
                    other.setCorrelationGroup(group);
                }
                relatedIds.add(other.getId());
            }
            alert.setCorrelationGroup(group);
            LOG.debug("Alert {} ({} on {}) joined correlation group {} with {}",
                    alert.getId(), species, cameraId, group, relatedIds);
            return CorrelationOutcome.distinct(group, relatedIds);
        }
    }

    private boolean withinWindow(Instant a, Instant b) {
        return Duration.between(a, b).abs().compareTo(window) <= 0;
    }

    private static String key(String cameraId, String species) {
        return cameraId + "|" + species;
    }

    private static String normalize(String species) {
        return species == null ? "" : species.trim().toLowerCase(Locale.ROOT);
    }
}
