package com.wildsentinel.core.adaptation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the current {@link ParameterSnapshot}.
 *
 * <p>
 * Readers take one snapshot per evaluation with {@link #current()};
 * the adaptation loop swaps in a successor with {@link #publish}. A stale
 * publish (version not greater than the current one) is rejected.
 * </p>
 *
 * @since 1.0.0
 */
public class ParameterRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterRegistry.class);

    private final AtomicReference<ParameterSnapshot> current;

    public ParameterRegistry(ParameterSnapshot initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial must not be null"));
    }

    public ParameterSnapshot current() {
        return current.get();
    }

    /**
     * Publish {@code next} if it is newer than the current snapshot.
     *
     * @return {@code true} if published
     */
    public boolean publish(ParameterSnapshot next) {
        Objects.requireNonNull(next, "next must not be null");
        ParameterSnapshot previous = current.getAndUpdate(
                cur -> next.getVersion() > cur.getVersion() ? next : cur);
        if (next.getVersion() <= previous.getVersion()) {
            LOG.warn("Rejected stale parameter snapshot v{} (current v{})",
                    next.getVersion(), previous.getVersion());
            return false;
        }
        LOG.info("Published parameter snapshot v{} ({} learned threshold(s))",
                next.getVersion(), next.getThresholds().size());
        return true;
    }
}
