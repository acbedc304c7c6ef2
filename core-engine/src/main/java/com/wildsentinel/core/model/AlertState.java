package com.wildsentinel.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an {@link Alert}.
 *
 * <pre>
 * CREATED → FILTERED
 * CREATED → PROMOTED → DUPLICATE
 *           PROMOTED → DISPATCHING → DELIVERED → ACKNOWLEDGED → RESOLVED
 * </pre>
 *
 * <p>
 * Users may acknowledge or resolve an alert as soon as it is visible, i.e.
 * from PROMOTED onwards, without waiting for delivery to finish.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertState {

    CREATED,
    FILTERED,
    PROMOTED,
    DUPLICATE,
    DISPATCHING,
    DELIVERED,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * @param target the requested next state
     * @return whether the transition {@code this → target} is legal
     */
    public boolean canTransitionTo(AlertState target) {
        return successors().contains(target);
    }

    /**
     * @return {@code true} for states no transition leaves
     */
    public boolean isTerminal() {
        return successors().isEmpty();
    }

    private Set<AlertState> successors() {
        return switch (this) {
            case CREATED -> EnumSet.of(FILTERED, PROMOTED);
            case PROMOTED -> EnumSet.of(DUPLICATE, DISPATCHING, ACKNOWLEDGED, RESOLVED);
            case DISPATCHING -> EnumSet.of(DELIVERED, ACKNOWLEDGED, RESOLVED);
            case DELIVERED -> EnumSet.of(ACKNOWLEDGED, RESOLVED);
            case ACKNOWLEDGED -> EnumSet.of(RESOLVED);
            case FILTERED, DUPLICATE, RESOLVED -> EnumSet.noneOf(AlertState.class);
        };
    }
}
