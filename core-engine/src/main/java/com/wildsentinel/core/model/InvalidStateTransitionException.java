package com.wildsentinel.core.model;

/**
 * Thrown when an {@link Alert} is asked to move to a state its lifecycle does
 * not allow from where it is.
 *
 * @since 1.0.0
 */
public class InvalidStateTransitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AlertState from;
    private final AlertState to;

    public InvalidStateTransitionException(String alertId, AlertState from, AlertState to) {
        super("Alert " + alertId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public AlertState getFrom() {
        return from;
    }

    public AlertState getTo() {
        return to;
    }
}
