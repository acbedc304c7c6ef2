package com.wildsentinel.service;

/**
 * Thrown when an alert or alert rule does not exist or is not visible to the
 * caller. Mapped to {@code 404} by the API.
 *
 * @since 1.0.0
 */
public class AlertNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AlertNotFoundException(String message) {
        super(message);
    }
}
