package com.wildsentinel.core.dispatch;

/**
 * Delivery failure that retrying cannot fix: 4xx responses, malformed URLs,
 * invalid addresses. Never retried and not held against the channel's
 * circuit breaker, since it reflects one recipient's configuration.
 *
 * @since 1.0.0
 */
public class PermanentDeliveryException extends DeliveryException {

    private static final long serialVersionUID = 1L;

    public PermanentDeliveryException(String message) {
        super(message);
    }

    public PermanentDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
