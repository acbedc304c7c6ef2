package com.wildsentinel.core.dispatch;

/**
 * Delivery failure worth retrying: timeouts, 5xx responses, I/O and SMTP
 * transport errors. Counts toward the channel's circuit breaker.
 *
 * @since 1.0.0
 */
public class TransientDeliveryException extends DeliveryException {

    private static final long serialVersionUID = 1L;

    public TransientDeliveryException(String message) {
        super(message);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
