package com.wildsentinel.core.dispatch;

/**
 * A notification could not be delivered over a channel.
 *
 * @since 1.0.0
 */
public class DeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
