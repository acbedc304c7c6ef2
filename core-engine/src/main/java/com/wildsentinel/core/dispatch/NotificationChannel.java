package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.model.ChannelType;

/**
 * One outbound delivery mechanism.
 *
 * <p>
 * Implementations perform a single attempt and classify failures as
 * {@link TransientDeliveryException} or {@link PermanentDeliveryException};
 * retries and circuit breaking are applied around them by
 * {@link ChannelGateway}. Every attempt must be bounded by a timeout.
 * </p>
 *
 * @since 1.0.0
 */
public interface NotificationChannel {

    ChannelType type();

    /**
     * Deliver one notification.
     *
     * @throws DeliveryException if the attempt failed
     */
    void send(Notification notification) throws DeliveryException;
}
