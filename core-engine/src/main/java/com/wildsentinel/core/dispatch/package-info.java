/**
 * Multi-channel notification delivery.
 *
 * <p>
 * {@link com.wildsentinel.core.dispatch.NotificationDispatcher} applies
 * per-camera rate limits, quiet hours and digest batching, then delivers
 * through {@link com.wildsentinel.core.dispatch.ChannelGateway}, which wraps
 * each channel type in its own circuit breaker and retry policy.
 * </p>
 *
 * @since 1.0.0
 */
package com.wildsentinel.core.dispatch;
