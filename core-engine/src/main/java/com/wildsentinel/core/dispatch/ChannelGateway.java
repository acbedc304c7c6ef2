package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.config.NotificationSettings;
import com.wildsentinel.core.model.ChannelType;
import com.wildsentinel.core.model.DeliveryReceipt;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedRunnable;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Failure isolation around {@link NotificationChannel}s.
 *
 * <p>
 * Every channel type gets its own Resilience4j {@link CircuitBreaker} and
 * {@link Retry}, so one failing channel never blocks the others.
 * </p>
 *
 * <h3>Circuit breaker</h3>
 * <p>
 * Count-based window of K calls, minimum K calls, 100&nbsp;% failure rate
 * threshold: the breaker opens after K consecutive transient failures and
 * short-circuits further sends until the cooldown has passed, then lets a
 * single probe through (HALF_OPEN). Permanent failures are ignored by the
 * breaker.
 * </p>
 *
 * <h3>Retry</h3>
 * <p>
 * Wraps the breaker. Only {@link TransientDeliveryException} is retried,
 * with exponential backoff and a bounded attempt count. Short-circuited and
 * permanent failures are never retried.
 * </p>
 *
 * @since 1.0.0
 */
public class ChannelGateway {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelGateway.class);

    private final CircuitBreakerRegistry breakers;
    private final RetryRegistry retries;
    private final Clock clock;

    public ChannelGateway(NotificationSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getBreakerFailureThreshold())
                .minimumNumberOfCalls(settings.getBreakerFailureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(settings.breakerCooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordExceptions(TransientDeliveryException.class)
                .ignoreExceptions(PermanentDeliveryException.class)
                .build();
        this.breakers = CircuitBreakerRegistry.of(breakerConfig);
        breakers.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onStateTransition(event -> LOG.warn("{} channel circuit {} -> {}",
                        event.getCircuitBreakerName(),
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState())));

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(settings.getRetryMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getRetryInitialBackoffMillis(), settings.getRetryBackoffMultiplier()))
                .retryExceptions(TransientDeliveryException.class)
                .build();
        this.retries = RetryRegistry.of(retryConfig);
    }

    /**
     * Deliver one notification through its channel's breaker and retry
     * policy. Never throws for delivery problems; the outcome is in the
     * receipt.
     */
    public DeliveryReceipt deliver(NotificationChannel channel, Notification notification) {
        ChannelType type = channel.type();
        CircuitBreaker breaker = breakerFor(type);
        Retry retry = retries.retry(type.name());
        AtomicInteger attempts = new AtomicInteger();

        CheckedRunnable attempt = () -> {
            attempts.incrementAndGet();
            channel.send(notification);
        };
        CheckedRunnable guarded = Retry.decorateCheckedRunnable(retry,
                CircuitBreaker.decorateCheckedRunnable(breaker, attempt));

        try {
            guarded.run();
            return receipt(notification, DeliveryReceipt.Status.DELIVERED, attempts.get(), "delivered");
        } catch (CallNotPermittedException e) {
            LOG.warn("{} channel circuit is {} - short-circuiting notification for user {}",
                    type, breaker.getState(), notification.getUserId());
            return receipt(notification, DeliveryReceipt.Status.SHORT_CIRCUITED, attempts.get(),
                    "circuit " + breaker.getState());
        } catch (PermanentDeliveryException e) {
            LOG.warn("Permanent {} delivery failure for user {}: {}",
                    type, notification.getUserId(), e.getMessage());
            return receipt(notification, DeliveryReceipt.Status.FAILED, attempts.get(),
                    "permanent: " + e.getMessage());
        } catch (TransientDeliveryException e) {
            LOG.warn("{} delivery for user {} failed after {} attempt(s): {}",
                    type, notification.getUserId(), attempts.get(), e.getMessage());
            return receipt(notification, DeliveryReceipt.Status.FAILED, attempts.get(),
                    "transient: " + e.getMessage());
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            LOG.error("Unexpected {} delivery error for user {}", type, notification.getUserId(), t);
            return receipt(notification, DeliveryReceipt.Status.FAILED, attempts.get(),
                    "error: " + t.getMessage());
        }
    }

    /**
     * @return current breaker state for the channel type
     */
    public CircuitBreaker.State state(ChannelType type) {
        return breakerFor(type).getState();
    }

    private CircuitBreaker breakerFor(ChannelType type) {
        return breakers.circuitBreaker(type.name());
    }

    private DeliveryReceipt receipt(Notification n, DeliveryReceipt.Status status, int attempts, String detail) {
        return new DeliveryReceipt(n.getUserId(), n.getChannel(), status, attempts, detail, clock.instant());
    }
}
