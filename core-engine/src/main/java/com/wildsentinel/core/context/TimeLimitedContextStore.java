package com.wildsentinel.core.context;

import com.wildsentinel.core.model.DetectionEvent;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * {@link ContextStore} decorator that bounds every read with a Resilience4j
 * {@link TimeLimiter}.
 *
 * <p>
 * A read that times out or fails returns the neutral answer (no history, no
 * metadata) and is logged at WARN. Scoring then falls back to its neutral
 * sub-scores.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeLimitedContextStore implements ContextStore {

    private static final Logger LOG = LoggerFactory.getLogger(TimeLimitedContextStore.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    private final ContextStore delegate;
    private final ExecutorService executor;
    private final TimeLimiter timeLimiter;

    /**
     * @param delegate the store to read from
     * @param executor runs the reads so they can be abandoned on timeout
     * @param timeout  per-read time budget
     */
    public TimeLimitedContextStore(ContextStore delegate, ExecutorService executor, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeLimiter = TimeLimiter.of("context-store", TimeLimiterConfig.custom()
                .timeoutDuration(Objects.requireNonNull(timeout, "timeout must not be null"))
                .cancelRunningFuture(true)
                .build());
    }

    @Override
    public List<DetectionEvent> recentDetections(String cameraId, Instant since, Instant before, int limit) {
        return read("recentDetections", cameraId,
                () -> delegate.recentDetections(cameraId, since, before, limit), List.of());
    }

    @Override
    public long countDetections(String cameraId, String species, Instant since, Instant until) {
        return read("countDetections", cameraId,
                () -> delegate.countDetections(cameraId, species, since, until), 0L);
    }

    @Override
    public Optional<CameraMetadata> cameraMetadata(String cameraId) {
        return read("cameraMetadata", cameraId, () -> delegate.cameraMetadata(cameraId), Optional.empty());
    }

    private <T> T read(String operation, String cameraId, Callable<T> call, T fallback) {
        try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(call));
        } catch (TimeoutException e) {
            LOG.warn("Context read '{}' for camera {} exceeded {} - using neutral default",
                    operation, cameraId, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return fallback;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Context read '{}' for camera {} interrupted - using neutral default", operation, cameraId);
            return fallback;
        } catch (Exception e) {
            LOG.warn("Context read '{}' for camera {} failed - using neutral default: {}",
                    operation, cameraId, e.toString());
            return fallback;
        }
    }
}
