package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.config.NotificationSettings;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-camera token buckets limiting how many alerts are dispatched.
 *
 * <p>
 * Each camera's bucket carries two Bucket4j bandwidths: a sustained rate of
 * {@code maxAlertsPerHour} and a burst allowance of {@code burstCapacity}
 * per {@code burstWindowSeconds}. One dispatched alert takes one token,
 * however many users and channels it fans out to.
 * </p>
 *
 * <p>
 * Time is read from the injected {@link Clock} so tests can drive refills.
 * </p>
 *
 * @since 1.0.0
 */
public class CameraRateLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(CameraRateLimiter.class);

    private final NotificationSettings settings;
    private final TimeMeter timeMeter;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public CameraRateLimiter(NotificationSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        this.timeMeter = new ClockTimeMeter(clock);
    }

    /**
     * Take one token from the camera's bucket.
     *
     * @return {@code true} if the alert may be dispatched
     */
    public boolean tryAcquire(String cameraId) {
        boolean allowed = buckets.computeIfAbsent(cameraId, id -> newBucket()).tryConsume(1);
        if (!allowed) {
            LOG.warn("Rate limit reached for camera {} - alert recorded but not sent", cameraId);
        }
        return allowed;
    }

    /**
     * @return tokens currently available for the camera
     */
    public long availableTokens(String cameraId) {
        return buckets.computeIfAbsent(cameraId, id -> newBucket()).getAvailableTokens();
    }

    private Bucket newBucket() {
        int hourly = settings.getMaxAlertsPerHour();
        int burst = settings.getBurstCapacity();
        return Bucket.builder()
                .addLimit(Bandwidth.classic(hourly, Refill.intervally(hourly, Duration.ofHours(1))))
                .addLimit(Bandwidth.classic(burst,
                        Refill.intervally(burst, Duration.ofSeconds(settings.getBurstWindowSeconds()))))
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    /**
     * Bucket4j time source backed by a {@link Clock}.
     */
    private static final class ClockTimeMeter implements TimeMeter {

        private final Clock clock;

        ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            Instant now = clock.instant();
            return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
