package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.MutableClock;
import com.wildsentinel.core.config.NotificationSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CameraRateLimiter}.
 */
class CameraRateLimiterTest {

    private MutableClock clock;
    private NotificationSettings settings;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        settings = new NotificationSettings();
    }

    @Test
    @DisplayName("Should allow exactly the hourly limit and refuse the next")
    void shouldEnforceHourlyLimit() {
        settings.setMaxAlertsPerHour(3);
        CameraRateLimiter limiter = new CameraRateLimiter(settings, clock);

        for (int i = 0; i < 3; i++) {
            assertThat(limiter.tryAcquire("cam-1")).isTrue();
            clock.advance(Duration.ofMinutes(5));
        }

        assertThat(limiter.tryAcquire("cam-1")).isFalse();
        assertThat(limiter.availableTokens("cam-1")).isZero();
    }

    @Test
    @DisplayName("Should refill once the hour has passed")
    void shouldRefillAfterAnHour() {
        settings.setMaxAlertsPerHour(2);
        CameraRateLimiter limiter = new CameraRateLimiter(settings, clock);
        limiter.tryAcquire("cam-1");
        limiter.tryAcquire("cam-1");

        clock.advance(Duration.ofMinutes(61));

        assertThat(limiter.tryAcquire("cam-1")).isTrue();
    }

    @Test
    @DisplayName("Should cap bursts inside the burst window")
    void shouldCapBursts() {
        settings.setBurstCapacity(2);
        settings.setBurstWindowSeconds(60);
        CameraRateLimiter limiter = new CameraRateLimiter(settings, clock);

        assertThat(limiter.tryAcquire("cam-1")).isTrue();
        assertThat(limiter.tryAcquire("cam-1")).isTrue();
        assertThat(limiter.tryAcquire("cam-1")).isFalse();

        clock.advance(Duration.ofSeconds(61));
        assertThat(limiter.tryAcquire("cam-1")).isTrue();
    }

    @Test
    @DisplayName("Should keep a separate budget per camera")
    void shouldIsolateCameras() {
        settings.setMaxAlertsPerHour(1);
        CameraRateLimiter limiter = new CameraRateLimiter(settings, clock);

        assertThat(limiter.tryAcquire("cam-1")).isTrue();
        assertThat(limiter.tryAcquire("cam-1")).isFalse();
        assertThat(limiter.tryAcquire("cam-2")).isTrue();
    }
}
