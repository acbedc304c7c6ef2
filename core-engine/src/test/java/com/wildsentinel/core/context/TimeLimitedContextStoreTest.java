package com.wildsentinel.core.context;

import com.wildsentinel.core.model.DetectionEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link TimeLimitedContextStore}.
 */
@ExtendWith(MockitoExtension.class)
class TimeLimitedContextStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private ContextStore delegate;

    private ExecutorService executor;
    private TimeLimitedContextStore store;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        store = new TimeLimitedContextStore(delegate, executor, Duration.ofMillis(100));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should pass through answers that arrive in time")
    void shouldPassThrough() {
        DetectionEvent frame = DetectionEvent.builder()
                .species("wolf").cameraId("cam-1").baseConfidence(0.9).timestamp(NOW.minusSeconds(2)).build();
        CameraMetadata camera = new CameraMetadata("cam-1", "North gate", 1920, 1080, ZoneId.of("Europe/Oslo"));
        when(delegate.recentDetections("cam-1", NOW.minusSeconds(10), NOW, 5)).thenReturn(List.of(frame));
        when(delegate.countDetections("cam-1", "wolf", NOW.minusSeconds(3600), NOW)).thenReturn(7L);
        when(delegate.cameraMetadata("cam-1")).thenReturn(Optional.of(camera));

        assertThat(store.recentDetections("cam-1", NOW.minusSeconds(10), NOW, 5)).containsExactly(frame);
        assertThat(store.countDetections("cam-1", "wolf", NOW.minusSeconds(3600), NOW)).isEqualTo(7L);
        assertThat(store.cameraMetadata("cam-1")).containsSame(camera);
    }

    @Test
    @DisplayName("Should fall back to neutral answers when the delegate is too slow")
    void shouldFallBackOnTimeout() {
        doAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        }).when(delegate).recentDetections(anyString(), any(), any(), anyInt());
        doAnswer(invocation -> {
            Thread.sleep(2_000);
            return 42L;
        }).when(delegate).countDetections(anyString(), anyString(), any(), any());

        assertThat(store.recentDetections("cam-1", NOW.minusSeconds(10), NOW, 5)).isEmpty();
        assertThat(store.countDetections("cam-1", "wolf", NOW.minusSeconds(3600), NOW)).isZero();
    }

    @Test
    @DisplayName("Should fall back to neutral answers when the delegate fails")
    void shouldFallBackOnFailure() {
        when(delegate.cameraMetadata("cam-1")).thenThrow(new IllegalStateException("store unavailable"));

        assertThat(store.cameraMetadata("cam-1")).isEmpty();
    }
}
