package com.wildsentinel.core.context;

import com.wildsentinel.core.model.DetectionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryContextStore}.
 */
class InMemoryContextStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private InMemoryContextStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore(3);
    }

    @Test
    @DisplayName("Should return recent frames newest first within [since, before)")
    void shouldReturnRecentFrames() {
        store.record(frame("a", "wolf", NOW.minusSeconds(12)));
        store.record(frame("b", "wolf", NOW.minusSeconds(10)));
        store.record(frame("c", "deer", NOW.minusSeconds(5)));

        assertThat(store.recentDetections("cam-1", NOW.minusSeconds(10), NOW.minusSeconds(5), 5))
                .extracting(DetectionEvent::getDetectionId)
                .containsExactly("b");
        assertThat(store.recentDetections("cam-1", NOW.minusSeconds(60), NOW, 2))
                .extracting(DetectionEvent::getDetectionId)
                .containsExactly("c", "b");
        assertThat(store.recentDetections("cam-2", NOW.minusSeconds(60), NOW, 5)).isEmpty();
    }

    @Test
    @DisplayName("Should keep only the configured number of frames per camera")
    void shouldBoundHistory() {
        for (int i = 4; i >= 1; i--) {
            store.record(frame("f" + i, "wolf", NOW.minusSeconds(i)));
        }

        assertThat(store.recentDetections("cam-1", NOW.minusSeconds(60), NOW, 10))
                .extracting(DetectionEvent::getDetectionId)
                .containsExactly("f1", "f2", "f3");
    }

    @Test
    @DisplayName("Should count one species with inclusive bounds, ignoring case")
    void shouldCountSpecies() {
        store.record(frame("a", "Wolf", NOW.minusSeconds(60)));
        store.record(frame("b", "wolf", NOW));
        store.record(frame("c", "deer", NOW));

        assertThat(store.countDetections("cam-1", "wolf", NOW.minusSeconds(60), NOW)).isEqualTo(2);
        assertThat(store.countDetections("cam-1", "wolf", NOW.minusSeconds(59), NOW)).isEqualTo(1);
        assertThat(store.countDetections("cam-9", "wolf", NOW.minusSeconds(60), NOW)).isZero();
    }

    @Test
    @DisplayName("Should return registered camera metadata")
    void shouldRegisterCameras() {
        store.registerCamera(new CameraMetadata("cam-1", "Ridge", 1280, 720, ZoneId.of("America/Denver")));

        assertThat(store.cameraMetadata("cam-1")).hasValueSatisfying(c ->
                assertThat(c.getZoneId()).isEqualTo(ZoneId.of("America/Denver")));
        assertThat(store.cameraMetadata("cam-2")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive history size")
    void shouldRejectBadCapacity() {
        assertThatThrownBy(() -> new InMemoryContextStore(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("historyPerCamera");
    }

    private static DetectionEvent frame(String id, String species, Instant at) {
        return DetectionEvent.builder()
                .detectionId(id)
                .species(species)
                .baseConfidence(0.9)
                .cameraId("cam-1")
                .timestamp(at)
                .build();
    }
}
