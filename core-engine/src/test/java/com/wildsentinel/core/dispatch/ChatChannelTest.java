package com.wildsentinel.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.ChannelType;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.ScoredDetection;
import com.wildsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ChatChannel} message rendering.
 */
class ChatChannelTest {

    private static final Instant NOW = Instant.parse("2024-06-01T02:15:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final ChatChannel channel = new ChatChannel(Mockito.mock(HttpDelivery.class), mapper);

    @Test
    @DisplayName("Should render a headline and one coloured attachment per alert")
    void shouldRenderAttachments() throws Exception {
        Alert bear = alert("bear", Severity.EMERGENCY);
        Notification digest = Notification.digest("ranger-1", ChannelType.CHAT, "https://chat.example.org/hook",
                Severity.EMERGENCY, List.of(bear, alert("grizzly", Severity.EMERGENCY)));

        JsonNode body = mapper.readTree(channel.render(digest));

        assertThat(body.get("text").asText()).isEqualTo("[EMERGENCY] 2 wildlife alerts");
        assertThat(body.get("attachments")).hasSize(2);
        JsonNode first = body.get("attachments").get(0);
        assertThat(first.get("color").asText()).isEqualTo("#8b0000");
        assertThat(first.get("title").asText()).isEqualTo("bear at cam-1");
        assertThat(first.get("text").asText()).startsWith("Confidence 95%");
        assertThat(first.get("fields").get(1).get("value").asText()).isEqualTo(bear.getId());
        assertThat(first.has("image_url")).isFalse();
    }

    @Test
    @DisplayName("Should include the snapshot image when there is one")
    void shouldIncludeImage() throws Exception {
        DetectionEvent event = DetectionEvent.builder()
                .species("deer").baseConfidence(0.7).cameraId("cam-1").timestamp(NOW)
                .imageUrl("https://img.example.org/1.jpg").build();
        Alert alert = Alert.builder()
                .scoredDetection(new ScoredDetection(event, 0.7, 1.0, 1.0, 0.5))
                .severity(Severity.WARNING)
                .createdAt(NOW)
                .build();

        JsonNode body = mapper.readTree(channel.render(
                Notification.single(alert, "ranger-1", ChannelType.CHAT, "https://chat.example.org/hook")));

        JsonNode attachment = body.get("attachments").get(0);
        assertThat(attachment.get("color").asText()).isEqualTo("warning");
        assertThat(attachment.get("image_url").asText()).isEqualTo("https://img.example.org/1.jpg");
    }

    private static Alert alert(String species, Severity severity) {
        DetectionEvent event = DetectionEvent.builder()
                .species(species).baseConfidence(0.9).cameraId("cam-1").timestamp(NOW).build();
        return Alert.builder()
                .scoredDetection(new ScoredDetection(event, 0.95, 1.0, 1.0, 0.95))
                .severity(severity)
                .createdAt(NOW)
                .build();
    }
}
