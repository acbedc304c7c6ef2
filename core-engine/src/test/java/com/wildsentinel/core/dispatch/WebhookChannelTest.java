package com.wildsentinel.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.ChannelType;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.model.ScoredDetection;
import com.wildsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link WebhookChannel}.
 */
@ExtendWith(MockitoExtension.class)
class WebhookChannelTest {

    private static final Instant NOW = Instant.parse("2024-06-01T02:15:00Z");
    private static final String URL = "https://hooks.example.org/wildlife";

    @Mock
    private HttpDelivery http;

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Test
    @DisplayName("Should post the alert payload")
    void shouldRenderSingleAlert() throws Exception {
        WebhookChannel channel = new WebhookChannel(http, mapper, null, null);
        Alert alert = alert("wolf", Severity.CRITICAL);

        JsonNode body = mapper.readTree(channel.render(single(alert)));

        assertThat(body.get("alertId").asText()).isEqualTo(alert.getId());
        assertThat(body.get("species").asText()).isEqualTo("wolf");
        assertThat(body.get("severity").asText()).isEqualTo("CRITICAL");
        assertThat(body.get("cameraId").asText()).isEqualTo("cam-1");
        assertThat(body.get("timestamp").asText()).isEqualTo("2024-06-01T02:15:00Z");
        assertThat(body.get("compositeConfidence").asDouble()).isEqualTo(0.95);
        assertThat(body.has("correlationGroup")).isFalse();
    }

    @Test
    @DisplayName("Should post a digest as a list of alert payloads")
    void shouldRenderDigest() throws Exception {
        WebhookChannel channel = new WebhookChannel(http, mapper, null, null);
        Notification digest = Notification.digest("ranger-1", ChannelType.WEBHOOK, URL, Severity.INFO,
                List.of(alert("deer", Severity.INFO), alert("fox", Severity.INFO)));

        JsonNode body = mapper.readTree(channel.render(digest));

        assertThat(body.get("digest").asBoolean()).isTrue();
        assertThat(body.get("severity").asText()).isEqualTo("INFO");
        assertThat(body.get("alerts")).hasSize(2);
    }

    @Test
    @DisplayName("Should sign the body with HMAC-SHA256 when a secret is configured")
    @SuppressWarnings("unchecked")
    void shouldSignBody() throws Exception {
        WebhookChannel channel = new WebhookChannel(http, mapper, "s3cret", "X-Sentinel-Signature");
        Notification notification = single(alert("wolf", Severity.CRITICAL));

        channel.send(notification);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(http).postJson(eq(URL), body.capture(), headers.capture());
        assertThat(headers.getValue()).containsEntry("X-Sentinel-Signature", expectedSignature("s3cret",
                body.getValue()));
    }

    @Test
    @DisplayName("Should send no signature header without a secret")
    @SuppressWarnings("unchecked")
    void shouldNotSignWithoutSecret() throws Exception {
        WebhookChannel channel = new WebhookChannel(http, mapper, " ", null);

        channel.send(single(alert("wolf", Severity.CRITICAL)));

        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(http).postJson(eq(URL), anyString(), headers.capture());
        assertThat(headers.getValue()).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static String expectedSignature(String secret, String body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return "sha256=" + HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    }

    private static Notification single(Alert alert) {
        return Notification.single(alert, "ranger-1", ChannelType.WEBHOOK, URL);
    }

    private static Alert alert(String species, Severity severity) {
        DetectionEvent event = DetectionEvent.builder()
                .detectionId("d-" + species)
                .species(species)
                .baseConfidence(0.9)
                .cameraId("cam-1")
                .timestamp(NOW)
                .build();
        return Alert.builder()
                .scoredDetection(new ScoredDetection(event, 0.95, 1.0, 1.0, 0.95))
                .severity(severity)
                .createdAt(NOW)
                .build();
    }
}
