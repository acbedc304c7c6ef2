package com.wildsentinel.core.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildsentinel.core.model.ChannelType;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Signed JSON webhook.
 *
 * <p>
 * Single alerts are posted as a {@link WebhookPayload}; digests as
 * {@code {"digest": true, "severity": ..., "alerts": [...]}}. When a shared
 * secret is configured the body is signed with HMAC-SHA256 and the signature
 * is sent as {@code sha256=<hex>} in the configured header so the receiver
 * can verify it.
 * </p>
 *
 * @since 1.0.0
 */
public class WebhookChannel implements NotificationChannel {

    public static final String DEFAULT_SIGNATURE_HEADER = "X-Sentinel-Signature";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final HttpDelivery http;
    private final ObjectMapper mapper;
    private final byte[] secret;
    private final String signatureHeader;

    /**
     * @param secret shared secret; {@code null} or blank disables signing
     */
    public WebhookChannel(HttpDelivery http, ObjectMapper mapper, String secret, String signatureHeader) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.secret = secret == null || secret.isBlank() ? null : secret.getBytes(StandardCharsets.UTF_8);
        this.signatureHeader = signatureHeader != null ? signatureHeader : DEFAULT_SIGNATURE_HEADER;
    }

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public void send(Notification notification) throws DeliveryException {
        String body = render(notification);
        Map<String, String> headers = secret == null
                ? Map.of()
                : Map.of(signatureHeader, sign(body));
        http.postJson(notification.getAddress(), body, headers);
    }

    String render(Notification notification) throws PermanentDeliveryException {
        try {
            if (!notification.isDigest()) {
                return mapper.writeValueAsString(WebhookPayload.of(notification.getAlerts().get(0)));
            }
            Map<String, Object> digest = new LinkedHashMap<>();
            digest.put("digest", true);
            digest.put("severity", notification.getSeverity().name());
            List<WebhookPayload> alerts = notification.getAlerts().stream().map(WebhookPayload::of).toList();
            digest.put("alerts", alerts);
            return mapper.writeValueAsString(digest);
        } catch (JsonProcessingException e) {
            throw new PermanentDeliveryException("Cannot serialise webhook payload", e);
        }
    }

    /**
     * @return {@code sha256=<hex HMAC of body>}
     */
    String sign(String body) throws PermanentDeliveryException {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
            return "sha256=" + HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new PermanentDeliveryException("Cannot sign webhook payload", e);
        }
    }
}
