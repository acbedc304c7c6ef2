package com.wildsentinel.core.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.ChannelType;
import com.wildsentinel.core.model.Severity;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Chat integration posting Slack-compatible incoming-webhook messages: a
 * headline plus one coloured attachment per alert.
 *
 * @since 1.0.0
 */
public class ChatChannel implements NotificationChannel {

    private final HttpDelivery http;
    private final ObjectMapper mapper;

    public ChatChannel(HttpDelivery http, ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ChannelType type() {
        return ChannelType.CHAT;
    }

    @Override
    public void send(Notification notification) throws DeliveryException {
        http.postJson(notification.getAddress(), render(notification), Map.of());
    }

    String render(Notification notification) throws PermanentDeliveryException {
        ObjectNode root = mapper.createObjectNode();
        root.put("text", notification.title());
        ArrayNode attachments = root.putArray("attachments");
        for (Alert alert : notification.getAlerts()) {
            ObjectNode attachment = attachments.addObject();
            attachment.put("color", colorFor(alert.getSeverity()));
            attachment.put("title", alert.getSpecies() + " at " + alert.getCameraId());
            attachment.put("text", String.format(Locale.ROOT, "Confidence %.0f%%, detected %s",
                    alert.getCompositeConfidence() * 100, alert.getDetectedAt()));
            if (alert.getImageUrl() != null) {
                attachment.put("image_url", alert.getImageUrl());
            }
            ArrayNode fields = attachment.putArray("fields");
            fields.addObject().put("title", "Severity").put("value", alert.getSeverity().name()).put("short", true);
            fields.addObject().put("title", "Alert").put("value", alert.getId()).put("short", true);
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new PermanentDeliveryException("Cannot serialise chat message", e);
        }
    }

    private static String colorFor(Severity severity) {
        return switch (severity) {
            case EMERGENCY -> "#8b0000";
            case CRITICAL -> "danger";
            case WARNING -> "warning";
            case INFO -> "good";
        };
    }
}
