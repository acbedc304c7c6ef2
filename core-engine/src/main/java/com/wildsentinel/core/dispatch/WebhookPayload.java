package com.wildsentinel.core.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wildsentinel.core.model.Alert;

import java.time.Instant;

/**
 * JSON body posted to generic webhooks for one alert.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookPayload(String alertId,
        String species,
        String severity,
        double compositeConfidence,
        double falsePositiveScore,
        String cameraId,
        Instant timestamp,
        String imageUrl,
        String correlationGroup) {

    public static WebhookPayload of(Alert alert) {
        return new WebhookPayload(alert.getId(),
                alert.getSpecies(),
                alert.getSeverity().name(),
                alert.getCompositeConfidence(),
                alert.getFalsePositiveScore(),
                alert.getCameraId(),
                alert.getDetectedAt(),
                alert.getImageUrl(),
                alert.getCorrelationGroup());
    }
}
