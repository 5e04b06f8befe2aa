package uk.gegc.reviewhub.features.billing.application.webhook;

import java.util.Map;

public record WebhookProcessingResult(
        WebhookResult result,
        String message,
        Map<String, Object> details
) {

    public static WebhookProcessingResult ok() {
        return new WebhookProcessingResult(WebhookResult.OK, null, null);
    }

    public static WebhookProcessingResult duplicate() {
        return new WebhookProcessingResult(WebhookResult.DUPLICATE, null, null);
    }

    public static WebhookProcessingResult ignored() {
        return new WebhookProcessingResult(WebhookResult.IGNORED, null, null);
    }

    public static WebhookProcessingResult pendingCorrelation() {
        return new WebhookProcessingResult(WebhookResult.PENDING_CORRELATION, null, null);
    }

    public static WebhookProcessingResult unprocessed(String message) {
        return new WebhookProcessingResult(WebhookResult.UNPROCESSED, message, null);
    }

    public static WebhookProcessingResult blocked(String message, Map<String, Object> details) {
        return new WebhookProcessingResult(WebhookResult.BLOCKED, message, details);
    }
}
