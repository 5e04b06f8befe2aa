package uk.gegc.reviewhub.features.billing.application.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookPayloadException;

/**
 * Reads the envelope of a verified Stripe event body.
 */
@Component
@RequiredArgsConstructor
public class WebhookEventParser {

    private final ObjectMapper objectMapper;

    public WebhookEvent parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new WebhookPayloadException("Empty webhook payload");
        }
        final JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new WebhookPayloadException("Malformed JSON payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new WebhookPayloadException("Webhook payload must be a JSON object");
        }

        String eventId = root.path("id").asText("");
        if (eventId.isBlank()) {
            throw new WebhookPayloadException("Missing event id in webhook payload");
        }
        String type = root.path("type").asText("");
        if (type.isBlank()) {
            throw new WebhookPayloadException("Missing event type in webhook payload");
        }
        JsonNode dataObject = root.path("data").path("object");
        if (!dataObject.isObject()) {
            throw new WebhookPayloadException("Missing data.object in webhook payload " + eventId);
        }

        return new WebhookEvent(eventId, type, WebhookEventKind.fromStripeType(type), dataObject);
    }
}
