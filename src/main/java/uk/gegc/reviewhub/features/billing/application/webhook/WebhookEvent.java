package uk.gegc.reviewhub.features.billing.application.webhook;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A verified Stripe event with its {@code data.object} kept as a JSON tree.
 */
public record WebhookEvent(
        String eventId,
        String type,
        WebhookEventKind kind,
        JsonNode dataObject
) {

    /**
     * Text value of a top-level field of the data object, or {@code null} when absent, null or blank.
     */
    public String text(String field) {
        return textOf(dataObject.path(field));
    }

    public String metadata(String key) {
        return textOf(dataObject.path("metadata").path(key));
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        // expanded objects (e.g. "customer": {"id": ...}) carry their id
        if (node.isObject()) {
            return textOf(node.path("id"));
        }
        String value = node.asText();
        return value == null || value.isBlank() ? null : value;
    }
}
