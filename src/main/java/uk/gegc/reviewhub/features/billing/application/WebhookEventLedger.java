package uk.gegc.reviewhub.features.billing.application;

import java.util.Map;

/**
 * Record of Stripe events that have been fully applied.
 */
public interface WebhookEventLedger {

    boolean isProcessed(String eventId);

    /**
     * Records the event inside the caller's transaction, so the record commits together with
     * the state change it describes.
     *
     * @throws uk.gegc.reviewhub.features.billing.domain.exception.DuplicateWebhookEventException
     *         if a concurrent delivery recorded the event first
     */
    void markProcessed(String eventId, String eventType, String subscriptionId, Map<String, Object> metadata);
}
