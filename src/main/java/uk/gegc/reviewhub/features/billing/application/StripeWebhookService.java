package uk.gegc.reviewhub.features.billing.application;

import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;

public interface StripeWebhookService {

    /**
     * Verifies, parses and applies one Stripe webhook delivery.
     *
     * @throws uk.gegc.reviewhub.features.billing.domain.exception.WebhookSignatureException if the request is not signed by Stripe
     * @throws uk.gegc.reviewhub.features.billing.domain.exception.WebhookPayloadException if the body is not a Stripe event
     */
    WebhookProcessingResult process(String payload, String signatureHeader);
}
