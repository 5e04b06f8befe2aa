package uk.gegc.reviewhub.features.billing.application.webhook;

import uk.gegc.reviewhub.features.billing.application.WebhookLoggingContext;

import java.util.Set;

/**
 * Applies one or more kinds of Stripe event to the subscription store.
 * Implementations are discovered as Spring beans and keyed by {@link #supportedKinds()}.
 */
public interface WebhookEventHandler {

    Set<WebhookEventKind> supportedKinds();

    WebhookProcessingResult handle(WebhookEvent event, WebhookLoggingContext loggingContext);
}
