package uk.gegc.reviewhub.features.billing.application.webhook.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.application.SubscriptionLifecycleService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionMutationOutcome;
import uk.gegc.reviewhub.features.billing.application.WebhookLoggingContext;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEvent;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEventHandler;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookValidationException;
import uk.gegc.reviewhub.features.billing.infra.mapping.ProviderSubscriptionMapper;

import java.util.function.Supplier;

/**
 * Shared plumbing for handlers of {@code customer.subscription.*} events.
 */
@Slf4j
abstract class SubscriptionEventHandlerSupport implements WebhookEventHandler {

    protected final SubscriptionLifecycleService lifecycleService;
    protected final ProviderSubscriptionMapper subscriptionMapper;
    protected final BillingMetricsService metricsService;

    protected SubscriptionEventHandlerSupport(SubscriptionLifecycleService lifecycleService,
                                              ProviderSubscriptionMapper subscriptionMapper,
                                              BillingMetricsService metricsService) {
        this.lifecycleService = lifecycleService;
        this.subscriptionMapper = subscriptionMapper;
        this.metricsService = metricsService;
    }

    /**
     * Reads the event's subscription object, requiring its id and customer.
     */
    protected ProviderSubscription readSubscription(WebhookEvent event, WebhookLoggingContext loggingContext) {
        ProviderSubscription subscription;
        try {
            subscription = subscriptionMapper.fromPayload(event.dataObject());
        } catch (IllegalArgumentException e) {
            throw new WebhookValidationException(event.eventId(), "status", e.getMessage());
        }
        if (subscription.id() == null) {
            throw new WebhookValidationException(event.eventId(), "id", "Missing subscription id in event " + event.eventId());
        }
        if (subscription.customerId() == null) {
            throw new WebhookValidationException(event.eventId(), "customer", "Missing customer in event " + event.eventId());
        }
        loggingContext.setSubscriptionId(subscription.id());
        loggingContext.setCustomerId(subscription.customerId());
        return subscription;
    }

    /**
     * Runs an update-style mutation. A persistence failure leaves the event unrecorded and is
     * acknowledged, so a redelivery or a later event can repair the row.
     */
    protected WebhookProcessingResult applyMutation(WebhookEvent event,
                                                    WebhookLoggingContext loggingContext,
                                                    Supplier<SubscriptionMutationOutcome> mutation) {
        final SubscriptionMutationOutcome outcome;
        try {
            outcome = mutation.get();
        } catch (DataAccessException | TransactionException e) {
            metricsService.incrementSubscriptionUpdateFailed(event.type());
            loggingContext.logError(log, "Failed to apply {} to subscription {}; leaving event {} unprocessed",
                    event.type(), loggingContext.getSubscriptionId(), event.eventId(), e);
            return WebhookProcessingResult.unprocessed("Subscription update could not be persisted");
        }
        return switch (outcome) {
            case APPLIED -> {
                loggingContext.logInfo(log, "Applied {} to subscription {}", event.type(), loggingContext.getSubscriptionId());
                yield WebhookProcessingResult.ok();
            }
            case NOT_FOUND -> WebhookProcessingResult.ok();
            case DUPLICATE -> WebhookProcessingResult.duplicate();
        };
    }
}
