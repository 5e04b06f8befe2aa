package uk.gegc.reviewhub.features.billing.application.webhook.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.CustomerLockService;
import uk.gegc.reviewhub.features.billing.application.MaterializationOutcome;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.application.StripeService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionLifecycleService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionMaterialization;
import uk.gegc.reviewhub.features.billing.application.UpstreamCancellationService;
import uk.gegc.reviewhub.features.billing.application.WebhookLoggingContext;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEvent;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEventKind;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;
import uk.gegc.reviewhub.features.billing.domain.model.ReplacementReason;
import uk.gegc.reviewhub.features.billing.infra.mapping.ProviderSubscriptionMapper;

import java.util.Set;
import java.util.UUID;

/**
 * Handles the provider-side half of a purchase. Depending on what is already known it mirrors an
 * existing row, materialises a new one or parks the event until the checkout session arrives.
 */
@Slf4j
@Component
public class SubscriptionCreatedHandler extends SubscriptionCreationHandlerSupport {

    static final String SOURCE = "subscription_created";

    private final StripeService stripeService;

    public SubscriptionCreatedHandler(SubscriptionLifecycleService lifecycleService,
                                      ProviderSubscriptionMapper subscriptionMapper,
                                      BillingMetricsService metricsService,
                                      UpstreamCancellationService upstreamCancellationService,
                                      CustomerLockService customerLockService,
                                      StripeService stripeService) {
        super(lifecycleService, subscriptionMapper, metricsService, upstreamCancellationService, customerLockService);
        this.stripeService = stripeService;
    }

    @Override
    public Set<WebhookEventKind> supportedKinds() {
        return Set.of(WebhookEventKind.SUBSCRIPTION_CREATED);
    }

    @Override
    public WebhookProcessingResult handle(WebhookEvent event, WebhookLoggingContext loggingContext) {
        ProviderSubscription subscription = readSubscription(event, loggingContext);

        if (lifecycleService.exists(subscription.id())) {
            loggingContext.logInfo(log, "Subscription {} already materialised; confirming the match", subscription.id());
            return applyMutation(event, loggingContext,
                    () -> lifecycleService.confirmMatch(event.eventId(), event.type(), subscription.id()));
        }

        UUID userId = resolveUserId(subscription);
        if (userId == null) {
            MaterializationOutcome outcome = lifecycleService.park(event.eventId(), event.type(), subscription);
            return settle(outcome, SOURCE, loggingContext);
        }
        loggingContext.setUserId(userId);

        SubscriptionMaterialization request = SubscriptionMaterialization.fromProvider(subscription)
                .eventId(event.eventId())
                .eventType(event.type())
                .userId(userId)
                .replacementReason(ReplacementReason.SUBSCRIPTION_CREATED_REPLACEMENT)
                .build();
        MaterializationOutcome outcome = materialize(request);
        return settle(outcome, SOURCE, loggingContext);
    }

    private UUID resolveUserId(ProviderSubscription subscription) {
        UUID userId = subscription.metadataUserId();
        if (userId != null) {
            return userId;
        }
        // ProviderApiException propagates so Stripe redelivers rather than parking on a lookup failure
        return ProviderSubscription.parseUserId(
                stripeService.retrieveCustomerMetadata(subscription.customerId())
                        .get(ProviderSubscription.USER_ID_METADATA_KEY));
    }
}
