package uk.gegc.reviewhub.features.billing.application.webhook.handler;

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
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookValidationException;
import uk.gegc.reviewhub.features.billing.domain.model.ReplacementReason;
import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;
import uk.gegc.reviewhub.features.billing.infra.mapping.ProviderSubscriptionMapper;

import java.util.Set;
import java.util.UUID;

/**
 * Materialises the purchase described by a completed checkout session. The session carries the
 * user, so this half never waits for the subscription-created event.
 */
@Component
public class CheckoutSessionCompletedHandler extends SubscriptionCreationHandlerSupport {

    static final String SOURCE = "checkout_session";

    private final StripeService stripeService;

    public CheckoutSessionCompletedHandler(SubscriptionLifecycleService lifecycleService,
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
        return Set.of(WebhookEventKind.CHECKOUT_SESSION_COMPLETED);
    }

    @Override
    public WebhookProcessingResult handle(WebhookEvent event, WebhookLoggingContext loggingContext) {
        loggingContext.setSessionId(event.text("id"));

        UUID userId = resolveUserId(event);
        String customerId = require(event, "customer");
        String subscriptionId = require(event, "subscription");
        loggingContext.setUserId(userId);
        loggingContext.setCustomerId(customerId);
        loggingContext.setSubscriptionId(subscriptionId);

        // ProviderApiException propagates: without Stripe's data the row cannot be built
        ProviderSubscription subscription = stripeService.retrieveSubscription(subscriptionId);

        SubscriptionMaterialization request = SubscriptionMaterialization.fromProvider(subscription)
                .eventId(event.eventId())
                .eventType(event.type())
                .subscriptionId(subscriptionId)
                .customerId(customerId)
                .userId(userId)
                .status(SubscriptionLifecycleStatus.ACTIVE)
                .replacementReason(ReplacementReason.CHECKOUT_SESSION_REPLACEMENT)
                .build();

        MaterializationOutcome outcome = materialize(request);
        return settle(outcome, SOURCE, loggingContext);
    }

    private UUID resolveUserId(WebhookEvent event) {
        String raw = event.text("client_reference_id");
        if (raw == null) {
            raw = event.metadata(ProviderSubscription.USER_ID_METADATA_KEY);
        }
        if (raw == null) {
            throw new WebhookValidationException(event.eventId(), "client_reference_id",
                    "Missing client_reference_id and metadata userId in session " + event.text("id"));
        }
        UUID userId = ProviderSubscription.parseUserId(raw);
        if (userId == null) {
            throw new WebhookValidationException(event.eventId(), "client_reference_id",
                    "Invalid user id '" + raw + "' in session " + event.text("id"));
        }
        return userId;
    }

    private static String require(WebhookEvent event, String field) {
        String value = event.text(field);
        if (value == null) {
            throw new WebhookValidationException(event.eventId(), field,
                    "Missing " + field + " in session " + event.text("id"));
        }
        return value;
    }
}
