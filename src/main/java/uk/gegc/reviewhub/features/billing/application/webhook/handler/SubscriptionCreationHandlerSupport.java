package uk.gegc.reviewhub.features.billing.application.webhook.handler;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.CustomerLockService;
import uk.gegc.reviewhub.features.billing.application.MaterializationOutcome;
import uk.gegc.reviewhub.features.billing.application.SubscriptionLifecycleService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionMaterialization;
import uk.gegc.reviewhub.features.billing.application.UpstreamCancellationService;
import uk.gegc.reviewhub.features.billing.application.WebhookLoggingContext;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;
import uk.gegc.reviewhub.features.billing.infra.mapping.ProviderSubscriptionMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the committed outcome of a subscription creation into a webhook result and performs the
 * Stripe side effects that must follow the local commit.
 */
@Slf4j
abstract class SubscriptionCreationHandlerSupport extends SubscriptionEventHandlerSupport {

    static final String BLOCKED_MESSAGE = "Customer already has an active subscription";

    protected final UpstreamCancellationService upstreamCancellationService;
    protected final CustomerLockService customerLockService;

    protected SubscriptionCreationHandlerSupport(SubscriptionLifecycleService lifecycleService,
                                                 ProviderSubscriptionMapper subscriptionMapper,
                                                 BillingMetricsService metricsService,
                                                 UpstreamCancellationService upstreamCancellationService,
                                                 CustomerLockService customerLockService) {
        super(lifecycleService, subscriptionMapper, metricsService);
        this.upstreamCancellationService = upstreamCancellationService;
        this.customerLockService = customerLockService;
    }

    /**
     * Creates the customer's lock row before the creation transaction opens, then materialises.
     */
    protected MaterializationOutcome materialize(SubscriptionMaterialization request) {
        customerLockService.ensureLockRow(request.customerId());
        return lifecycleService.materialize(request);
    }

    protected WebhookProcessingResult settle(MaterializationOutcome outcome, String source, WebhookLoggingContext loggingContext) {
        return switch (outcome.status()) {
            case DUPLICATE -> WebhookProcessingResult.duplicate();
            case PARKED -> {
                loggingContext.logInfo(log, "Subscription {} parked until its checkout session arrives", outcome.subscriptionId());
                yield WebhookProcessingResult.pendingCorrelation();
            }
            case BLOCKED -> {
                metricsService.incrementSubscriptionBlocked(source);
                loggingContext.logWarn(log, "Duplicate subscription {} blocked; cancelling it at Stripe", outcome.subscriptionId());
                upstreamCancellationService.cancelBlocked(outcome.subscriptionId());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("activeCount", outcome.blockingSubscriptions().size());
                details.put("subscriptions", outcome.blockingSubscriptions());
                yield WebhookProcessingResult.blocked(BLOCKED_MESSAGE, details);
            }
            case CREATED, CONFIRMED -> {
                metricsService.incrementSubscriptionMaterialized(source);
                metricsService.incrementSubscriptionReplaced(outcome.supersededSubscriptionIds().size());
                if (!outcome.supersededSubscriptionIds().isEmpty()) {
                    int confirmed = upstreamCancellationService.cancelSuperseded(outcome.supersededSubscriptionIds());
                    loggingContext.logInfo(log, "Replaced {} subscription(s), {} confirmed cancelled at Stripe",
                            outcome.supersededSubscriptionIds().size(), confirmed);
                }
                yield WebhookProcessingResult.ok();
            }
        };
    }
}
