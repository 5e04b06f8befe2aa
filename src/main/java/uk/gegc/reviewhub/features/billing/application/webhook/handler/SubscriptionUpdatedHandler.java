package uk.gegc.reviewhub.features.billing.application.webhook.handler;

import org.springframework.stereotype.Component;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.ProviderMirrorScope;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.application.SubscriptionLifecycleService;
import uk.gegc.reviewhub.features.billing.application.WebhookLoggingContext;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEvent;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEventKind;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;
import uk.gegc.reviewhub.features.billing.infra.mapping.ProviderSubscriptionMapper;

import java.util.Set;

@Component
public class SubscriptionUpdatedHandler extends SubscriptionEventHandlerSupport {

    public SubscriptionUpdatedHandler(SubscriptionLifecycleService lifecycleService,
                                      ProviderSubscriptionMapper subscriptionMapper,
                                      BillingMetricsService metricsService) {
        super(lifecycleService, subscriptionMapper, metricsService);
    }

    @Override
    public Set<WebhookEventKind> supportedKinds() {
        return Set.of(WebhookEventKind.SUBSCRIPTION_UPDATED);
    }

    @Override
    public WebhookProcessingResult handle(WebhookEvent event, WebhookLoggingContext loggingContext) {
        ProviderSubscription subscription = readSubscription(event, loggingContext);
        return applyMutation(event, loggingContext,
                () -> lifecycleService.mirror(event.eventId(), event.type(), subscription, ProviderMirrorScope.FULL));
    }
}
