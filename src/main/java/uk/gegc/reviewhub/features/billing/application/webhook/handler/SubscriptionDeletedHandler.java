package uk.gegc.reviewhub.features.billing.application.webhook.handler;

import org.springframework.stereotype.Component;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionLifecycleService;
import uk.gegc.reviewhub.features.billing.application.WebhookLoggingContext;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEvent;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEventKind;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookValidationException;
import uk.gegc.reviewhub.features.billing.infra.mapping.ProviderSubscriptionMapper;

import java.util.Set;

@Component
public class SubscriptionDeletedHandler extends SubscriptionEventHandlerSupport {

    public SubscriptionDeletedHandler(SubscriptionLifecycleService lifecycleService,
                                      ProviderSubscriptionMapper subscriptionMapper,
                                      BillingMetricsService metricsService) {
        super(lifecycleService, subscriptionMapper, metricsService);
    }

    @Override
    public Set<WebhookEventKind> supportedKinds() {
        return Set.of(WebhookEventKind.SUBSCRIPTION_DELETED);
    }

    @Override
    public WebhookProcessingResult handle(WebhookEvent event, WebhookLoggingContext loggingContext) {
        String subscriptionId = event.text("id");
        if (subscriptionId == null) {
            throw new WebhookValidationException(event.eventId(), "id", "Missing subscription id in event " + event.eventId());
        }
        loggingContext.setSubscriptionId(subscriptionId);
        loggingContext.setCustomerId(event.text("customer"));
        return applyMutation(event, loggingContext,
                () -> lifecycleService.markDeleted(event.eventId(), event.type(), subscriptionId));
    }
}
