package uk.gegc.reviewhub.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.application.StripeService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionLifecycleService;
import uk.gegc.reviewhub.features.billing.application.UpstreamCancellationService;
import uk.gegc.reviewhub.features.billing.domain.exception.ProviderApiException;
import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UpstreamCancellationServiceImpl implements UpstreamCancellationService {

    private final StripeService stripeService;
    private final SubscriptionLifecycleService lifecycleService;
    private final BillingMetricsService metricsService;

    @Override
    public boolean cancelIfActive(String subscriptionId) {
        try {
            ProviderSubscription current = stripeService.retrieveSubscription(subscriptionId);
            if (!current.isActiveAndRenewing()) {
                log.info("Stripe subscription {} already inactive (status={}, cancelAtPeriodEnd={})",
                        subscriptionId, current.status().getValue(), current.cancelAtPeriodEnd());
                metricsService.incrementUpstreamCancellation("already_inactive");
                return true;
            }
            stripeService.cancelSubscription(subscriptionId);
            metricsService.incrementUpstreamCancellation("cancelled");
            return true;
        } catch (ProviderApiException e) {
            if (e.isResourceMissing()) {
                log.info("Stripe subscription {} no longer exists; nothing to cancel", subscriptionId);
                metricsService.incrementUpstreamCancellation("missing");
                return true;
            }
            log.warn("Could not cancel Stripe subscription {} (will be retried by reconciliation): {}",
                    subscriptionId, e.getMessage());
            metricsService.incrementUpstreamCancellation("failed");
            return false;
        }
    }

    @Override
    public boolean cancelBlocked(String subscriptionId) {
        try {
            ProviderSubscription current = stripeService.retrieveSubscription(subscriptionId);
            if (current.status() == SubscriptionLifecycleStatus.CANCELED
                    || current.status() == SubscriptionLifecycleStatus.INCOMPLETE_EXPIRED) {
                log.info("Blocked Stripe subscription {} already ended (status={})",
                        subscriptionId, current.status().getValue());
                metricsService.incrementUpstreamCancellation("already_inactive");
                return true;
            }
            stripeService.cancelSubscription(subscriptionId);
            log.info("Cancelled blocked Stripe subscription {} (was {})", subscriptionId, current.status().getValue());
            metricsService.incrementUpstreamCancellation("cancelled");
            return true;
        } catch (ProviderApiException e) {
            if (e.isResourceMissing()) {
                log.info("Blocked Stripe subscription {} no longer exists; nothing to cancel", subscriptionId);
                metricsService.incrementUpstreamCancellation("missing");
                return true;
            }
            log.error("Could not cancel blocked Stripe subscription {}; it may still bill the customer: {}",
                    subscriptionId, e.getMessage());
            metricsService.incrementUpstreamCancellation("failed");
            return false;
        }
    }

    @Override
    public int cancelSuperseded(List<String> subscriptionIds) {
        int confirmed = 0;
        for (String subscriptionId : subscriptionIds) {
            if (!cancelIfActive(subscriptionId)) {
                continue;
            }
            try {
                lifecycleService.recordUpstreamCancellation(subscriptionId);
                confirmed++;
            } catch (DataAccessException e) {
                log.warn("Cancelled {} at Stripe but could not record it; reconciliation will revisit: {}",
                        subscriptionId, e.getMessage());
            }
        }
        return confirmed;
    }
}
