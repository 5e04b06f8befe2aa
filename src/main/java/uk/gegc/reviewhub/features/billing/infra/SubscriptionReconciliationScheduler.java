package uk.gegc.reviewhub.features.billing.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.reviewhub.features.billing.application.SubscriptionReconciliationService;
import uk.gegc.reviewhub.shared.config.FeatureFlags;

/**
 * Scheduled job that periodically reconciles the subscription store with Stripe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class SubscriptionReconciliationScheduler {

    private final SubscriptionReconciliationService reconciliationService;
    private final FeatureFlags featureFlags;

    @Scheduled(cron = "${billing.reconciliation.cron:0 0 * * * *}")
    public void reconcile() {
        if (!featureFlags.isBilling()) {
            return;
        }
        try {
            reconciliationService.reconcile();
        } catch (Exception e) {
            log.warn("SubscriptionReconciliationScheduler: error during reconciliation sweep", e);
        }
    }
}
