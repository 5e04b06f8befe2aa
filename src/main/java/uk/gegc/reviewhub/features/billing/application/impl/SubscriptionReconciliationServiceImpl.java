package uk.gegc.reviewhub.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.BillingProperties;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.application.StripeService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionLifecycleService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionReconciliationService;
import uk.gegc.reviewhub.features.billing.application.UpstreamCancellationService;
import uk.gegc.reviewhub.features.billing.domain.exception.ProviderApiException;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;
import uk.gegc.reviewhub.features.billing.infra.repository.CustomerSubscriptionRepository;

import java.util.List;

/**
 * Runs outside any transaction: every Stripe call happens between short local writes. Both sweeps
 * page by Stripe subscription id, so every matching row is visited once per run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionReconciliationServiceImpl implements SubscriptionReconciliationService {

    private final CustomerSubscriptionRepository subscriptionRepository;
    private final UpstreamCancellationService upstreamCancellationService;
    private final SubscriptionLifecycleService lifecycleService;
    private final StripeService stripeService;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;

    @Override
    public ReconciliationReport reconcile() {
        int batchSize = billingProperties.getReconciliation().getBatchSize();

        int supersededExamined = 0;
        int confirmed = 0;
        String after = "";
        List<CustomerSubscription> page;
        do {
            page = subscriptionRepository.findSupersededAwaitingUpstreamCancellation(after, PageRequest.of(0, batchSize));
            if (page.isEmpty()) {
                break;
            }
            List<String> ids = page.stream().map(CustomerSubscription::getStripeSubscriptionId).toList();
            confirmed += upstreamCancellationService.cancelSuperseded(ids);
            supersededExamined += ids.size();
            after = ids.get(ids.size() - 1);
        } while (page.size() == batchSize);

        int activeExamined = 0;
        int drift = 0;
        int failures = supersededExamined - confirmed;
        after = "";
        do {
            page = subscriptionRepository.findActiveSlotHolders(after, PageRequest.of(0, batchSize));
            for (CustomerSubscription row : page) {
                switch (checkHolder(row.getStripeSubscriptionId())) {
                    case DRIFT_CORRECTED -> drift++;
                    case FAILED -> failures++;
                    case IN_SYNC -> { }
                }
                activeExamined++;
                after = row.getStripeSubscriptionId();
            }
        } while (page.size() == batchSize);

        ReconciliationReport report = new ReconciliationReport(
                supersededExamined, confirmed, activeExamined, drift, failures);
        log.info("Subscription reconciliation finished: supersededExamined={}, upstreamCancellationsConfirmed={}, activeExamined={}, driftCorrected={}, failures={}",
                report.supersededExamined(), report.upstreamCancellationsConfirmed(), report.activeExamined(),
                report.driftCorrected(), report.failures());
        return report;
    }

    private HolderCheck checkHolder(String subscriptionId) {
        try {
            ProviderSubscription current = stripeService.retrieveSubscription(subscriptionId);
            if (lifecycleService.reconcile(current)) {
                metricsService.recordReconciliationDrift(subscriptionId);
                return HolderCheck.DRIFT_CORRECTED;
            }
            return HolderCheck.IN_SYNC;
        } catch (ProviderApiException e) {
            String reason = e.isResourceMissing() ? "missing_upstream" : "provider_error";
            metricsService.recordReconciliationFailure(subscriptionId, reason);
            log.warn("Reconciliation could not read Stripe subscription {} ({}): {}", subscriptionId, reason, e.getMessage());
            return HolderCheck.FAILED;
        } catch (DataAccessException e) {
            metricsService.recordReconciliationFailure(subscriptionId, "persistence_error");
            log.warn("Reconciliation could not update subscription {}: {}", subscriptionId, e.getMessage());
            return HolderCheck.FAILED;
        }
    }

    private enum HolderCheck { IN_SYNC, DRIFT_CORRECTED, FAILED }
}
