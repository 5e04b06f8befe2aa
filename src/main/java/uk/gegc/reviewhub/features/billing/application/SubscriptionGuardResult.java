package uk.gegc.reviewhub.features.billing.application;

import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;

import java.util.List;

/**
 * Classification of a customer's existing subscriptions ahead of materialising a new one.
 *
 * @param trulyActive rows that block the new subscription
 * @param replaceable rows the new subscription supersedes (scheduled to cancel or past their period end)
 */
public record SubscriptionGuardResult(
        List<CustomerSubscription> trulyActive,
        List<CustomerSubscription> replaceable
) {

    public SubscriptionGuardResult {
        trulyActive = List.copyOf(trulyActive);
        replaceable = List.copyOf(replaceable);
    }

    public boolean blocked() {
        return !trulyActive.isEmpty();
    }
}
