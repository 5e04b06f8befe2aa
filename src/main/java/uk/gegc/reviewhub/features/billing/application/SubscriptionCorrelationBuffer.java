package uk.gegc.reviewhub.features.billing.application;

import uk.gegc.reviewhub.features.billing.domain.model.PendingSubscriptionCorrelation;

import java.util.Optional;

/**
 * Holds subscription-created events whose checkout session has not arrived yet, keyed by
 * Stripe subscription id. Entries expire after {@code billing.correlation.ttl}.
 */
public interface SubscriptionCorrelationBuffer {

    /**
     * Inserts or refreshes the entry for the subscription. Replaying the same event leaves the same state.
     */
    PendingSubscriptionCorrelation park(String subscriptionId, String customerId, String sourceEventId);

    /**
     * Removes the entry for the subscription and returns it if it had not expired.
     */
    Optional<PendingSubscriptionCorrelation> consume(String subscriptionId);

    int purgeExpired();
}
