package uk.gegc.reviewhub.features.billing.application;

/**
 * Transactional writes to the subscription store. Every event-driven method records the event in
 * the {@link WebhookEventLedger} in the same transaction as the change it makes. None of these
 * methods call Stripe.
 */
public interface SubscriptionLifecycleService {

    /**
     * Creates or confirms the row for a new subscription under the customer lock.
     * Blocks when the customer already has a truly active subscription; otherwise supersedes
     * replaceable rows first, then writes the row and clears any parked correlation entry.
     *
     * @throws uk.gegc.reviewhub.features.billing.domain.exception.SubscriptionPersistenceException
     *         if the row cannot be written
     */
    MaterializationOutcome materialize(SubscriptionMaterialization request);

    /**
     * Parks a subscription-created event whose user cannot be resolved yet, unless the customer
     * already holds a truly active subscription, in which case the event is blocked.
     */
    MaterializationOutcome park(String eventId, String eventType, ProviderSubscription subscription);

    SubscriptionMutationOutcome mirror(String eventId, String eventType, ProviderSubscription subscription, ProviderMirrorScope scope);

    /**
     * Records a subscription-created event for a row that already exists. The row is left as it is:
     * it was built from Stripe at checkout and later events may already have moved it on.
     */
    SubscriptionMutationOutcome confirmMatch(String eventId, String eventType, String subscriptionId);

    SubscriptionMutationOutcome markDeleted(String eventId, String eventType, String subscriptionId);

    boolean exists(String subscriptionId);

    /**
     * Stamps {@code upstream_cancelled_at} on a superseded row once Stripe stopped billing it.
     */
    void recordUpstreamCancellation(String subscriptionId);

    /**
     * Copies Stripe's current state onto the row when they differ. Used by the reconciliation sweep.
     *
     * @return whether the row changed
     */
    boolean reconcile(ProviderSubscription subscription);
}
