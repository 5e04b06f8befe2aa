package uk.gegc.reviewhub.features.billing.application;

public enum SubscriptionMutationOutcome {
    APPLIED,
    /** No row for the subscription; the event was recorded with reason {@code subscription_not_found}. */
    NOT_FOUND,
    DUPLICATE
}
