package uk.gegc.reviewhub.features.billing.application;

/**
 * Which Stripe fields an update event copies onto the subscription row.
 */
public enum ProviderMirrorScope {
    /** Status, period bounds, cancellation flag, price and plan. */
    FULL,
    /** Status, period bounds and cancellation flag only. */
    STATUS_AND_PERIOD
}
