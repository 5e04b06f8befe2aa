package uk.gegc.reviewhub.features.billing.application;

/**
 * Per-customer row lock that serialises subscription creation for one Stripe customer.
 */
public interface CustomerLockService {

    /**
     * Creates the customer's lock row if it does not exist yet. Must be called outside any
     * transaction, before the creation transaction opens.
     */
    void ensureLockRow(String customerId);

    /**
     * Locks the customer's row until the caller's transaction ends.
     *
     * @throws IllegalStateException if {@link #ensureLockRow(String)} was not called for the customer
     */
    void lock(String customerId);
}
