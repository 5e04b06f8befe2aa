package uk.gegc.reviewhub.features.billing.application;

import java.util.UUID;

public interface ActiveSubscriptionGuard {

    /**
     * Loads every subscription owned by the customer or the user and sorts it into truly active,
     * replaceable or inert. Superseded rows, rows whose status is not {@code active} and the row for
     * {@code excludeSubscriptionId} are inert and appear in neither list.
     *
     * @param userId optional; when present, rows owned by the user under another customer are included
     * @param excludeSubscriptionId the subscription being materialised, may be {@code null}
     */
    SubscriptionGuardResult evaluate(String customerId, UUID userId, String excludeSubscriptionId);
}
