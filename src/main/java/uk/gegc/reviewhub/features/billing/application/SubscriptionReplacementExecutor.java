package uk.gegc.reviewhub.features.billing.application;

import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;
import uk.gegc.reviewhub.features.billing.domain.model.ReplacementReason;

import java.util.List;

public interface SubscriptionReplacementExecutor {

    /**
     * Marks each row as superseded by {@code replacementSubscriptionId} and flushes, releasing the
     * rows' active slots before the replacement row is inserted. Runs in the caller's transaction.
     *
     * @return the Stripe subscription ids that were superseded, for upstream cancellation after commit
     */
    List<String> supersede(List<CustomerSubscription> rows, String replacementSubscriptionId, ReplacementReason reason);
}
