package uk.gegc.reviewhub.features.billing.application;

import java.util.Map;

/**
 * Stripe API calls used by the subscription lifecycle. Failures surface as
 * {@link uk.gegc.reviewhub.features.billing.domain.exception.ProviderApiException}.
 */
public interface StripeService {

    ProviderSubscription retrieveSubscription(String subscriptionId);

    /**
     * Cancels the subscription immediately and returns its resulting state.
     */
    ProviderSubscription cancelSubscription(String subscriptionId);

    Map<String, String> retrieveCustomerMetadata(String customerId);
}
