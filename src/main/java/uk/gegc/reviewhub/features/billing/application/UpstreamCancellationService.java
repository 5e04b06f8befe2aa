package uk.gegc.reviewhub.features.billing.application;

import java.util.List;

/**
 * Best-effort cancellation of subscriptions at Stripe. Runs after the local transaction has
 * committed and never throws on Stripe failures.
 */
public interface UpstreamCancellationService {

    /**
     * Cancels the subscription if Stripe still reports it active and renewing.
     *
     * @return {@code true} when Stripe no longer renews the subscription, {@code false} if that could not be confirmed
     */
    boolean cancelIfActive(String subscriptionId);

    /**
     * Cancels a subscription that was blocked as a duplicate. Any status that could still bill the
     * customer is cancelled, including trialing, incomplete and past due.
     *
     * @return {@code true} when Stripe reports it cancelled, expired or gone
     */
    boolean cancelBlocked(String subscriptionId);

    /**
     * Cancels superseded subscriptions and stamps {@code upstream_cancelled_at} on each confirmed one.
     *
     * @return how many were confirmed
     */
    int cancelSuperseded(List<String> subscriptionIds);
}
