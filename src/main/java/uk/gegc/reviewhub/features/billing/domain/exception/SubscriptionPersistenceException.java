package uk.gegc.reviewhub.features.billing.domain.exception;

import lombok.Getter;

/**
 * Thrown when a subscription row could not be written while materialising a new subscription.
 * Answered with 500 so that Stripe redelivers the event.
 */
@Getter
public class SubscriptionPersistenceException extends RuntimeException {

    private final String subscriptionId;

    public SubscriptionPersistenceException(String subscriptionId, String message, Throwable cause) {
        super(message, cause);
        this.subscriptionId = subscriptionId;
    }
}
