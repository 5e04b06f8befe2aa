package uk.gegc.reviewhub.features.billing.application.webhook;

import java.util.Arrays;

/**
 * Stripe event types the subscription lifecycle reacts to.
 */
public enum WebhookEventKind {
    CHECKOUT_SESSION_COMPLETED("checkout.session.completed"),
    SUBSCRIPTION_CREATED("customer.subscription.created"),
    SUBSCRIPTION_UPDATED("customer.subscription.updated"),
    SUBSCRIPTION_DELETED("customer.subscription.deleted"),
    SUBSCRIPTION_PENDING_UPDATE_APPLIED("customer.subscription.pending_update_applied"),
    SUBSCRIPTION_PENDING_UPDATE_EXPIRED("customer.subscription.pending_update_expired"),
    SUBSCRIPTION_TRIAL_WILL_END("customer.subscription.trial_will_end"),
    /** Any other event type. No handler is registered for it. */
    UNHANDLED(null);

    private final String stripeType;

    WebhookEventKind(String stripeType) {
        this.stripeType = stripeType;
    }

    public String getStripeType() {
        return stripeType;
    }

    public static WebhookEventKind fromStripeType(String type) {
        return Arrays.stream(values())
                .filter(kind -> kind.stripeType != null && kind.stripeType.equals(type))
                .findFirst()
                .orElse(UNHANDLED);
    }
}
