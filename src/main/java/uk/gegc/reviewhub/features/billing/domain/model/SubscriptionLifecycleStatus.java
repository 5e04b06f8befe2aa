package uk.gegc.reviewhub.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Subscription status as reported by Stripe. Persisted as the provider's lower-case string.
 */
public enum SubscriptionLifecycleStatus {
    ACTIVE("active"),
    TRIALING("trialing"),
    PAST_DUE("past_due"),
    CANCELED("canceled"),
    UNPAID("unpaid"),
    INCOMPLETE("incomplete"),
    INCOMPLETE_EXPIRED("incomplete_expired"),
    PAUSED("paused");

    private final String value;

    SubscriptionLifecycleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<SubscriptionLifecycleStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(status -> status.value.equals(normalized))
                .findFirst();
    }
}
