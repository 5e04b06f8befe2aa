package uk.gegc.reviewhub.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Why a subscription row was superseded by a newer one.
 */
public enum ReplacementReason {
    CHECKOUT_SESSION_REPLACEMENT("checkout_session_replacement"),
    SUBSCRIPTION_CREATED_REPLACEMENT("subscription_created_replacement");

    private final String value;

    ReplacementReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ReplacementReason fromValue(String value) {
        return Arrays.stream(values())
                .filter(reason -> reason.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown replacement reason: " + value));
    }
}
