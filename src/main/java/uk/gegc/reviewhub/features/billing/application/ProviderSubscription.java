package uk.gegc.reviewhub.features.billing.application;

import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Stripe's view of a subscription, reduced to the fields the lifecycle engine mirrors.
 */
public record ProviderSubscription(
        String id,
        String customerId,
        SubscriptionLifecycleStatus status,
        boolean cancelAtPeriodEnd,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        String priceId,
        Map<String, String> metadata
) {

    public static final String USER_ID_METADATA_KEY = "userId";

    public ProviderSubscription {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isActiveAndRenewing() {
        return status == SubscriptionLifecycleStatus.ACTIVE && !cancelAtPeriodEnd;
    }

    /**
     * User id stamped on the subscription at checkout, if present and well-formed.
     */
    public UUID metadataUserId() {
        return parseUserId(metadata.get(USER_ID_METADATA_KEY));
    }

    public static UUID parseUserId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
