package uk.gegc.reviewhub.features.billing.application;

import lombok.Builder;
import uk.gegc.reviewhub.features.billing.domain.model.ReplacementReason;
import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Everything needed to create or confirm the row for a newly purchased subscription.
 */
@Builder
public record SubscriptionMaterialization(
        String eventId,
        String eventType,
        String subscriptionId,
        String customerId,
        UUID userId,
        SubscriptionLifecycleStatus status,
        boolean cancelAtPeriodEnd,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        String priceId,
        ReplacementReason replacementReason
) {

    public static SubscriptionMaterializationBuilder fromProvider(ProviderSubscription subscription) {
        return SubscriptionMaterialization.builder()
                .subscriptionId(subscription.id())
                .customerId(subscription.customerId())
                .status(subscription.status())
                .cancelAtPeriodEnd(subscription.cancelAtPeriodEnd())
                .currentPeriodStart(subscription.currentPeriodStart())
                .currentPeriodEnd(subscription.currentPeriodEnd())
                .priceId(subscription.priceId());
    }
}
