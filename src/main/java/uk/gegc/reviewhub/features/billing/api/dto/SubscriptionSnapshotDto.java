package uk.gegc.reviewhub.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;

import java.time.Instant;

@Schema(name = "SubscriptionSnapshot", description = "Existing subscription that blocked a new purchase")
public record SubscriptionSnapshotDto(
        @Schema(description = "Stripe subscription ID", example = "sub_...")
        String stripeSubscriptionId,

        @Schema(description = "Stripe subscription status", example = "active")
        SubscriptionLifecycleStatus status,

        @Schema(description = "Internal plan ID", example = "pro")
        String planId,

        @Schema(description = "Whether the subscription ends at the current period end")
        boolean cancelAtPeriodEnd,

        @Schema(description = "End of the current paid period")
        Instant currentPeriodEnd
) {}
