package uk.gegc.reviewhub.features.billing.application;

import uk.gegc.reviewhub.features.billing.api.dto.SubscriptionSnapshotDto;

import java.util.List;

public record MaterializationOutcome(
        Status status,
        String subscriptionId,
        List<String> supersededSubscriptionIds,
        List<SubscriptionSnapshotDto> blockingSubscriptions,
        boolean correlated
) {

    public enum Status {
        CREATED,
        CONFIRMED,
        BLOCKED,
        PARKED,
        DUPLICATE
    }

    public static MaterializationOutcome written(boolean created, String subscriptionId,
                                                 List<String> superseded, boolean correlated) {
        return new MaterializationOutcome(created ? Status.CREATED : Status.CONFIRMED,
                subscriptionId, List.copyOf(superseded), List.of(), correlated);
    }

    public static MaterializationOutcome blocked(String subscriptionId, List<SubscriptionSnapshotDto> blocking) {
        return new MaterializationOutcome(Status.BLOCKED, subscriptionId, List.of(), List.copyOf(blocking), false);
    }

    public static MaterializationOutcome parked(String subscriptionId) {
        return new MaterializationOutcome(Status.PARKED, subscriptionId, List.of(), List.of(), false);
    }

    public static MaterializationOutcome duplicate(String subscriptionId) {
        return new MaterializationOutcome(Status.DUPLICATE, subscriptionId, List.of(), List.of(), false);
    }
}
