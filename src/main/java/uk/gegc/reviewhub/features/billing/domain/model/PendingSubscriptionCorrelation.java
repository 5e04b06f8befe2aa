package uk.gegc.reviewhub.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Subscription-created half of a purchase that arrived before its checkout session.
 */
@Entity
@Table(
        name = "pending_subscription_correlations",
        indexes = @Index(name = "idx_pending_correlations_expires_at", columnList = "expires_at")
)
@Getter
@Setter
public class PendingSubscriptionCorrelation {

    @Id
    @Column(name = "stripe_subscription_id", nullable = false, updatable = false)
    private String stripeSubscriptionId;

    @Column(name = "stripe_customer_id", nullable = false)
    private String stripeCustomerId;

    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "source_event_id", nullable = false)
    private String sourceEventId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
