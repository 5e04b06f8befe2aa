package uk.gegc.reviewhub.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Internal mirror of one Stripe subscription.
 *
 * <p>{@code activeSlot} holds the customer id while the row is active, not scheduled for
 * cancellation and not superseded. The unique index on it allows at most one such row per customer;
 * every other row stores {@code NULL} there.
 */
@Entity
@Table(
        name = "customer_subscriptions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_customer_subscriptions_stripe_subscription_id", columnNames = "stripe_subscription_id"),
                @UniqueConstraint(name = "uk_customer_subscriptions_active_slot", columnNames = "active_slot")
        },
        indexes = {
                @Index(name = "idx_customer_subscriptions_customer", columnList = "stripe_customer_id"),
                @Index(name = "idx_customer_subscriptions_user", columnList = "user_id")
        }
)
@Getter
@Setter
public class CustomerSubscription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "stripe_customer_id", nullable = false)
    private String stripeCustomerId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "stripe_subscription_id", nullable = false, updatable = false)
    private String stripeSubscriptionId;

    @Column(name = "status", nullable = false, length = 32)
    private SubscriptionLifecycleStatus status;

    @Column(name = "cancel_at_period_end", nullable = false)
    private boolean cancelAtPeriodEnd;

    @Column(name = "current_period_start")
    private Instant currentPeriodStart;

    @Column(name = "current_period_end")
    private Instant currentPeriodEnd;

    @Column(name = "plan_id", length = 64)
    private String planId;

    @Column(name = "stripe_price_id")
    private String stripePriceId;

    @Column(name = "superseded_by")
    private String supersededBy;

    @Column(name = "replacement_reason", length = 64)
    private ReplacementReason replacementReason;

    @Column(name = "upstream_cancelled_at")
    private Instant upstreamCancelledAt;

    @Setter(AccessLevel.NONE)
    @Column(name = "active_slot")
    private String activeSlot;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isSuperseded() {
        return supersededBy != null;
    }

    /**
     * Active, renewing, inside its paid period and not replaced.
     */
    public boolean isTrulyActive(Instant now) {
        return !isSuperseded()
                && status == SubscriptionLifecycleStatus.ACTIVE
                && !cancelAtPeriodEnd
                && currentPeriodEnd != null
                && currentPeriodEnd.isAfter(now);
    }

    public void mirrorProviderState(SubscriptionLifecycleStatus status,
                                    boolean cancelAtPeriodEnd,
                                    Instant currentPeriodStart,
                                    Instant currentPeriodEnd,
                                    Instant now) {
        this.status = status;
        this.cancelAtPeriodEnd = cancelAtPeriodEnd;
        this.currentPeriodStart = currentPeriodStart;
        this.currentPeriodEnd = currentPeriodEnd;
        touch(now);
    }

    public void changePlan(String stripePriceId, String planId, Instant now) {
        this.stripePriceId = stripePriceId;
        this.planId = planId;
        touch(now);
    }

    public void markCanceled(Instant now) {
        this.status = SubscriptionLifecycleStatus.CANCELED;
        this.cancelAtPeriodEnd = false;
        this.currentPeriodEnd = now;
        touch(now);
    }

    /**
     * Retires this row in favour of {@code replacementSubscriptionId}. A row is superseded at most once.
     */
    public void supersede(String replacementSubscriptionId, ReplacementReason reason, Instant now) {
        Objects.requireNonNull(replacementSubscriptionId, "replacementSubscriptionId");
        Objects.requireNonNull(reason, "reason");
        if (replacementSubscriptionId.equals(stripeSubscriptionId)) {
            throw new IllegalArgumentException("Subscription " + stripeSubscriptionId + " cannot replace itself");
        }
        if (isSuperseded()) {
            throw new IllegalStateException("Subscription " + stripeSubscriptionId + " is already superseded by " + supersededBy);
        }
        this.supersededBy = replacementSubscriptionId;
        this.replacementReason = reason;
        touch(now);
    }

    public void markUpstreamCancelled(Instant now) {
        this.upstreamCancelledAt = now;
        touch(now);
    }

    @PrePersist
    @PreUpdate
    void syncActiveSlot() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        refreshActiveSlot();
    }

    private void touch(Instant now) {
        this.updatedAt = now;
        refreshActiveSlot();
    }

    private void refreshActiveSlot() {
        boolean holdsSlot = status == SubscriptionLifecycleStatus.ACTIVE
                && !cancelAtPeriodEnd
                && !isSuperseded();
        this.activeSlot = holdsSlot ? stripeCustomerId : null;
    }
}
