package uk.gegc.reviewhub.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One row per Stripe customer, locked for update while a subscription for that customer is created.
 */
@Entity
@Table(name = "customer_subscription_locks")
@Getter
@Setter
@NoArgsConstructor
public class CustomerSubscriptionLock {

    @Id
    @Column(name = "stripe_customer_id", nullable = false, updatable = false)
    private String stripeCustomerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public CustomerSubscriptionLock(String stripeCustomerId, Instant createdAt) {
        this.stripeCustomerId = stripeCustomerId;
        this.createdAt = createdAt;
    }
}
