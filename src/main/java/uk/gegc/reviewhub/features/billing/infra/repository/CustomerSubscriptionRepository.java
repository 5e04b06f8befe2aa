package uk.gegc.reviewhub.features.billing.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CustomerSubscriptionRepository extends JpaRepository<CustomerSubscription, UUID> {

    Optional<CustomerSubscription> findByStripeSubscriptionId(String stripeSubscriptionId);

    boolean existsByStripeSubscriptionId(String stripeSubscriptionId);

    List<CustomerSubscription> findByStripeCustomerId(String stripeCustomerId);

    List<CustomerSubscription> findByUserId(UUID userId);

    /**
     * Superseded rows whose Stripe subscription has not yet been confirmed cancelled, keyed after
     * {@code afterSubscriptionId}.
     */
    @Query("SELECT s FROM CustomerSubscription s " +
           "WHERE s.supersededBy IS NOT NULL AND s.upstreamCancelledAt IS NULL " +
           "AND s.stripeSubscriptionId > :after " +
           "ORDER BY s.stripeSubscriptionId ASC")
    List<CustomerSubscription> findSupersededAwaitingUpstreamCancellation(@Param("after") String afterSubscriptionId,
                                                                          Pageable pageable);

    @Query("SELECT s FROM CustomerSubscription s " +
           "WHERE s.activeSlot IS NOT NULL AND s.stripeSubscriptionId > :after " +
           "ORDER BY s.stripeSubscriptionId ASC")
    List<CustomerSubscription> findActiveSlotHolders(@Param("after") String afterSubscriptionId, Pageable pageable);
}
