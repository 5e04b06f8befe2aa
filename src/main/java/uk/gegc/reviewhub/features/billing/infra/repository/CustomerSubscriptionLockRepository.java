package uk.gegc.reviewhub.features.billing.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscriptionLock;

import java.util.Optional;

public interface CustomerSubscriptionLockRepository extends JpaRepository<CustomerSubscriptionLock, String> {

    /**
     * SELECT ... FOR UPDATE on the customer's lock row. Held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM CustomerSubscriptionLock l WHERE l.stripeCustomerId = :customerId")
    Optional<CustomerSubscriptionLock> findByIdForUpdate(@Param("customerId") String customerId);
}
