package uk.gegc.reviewhub.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.reviewhub.features.billing.domain.model.PendingSubscriptionCorrelation;

import java.time.Instant;

public interface PendingSubscriptionCorrelationRepository extends JpaRepository<PendingSubscriptionCorrelation, String> {

    @Modifying
    @Query("DELETE FROM PendingSubscriptionCorrelation p WHERE p.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
