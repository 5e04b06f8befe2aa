package uk.gegc.reviewhub.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.reviewhub.features.billing.domain.model.ProcessedWebhookEvent;

public interface ProcessedWebhookEventRepository extends JpaRepository<ProcessedWebhookEvent, String> {
    boolean existsByEventId(String eventId);
}
