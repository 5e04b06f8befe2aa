package uk.gegc.reviewhub.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewhub.features.billing.application.WebhookEventLedger;
import uk.gegc.reviewhub.features.billing.domain.exception.DuplicateWebhookEventException;
import uk.gegc.reviewhub.features.billing.domain.model.ProcessedWebhookEvent;
import uk.gegc.reviewhub.features.billing.infra.repository.ProcessedWebhookEventRepository;

import java.time.Clock;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventLedgerImpl implements WebhookEventLedger {

    private final ProcessedWebhookEventRepository processedWebhookEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public boolean isProcessed(String eventId) {
        return processedWebhookEventRepository.existsByEventId(eventId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void markProcessed(String eventId, String eventType, String subscriptionId, Map<String, Object> metadata) {
        ProcessedWebhookEvent event = new ProcessedWebhookEvent();
        event.setEventId(eventId);
        event.setEventType(eventType);
        event.setSubscriptionId(subscriptionId);
        event.setMetadata(toJson(eventId, metadata));
        event.setProcessedAt(clock.instant());
        try {
            // persist rather than merge so an existing id fails on the primary key
            processedWebhookEventRepository.saveAndFlush(event);
        } catch (DataIntegrityViolationException e) {
            log.info("Stripe event {} was recorded by a concurrent delivery", eventId);
            throw new DuplicateWebhookEventException(eventId, e);
        }
    }

    private String toJson(String eventId, Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise metadata for Stripe event {}: {}", eventId, e.getMessage());
            return null;
        }
    }
}
