package uk.gegc.reviewhub.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.BillingProperties;
import uk.gegc.reviewhub.features.billing.application.SubscriptionCorrelationBuffer;
import uk.gegc.reviewhub.features.billing.domain.model.PendingSubscriptionCorrelation;
import uk.gegc.reviewhub.features.billing.infra.repository.PendingSubscriptionCorrelationRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionCorrelationBufferImpl implements SubscriptionCorrelationBuffer {

    private final PendingSubscriptionCorrelationRepository correlationRepository;
    private final BillingProperties billingProperties;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public PendingSubscriptionCorrelation park(String subscriptionId, String customerId, String sourceEventId) {
        Instant now = clock.instant();
        PendingSubscriptionCorrelation entry = correlationRepository.findById(subscriptionId)
                .orElseGet(() -> {
                    PendingSubscriptionCorrelation created = new PendingSubscriptionCorrelation();
                    created.setStripeSubscriptionId(subscriptionId);
                    created.setCreatedAt(now);
                    return created;
                });
        entry.setStripeCustomerId(customerId);
        entry.setSourceEventId(sourceEventId);
        entry.setExpiresAt(now.plus(billingProperties.getCorrelation().getTtl()));

        PendingSubscriptionCorrelation saved = correlationRepository.save(entry);
        metricsService.incrementCorrelationParked();
        log.info("Parked subscription {} for customer {} until {} awaiting checkout session",
                subscriptionId, customerId, saved.getExpiresAt());
        return saved;
    }

    @Override
    @Transactional
    public Optional<PendingSubscriptionCorrelation> consume(String subscriptionId) {
        Optional<PendingSubscriptionCorrelation> entry = correlationRepository.findById(subscriptionId);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        correlationRepository.delete(entry.get());
        if (entry.get().isExpired(clock.instant())) {
            log.debug("Dropped expired correlation entry for subscription {}", subscriptionId);
            return Optional.empty();
        }
        metricsService.incrementCorrelationMatched();
        return entry;
    }

    @Override
    @Transactional
    public int purgeExpired() {
        int purged = correlationRepository.deleteExpired(clock.instant());
        metricsService.recordCorrelationPurged(purged);
        if (purged > 0) {
            log.info("Purged {} expired subscription correlation entries", purged);
        }
        return purged;
    }
}
