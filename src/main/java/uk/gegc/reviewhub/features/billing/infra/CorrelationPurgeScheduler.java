package uk.gegc.reviewhub.features.billing.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.reviewhub.features.billing.application.SubscriptionCorrelationBuffer;
import uk.gegc.reviewhub.shared.config.FeatureFlags;

/**
 * Deletes parked subscription-created events whose checkout session never arrived.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationPurgeScheduler {

    private final SubscriptionCorrelationBuffer correlationBuffer;
    private final FeatureFlags featureFlags;

    @Scheduled(fixedDelayString = "${billing.correlation.purge-fixed-delay-ms:900000}")
    public void purgeExpired() {
        if (!featureFlags.isBilling()) {
            return;
        }
        try {
            correlationBuffer.purgeExpired();
        } catch (Exception e) {
            log.warn("CorrelationPurgeScheduler: error purging expired correlation entries", e);
        }
    }
}
