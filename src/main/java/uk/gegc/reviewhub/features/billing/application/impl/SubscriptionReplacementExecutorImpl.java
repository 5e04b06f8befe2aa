package uk.gegc.reviewhub.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewhub.features.billing.application.SubscriptionReplacementExecutor;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;
import uk.gegc.reviewhub.features.billing.domain.model.ReplacementReason;
import uk.gegc.reviewhub.features.billing.infra.repository.CustomerSubscriptionRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionReplacementExecutorImpl implements SubscriptionReplacementExecutor {

    private final CustomerSubscriptionRepository subscriptionRepository;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public List<String> supersede(List<CustomerSubscription> rows, String replacementSubscriptionId, ReplacementReason reason) {
        Instant now = clock.instant();
        List<String> superseded = new ArrayList<>();
        for (CustomerSubscription row : rows) {
            row.supersede(replacementSubscriptionId, reason, now);
            // Hibernate orders inserts before updates; flush so the slot is free before the new row lands
            subscriptionRepository.saveAndFlush(row);
            superseded.add(row.getStripeSubscriptionId());
            log.info("Subscription {} superseded by {} (reason={})",
                    row.getStripeSubscriptionId(), replacementSubscriptionId, reason.getValue());
        }
        return superseded;
    }
}
