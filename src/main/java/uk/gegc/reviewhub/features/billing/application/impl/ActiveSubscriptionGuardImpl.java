package uk.gegc.reviewhub.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewhub.features.billing.application.ActiveSubscriptionGuard;
import uk.gegc.reviewhub.features.billing.application.SubscriptionGuardResult;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;
import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;
import uk.gegc.reviewhub.features.billing.infra.repository.CustomerSubscriptionRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ActiveSubscriptionGuardImpl implements ActiveSubscriptionGuard {

    private final CustomerSubscriptionRepository subscriptionRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public SubscriptionGuardResult evaluate(String customerId, UUID userId, String excludeSubscriptionId) {
        Map<String, CustomerSubscription> candidates = new LinkedHashMap<>();
        subscriptionRepository.findByStripeCustomerId(customerId)
                .forEach(row -> candidates.putIfAbsent(row.getStripeSubscriptionId(), row));
        if (userId != null) {
            subscriptionRepository.findByUserId(userId)
                    .forEach(row -> candidates.putIfAbsent(row.getStripeSubscriptionId(), row));
        }

        Instant now = clock.instant();
        List<CustomerSubscription> trulyActive = new ArrayList<>();
        List<CustomerSubscription> replaceable = new ArrayList<>();
        for (CustomerSubscription row : candidates.values()) {
            if (isInert(row, excludeSubscriptionId)) {
                continue;
            }
            if (row.isTrulyActive(now)) {
                trulyActive.add(row);
            } else {
                replaceable.add(row);
            }
        }

        log.debug("Guard for customer={} user={} exclude={}: {} truly active, {} replaceable, {} inspected",
                customerId, userId, excludeSubscriptionId, trulyActive.size(), replaceable.size(), candidates.size());
        return new SubscriptionGuardResult(trulyActive, replaceable);
    }

    private boolean isInert(CustomerSubscription row, String excludeSubscriptionId) {
        return row.isSuperseded()
                || row.getStatus() != SubscriptionLifecycleStatus.ACTIVE
                || row.getStripeSubscriptionId().equals(excludeSubscriptionId);
    }
}
