package uk.gegc.reviewhub.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewhub.features.billing.api.dto.SubscriptionSnapshotDto;
import uk.gegc.reviewhub.features.billing.application.ActiveSubscriptionGuard;
import uk.gegc.reviewhub.features.billing.application.CustomerLockService;
import uk.gegc.reviewhub.features.billing.application.MaterializationOutcome;
import uk.gegc.reviewhub.features.billing.application.ProviderMirrorScope;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.application.SubscriptionCorrelationBuffer;
import uk.gegc.reviewhub.features.billing.application.SubscriptionGuardResult;
import uk.gegc.reviewhub.features.billing.application.SubscriptionLifecycleService;
import uk.gegc.reviewhub.features.billing.application.SubscriptionMaterialization;
import uk.gegc.reviewhub.features.billing.application.SubscriptionMutationOutcome;
import uk.gegc.reviewhub.features.billing.application.SubscriptionPlanResolver;
import uk.gegc.reviewhub.features.billing.application.SubscriptionReplacementExecutor;
import uk.gegc.reviewhub.features.billing.application.WebhookEventLedger;
import uk.gegc.reviewhub.features.billing.domain.exception.SubscriptionPersistenceException;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;
import uk.gegc.reviewhub.features.billing.infra.mapping.CustomerSubscriptionMapper;
import uk.gegc.reviewhub.features.billing.infra.repository.CustomerSubscriptionRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionLifecycleServiceImpl implements SubscriptionLifecycleService {

    static final String REASON_BLOCKED_DUPLICATE = "blocked_duplicate";
    static final String REASON_AWAITING_SESSION = "awaiting_session";
    static final String REASON_SUBSCRIPTION_NOT_FOUND = "subscription_not_found";

    private final CustomerSubscriptionRepository subscriptionRepository;
    private final CustomerLockService customerLockService;
    private final ActiveSubscriptionGuard activeSubscriptionGuard;
    private final SubscriptionReplacementExecutor replacementExecutor;
    private final SubscriptionCorrelationBuffer correlationBuffer;
    private final WebhookEventLedger eventLedger;
    private final SubscriptionPlanResolver planResolver;
    private final CustomerSubscriptionMapper subscriptionMapper;
    private final Clock clock;

    @Override
    @Transactional
    public MaterializationOutcome materialize(SubscriptionMaterialization request) {
        String subscriptionId = request.subscriptionId();
        customerLockService.lock(request.customerId());

        // a delivery that held the lock before us may have finished this event
        if (eventLedger.isProcessed(request.eventId())) {
            return MaterializationOutcome.duplicate(subscriptionId);
        }

        SubscriptionGuardResult guard = activeSubscriptionGuard.evaluate(
                request.customerId(), request.userId(), subscriptionId);
        if (guard.blocked()) {
            return block(request.eventId(), request.eventType(), subscriptionId, guard);
        }

        List<String> superseded = replacementExecutor.supersede(
                guard.replaceable(), subscriptionId, request.replacementReason());

        Instant now = clock.instant();
        Optional<CustomerSubscription> existing = subscriptionRepository.findByStripeSubscriptionId(subscriptionId);
        CustomerSubscription row = existing.orElseGet(() -> newRow(request, now));
        if (existing.isPresent() && !Objects.equals(row.getUserId(), request.userId())) {
            log.warn("Subscription {} is owned by user {} but event {} names user {}; keeping the recorded owner",
                    subscriptionId, row.getUserId(), request.eventId(), request.userId());
        }
        row.mirrorProviderState(request.status(), request.cancelAtPeriodEnd(),
                request.currentPeriodStart(), request.currentPeriodEnd(), now);
        row.changePlan(request.priceId(), planResolver.resolvePlan(request.priceId()), now);

        try {
            subscriptionRepository.saveAndFlush(row);
        } catch (DataIntegrityViolationException e) {
            log.error("Could not write subscription {} for customer {}: {}",
                    subscriptionId, request.customerId(), e.getMostSpecificCause().getMessage());
            throw new SubscriptionPersistenceException(subscriptionId,
                    "Failed to persist subscription " + subscriptionId, e);
        }

        boolean correlated = correlationBuffer.consume(subscriptionId).isPresent();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", existing.isPresent() ? "confirmed" : "created");
        metadata.put("status", request.status().getValue());
        if (!superseded.isEmpty()) {
            metadata.put("replaced", superseded);
            metadata.put("replacementReason", request.replacementReason().getValue());
        }
        if (correlated) {
            metadata.put("correlated", true);
        }
        eventLedger.markProcessed(request.eventId(), request.eventType(), subscriptionId, metadata);

        log.info("Subscription {} {} for customer {} (status={}, replaced={})",
                subscriptionId, existing.isPresent() ? "confirmed" : "created",
                request.customerId(), request.status().getValue(), superseded);
        return MaterializationOutcome.written(existing.isEmpty(), subscriptionId, superseded, correlated);
    }

    @Override
    @Transactional
    public MaterializationOutcome park(String eventId, String eventType, ProviderSubscription subscription) {
        if (eventLedger.isProcessed(eventId)) {
            return MaterializationOutcome.duplicate(subscription.id());
        }

        SubscriptionGuardResult guard = activeSubscriptionGuard.evaluate(
                subscription.customerId(), null, subscription.id());
        if (guard.blocked()) {
            return block(eventId, eventType, subscription.id(), guard);
        }

        correlationBuffer.park(subscription.id(), subscription.customerId(), eventId);
        eventLedger.markProcessed(eventId, eventType, subscription.id(),
                Map.of("reason", REASON_AWAITING_SESSION, "customerId", subscription.customerId()));
        return MaterializationOutcome.parked(subscription.id());
    }

    @Override
    @Transactional
    public SubscriptionMutationOutcome mirror(String eventId, String eventType,
                                              ProviderSubscription subscription, ProviderMirrorScope scope) {
        if (eventLedger.isProcessed(eventId)) {
            return SubscriptionMutationOutcome.DUPLICATE;
        }
        Optional<CustomerSubscription> found = subscriptionRepository.findByStripeSubscriptionId(subscription.id());
        if (found.isEmpty()) {
            return recordNotFound(eventId, eventType, subscription.id());
        }

        CustomerSubscription row = found.get();
        applyProviderState(row, subscription, scope, clock.instant());
        subscriptionRepository.saveAndFlush(row);

        eventLedger.markProcessed(eventId, eventType, subscription.id(),
                Map.of("status", subscription.status().getValue(),
                        "cancelAtPeriodEnd", subscription.cancelAtPeriodEnd()));
        return SubscriptionMutationOutcome.APPLIED;
    }

    @Override
    @Transactional
    public SubscriptionMutationOutcome confirmMatch(String eventId, String eventType, String subscriptionId) {
        if (eventLedger.isProcessed(eventId)) {
            return SubscriptionMutationOutcome.DUPLICATE;
        }
        Optional<CustomerSubscription> found = subscriptionRepository.findByStripeSubscriptionId(subscriptionId);
        if (found.isEmpty()) {
            return recordNotFound(eventId, eventType, subscriptionId);
        }

        eventLedger.markProcessed(eventId, eventType, subscriptionId,
                Map.of("action", "matched", "status", found.get().getStatus().getValue()));
        log.info("Subscription {} already materialised; event {} recorded without changes", subscriptionId, eventId);
        return SubscriptionMutationOutcome.APPLIED;
    }

    @Override
    @Transactional
    public SubscriptionMutationOutcome markDeleted(String eventId, String eventType, String subscriptionId) {
        if (eventLedger.isProcessed(eventId)) {
            return SubscriptionMutationOutcome.DUPLICATE;
        }
        Optional<CustomerSubscription> found = subscriptionRepository.findByStripeSubscriptionId(subscriptionId);
        if (found.isEmpty()) {
            return recordNotFound(eventId, eventType, subscriptionId);
        }

        CustomerSubscription row = found.get();
        row.markCanceled(clock.instant());
        subscriptionRepository.saveAndFlush(row);

        eventLedger.markProcessed(eventId, eventType, subscriptionId, Map.of("status", row.getStatus().getValue()));
        log.info("Subscription {} cancelled", subscriptionId);
        return SubscriptionMutationOutcome.APPLIED;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String subscriptionId) {
        return subscriptionRepository.existsByStripeSubscriptionId(subscriptionId);
    }

    @Override
    @Transactional
    public void recordUpstreamCancellation(String subscriptionId) {
        subscriptionRepository.findByStripeSubscriptionId(subscriptionId).ifPresentOrElse(row -> {
            if (row.getUpstreamCancelledAt() == null) {
                row.markUpstreamCancelled(clock.instant());
                subscriptionRepository.save(row);
            }
        }, () -> log.warn("Cannot record upstream cancellation; subscription {} not found", subscriptionId));
    }

    @Override
    @Transactional
    public boolean reconcile(ProviderSubscription subscription) {
        Optional<CustomerSubscription> found = subscriptionRepository.findByStripeSubscriptionId(subscription.id());
        if (found.isEmpty() || !diverges(found.get(), subscription)) {
            return false;
        }
        CustomerSubscription row = found.get();
        log.info("Reconciling subscription {}: status {} -> {}, cancelAtPeriodEnd {} -> {}, periodEnd {} -> {}",
                subscription.id(), row.getStatus().getValue(), subscription.status().getValue(),
                row.isCancelAtPeriodEnd(), subscription.cancelAtPeriodEnd(),
                row.getCurrentPeriodEnd(), subscription.currentPeriodEnd());
        applyProviderState(row, subscription, ProviderMirrorScope.FULL, clock.instant());
        subscriptionRepository.saveAndFlush(row);
        return true;
    }

    private MaterializationOutcome block(String eventId, String eventType, String subscriptionId, SubscriptionGuardResult guard) {
        List<SubscriptionSnapshotDto> blocking = subscriptionMapper.toSnapshots(guard.trulyActive());
        eventLedger.markProcessed(eventId, eventType, subscriptionId,
                Map.of("reason", REASON_BLOCKED_DUPLICATE, "existingSubscriptions", blocking));
        log.warn("Blocked subscription {}: customer already has {} truly active subscription(s)",
                subscriptionId, blocking.size());
        return MaterializationOutcome.blocked(subscriptionId, blocking);
    }

    private SubscriptionMutationOutcome recordNotFound(String eventId, String eventType, String subscriptionId) {
        log.info("No subscription row for {}; recording event {} as {}", subscriptionId, eventId, REASON_SUBSCRIPTION_NOT_FOUND);
        eventLedger.markProcessed(eventId, eventType, subscriptionId, Map.of("reason", REASON_SUBSCRIPTION_NOT_FOUND));
        return SubscriptionMutationOutcome.NOT_FOUND;
    }

    private void applyProviderState(CustomerSubscription row, ProviderSubscription subscription,
                                    ProviderMirrorScope scope, Instant now) {
        row.mirrorProviderState(subscription.status(), subscription.cancelAtPeriodEnd(),
                subscription.currentPeriodStart(), subscription.currentPeriodEnd(), now);
        if (scope == ProviderMirrorScope.FULL && subscription.priceId() != null) {
            row.changePlan(subscription.priceId(), planResolver.resolvePlan(subscription.priceId()), now);
        }
    }

    private boolean diverges(CustomerSubscription row, ProviderSubscription subscription) {
        return row.getStatus() != subscription.status()
                || row.isCancelAtPeriodEnd() != subscription.cancelAtPeriodEnd()
                || !Objects.equals(row.getCurrentPeriodStart(), subscription.currentPeriodStart())
                || !Objects.equals(row.getCurrentPeriodEnd(), subscription.currentPeriodEnd())
                || (subscription.priceId() != null && !subscription.priceId().equals(row.getStripePriceId()));
    }

    private CustomerSubscription newRow(SubscriptionMaterialization request, Instant now) {
        CustomerSubscription row = new CustomerSubscription();
        row.setStripeSubscriptionId(request.subscriptionId());
        row.setStripeCustomerId(request.customerId());
        row.setUserId(request.userId());
        row.setCreatedAt(now);
        return row;
    }
}
