package uk.gegc.reviewhub.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;

import java.util.concurrent.TimeUnit;

/**
 * Implementation of billing metrics service.
 * Emits structured metrics for observability and monitoring using Micrometer.
 */
@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter webhookReceivedCounter;
    private final Counter webhookOkCounter;
    private final Counter webhookDuplicateCounter;
    private final Counter webhookIgnoredCounter;
    private final Counter webhookFailedCounter;
    private final Counter subscriptionMaterializedCounter;
    private final Counter subscriptionBlockedCounter;
    private final Counter subscriptionReplacedCounter;
    private final Counter subscriptionUpdateFailedCounter;
    private final Counter correlationParkedCounter;
    private final Counter correlationMatchedCounter;
    private final Counter correlationPurgedCounter;
    private final Counter reconciliationDriftCounter;
    private final Counter reconciliationFailureCounter;

    private final Timer webhookLatencyTimer;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.webhookReceivedCounter = Counter.builder("stripe.webhooks.received")
                .description("Number of Stripe webhooks received")
                .register(meterRegistry);
        this.webhookOkCounter = Counter.builder("stripe.webhooks.ok")
                .description("Number of successful Stripe webhook processing")
                .register(meterRegistry);
        this.webhookDuplicateCounter = Counter.builder("stripe.webhooks.duplicate")
                .description("Number of duplicate Stripe webhooks")
                .register(meterRegistry);
        this.webhookIgnoredCounter = Counter.builder("stripe.webhooks.ignored")
                .description("Number of Stripe webhooks with no handler")
                .register(meterRegistry);
        this.webhookFailedCounter = Counter.builder("stripe.webhooks.failed")
                .description("Number of failed Stripe webhook processing")
                .register(meterRegistry);
        this.subscriptionMaterializedCounter = Counter.builder("billing.subscriptions.materialized")
                .description("Number of subscription rows created or confirmed")
                .register(meterRegistry);
        this.subscriptionBlockedCounter = Counter.builder("billing.subscriptions.blocked")
                .description("Number of duplicate subscriptions blocked")
                .register(meterRegistry);
        this.subscriptionReplacedCounter = Counter.builder("billing.subscriptions.replaced")
                .description("Number of subscription rows superseded by a newer subscription")
                .register(meterRegistry);
        this.subscriptionUpdateFailedCounter = Counter.builder("billing.subscriptions.update_failed")
                .description("Number of subscription updates left unprocessed after a persistence failure")
                .register(meterRegistry);
        this.correlationParkedCounter = Counter.builder("billing.correlation.parked")
                .description("Number of subscription-created events parked until their checkout session arrives")
                .register(meterRegistry);
        this.correlationMatchedCounter = Counter.builder("billing.correlation.matched")
                .description("Number of parked subscriptions matched by a checkout session")
                .register(meterRegistry);
        this.correlationPurgedCounter = Counter.builder("billing.correlation.purged")
                .description("Number of expired correlation entries purged")
                .register(meterRegistry);
        this.reconciliationDriftCounter = Counter.builder("billing.reconciliation.drift")
                .description("Number of subscription rows corrected from Stripe")
                .register(meterRegistry);
        this.reconciliationFailureCounter = Counter.builder("billing.reconciliation.failure")
                .description("Number of failed reconciliations")
                .register(meterRegistry);

        this.webhookLatencyTimer = Timer.builder("stripe.webhooks.latency")
                .description("Stripe webhook processing latency")
                .register(meterRegistry);
    }

    @Override
    public void incrementWebhookReceived(String eventType) {
        log.info("METRIC: stripe.webhooks.received eventType={}", eventType);
        webhookReceivedCounter.increment();
    }

    @Override
    public void incrementWebhookOk(String eventType) {
        log.info("METRIC: stripe.webhooks.ok eventType={}", eventType);
        webhookOkCounter.increment();
    }

    @Override
    public void incrementWebhookDuplicate(String eventType) {
        log.info("METRIC: stripe.webhooks.duplicate eventType={}", eventType);
        webhookDuplicateCounter.increment();
    }

    @Override
    public void incrementWebhookIgnored(String eventType) {
        log.debug("METRIC: stripe.webhooks.ignored eventType={}", eventType);
        webhookIgnoredCounter.increment();
    }

    @Override
    public void incrementWebhookFailed(String eventType) {
        log.warn("METRIC: stripe.webhooks.failed eventType={}", eventType);
        webhookFailedCounter.increment();
    }

    @Override
    public void recordWebhookLatency(String eventType, long latencyMs) {
        log.debug("METRIC: stripe.webhooks.latency eventType={} latencyMs={}", eventType, latencyMs);
        webhookLatencyTimer.record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementSubscriptionMaterialized(String source) {
        log.info("METRIC: billing.subscriptions.materialized source={}", source);
        subscriptionMaterializedCounter.increment();
    }

    @Override
    public void incrementSubscriptionBlocked(String source) {
        log.info("METRIC: billing.subscriptions.blocked source={}", source);
        subscriptionBlockedCounter.increment();
    }

    @Override
    public void incrementSubscriptionReplaced(int count) {
        if (count <= 0) {
            return;
        }
        log.info("METRIC: billing.subscriptions.replaced count={}", count);
        subscriptionReplacedCounter.increment(count);
    }

    @Override
    public void incrementSubscriptionUpdateFailed(String eventType) {
        log.warn("METRIC: billing.subscriptions.update_failed eventType={}", eventType);
        subscriptionUpdateFailedCounter.increment();
    }

    @Override
    public void incrementCorrelationParked() {
        log.info("METRIC: billing.correlation.parked");
        correlationParkedCounter.increment();
    }

    @Override
    public void incrementCorrelationMatched() {
        log.info("METRIC: billing.correlation.matched");
        correlationMatchedCounter.increment();
    }

    @Override
    public void recordCorrelationPurged(int purged) {
        if (purged <= 0) {
            return;
        }
        log.info("METRIC: billing.correlation.purged count={}", purged);
        correlationPurgedCounter.increment(purged);
    }

    @Override
    public void incrementUpstreamCancellation(String outcome) {
        log.info("METRIC: billing.subscriptions.upstream_cancellation outcome={}", outcome);
        meterRegistry.counter("billing.subscriptions.upstream_cancellation", "outcome", outcome).increment();
    }

    @Override
    public void recordReconciliationDrift(String subscriptionId) {
        log.info("METRIC: billing.reconciliation.drift subscriptionId={}", subscriptionId);
        reconciliationDriftCounter.increment();
    }

    @Override
    public void recordReconciliationFailure(String subscriptionId, String reason) {
        log.warn("METRIC: billing.reconciliation.failure subscriptionId={} reason={}", subscriptionId, reason);
        reconciliationFailureCounter.increment();
    }
}
