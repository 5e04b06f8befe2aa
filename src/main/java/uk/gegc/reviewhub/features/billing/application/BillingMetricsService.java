package uk.gegc.reviewhub.features.billing.application;

/**
 * Service for emitting billing metrics and counters.
 * Provides structured metrics for observability and monitoring.
 */
public interface BillingMetricsService {

    /**
     * Increment webhook counters.
     */
    void incrementWebhookReceived(String eventType);
    void incrementWebhookOk(String eventType);
    void incrementWebhookDuplicate(String eventType);
    void incrementWebhookIgnored(String eventType);
    void incrementWebhookFailed(String eventType);

    /**
     * Record webhook latency metrics.
     */
    void recordWebhookLatency(String eventType, long latencyMs);

    /**
     * Subscription lifecycle counters.
     */
    void incrementSubscriptionMaterialized(String source);
    void incrementSubscriptionBlocked(String source);
    void incrementSubscriptionReplaced(int count);
    void incrementSubscriptionUpdateFailed(String eventType);

    /**
     * Correlation buffer counters.
     */
    void incrementCorrelationParked();
    void incrementCorrelationMatched();
    void recordCorrelationPurged(int purged);

    /**
     * Upstream cancellation counters.
     */
    void incrementUpstreamCancellation(String outcome);

    /**
     * Record reconciliation metrics.
     */
    void recordReconciliationDrift(String subscriptionId);
    void recordReconciliationFailure(String subscriptionId, String reason);
}
