package uk.gegc.reviewhub.features.billing.application;

/**
 * Repairs drift between the subscription store and Stripe that webhooks alone left behind:
 * superseded subscriptions Stripe still bills, and missed update events.
 */
public interface SubscriptionReconciliationService {

    /**
     * Runs one sweep over every matching row, read in batches. Failures on individual rows are counted
     * and never abort the sweep.
     */
    ReconciliationReport reconcile();

    /**
     * Outcome of a single sweep.
     */
    record ReconciliationReport(
            int supersededExamined,
            int upstreamCancellationsConfirmed,
            int activeExamined,
            int driftCorrected,
            int failures
    ) {
        public boolean hasDrift() {
            return driftCorrected > 0;
        }
    }
}
