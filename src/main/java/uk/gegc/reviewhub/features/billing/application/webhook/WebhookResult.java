package uk.gegc.reviewhub.features.billing.application.webhook;

public enum WebhookResult {
    OK,
    DUPLICATE,
    IGNORED,
    BLOCKED,
    PENDING_CORRELATION,
    /** Acknowledged without recording the event; a redelivery or a later event settles it. */
    UNPROCESSED
}
