package uk.gegc.reviewhub.features.billing.domain.exception;

import lombok.Getter;

/**
 * Raised when another delivery of the same event was recorded first.
 * Callers translate it into a duplicate acknowledgement, never into an error response.
 */
@Getter
public class DuplicateWebhookEventException extends RuntimeException {

    private final String eventId;

    public DuplicateWebhookEventException(String eventId, Throwable cause) {
        super("Stripe event " + eventId + " was already processed", cause);
        this.eventId = eventId;
    }
}
