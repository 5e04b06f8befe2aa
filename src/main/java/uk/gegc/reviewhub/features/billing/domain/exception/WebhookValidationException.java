package uk.gegc.reviewhub.features.billing.domain.exception;

import lombok.Getter;

/**
 * Thrown when an event is well-formed but lacks a field required to act on it.
 */
@Getter
public class WebhookValidationException extends RuntimeException {

    private final String eventId;
    private final String field;

    public WebhookValidationException(String eventId, String field, String message) {
        super(message);
        this.eventId = eventId;
        this.field = field;
    }
}
