package uk.gegc.reviewhub.features.billing.domain.exception;

/**
 * Thrown when a signed webhook body is not a well-formed Stripe event.
 */
public class WebhookPayloadException extends RuntimeException {

    public WebhookPayloadException(String message) {
        super(message);
    }

    public WebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
