package uk.gegc.reviewhub.features.billing.domain.exception;

/**
 * Thrown when a webhook request cannot be authenticated: missing secret, missing
 * {@code Stripe-Signature} header or a signature that does not match the payload.
 */
public class WebhookSignatureException extends RuntimeException {

    public WebhookSignatureException(String message) {
        super(message);
    }

    public WebhookSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
