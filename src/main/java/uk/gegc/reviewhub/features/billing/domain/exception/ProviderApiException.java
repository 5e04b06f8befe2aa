package uk.gegc.reviewhub.features.billing.domain.exception;

import com.stripe.exception.StripeException;
import lombok.Getter;

/**
 * Wraps a failed Stripe API call after retries were exhausted or the error was not retryable.
 */
@Getter
public class ProviderApiException extends RuntimeException {

    private final String operation;
    private final Integer statusCode;
    private final String stripeCode;
    private final String requestId;

    public ProviderApiException(String operation, StripeException cause) {
        super("Stripe " + operation + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
        this.statusCode = cause.getStatusCode();
        this.stripeCode = cause.getCode();
        this.requestId = cause.getRequestId();
    }

    /**
     * For failures that never produced a Stripe response, such as a missing client or an interrupted retry.
     */
    public ProviderApiException(String operation, String message, Throwable cause) {
        super("Stripe " + operation + " failed: " + message, cause);
        this.operation = operation;
        this.statusCode = null;
        this.stripeCode = null;
        this.requestId = null;
    }

    public boolean isResourceMissing() {
        return (statusCode != null && statusCode == 404) || "resource_missing".equals(stripeCode);
    }
}
