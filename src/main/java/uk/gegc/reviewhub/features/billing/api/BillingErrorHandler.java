package uk.gegc.reviewhub.features.billing.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.reviewhub.features.billing.domain.exception.ProviderApiException;
import uk.gegc.reviewhub.features.billing.domain.exception.SubscriptionPersistenceException;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookPayloadException;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookSignatureException;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookValidationException;
import uk.gegc.reviewhub.shared.api.problem.ErrorTypes;
import uk.gegc.reviewhub.shared.api.problem.ProblemDetailBuilder;

/**
 * Global error handler for billing API endpoints.
 * Maps domain exceptions to RFC 7807 Problem Detail responses.
 */
@Slf4j
@RestControllerAdvice(basePackages = "uk.gegc.reviewhub.features.billing.api")
public class BillingErrorHandler {

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidWebhookSignature(WebhookSignatureException ex, HttpServletRequest request) {
        log.warn("Invalid webhook signature: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.STRIPE_WEBHOOK_INVALID_SIGNATURE,
                "Stripe Webhook Invalid Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(WebhookPayloadException.class)
    public ResponseEntity<ProblemDetail> handleMalformedPayload(WebhookPayloadException ex, HttpServletRequest request) {
        log.warn("Malformed webhook payload: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_WEBHOOK_PAYLOAD,
                "Malformed Webhook Payload",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(WebhookValidationException.class)
    public ResponseEntity<ProblemDetail> handleWebhookValidation(WebhookValidationException ex, HttpServletRequest request) {
        log.warn("Webhook event {} rejected: {}", ex.getEventId(), ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.WEBHOOK_VALIDATION_FAILED,
                "Webhook Validation Failed",
                ex.getMessage(),
                request
        );
        problem.setProperty("eventId", ex.getEventId());
        problem.setProperty("field", ex.getField());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(SubscriptionPersistenceException.class)
    public ResponseEntity<ProblemDetail> handleSubscriptionPersistence(SubscriptionPersistenceException ex, HttpServletRequest request) {
        log.error("Subscription {} could not be persisted: {}", ex.getSubscriptionId(), ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.SUBSCRIPTION_PERSISTENCE_FAILED,
                "Subscription Persistence Failed",
                "Subscription could not be stored",
                request
        );
        problem.setProperty("subscriptionId", ex.getSubscriptionId());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(ProviderApiException.class)
    public ResponseEntity<ProblemDetail> handleProviderApi(ProviderApiException ex, HttpServletRequest request) {
        log.error("Stripe API error during {}: {}", ex.getOperation(), ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.STRIPE_ERROR,
                "Payment Provider Error",
                "Payment provider request failed",
                request
        );
        if (ex.getStripeCode() != null) {
            problem.setProperty("stripeCode", ex.getStripeCode());
        }
        if (ex.getRequestId() != null) {
            problem.setProperty("stripeRequestId", ex.getRequestId());
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Invalid request body: {}", ex.getMessage());
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.BILLING_INVALID_REQUEST_BODY,
                "Invalid Request Body",
                "Invalid request body",
                request
        );
        problem.setProperty("parseError", detail);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error in billing API: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.BILLING_INTERNAL_ERROR,
                "Internal Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}
