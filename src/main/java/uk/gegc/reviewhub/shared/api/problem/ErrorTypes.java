package uk.gegc.reviewhub.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://reviewhub.app/docs/errors";

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Webhook Errors ====================
    public static final URI STRIPE_WEBHOOK_INVALID_SIGNATURE = URI.create(BASE_URL + "/stripe-webhook-invalid-signature");
    public static final URI MALFORMED_WEBHOOK_PAYLOAD = URI.create(BASE_URL + "/malformed-webhook-payload");
    public static final URI WEBHOOK_VALIDATION_FAILED = URI.create(BASE_URL + "/webhook-validation-failed");

    // ==================== Billing Errors ====================
    public static final URI STRIPE_ERROR = URI.create(BASE_URL + "/stripe-error");
    public static final URI SUBSCRIPTION_PERSISTENCE_FAILED = URI.create(BASE_URL + "/subscription-persistence-failed");
    public static final URI BILLING_INVALID_REQUEST_BODY = URI.create(BASE_URL + "/billing-invalid-request-body");
    public static final URI BILLING_INTERNAL_ERROR = URI.create(BASE_URL + "/billing-internal-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
