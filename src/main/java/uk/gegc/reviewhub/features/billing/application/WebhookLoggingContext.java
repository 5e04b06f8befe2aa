package uk.gegc.reviewhub.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging context for webhook processing.
 * Provides consistent logging fields across all webhook handlers.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String eventId;
    private String eventType;
    private String sessionId;
    private String subscriptionId;
    private String customerId;
    private UUID userId;

    /**
     * Set MDC context for structured logging.
     */
    public void setMDC() {
        if (eventId != null) MDC.put("stripe_event_id", eventId);
        if (eventType != null) MDC.put("stripe_event_type", eventType);
        if (sessionId != null) MDC.put("stripe_session_id", sessionId);
        if (subscriptionId != null) MDC.put("stripe_subscription_id", subscriptionId);
        if (customerId != null) MDC.put("stripe_customer_id", customerId);
        if (userId != null) MDC.put("user_id", userId.toString());
    }

    /**
     * Clear MDC context.
     */
    public static void clearMDC() {
        MDC.remove("stripe_event_id");
        MDC.remove("stripe_event_type");
        MDC.remove("stripe_session_id");
        MDC.remove("stripe_subscription_id");
        MDC.remove("stripe_customer_id");
        MDC.remove("user_id");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
