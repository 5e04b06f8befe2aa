package uk.gegc.reviewhub.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "WebhookAck", description = "Acknowledgement returned to Stripe for a webhook delivery")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAckResponse(
        @Schema(description = "Present when the event was accepted for processing")
        Boolean received,

        @Schema(description = "Settlement of the event when it was not simply applied",
                example = "already_processed")
        String status,

        @Schema(description = "Human-readable explanation")
        String message,

        @Schema(description = "Additional details, e.g. the subscriptions that blocked a purchase")
        Map<String, Object> details
) {

    public static WebhookAckResponse receivedAck() {
        return new WebhookAckResponse(true, null, null, null);
    }

    public static WebhookAckResponse receivedWithStatus(String status) {
        return new WebhookAckResponse(true, status, null, null);
    }

    public static WebhookAckResponse status(String status, String message, Map<String, Object> details) {
        return new WebhookAckResponse(null, status, message, details);
    }
}
