package uk.gegc.reviewhub.features.billing.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.reviewhub.features.billing.api.dto.WebhookAckResponse;
import uk.gegc.reviewhub.features.billing.application.StripeWebhookService;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;
import uk.gegc.reviewhub.shared.config.FeatureFlags;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Tag(name = "Stripe Webhooks", description = "Internal endpoints for Stripe subscription events (not for public use)")
public class StripeWebhookController {

    private final StripeWebhookService webhookService;
    private final FeatureFlags featureFlags;

    @Operation(
            summary = "Handle Stripe webhook",
            description = "Internal endpoint for Stripe to send subscription lifecycle events. Validates the signature and reconciles the subscription store."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event processed, ignored, deduplicated, blocked or buffered",
                    content = @Content(schema = @Schema(implementation = WebhookAckResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid signature or payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Billing feature disabled"),
            @ApiResponse(responseCode = "500", description = "Subscription could not be created; Stripe will redeliver",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden
    @PostMapping("/stripe/webhook")
    public ResponseEntity<WebhookAckResponse> handleStripeWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(description = "Stripe signature header for verification") @RequestHeader(name = "Stripe-Signature", required = false) String sigHeader
    ) {
        return handleWebhook(payload, sigHeader);
    }

    @Operation(
            summary = "Handle Stripe webhook (alternative endpoint)",
            description = "Alias of /stripe/webhook."
    )
    @Hidden
    @PostMapping("/webhooks")
    public ResponseEntity<WebhookAckResponse> handleWebhooks(
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(description = "Stripe signature header for verification") @RequestHeader(name = "Stripe-Signature", required = false) String sigHeader
    ) {
        return handleWebhook(payload, sigHeader);
    }

    private ResponseEntity<WebhookAckResponse> handleWebhook(String payload, String sigHeader) {
        if (!featureFlags.isBilling()) {
            log.warn("Billing feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }

        WebhookProcessingResult res = webhookService.process(payload, sigHeader);
        return ResponseEntity.ok(switch (res.result()) {
            case OK, IGNORED -> WebhookAckResponse.receivedAck();
            case DUPLICATE -> WebhookAckResponse.status("already_processed", null, null);
            case BLOCKED -> WebhookAckResponse.status("blocked", res.message(), res.details());
            case PENDING_CORRELATION -> WebhookAckResponse.receivedWithStatus("pending_correlation");
            case UNPROCESSED -> WebhookAckResponse.receivedWithStatus("unprocessed");
        });
    }
}
