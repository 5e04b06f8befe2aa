package uk.gegc.reviewhub.features.billing.api;

import com.stripe.exception.ApiConnectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.reviewhub.features.billing.application.StripeWebhookService;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;
import uk.gegc.reviewhub.features.billing.domain.exception.ProviderApiException;
import uk.gegc.reviewhub.features.billing.domain.exception.SubscriptionPersistenceException;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookPayloadException;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookSignatureException;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookValidationException;
import uk.gegc.reviewhub.shared.config.FeatureFlags;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("StripeWebhookController")
class StripeWebhookControllerTest {

    private static final String BODY = "{\"id\": \"evt_1\", \"type\": \"customer.subscription.updated\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StripeWebhookService webhookService;

    @MockitoBean
    private FeatureFlags featureFlags;

    private org.springframework.test.web.servlet.ResultActions postWebhook(String path) throws Exception {
        return mockMvc.perform(post(path)
                .with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .header("Stripe-Signature", "t=1,v1=abc")
                .content(BODY));
    }

    @Test
    @DisplayName("Processed event returns received=true")
    void ok() throws Exception {
        when(featureFlags.isBilling()).thenReturn(true);
        when(webhookService.process(any(), any())).thenReturn(WebhookProcessingResult.ok());

        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.status").doesNotExist());
    }

    @Test
    @DisplayName("Alias endpoint behaves the same")
    void alias() throws Exception {
        when(featureFlags.isBilling()).thenReturn(true);
        when(webhookService.process(any(), any())).thenReturn(WebhookProcessingResult.ignored());

        postWebhook("/api/v1/billing/webhooks")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));
    }

    @Test
    @DisplayName("Duplicate returns already_processed")
    void duplicate() throws Exception {
        when(featureFlags.isBilling()).thenReturn(true);
        when(webhookService.process(any(), any())).thenReturn(WebhookProcessingResult.duplicate());

        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("already_processed"))
                .andExpect(jsonPath("$.received").doesNotExist());
    }

    @Test
    @DisplayName("Blocked returns message and details")
    void blocked() throws Exception {
        when(featureFlags.isBilling()).thenReturn(true);
        when(webhookService.process(any(), any())).thenReturn(
                WebhookProcessingResult.blocked("Customer already has an active subscription", Map.of("activeCount", 1)));

        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("blocked"))
                .andExpect(jsonPath("$.message").value("Customer already has an active subscription"))
                .andExpect(jsonPath("$.details.activeCount").value(1));
    }

    @Test
    @DisplayName("Buffered half returns pending_correlation")
    void pendingCorrelation() throws Exception {
        when(featureFlags.isBilling()).thenReturn(true);
        when(webhookService.process(any(), any())).thenReturn(WebhookProcessingResult.pendingCorrelation());

        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.status").value("pending_correlation"));
    }

    @Test
    @DisplayName("Invalid signature returns 400 problem detail")
    void invalidSignature() throws Exception {
        when(featureFlags.isBilling()).thenReturn(true);
        when(webhookService.process(any(), any())).thenThrow(new WebhookSignatureException("Invalid Stripe signature"));

        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://reviewhub.app/docs/errors/stripe-webhook-invalid-signature"));
    }

    @Test
    @DisplayName("Malformed payload and validation failures return 400")
    void badPayload() throws Exception {
        when(featureFlags.isBilling()).thenReturn(true);
        when(webhookService.process(any(), any()))
                .thenThrow(new WebhookPayloadException("Malformed JSON payload"))
                .thenThrow(new WebhookValidationException("evt_1", "customer", "Missing customer"));

        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed Webhook Payload"));
        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("customer"));
    }

    @Test
    @DisplayName("Creation failures return 500 so Stripe redelivers")
    void creationFailures() throws Exception {
        when(featureFlags.isBilling()).thenReturn(true);
        when(webhookService.process(any(), any()))
                .thenThrow(new SubscriptionPersistenceException("sub_1", "Failed to persist subscription sub_1", null))
                .thenThrow(new ProviderApiException("retrieveSubscription", new ApiConnectionException("timeout")));

        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.subscriptionId").value("sub_1"));
        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("https://reviewhub.app/docs/errors/stripe-error"));
    }

    @Test
    @DisplayName("Billing disabled returns 404 without processing")
    void disabled() throws Exception {
        when(featureFlags.isBilling()).thenReturn(false);

        postWebhook("/api/v1/billing/stripe/webhook")
                .andExpect(status().isNotFound());
        verify(webhookService, never()).process(any(), any());
    }
}
