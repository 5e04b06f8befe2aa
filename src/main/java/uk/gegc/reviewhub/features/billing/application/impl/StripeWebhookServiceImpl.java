package uk.gegc.reviewhub.features.billing.application.impl;

import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.reviewhub.features.billing.application.BillingMetricsService;
import uk.gegc.reviewhub.features.billing.application.StripeProperties;
import uk.gegc.reviewhub.features.billing.application.StripeWebhookService;
import uk.gegc.reviewhub.features.billing.application.WebhookEventLedger;
import uk.gegc.reviewhub.features.billing.application.WebhookLoggingContext;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEvent;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEventHandler;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEventKind;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookEventParser;
import uk.gegc.reviewhub.features.billing.application.webhook.WebhookProcessingResult;
import uk.gegc.reviewhub.features.billing.domain.exception.DuplicateWebhookEventException;
import uk.gegc.reviewhub.features.billing.domain.exception.WebhookSignatureException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class StripeWebhookServiceImpl implements StripeWebhookService {

    private final StripeProperties stripeProperties;
    private final WebhookEventParser eventParser;
    private final WebhookEventLedger eventLedger;
    private final BillingMetricsService metricsService;
    private final Map<WebhookEventKind, WebhookEventHandler> handlers;

    public StripeWebhookServiceImpl(StripeProperties stripeProperties,
                                    WebhookEventParser eventParser,
                                    WebhookEventLedger eventLedger,
                                    BillingMetricsService metricsService,
                                    List<WebhookEventHandler> handlers) {
        this.stripeProperties = stripeProperties;
        this.eventParser = eventParser;
        this.eventLedger = eventLedger;
        this.metricsService = metricsService;
        this.handlers = index(handlers);
    }

    @Override
    public WebhookProcessingResult process(String payload, String signatureHeader) {
        long startTime = System.currentTimeMillis();

        verifySignature(payload, signatureHeader);
        WebhookEvent event = eventParser.parse(payload);

        String eventId = event.eventId();
        String type = event.type();
        metricsService.incrementWebhookReceived(type);

        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .eventId(eventId)
                .eventType(type)
                .build();

        try {
            WebhookProcessingResult result = route(event, loggingContext);

            switch (result.result()) {
                case OK, BLOCKED, PENDING_CORRELATION -> metricsService.incrementWebhookOk(type);
                case DUPLICATE -> metricsService.incrementWebhookDuplicate(type);
                case IGNORED -> metricsService.incrementWebhookIgnored(type);
                case UNPROCESSED -> metricsService.incrementWebhookFailed(type);
            }
            metricsService.recordWebhookLatency(type, System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            metricsService.incrementWebhookFailed(type);
            loggingContext.logError(log, "Failed to process webhook event: id={} type={}", eventId, type, e);
            throw e; // controller answers 500/400 and Stripe redelivers
        } finally {
            WebhookLoggingContext.clearMDC();
        }
    }

    private WebhookProcessingResult route(WebhookEvent event, WebhookLoggingContext loggingContext) {
        WebhookEventHandler handler = handlers.get(event.kind());
        if (handler == null) {
            loggingContext.logInfo(log, "Ignoring Stripe event id={} type={} (not handled)", event.eventId(), event.type());
            return WebhookProcessingResult.ignored();
        }
        if (eventLedger.isProcessed(event.eventId())) {
            loggingContext.logInfo(log, "Event {} already processed", event.eventId());
            return WebhookProcessingResult.duplicate();
        }

        loggingContext.logInfo(log, "Processing Stripe webhook event: id={} type={}", event.eventId(), event.type());
        try {
            return handler.handle(event, loggingContext);
        } catch (DuplicateWebhookEventException e) {
            loggingContext.logInfo(log, "Event {} was recorded by a concurrent delivery", event.eventId());
            return WebhookProcessingResult.duplicate();
        }
    }

    private void verifySignature(String payload, String signatureHeader) {
        String webhookSecret = stripeProperties.getWebhookSecret();
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("Stripe webhook secret not configured; rejecting request");
            throw new WebhookSignatureException("Webhook secret not configured");
        }
        if (!StringUtils.hasText(signatureHeader)) {
            log.warn("Stripe webhook request without Stripe-Signature header");
            throw new WebhookSignatureException("Missing Stripe-Signature header");
        }
        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, webhookSecret,
                    stripeProperties.getWebhookToleranceSeconds());
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            throw new WebhookSignatureException("Invalid Stripe signature", e);
        }
    }

    private static Map<WebhookEventKind, WebhookEventHandler> index(List<WebhookEventHandler> handlers) {
        Map<WebhookEventKind, WebhookEventHandler> byKind = new EnumMap<>(WebhookEventKind.class);
        for (WebhookEventHandler handler : handlers) {
            for (WebhookEventKind kind : handler.supportedKinds()) {
                WebhookEventHandler previous = byKind.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException("Both " + previous.getClass().getSimpleName() + " and "
                            + handler.getClass().getSimpleName() + " handle " + kind);
                }
            }
        }
        return byKind;
    }
}
