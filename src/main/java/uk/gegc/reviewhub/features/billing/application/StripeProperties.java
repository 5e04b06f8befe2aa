package uk.gegc.reviewhub.features.billing.application;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Stripe configuration properties: keys, webhook verification, client timeouts and API retry policy.
 */
@Configuration
@ConfigurationProperties(prefix = "stripe")
@Validated
@Data
public class StripeProperties {
    /** Secret API key (server-side). */
    private String secretKey;

    /** Webhook signing secret for signature verification. */
    private String webhookSecret;

    /** Maximum age of a signed webhook timestamp, in seconds. */
    @Positive
    private long webhookToleranceSeconds = 300;

    private Client client = new Client();

    private Retry retry = new Retry();

    /**
     * HTTP settings of the Stripe client.
     */
    @Data
    public static class Client {
        @Positive
        private int connectTimeoutMs = 30_000;

        @Positive
        private int readTimeoutMs = 80_000;

        /** Retries inside the Stripe SDK, on top of the backoff in {@link Retry}. */
        @Min(0)
        private int maxNetworkRetries = 0;
    }

    /**
     * Exponential backoff for Stripe API calls. Only connection errors, rate limiting and 5xx
     * responses are retried.
     */
    @Data
    public static class Retry {
        /** Total attempts, including the first call. */
        @Positive
        private int maxAttempts = 3;

        /** Base delay in milliseconds for exponential backoff. */
        @Positive
        private long baseDelayMs = 200;

        /** Cap for a single backoff delay in milliseconds. */
        @Positive
        private long maxDelayMs = 5000;

        /** Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation). */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.25;
    }
}
