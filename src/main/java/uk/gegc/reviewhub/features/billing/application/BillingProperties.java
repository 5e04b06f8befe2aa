package uk.gegc.reviewhub.features.billing.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subscription billing configuration: price to plan mapping, correlation buffer and reconciliation sweep.
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    /**
     * Stripe price id to internal plan id (e.g. {@code price_123 -> pro}).
     */
    private Map<String, String> plans = new LinkedHashMap<>();

    /**
     * Plan assigned when a price id is missing or not mapped.
     */
    @NotBlank
    private String defaultPlan = "starter";

    private Correlation correlation = new Correlation();

    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Correlation {
        /** How long a parked subscription-created half waits for its checkout session. */
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;

        /** Spring cron expression for the reconciliation sweep. */
        private String cron = "0 0 * * * *";

        /** Maximum rows examined per step of a single sweep. */
        @Positive
        private int batchSize = 100;
    }
}
