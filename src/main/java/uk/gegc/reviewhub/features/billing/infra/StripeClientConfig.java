package uk.gegc.reviewhub.features.billing.infra;

import com.stripe.StripeClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.reviewhub.features.billing.application.StripeProperties;

/**
 * Builds the Stripe client used by {@code StripeService}. Without a secret key no client exists and
 * every Stripe call fails fast.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    @Bean
    @ConditionalOnProperty(name = "stripe.secret-key")
    public StripeClient stripeClient() {
        StripeProperties.Client client = stripe.getClient();
        log.info("Configuring Stripe client (connectTimeout={}ms, readTimeout={}ms, networkRetries={})",
                client.getConnectTimeoutMs(), client.getReadTimeoutMs(), client.getMaxNetworkRetries());
        return StripeClient.builder()
                .setApiKey(stripe.getSecretKey())
                .setConnectTimeout(client.getConnectTimeoutMs())
                .setReadTimeout(client.getReadTimeoutMs())
                // StripeService retries with its own backoff
                .setMaxNetworkRetries(client.getMaxNetworkRetries())
                .build();
    }
}
