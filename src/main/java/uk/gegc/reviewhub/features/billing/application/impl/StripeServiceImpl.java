package uk.gegc.reviewhub.features.billing.application.impl;

import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.Subscription;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.application.StripeProperties;
import uk.gegc.reviewhub.features.billing.application.StripeService;
import uk.gegc.reviewhub.features.billing.domain.exception.ProviderApiException;
import uk.gegc.reviewhub.features.billing.infra.mapping.ProviderSubscriptionMapper;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@Service
@RequiredArgsConstructor
public class StripeServiceImpl implements StripeService {

    private static final Logger log = LoggerFactory.getLogger(StripeServiceImpl.class);

    private final StripeProperties stripeProperties;
    private final ProviderSubscriptionMapper subscriptionMapper;
    @Autowired(required = false)
    private StripeClient stripeClient;

    @Override
    public ProviderSubscription retrieveSubscription(String subscriptionId) {
        if (!StringUtils.hasText(subscriptionId)) {
            throw new IllegalArgumentException("Subscription ID must be provided");
        }

        Subscription subscription = withRetry("retrieveSubscription",
                client -> client.subscriptions().retrieve(subscriptionId));
        return subscriptionMapper.fromStripe(subscription);
    }

    @Override
    public ProviderSubscription cancelSubscription(String subscriptionId) {
        if (!StringUtils.hasText(subscriptionId)) {
            throw new IllegalArgumentException("Subscription ID must be provided");
        }

        Subscription cancelled = withRetry("cancelSubscription",
                client -> client.subscriptions().cancel(subscriptionId));

        log.info("Cancelled Stripe subscription id={} status={}", subscriptionId, cancelled.getStatus());
        return subscriptionMapper.fromStripe(cancelled);
    }

    @Override
    public Map<String, String> retrieveCustomerMetadata(String customerId) {
        if (!StringUtils.hasText(customerId)) {
            throw new IllegalArgumentException("Customer ID must be provided");
        }

        Customer customer = withRetry("retrieveCustomer",
                client -> client.customers().retrieve(customerId));
        return customer.getMetadata() != null ? customer.getMetadata() : Map.of();
    }

    private <T> T withRetry(String operation, StripeCall<T> call) {
        if (stripeClient == null) {
            throw new ProviderApiException(operation, "Stripe secret key is not configured", null);
        }
        StripeProperties.Retry retry = stripeProperties.getRetry();
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return call.execute(stripeClient);
            } catch (StripeException e) {
                if (!isRetryable(e) || attempt >= maxAttempts) {
                    log.error("Stripe {} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw new ProviderApiException(operation, e);
                }
                long delay = backoffDelay(attempt, retry);
                log.warn("Stripe {} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                sleepBackoff(operation, delay, e);
            }
        }
    }

    static boolean isRetryable(StripeException e) {
        if (e instanceof ApiConnectionException || e instanceof RateLimitException) {
            return true;
        }
        Integer status = e.getStatusCode();
        return status != null && (status == 429 || status >= 500);
    }

    static long backoffDelay(int attempt, StripeProperties.Retry retry) {
        double exponential = retry.getBaseDelayMs() * Math.pow(2, attempt - 1);
        double capped = Math.min(exponential, retry.getMaxDelayMs());
        double jitter = capped * retry.getJitterFactor() * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        return Math.max(0L, Math.round(capped + jitter));
    }

    private void sleepBackoff(String operation, long delayMs, StripeException lastFailure) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Stripe {} retry interrupted; giving up", operation);
            ProviderApiException failure = new ProviderApiException(operation, "interrupted while waiting to retry", lastFailure);
            failure.addSuppressed(e);
            throw failure;
        }
    }

    @FunctionalInterface
    private interface StripeCall<T> {
        T execute(StripeClient client) throws StripeException;
    }
}
