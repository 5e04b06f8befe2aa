package uk.gegc.reviewhub.features.billing.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Maps Stripe price ids to internal plan ids using {@code billing.plans}.
 */
@Component
@RequiredArgsConstructor
public class SubscriptionPlanResolver {

    private final BillingProperties billingProperties;

    public String resolvePlan(String priceId) {
        if (!StringUtils.hasText(priceId)) {
            return billingProperties.getDefaultPlan();
        }
        return billingProperties.getPlans().getOrDefault(priceId, billingProperties.getDefaultPlan());
    }
}
