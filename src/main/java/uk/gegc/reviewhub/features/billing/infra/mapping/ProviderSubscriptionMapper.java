package uk.gegc.reviewhub.features.billing.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.stripe.model.Price;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import org.springframework.stereotype.Component;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Builds {@link ProviderSubscription} from either the Stripe SDK model or a raw webhook {@code data.object}.
 */
@Component
public class ProviderSubscriptionMapper {

    public ProviderSubscription fromStripe(Subscription subscription) {
        SubscriptionItem firstItem = subscription.getItems() != null
                && subscription.getItems().getData() != null
                && !subscription.getItems().getData().isEmpty()
                ? subscription.getItems().getData().get(0)
                : null;
        Price price = firstItem != null ? firstItem.getPrice() : null;

        return new ProviderSubscription(
                subscription.getId(),
                subscription.getCustomer(),
                toStatus(subscription.getStatus()),
                Boolean.TRUE.equals(subscription.getCancelAtPeriodEnd()),
                toInstant(subscription.getCurrentPeriodStart()),
                toInstant(subscription.getCurrentPeriodEnd()),
                price != null ? price.getId() : null,
                subscription.getMetadata()
        );
    }

    /**
     * Reads a subscription object as delivered in {@code customer.subscription.*} events.
     * Period bounds fall back to the first item for API versions that moved them there.
     */
    public ProviderSubscription fromPayload(JsonNode object) {
        JsonNode firstItem = object.path("items").path("data").path(0);

        Instant periodStart = epochSeconds(object.path("current_period_start"));
        if (periodStart == null) {
            periodStart = epochSeconds(firstItem.path("current_period_start"));
        }
        Instant periodEnd = epochSeconds(object.path("current_period_end"));
        if (periodEnd == null) {
            periodEnd = epochSeconds(firstItem.path("current_period_end"));
        }

        return new ProviderSubscription(
                text(object.path("id")),
                text(object.path("customer")),
                toStatus(text(object.path("status"))),
                object.path("cancel_at_period_end").asBoolean(false),
                periodStart,
                periodEnd,
                text(firstItem.path("price")),
                metadata(object.path("metadata"))
        );
    }

    private SubscriptionLifecycleStatus toStatus(String status) {
        return SubscriptionLifecycleStatus.fromValue(status)
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscription status: " + status));
    }

    private static Instant toInstant(Long epochSeconds) {
        return epochSeconds == null ? null : Instant.ofEpochSecond(epochSeconds);
    }

    private static Instant epochSeconds(JsonNode node) {
        return node.isNumber() ? Instant.ofEpochSecond(node.asLong()) : null;
    }

    private static String text(JsonNode node) {
        if (node.isObject()) {
            node = node.path("id");
        }
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static Map<String, String> metadata(JsonNode node) {
        Map<String, String> metadata = new HashMap<>();
        if (!node.isObject()) {
            return metadata;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                metadata.put(field.getKey(), field.getValue().asText());
            }
        }
        return metadata;
    }
}
