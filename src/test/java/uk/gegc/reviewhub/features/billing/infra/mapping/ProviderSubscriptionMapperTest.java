package uk.gegc.reviewhub.features.billing.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.model.Price;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import com.stripe.model.SubscriptionItemCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.reviewhub.features.billing.application.ProviderSubscription;
import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProviderSubscriptionMapper")
class ProviderSubscriptionMapperTest {

    private final ProviderSubscriptionMapper mapper = new ProviderSubscriptionMapper();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("reads a webhook subscription object")
    void fromPayload() throws Exception {
        UUID userId = UUID.randomUUID();
        JsonNode object = objectMapper.readTree("""
                {"id": "sub_1", "customer": "cus_1", "status": "past_due", "cancel_at_period_end": true,
                 "current_period_start": 1700000000, "current_period_end": 1702592000,
                 "metadata": {"userId": "%s"},
                 "items": {"data": [{"price": {"id": "price_pro"}}]}}
                """.formatted(userId));

        ProviderSubscription subscription = mapper.fromPayload(object);

        assertThat(subscription.id()).isEqualTo("sub_1");
        assertThat(subscription.customerId()).isEqualTo("cus_1");
        assertThat(subscription.status()).isEqualTo(SubscriptionLifecycleStatus.PAST_DUE);
        assertThat(subscription.cancelAtPeriodEnd()).isTrue();
        assertThat(subscription.currentPeriodStart()).isEqualTo(Instant.ofEpochSecond(1700000000L));
        assertThat(subscription.currentPeriodEnd()).isEqualTo(Instant.ofEpochSecond(1702592000L));
        assertThat(subscription.priceId()).isEqualTo("price_pro");
        assertThat(subscription.metadataUserId()).isEqualTo(userId);
    }

    @Test
    @DisplayName("falls back to item-level period bounds")
    void periodFromItems() throws Exception {
        JsonNode object = objectMapper.readTree("""
                {"id": "sub_1", "customer": "cus_1", "status": "active",
                 "items": {"data": [{"price": "price_pro",
                                     "current_period_start": 1700000000, "current_period_end": 1702592000}]}}
                """);

        ProviderSubscription subscription = mapper.fromPayload(object);

        assertThat(subscription.currentPeriodEnd()).isEqualTo(Instant.ofEpochSecond(1702592000L));
        assertThat(subscription.priceId()).isEqualTo("price_pro");
        assertThat(subscription.metadataUserId()).isNull();
    }

    @Test
    @DisplayName("rejects an unknown status")
    void unknownStatus() throws Exception {
        JsonNode object = objectMapper.readTree("""
                {"id": "sub_1", "customer": "cus_1", "status": "exploded"}
                """);

        assertThatThrownBy(() -> mapper.fromPayload(object)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("reads the Stripe SDK model")
    void fromStripe() {
        Price price = new Price();
        price.setId("price_starter");
        SubscriptionItem item = new SubscriptionItem();
        item.setPrice(price);
        SubscriptionItemCollection items = new SubscriptionItemCollection();
        items.setData(List.of(item));

        Subscription stripeSubscription = new Subscription();
        stripeSubscription.setId("sub_1");
        stripeSubscription.setCustomer("cus_1");
        stripeSubscription.setStatus("active");
        stripeSubscription.setCancelAtPeriodEnd(false);
        stripeSubscription.setCurrentPeriodStart(1700000000L);
        stripeSubscription.setCurrentPeriodEnd(1702592000L);
        stripeSubscription.setItems(items);
        stripeSubscription.setMetadata(Map.of("userId", "not-a-uuid"));

        ProviderSubscription subscription = mapper.fromStripe(stripeSubscription);

        assertThat(subscription.isActiveAndRenewing()).isTrue();
        assertThat(subscription.priceId()).isEqualTo("price_starter");
        assertThat(subscription.currentPeriodStart()).isEqualTo(Instant.ofEpochSecond(1700000000L));
        assertThat(subscription.metadataUserId()).isNull();
    }
}
