package uk.gegc.reviewhub.features.billing.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import uk.gegc.reviewhub.features.billing.application.StripeService;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;
import uk.gegc.reviewhub.features.billing.domain.model.ProcessedWebhookEvent;
import uk.gegc.reviewhub.features.billing.domain.model.ReplacementReason;
import uk.gegc.reviewhub.features.billing.domain.model.SubscriptionLifecycleStatus;
import uk.gegc.reviewhub.features.billing.infra.repository.CustomerSubscriptionLockRepository;
import uk.gegc.reviewhub.features.billing.infra.repository.CustomerSubscriptionRepository;
import uk.gegc.reviewhub.features.billing.infra.repository.PendingSubscriptionCorrelationRepository;
import uk.gegc.reviewhub.features.billing.infra.repository.ProcessedWebhookEventRepository;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static uk.gegc.reviewhub.features.billing.testutils.StripeWebhookTestUtils.TEST_WEBHOOK_SECRET;
import static uk.gegc.reviewhub.features.billing.testutils.StripeWebhookTestUtils.checkoutSessionCompleted;
import static uk.gegc.reviewhub.features.billing.testutils.StripeWebhookTestUtils.providerSubscription;
import static uk.gegc.reviewhub.features.billing.testutils.StripeWebhookTestUtils.sign;
import static uk.gegc.reviewhub.features.billing.testutils.StripeWebhookTestUtils.subscriptionEvent;
import static uk.gegc.reviewhub.features.billing.testutils.StripeWebhookTestUtils.subscriptionRow;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Subscription lifecycle over the webhook endpoint")
class SubscriptionLifecycleIntegrationTest {

    private static final String WEBHOOK = "/api/v1/billing/stripe/webhook";
    private static final String CUSTOMER = "cus_lifecycle";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CustomerSubscriptionRepository subscriptionRepository;

    @Autowired
    private ProcessedWebhookEventRepository processedWebhookEventRepository;

    @Autowired
    private PendingSubscriptionCorrelationRepository correlationRepository;

    @Autowired
    private CustomerSubscriptionLockRepository lockRepository;

    @MockitoBean
    private StripeService stripeService;

    private final UUID userId = UUID.randomUUID();
    private Instant periodStart;
    private Instant periodEnd;

    @BeforeEach
    void setUp() {
        subscriptionRepository.deleteAll();
        processedWebhookEventRepository.deleteAll();
        correlationRepository.deleteAll();
        lockRepository.deleteAll();

        periodStart = Instant.now().truncatedTo(ChronoUnit.SECONDS).minus(Duration.ofDays(1));
        periodEnd = periodStart.plus(Duration.ofDays(30));
    }

    private ResultActions deliver(String payload) throws Exception {
        return mockMvc.perform(post(WEBHOOK)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Stripe-Signature", sign(payload, TEST_WEBHOOK_SECRET))
                .content(payload));
    }

    private void stubActive(String subscriptionId, boolean cancelAtPeriodEnd) {
        stub(subscriptionId, SubscriptionLifecycleStatus.ACTIVE, cancelAtPeriodEnd, "price_starter");
    }

    private void stub(String subscriptionId, SubscriptionLifecycleStatus status, boolean cancelAtPeriodEnd, String priceId) {
        when(stripeService.retrieveSubscription(subscriptionId)).thenReturn(providerSubscription(
                subscriptionId, CUSTOMER, status, cancelAtPeriodEnd, periodStart, periodEnd, priceId));
    }

    private CustomerSubscription row(String subscriptionId) {
        return subscriptionRepository.findByStripeSubscriptionId(subscriptionId).orElseThrow();
    }

    private String ledgerMetadata(String eventId) {
        return processedWebhookEventRepository.findById(eventId)
                .map(ProcessedWebhookEvent::getMetadata)
                .orElseThrow();
    }

    @Test
    @DisplayName("completed checkout creates an active subscription with a resolved plan")
    void freshPurchase() throws Exception {
        stubActive("sub_1", false);

        deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        CustomerSubscription created = row("sub_1");
        assertThat(created.getUserId()).isEqualTo(userId);
        assertThat(created.getStatus()).isEqualTo(SubscriptionLifecycleStatus.ACTIVE);
        assertThat(created.getPlanId()).isEqualTo("starter");
        assertThat(created.getCurrentPeriodEnd()).isEqualTo(periodEnd);
        assertThat(created.getActiveSlot()).isEqualTo(CUSTOMER);
        assertThat(processedWebhookEventRepository.existsByEventId("evt_session_1")).isTrue();
    }

    @Test
    @DisplayName("redelivered event is acknowledged as already processed")
    void duplicateDelivery() throws Exception {
        stubActive("sub_1", false);
        String payload = checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1");

        deliver(payload).andExpect(status().isOk());
        deliver(payload)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("already_processed"));

        assertThat(subscriptionRepository.count()).isEqualTo(1);
        assertThat(processedWebhookEventRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("second purchase while a renewing subscription is active is blocked and cancelled at Stripe")
    void blockedPurchase() throws Exception {
        stubActive("sub_1", false);
        stubActive("sub_2", false);
        deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                .andExpect(status().isOk());

        deliver(checkoutSessionCompleted("evt_session_2", "cs_2", userId, CUSTOMER, "sub_2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("blocked"))
                .andExpect(jsonPath("$.message").value("Customer already has an active subscription"))
                .andExpect(jsonPath("$.details.activeCount").value(1))
                .andExpect(jsonPath("$.details.subscriptions[0].stripeSubscriptionId").value("sub_1"));

        assertThat(subscriptionRepository.findByStripeSubscriptionId("sub_2")).isEmpty();
        assertThat(row("sub_1").isSuperseded()).isFalse();
        assertThat(ledgerMetadata("evt_session_2")).contains("blocked_duplicate");
        verify(stripeService).cancelSubscription("sub_2");
        verify(stripeService, never()).cancelSubscription("sub_1");
    }

    @Test
    @DisplayName("purchase over a subscription set to lapse supersedes it and records the upstream cancellation")
    void replacement() throws Exception {
        CustomerSubscription lapsing = subscriptionRow("sub_old", CUSTOMER, userId,
                SubscriptionLifecycleStatus.ACTIVE, true, periodEnd, Instant.now());
        subscriptionRepository.saveAndFlush(lapsing);
        stubActive("sub_old", true);
        stubActive("sub_new", false);

        deliver(checkoutSessionCompleted("evt_session_new", "cs_new", userId, CUSTOMER, "sub_new"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        CustomerSubscription old = row("sub_old");
        assertThat(old.getSupersededBy()).isEqualTo("sub_new");
        assertThat(old.getReplacementReason()).isEqualTo(ReplacementReason.CHECKOUT_SESSION_REPLACEMENT);
        assertThat(old.getUpstreamCancelledAt()).isNotNull();
        assertThat(row("sub_new").getActiveSlot()).isEqualTo(CUSTOMER);
        assertThat(ledgerMetadata("evt_session_new")).contains("sub_old");
        // already set to lapse at Stripe, nothing to cancel
        verify(stripeService, never()).cancelSubscription(any());
    }

    @Test
    @DisplayName("blocked purchase still in trial is cancelled at Stripe")
    void blockedTrialingPurchase() throws Exception {
        stubActive("sub_1", false);
        stub("sub_2", SubscriptionLifecycleStatus.TRIALING, false, "price_starter");
        deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                .andExpect(status().isOk());

        deliver(checkoutSessionCompleted("evt_session_2", "cs_2", userId, CUSTOMER, "sub_2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("blocked"));

        assertThat(subscriptionRepository.findByStripeSubscriptionId("sub_2")).isEmpty();
        verify(stripeService).cancelSubscription("sub_2");
    }

    @Test
    @DisplayName("cancelling at period end then buying again replaces the lapsing subscription")
    void replacementAfterCancelAtPeriodEnd() throws Exception {
        stubActive("sub_1", false);
        stubActive("sub_2", false);
        deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                .andExpect(status().isOk());
        deliver(subscriptionEvent("evt_updated_1", "customer.subscription.updated", "sub_1", CUSTOMER,
                "active", true, periodStart, periodEnd, "price_starter", userId))
                .andExpect(status().isOk());
        stubActive("sub_1", true);

        deliver(checkoutSessionCompleted("evt_session_2", "cs_2", userId, CUSTOMER, "sub_2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        CustomerSubscription old = row("sub_1");
        assertThat(old.getSupersededBy()).isEqualTo("sub_2");
        assertThat(old.getReplacementReason()).isEqualTo(ReplacementReason.CHECKOUT_SESSION_REPLACEMENT);
        assertThat(old.getUpstreamCancelledAt()).isNotNull();
        assertThat(old.getActiveSlot()).isNull();
        assertThat(row("sub_2").getActiveSlot()).isEqualTo(CUSTOMER);
        verify(stripeService, never()).cancelSubscription(any());
    }

    @Test
    @DisplayName("concurrent purchases for one customer leave a single subscription")
    void concurrentPurchases() throws Exception {
        int purchases = 4;
        when(stripeService.retrieveSubscription(anyString())).thenAnswer(invocation -> providerSubscription(
                invocation.getArgument(0), CUSTOMER, SubscriptionLifecycleStatus.ACTIVE, false,
                periodStart, periodEnd, "price_starter"));

        ExecutorService executor = Executors.newFixedThreadPool(purchases);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MvcResult>> deliveries = new ArrayList<>();
        try {
            for (int i = 0; i < purchases; i++) {
                String payload = checkoutSessionCompleted("evt_race_" + i, "cs_race_" + i, userId, CUSTOMER, "sub_race_" + i);
                deliveries.add(executor.submit(() -> {
                    start.await();
                    return deliver(payload).andReturn();
                }));
            }
            start.countDown();

            int written = 0;
            int rejected = 0;
            for (Future<MvcResult> delivery : deliveries) {
                MvcResult result = delivery.get(30, TimeUnit.SECONDS);
                int httpStatus = result.getResponse().getStatus();
                String body = result.getResponse().getContentAsString();
                if (httpStatus == 200 && body.contains("\"received\":true")) {
                    written++;
                } else {
                    assertThat(httpStatus == 500 || body.contains("\"blocked\"")).as(body).isTrue();
                    rejected++;
                }
            }
            assertThat(written).isEqualTo(1);
            assertThat(rejected).isEqualTo(purchases - 1);
        } finally {
            executor.shutdownNow();
        }

        List<CustomerSubscription> rows = subscriptionRepository.findByStripeCustomerId(CUSTOMER);
        assertThat(rows).hasSize(1);
        assertThat(rows).filteredOn(s -> s.getActiveSlot() != null).hasSize(1);
    }

    @Nested
    @DisplayName("delivery order")
    class DeliveryOrder {

        @Test
        @DisplayName("subscription.created after the session confirms the existing row")
        void sessionFirst() throws Exception {
            stubActive("sub_1", false);
            deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                    .andExpect(status().isOk());

            deliver(subscriptionEvent("evt_created_1", "customer.subscription.created", "sub_1", CUSTOMER,
                    "active", false, periodStart, periodEnd, "price_pro", userId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.received").value(true));

            assertThat(subscriptionRepository.count()).isEqualTo(1);
            assertThat(row("sub_1").getPlanId()).isEqualTo("starter");
            assertThat(ledgerMetadata("evt_created_1")).contains("matched");
        }

        @Test
        @DisplayName("a trialing subscription ends in the same state whichever event arrives first")
        void bothOrdersAgree() throws Exception {
            stub("sub_1", SubscriptionLifecycleStatus.TRIALING, false, "price_pro");
            String session = checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1");
            String created = subscriptionEvent("evt_created_1", "customer.subscription.created", "sub_1", CUSTOMER,
                    "trialing", false, periodStart, periodEnd, "price_pro", userId);

            deliver(session).andExpect(status().isOk());
            deliver(created).andExpect(status().isOk());
            CustomerSubscription sessionFirst = row("sub_1");

            subscriptionRepository.deleteAll();
            processedWebhookEventRepository.deleteAll();
            lockRepository.deleteAll();
            deliver(created).andExpect(status().isOk());
            deliver(session).andExpect(status().isOk());
            CustomerSubscription createdFirst = row("sub_1");

            assertThat(createdFirst.getStatus()).isEqualTo(sessionFirst.getStatus())
                    .isEqualTo(SubscriptionLifecycleStatus.ACTIVE);
            assertThat(createdFirst.isCancelAtPeriodEnd()).isEqualTo(sessionFirst.isCancelAtPeriodEnd());
            assertThat(createdFirst.getCurrentPeriodStart()).isEqualTo(sessionFirst.getCurrentPeriodStart());
            assertThat(createdFirst.getCurrentPeriodEnd()).isEqualTo(sessionFirst.getCurrentPeriodEnd());
            assertThat(createdFirst.getPlanId()).isEqualTo(sessionFirst.getPlanId()).isEqualTo("pro");
            assertThat(createdFirst.getActiveSlot()).isEqualTo(sessionFirst.getActiveSlot()).isEqualTo(CUSTOMER);
        }

        @Test
        @DisplayName("a late subscription.created does not undo a cancellation already applied")
        void lateCreatedKeepsNewerState() throws Exception {
            stubActive("sub_1", false);
            deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                    .andExpect(status().isOk());
            deliver(subscriptionEvent("evt_updated_1", "customer.subscription.updated", "sub_1", CUSTOMER,
                    "active", true, periodStart, periodEnd, "price_starter", userId))
                    .andExpect(status().isOk());

            deliver(subscriptionEvent("evt_created_1", "customer.subscription.created", "sub_1", CUSTOMER,
                    "active", false, periodStart, periodEnd, "price_starter", userId))
                    .andExpect(status().isOk());

            CustomerSubscription current = row("sub_1");
            assertThat(current.isCancelAtPeriodEnd()).isTrue();
            assertThat(current.getActiveSlot()).isNull();
        }

        @Test
        @DisplayName("subscription.created without a user is buffered until the session arrives")
        void subscriptionFirst() throws Exception {
            when(stripeService.retrieveCustomerMetadata(CUSTOMER)).thenReturn(Map.of());
            stubActive("sub_1", false);

            deliver(subscriptionEvent("evt_created_1", "customer.subscription.created", "sub_1", CUSTOMER,
                    "active", false, periodStart, periodEnd, "price_starter", null))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("pending_correlation"));

            assertThat(subscriptionRepository.count()).isZero();
            assertThat(correlationRepository.findById("sub_1")).isPresent();

            deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.received").value(true));

            assertThat(row("sub_1").getUserId()).isEqualTo(userId);
            assertThat(correlationRepository.count()).isZero();
            assertThat(ledgerMetadata("evt_session_1")).contains("correlated");
        }

        @Test
        @DisplayName("subscription.created carrying the user in metadata creates the row directly")
        void subscriptionFirstWithMetadata() throws Exception {
            deliver(subscriptionEvent("evt_created_1", "customer.subscription.created", "sub_1", CUSTOMER,
                    "active", false, periodStart, periodEnd, "price_starter", userId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.received").value(true));

            assertThat(row("sub_1").getUserId()).isEqualTo(userId);
            verify(stripeService, never()).retrieveCustomerMetadata(any());
        }
    }

    @Test
    @DisplayName("invalid signature is rejected without touching state")
    void badSignature() throws Exception {
        String payload = checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1");

        mockMvc.perform(post(WEBHOOK)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", sign(payload, "whsec_wrong"))
                        .content(payload))
                .andExpect(status().isBadRequest());

        assertThat(processedWebhookEventRepository.count()).isZero();
        verify(stripeService, never()).retrieveSubscription(any());
    }

    @Test
    @DisplayName("update for an unknown subscription is acknowledged and recorded")
    void updateForUnknownSubscription() throws Exception {
        deliver(subscriptionEvent("evt_updated_x", "customer.subscription.updated", "sub_unknown", CUSTOMER,
                "active", false, periodStart, periodEnd, "price_starter", null))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        assertThat(subscriptionRepository.count()).isZero();
        assertThat(ledgerMetadata("evt_updated_x")).contains("subscription_not_found");
    }

    @Test
    @DisplayName("cancel at period end releases the active slot")
    void cancelAtPeriodEnd() throws Exception {
        stubActive("sub_1", false);
        deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                .andExpect(status().isOk());

        deliver(subscriptionEvent("evt_updated_1", "customer.subscription.updated", "sub_1", CUSTOMER,
                "active", true, periodStart, periodEnd, "price_starter", userId))
                .andExpect(status().isOk());

        CustomerSubscription updated = row("sub_1");
        assertThat(updated.isCancelAtPeriodEnd()).isTrue();
        assertThat(updated.getActiveSlot()).isNull();
    }

    @Test
    @DisplayName("deletion marks the subscription canceled")
    void deletion() throws Exception {
        stubActive("sub_1", false);
        deliver(checkoutSessionCompleted("evt_session_1", "cs_1", userId, CUSTOMER, "sub_1"))
                .andExpect(status().isOk());

        deliver(subscriptionEvent("evt_deleted_1", "customer.subscription.deleted", "sub_1", CUSTOMER,
                "canceled", false, periodStart, periodEnd, "price_starter", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        CustomerSubscription deleted = row("sub_1");
        assertThat(deleted.getStatus()).isEqualTo(SubscriptionLifecycleStatus.CANCELED);
        assertThat(deleted.getActiveSlot()).isNull();
    }
}
