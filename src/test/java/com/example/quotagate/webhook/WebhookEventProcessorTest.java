package com.example.quotagate.webhook;

import com.example.quotagate.AccountFixtures;
import com.example.quotagate.account.Account;
import com.example.quotagate.account.AccountRepository;
import com.example.quotagate.account.Subscription;
import com.example.quotagate.account.SubscriptionRepository;
import com.example.quotagate.account.SubscriptionStatus;
import com.example.quotagate.billing.Tier;
import com.example.quotagate.usage.UsageType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.quotagate.webhook.Payloads.bytes;
import static com.example.quotagate.webhook.Payloads.event;
import static com.example.quotagate.webhook.Payloads.newId;
import static com.example.quotagate.webhook.Payloads.subscription;
import static com.example.quotagate.webhook.Payloads.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * What this covers:
 *  1. redelivering one event id any number of times, also concurrently, applies it once
 *  2. a tampered body is rejected and leaves no successful audit row
 *  3. unknown, stale and not-allowed events are acknowledged without state change
 *  4. failures are recorded and retried on redelivery
 */
@SpringBootTest
@TestPropertySource(properties = {
        "admission.webhook.secret=" + Payloads.SECRET,
        "admission.tiers.plans.pro.price-ids=pri_pro",
        "admission.tiers.plans.enterprise.price-ids=pri_ent"
})
class WebhookEventProcessorTest {

    private static final String P_START = "2025-03-07T12:00:00Z";
    private static final String P_END = "2025-04-07T12:00:00Z";

    @Autowired
    WebhookEventProcessor processor;

    @Autowired
    BillingEventRepository events;

    @Autowired
    AccountRepository accounts;

    @Autowired
    SubscriptionRepository subscriptions;

    @Autowired
    AccountFixtures accountFixtures;

    @Test
    void subscriptionCreatedAssignsTierLimitsAndPeriod() {
        UUID account = accountFixtures.createFree();
        String subId = newId("sub");

        WebhookOutcome out = deliver(event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "active", account, newId("ctm"), "pri_pro", P_START, P_END)));

        assertThat(out.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
        Subscription sub = subscriptions.findByExternalSubscriptionId(subId).orElseThrow();
        assertThat(sub.getTier()).isEqualTo(Tier.PRO);
        assertThat(sub.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(sub.getLimits().limitFor(UsageType.API_CALLS)).isEqualTo(1000);
        assertThat(sub.getCurrentPeriodStart()).isEqualTo(Instant.parse(P_START));
        assertThat(sub.getCurrentPeriodEnd()).isEqualTo(Instant.parse(P_END));
        assertThat(sub.getCurrency()).isEqualTo("USD");

        Account a = accounts.findById(account).orElseThrow();
        assertThat(a.getTier()).isEqualTo(Tier.PRO);
        assertThat(a.getSubscriptionStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(a.getExternalCustomerId()).isEqualTo(sub.getExternalCustomerId());

        BillingEvent row = events.findByEventId(out.eventId()).orElseThrow();
        assertThat(row.getStatus()).isEqualTo(BillingEventStatus.PROCESSED);
        assertThat(row.getAccountId()).isEqualTo(account);
        assertThat(row.getExternalSubscriptionId()).isEqualTo(subId);
        assertThat(row.getProcessedAt()).isNotNull();
    }

    @Test
    void redeliveredEventIsAppliedOnce() {
        UUID account = accountFixtures.createFree();
        String subId = newId("sub");
        deliver(event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "active", account, newId("ctm"), "pri_pro", P_START, P_END)));
        String pause = event(newId("evt"), "subscription.paused", "2025-03-08T12:00:00Z",
                "{\"id\":\"" + subId + "\"}");

        WebhookOutcome first = deliver(pause);
        Instant appliedAt = subscriptions.findByExternalSubscriptionId(subId).orElseThrow().getUpdatedAt();
        for (int i = 0; i < 4; i++) {
            WebhookOutcome again = deliver(pause);
            assertThat(again.status()).isEqualTo(WebhookOutcome.Status.DUPLICATE);
            assertThat(again.successful()).isTrue();
        }

        assertThat(first.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
        Subscription sub = subscriptions.findByExternalSubscriptionId(subId).orElseThrow();
        assertThat(sub.getStatus()).isEqualTo(SubscriptionStatus.PAUSED);
        assertThat(sub.getUpdatedAt()).isEqualTo(appliedAt);
        assertThat(events.countByEventIdAndStatus(first.eventId(), BillingEventStatus.PROCESSED)).isEqualTo(1);
    }

    @Test
    void concurrentDuplicateDeliveriesApplyOnce() throws Exception {
        UUID account = accountFixtures.createFree();
        String subId = newId("sub");
        String created = event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "active", account, newId("ctm"), "pri_pro", P_START, P_END));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        Map<WebhookOutcome.Status, Integer> outcomes = new EnumMap<>(WebhookOutcome.Status.class);
        try {
            List<Future<WebhookOutcome>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return deliver(created);
                }));
            }
            start.countDown();

            for (Future<WebhookOutcome> f : results) {
                outcomes.merge(f.get(30, TimeUnit.SECONDS).status(), 1, Integer::sum);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(outcomes).containsEntry(WebhookOutcome.Status.PROCESSED, 1)
                .containsEntry(WebhookOutcome.Status.DUPLICATE, 7);
        assertThat(subscriptions.findByExternalSubscriptionId(subId)).isPresent();
        assertThat(accounts.findById(account).orElseThrow().getTier()).isEqualTo(Tier.PRO);
    }

    @Test
    void tamperedBodyIsRejectedWithoutSuccessRow() {
        String eventId = newId("evt");
        byte[] body = bytes(event(eventId, "subscription.created", "2025-03-07T12:00:00Z",
                subscription(newId("sub"), "active", accountFixtures.createFree(), newId("ctm"), "pri_ent", P_START, P_END)));
        String signature = Payloads.signature(body);
        body[body.length - 2] ^= 0x01;

        assertThatThrownBy(() -> processor.receive(body, signature, Payloads.TIMESTAMP))
                .isInstanceOf(WebhookAuthenticationException.class);
        assertThat(events.findByEventId(eventId)).isEmpty();
    }

    @Test
    void unknownEventTypeIsAcknowledgedAndRecorded() {
        WebhookOutcome out = deliver(event(newId("evt"), "adjustment.created", "2025-03-07T12:00:00Z", "{\"id\":\"adj_1\"}"));

        assertThat(out.status()).isEqualTo(WebhookOutcome.Status.IGNORED);
        assertThat(events.findByEventId(out.eventId()).orElseThrow().getStatus()).isEqualTo(BillingEventStatus.IGNORED);
    }

    @Test
    void missingAccountFailsAndSucceedsOnRedeliveryOnceAccountExists() {
        String customerId = newId("ctm");
        String subId = newId("sub");
        String body = event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "active", null, customerId, "pri_pro", P_START, P_END));

        WebhookOutcome failed = deliver(body);

        assertThat(failed.status()).isEqualTo(WebhookOutcome.Status.FAILED);
        assertThat(failed.retryable()).isTrue();
        BillingEvent row = events.findByEventId(failed.eventId()).orElseThrow();
        assertThat(row.getStatus()).isEqualTo(BillingEventStatus.FAILED);
        assertThat(row.getError()).contains("AccountNotFoundException");
        assertThat(subscriptions.findByExternalSubscriptionId(subId)).isEmpty();

        // the account shows up with the customer id linked
        UUID account = accountFixtures.createFree();
        Account a = accounts.findById(account).orElseThrow();
        a.linkCustomer(customerId, null, Instant.now());
        accounts.save(a);

        WebhookOutcome retried = deliver(body);

        assertThat(retried.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
        BillingEvent after = events.findByEventId(failed.eventId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(BillingEventStatus.PROCESSED);
        assertThat(after.getRetryCount()).isEqualTo(1);
        assertThat(subscriptions.findByExternalSubscriptionId(subId).orElseThrow().getAccountId()).isEqualTo(account);
    }

    @Test
    void olderEventAfterNewerOneIsIgnored() {
        UUID account = accountFixtures.createFree();
        String subId = newId("sub");
        String customer = newId("ctm");
        deliver(event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "active", account, customer, "pri_pro", P_START, P_END)));
        deliver(event(newId("evt"), "subscription.updated", "2025-03-10T12:00:00Z",
                subscription(subId, "active", account, customer, "pri_ent", P_START, P_END)));

        WebhookOutcome late = deliver(event(newId("evt"), "subscription.updated", "2025-03-09T12:00:00Z",
                subscription(subId, "past_due", account, customer, "pri_pro", P_START, P_END)));

        assertThat(late.status()).isEqualTo(WebhookOutcome.Status.IGNORED);
        assertThat(late.detail()).contains("stale");
        Subscription sub = subscriptions.findByExternalSubscriptionId(subId).orElseThrow();
        assertThat(sub.getTier()).isEqualTo(Tier.ENTERPRISE);
        assertThat(sub.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void cancelledSubscriptionStaysCancelledAndAccountDropsToFree() {
        UUID account = accountFixtures.createFree();
        String subId = newId("sub");
        String customer = newId("ctm");
        deliver(event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "active", account, customer, "pri_pro", P_START, P_END)));

        WebhookOutcome cancel = deliver(event(newId("evt"), "subscription.canceled", "2025-03-08T12:00:00Z",
                "{\"id\":\"" + subId + "\"}"));
        WebhookOutcome revive = deliver(event(newId("evt"), "subscription.updated", "2025-03-09T12:00:00Z",
                subscription(subId, "active", account, customer, "pri_pro", P_START, P_END)));
        WebhookOutcome resume = deliver(event(newId("evt"), "subscription.resumed", "2025-03-10T12:00:00Z",
                "{\"id\":\"" + subId + "\"}"));

        assertThat(cancel.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
        assertThat(revive.status()).isEqualTo(WebhookOutcome.Status.IGNORED);
        assertThat(resume.status()).isEqualTo(WebhookOutcome.Status.IGNORED);

        Subscription sub = subscriptions.findByExternalSubscriptionId(subId).orElseThrow();
        assertThat(sub.getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
        assertThat(sub.getLimits().limitFor(UsageType.API_CALLS)).isEqualTo(100);
        Account a = accounts.findById(account).orElseThrow();
        assertThat(a.getTier()).isEqualTo(Tier.FREE);
        assertThat(a.getSubscriptionStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
    }

    @Test
    void paymentFailureThenRenewalReturnsToActiveWithNewPeriod() {
        UUID account = accountFixtures.createFree();
        String subId = newId("sub");
        String customer = newId("ctm");
        deliver(event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "active", account, customer, "pri_pro", P_START, P_END)));

        WebhookOutcome failed = deliver(event(newId("evt"), "transaction.payment_failed", "2025-04-07T12:05:00Z",
                transaction(subId, customer, null, null)));
        assertThat(failed.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
        assertThat(accounts.findById(account).orElseThrow().getSubscriptionStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
        // grace: still on the paid tier
        assertThat(accounts.findById(account).orElseThrow().getTier()).isEqualTo(Tier.PRO);

        WebhookOutcome paid = deliver(event(newId("evt"), "transaction.completed", "2025-04-08T09:00:00Z",
                transaction(subId, customer, "2025-04-07T12:00:00Z", "2025-05-07T12:00:00Z")));

        assertThat(paid.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
        Subscription sub = subscriptions.findByExternalSubscriptionId(subId).orElseThrow();
        assertThat(sub.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(sub.getCurrentPeriodStart()).isEqualTo(Instant.parse("2025-04-07T12:00:00Z"));
        assertThat(sub.getCurrentPeriodEnd()).isEqualTo(Instant.parse("2025-05-07T12:00:00Z"));
        assertThat(accounts.findById(account).orElseThrow().getSubscriptionStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void trialEndsIntoActive() {
        UUID account = accountFixtures.createFree();
        String subId = newId("sub");
        deliver(event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "trialing", account, newId("ctm"), "pri_pro", P_START, P_END)));
        assertThat(subscriptions.findByExternalSubscriptionId(subId).orElseThrow().getStatus())
                .isEqualTo(SubscriptionStatus.TRIALING);

        WebhookOutcome out = deliver(event(newId("evt"), "subscription.trial_ended", "2025-03-21T12:00:00Z",
                "{\"id\":\"" + subId + "\"}"));

        assertThat(out.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
        Subscription sub = subscriptions.findByExternalSubscriptionId(subId).orElseThrow();
        assertThat(sub.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(sub.getTrialEnd()).isNull();
    }

    @Test
    void customerUpdateStoresPortalUrl() {
        UUID account = accountFixtures.createFree();
        String subId = newId("sub");
        String customer = newId("ctm");
        deliver(event(newId("evt"), "subscription.created", "2025-03-07T12:00:00Z",
                subscription(subId, "active", account, customer, "pri_pro", P_START, P_END)));

        WebhookOutcome out = deliver(event(newId("evt"), "customer.updated", "2025-03-08T12:00:00Z", """
                {"id":"%s","email":"billing@example.com",
                 "management_urls":{"customer_portal":"https://portal.example.com/%s"}}
                """.formatted(customer, customer)));

        assertThat(out.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
        assertThat(subscriptions.findByExternalSubscriptionId(subId).orElseThrow().getCustomerPortalUrl())
                .isEqualTo("https://portal.example.com/" + customer);
    }

    @Test
    void malformedBodyIsRecordedAsFailedAndNotRetried() {
        byte[] body = bytes("{\"event_type\":\"subscription.created\",\"data\":{}}");

        WebhookOutcome out = processor.receive(body, Payloads.signature(body), Payloads.TIMESTAMP);
        WebhookOutcome again = processor.receive(body, Payloads.signature(body), Payloads.TIMESTAMP);

        assertThat(out.status()).isEqualTo(WebhookOutcome.Status.FAILED);
        assertThat(out.retryable()).isFalse();
        assertThat(out.eventId()).startsWith("sha256:");
        assertThat(again.eventId()).isEqualTo(out.eventId());
        BillingEvent row = events.findByEventId(out.eventId()).orElseThrow();
        assertThat(row.getStatus()).isEqualTo(BillingEventStatus.FAILED);
    }

    private WebhookOutcome deliver(String json) {
        byte[] body = bytes(json);
        return processor.receive(body, Payloads.signature(body), Payloads.TIMESTAMP);
    }
}
