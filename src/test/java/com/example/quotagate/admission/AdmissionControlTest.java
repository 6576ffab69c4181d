package com.example.quotagate.admission;

import com.example.quotagate.MutableClock;
import com.example.quotagate.AccountFixtures;
import com.example.quotagate.MutableClockConfig;
import com.example.quotagate.account.AccountNotFoundException;
import com.example.quotagate.billing.Tier;
import com.example.quotagate.usage.UsageType;
import com.example.quotagate.webhook.WebhookEventProcessor;
import com.example.quotagate.webhook.WebhookOutcome;
import com.example.quotagate.webhook.WebhookSignatureVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end admission decisions with small limits:
 *  - free api-calls: 5 per month, free sentiment-analysis: 0
 *  - pro api-calls: 3 per month, enterprise unlimited
 *  - endpoint class "tight": 3 requests per 5 minutes
 */
@SpringBootTest
@Import(MutableClockConfig.class)
@TestPropertySource(properties = {
        "admission.webhook.secret=whsec_admission",
        "admission.tiers.plans.free.api-calls=5",
        "admission.tiers.plans.free.sentiment-analysis=0",
        "admission.tiers.plans.pro.api-calls=3",
        "admission.tiers.plans.pro.price-ids=pri_pro",
        "admission.tiers.plans.enterprise.price-ids=pri_ent",
        "admission.burst.default-limit=100",
        "admission.burst.limits.tight=3"
})
class AdmissionControlTest {

    @Autowired
    AdmissionControl admission;

    @Autowired
    WebhookEventProcessor webhooks;

    @Autowired
    AccountFixtures accountFixtures;

    @Autowired
    MutableClock clock;

    @Autowired
    MeterRegistry registry;

    @BeforeEach
    void resetClock() {
        clock.set(MutableClockConfig.START);
    }

    @Test
    void monthlyQuotaDeniesAfterLimitWithUsedEqualLimit() {
        UUID account = accountFixtures.createFree();

        for (int i = 0; i < 5; i++) {
            AdmissionDecision ok = admission.evaluate(account, "dashboard", UsageType.API_CALLS);
            assertThat(ok.permitted()).isTrue();
            assertThat(ok.headers()).containsEntry(AdmissionDecision.REMAINING, String.valueOf(4 - i));
        }

        AdmissionDecision denied = admission.evaluate(account, "dashboard", UsageType.API_CALLS);

        assertThat(denied.permitted()).isFalse();
        assertThat(denied.reason()).isEqualTo(DenialReason.MONTHLY_LIMIT);
        assertThat(denied.used()).isEqualTo(5);
        assertThat(denied.limit()).isEqualTo(5);
        assertThat(denied.headers())
                .containsEntry(AdmissionDecision.LIMIT, "5")
                .containsEntry(AdmissionDecision.REMAINING, "0")
                .containsEntry(AdmissionDecision.RESET, String.valueOf(Instant.parse("2025-04-01T00:00:00Z").getEpochSecond()))
                .containsEntry(AdmissionDecision.USER_TIER, "free");
    }

    @Test
    void burstDeniesFourthCallAndClearsAfterWindow() {
        UUID account = accountFixtures.createFree();

        for (int i = 0; i < 3; i++) {
            assertThat(admission.evaluate(account, "tight", UsageType.EXPORTS).permitted()).isTrue();
            clock.advance(Duration.ofSeconds(10));
        }

        AdmissionDecision denied = admission.evaluate(account, "tight", UsageType.EXPORTS);

        assertThat(denied.reason()).isEqualTo(DenialReason.BURST_LIMIT);
        assertThat(denied.burstCurrent()).isEqualTo(3);
        assertThat(denied.burstLimit()).isEqualTo(3);
        // first call at START leaves the window at START + 5m, 270s from now
        assertThat(denied.retryAfterSeconds()).isEqualTo(270);
        assertThat(denied.headers())
                .containsEntry(AdmissionDecision.TYPE, "burst")
                .containsEntry(AdmissionDecision.WINDOW, "5_minutes")
                .containsEntry(AdmissionDecision.CURRENT, "3")
                .containsEntry(AdmissionDecision.RETRY_AFTER, "270");

        clock.set(MutableClockConfig.START.plus(Duration.ofMinutes(5)));
        assertThat(admission.evaluate(account, "tight", UsageType.EXPORTS).permitted()).isTrue();
    }

    @Test
    void burstDenialDoesNotConsumeMonthlyQuota() {
        UUID account = accountFixtures.createFree();
        for (int i = 0; i < 3; i++) {
            admission.evaluate(account, "tight", UsageType.API_CALLS);
        }
        for (int i = 0; i < 5; i++) {
            assertThat(admission.evaluate(account, "tight", UsageType.API_CALLS).reason())
                    .isEqualTo(DenialReason.BURST_LIMIT);
        }

        AdmissionDecision other = admission.evaluate(account, "dashboard", UsageType.API_CALLS);

        assertThat(other.permitted()).isTrue();
        assertThat(other.used()).isEqualTo(4);
    }

    @Test
    void exhaustedMonthlyQuotaWinsOverBurst() {
        UUID account = accountFixtures.createFree();

        // limit 0: every call is a monthly denial and the burst window is never touched
        for (int i = 0; i < 6; i++) {
            AdmissionDecision d = admission.evaluate(account, "tight", UsageType.SENTIMENT_ANALYSIS);
            assertThat(d.reason()).isEqualTo(DenialReason.MONTHLY_LIMIT);
        }
        assertThat(admission.evaluate(account, "tight", UsageType.API_CALLS).permitted()).isTrue();
    }

    /**
     * PRO account uses up its 3 calls; a subscription.updated moving it to
     * ENTERPRISE mid-period admits the next call right away.
     */
    @Test
    void upgradeMidPeriodAppliesImmediately() {
        UUID account = accountFixtures.createFree();
        String subId = "sub_" + UUID.randomUUID();
        deliver("subscription.created", "2025-03-07T12:00:00Z", subId, account, "pri_pro");

        for (int i = 0; i < 3; i++) {
            AdmissionDecision ok = admission.evaluate(account, "dashboard", UsageType.API_CALLS);
            assertThat(ok.permitted()).isTrue();
            assertThat(ok.tier()).isEqualTo(Tier.PRO);
            assertThat(ok.periodStart()).isEqualTo(Instant.parse("2025-03-07T12:00:00Z"));
        }
        AdmissionDecision denied = admission.evaluate(account, "dashboard", UsageType.API_CALLS);
        assertThat(denied.reason()).isEqualTo(DenialReason.MONTHLY_LIMIT);
        assertThat(denied.headers()).containsEntry(AdmissionDecision.USER_TIER, "pro");

        deliver("subscription.updated", "2025-03-14T09:00:00Z", subId, account, "pri_ent");

        AdmissionDecision upgraded = admission.evaluate(account, "dashboard", UsageType.API_CALLS);
        assertThat(upgraded.permitted()).isTrue();
        assertThat(upgraded.tier()).isEqualTo(Tier.ENTERPRISE);
        assertThat(upgraded.used()).isEqualTo(4);
        assertThat(upgraded.periodStart()).isEqualTo(Instant.parse("2025-03-07T12:00:00Z"));
        assertThat(upgraded.headers())
                .containsEntry(AdmissionDecision.LIMIT, "unlimited")
                .containsEntry(AdmissionDecision.USER_TIER, "enterprise");
    }

    @Test
    void expiredSubscriptionPeriodFallsBackAndIsCounted() {
        UUID account = accountFixtures.createFree();
        String subId = "sub_" + UUID.randomUUID();
        deliver("subscription.created", "2025-02-07T12:00:00Z", subId, account, "pri_pro",
                "2025-02-07T12:00:00Z", "2025-03-07T12:00:00Z");
        double before = registry.counter("billing_period_stale_total").count();

        AdmissionDecision d = admission.evaluate(account, "dashboard", UsageType.API_CALLS);

        assertThat(d.permitted()).isTrue();
        assertThat(d.periodStale()).isTrue();
        assertThat(d.periodStart()).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(registry.counter("billing_period_stale_total").count()).isEqualTo(before + 1);
    }

    @Test
    void admitThrowsTypedDenials() {
        UUID account = accountFixtures.createFree();
        for (int i = 0; i < 3; i++) {
            admission.admit(account, "tight", UsageType.EXPORTS);
        }

        assertThatThrownBy(() -> admission.admit(account, "tight", UsageType.EXPORTS))
                .isInstanceOf(BurstExceededException.class)
                .isInstanceOf(AdmissionDeniedException.class);
        assertThatThrownBy(() -> admission.admit(account, "dashboard", UsageType.SENTIMENT_ANALYSIS))
                .isInstanceOf(QuotaExceededException.class);
    }

    @Test
    void unknownAccountIsRejected() {
        assertThatThrownBy(() -> admission.evaluate(UUID.randomUUID(), "dashboard", UsageType.API_CALLS))
                .isInstanceOf(AccountNotFoundException.class);
    }

    private void deliver(String type, String occurredAt, String subId, UUID account, String priceId) {
        deliver(type, occurredAt, subId, account, priceId, "2025-03-07T12:00:00Z", "2025-04-07T12:00:00Z");
    }

    private void deliver(String type, String occurredAt, String subId, UUID account, String priceId,
                         String periodStart, String periodEnd) {
        String json = """
            {"event_id":"evt_%s","event_type":"%s","occurred_at":"%s",
             "data":{"id":"%s","status":"active","customer_id":"ctm_%s",
                     "custom_data":{"account_id":"%s"},
                     "items":[{"price":{"id":"%s"}}],
                     "current_billing_period":{"starts_at":"%s","ends_at":"%s"}}}
            """.formatted(UUID.randomUUID(), type, occurredAt, subId, account, account, priceId, periodStart, periodEnd);
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        WebhookOutcome out = webhooks.receive(body,
                WebhookSignatureVerifier.sign("whsec_admission", "1741946400", body), null);
        assertThat(out.status()).isEqualTo(WebhookOutcome.Status.PROCESSED);
    }
}
