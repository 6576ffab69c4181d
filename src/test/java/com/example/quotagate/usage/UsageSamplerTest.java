package com.example.quotagate.usage;

import com.example.quotagate.billing.BillingPeriod;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class UsageSamplerTest {

    private final BillingPeriod march = new BillingPeriod(
            Instant.parse("2025-03-01T00:00:00Z"), Instant.parse("2025-04-01T00:00:00Z"),
            BillingPeriod.Source.CALENDAR_MONTH, false);

    @Test
    void exactByDefault() {
        UsageSampler sampler = new UsageSampler(new UsageProperties());
        UsageCharge charge = UsageCharge.single(UUID.randomUUID(), UsageType.API_CALLS);

        for (int i = 0; i < 5; i++) {
            assertThat(sampler.tryDrawCredit(charge, march)).isFalse();
            assertThat(sampler.unitsToRecord(charge, march, Long.MAX_VALUE)).isEqualTo(1);
        }
        assertThat(sampler.credit(charge, march)).isZero();
    }

    /** Rate 4: one write of 4 units, then three charges drawn from credit. */
    @Test
    void sampledWritesPrepay() {
        UsageProperties props = new UsageProperties();
        props.getSampleRates().put("api-calls", 4);
        UsageSampler sampler = new UsageSampler(props);
        UsageCharge charge = UsageCharge.single(UUID.randomUUID(), UsageType.API_CALLS);

        long recorded = 0;
        for (int used = 1; used <= 9; used++) {
            if (!sampler.tryDrawCredit(charge, march)) {
                recorded += sampler.unitsToRecord(charge, march, Long.MAX_VALUE);
            }
            assertThat(recorded).as("after %d charges", used).isGreaterThanOrEqualTo(used);
        }
        assertThat(recorded).isEqualTo(12);
        assertThat(sampler.credit(charge, march)).isEqualTo(3);
    }

    @Test
    void prepayIsCappedAtHeadroom() {
        UsageProperties props = new UsageProperties();
        props.getSampleRates().put("api-calls", 10);
        UsageSampler sampler = new UsageSampler(props);
        UsageCharge charge = UsageCharge.single(UUID.randomUUID(), UsageType.API_CALLS);

        assertThat(sampler.unitsToRecord(charge, march, 3)).isEqualTo(3);
        assertThat(sampler.credit(charge, march)).isEqualTo(2);
    }

    @Test
    void refundRestoresCredit() {
        UsageProperties props = new UsageProperties();
        props.getSampleRates().put("exports", 3);
        UsageSampler sampler = new UsageSampler(props);
        UsageCharge charge = UsageCharge.single(UUID.randomUUID(), UsageType.EXPORTS);

        long first = sampler.unitsToRecord(charge, march, Long.MAX_VALUE);
        sampler.refund(charge, march, first);

        // the failed prepay left no credit behind, so the next charge prepays again
        assertThat(sampler.tryDrawCredit(charge, march)).isFalse();
        assertThat(sampler.unitsToRecord(charge, march, Long.MAX_VALUE)).isEqualTo(3);
    }

    @Test
    void creditOfEndedPeriodsIsEvicted() {
        UsageProperties props = new UsageProperties();
        props.getSampleRates().put("api-calls", 10);
        UsageSampler sampler = new UsageSampler(props);
        sampler.unitsToRecord(UsageCharge.single(UUID.randomUUID(), UsageType.API_CALLS), march, Long.MAX_VALUE);

        assertThat(sampler.evictEndedBefore(Instant.parse("2025-03-15T00:00:00Z"))).isZero();
        assertThat(sampler.evictEndedBefore(Instant.parse("2025-04-02T00:00:00Z"))).isEqualTo(1);
    }
}
