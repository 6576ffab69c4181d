package com.example.quotagate.admission;

import com.example.quotagate.account.SubscriptionStatus;
import com.example.quotagate.billing.BillingPeriod;
import com.example.quotagate.billing.Tier;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Read-only billing view of one account for its current period. */
public record BillingStatus(
        UUID accountId,
        Tier tier,
        SubscriptionStatus status,
        String limitsVersion,
        Period period,
        Map<String, Usage> usage,
        Subscription subscription
) {

    public record Period(Instant start, Instant end, BillingPeriod.Source source, boolean stale) {

        static Period of(BillingPeriod p) {
            return new Period(p.start(), p.end(), p.source(), p.stale());
        }
    }

    /**
     * @param limit     -1 when unlimited
     * @param remaining -1 when unlimited
     * @param percentage share of the limit used, 0 when unlimited
     */
    public record Usage(long used, long limit, long remaining, double percentage) {}

    public record Subscription(
            String externalSubscriptionId,
            String externalCustomerId,
            Tier tier,
            SubscriptionStatus status,
            Instant nextBilledAt,
            Instant trialEnd,
            String customerPortalUrl
    ) {}
}
