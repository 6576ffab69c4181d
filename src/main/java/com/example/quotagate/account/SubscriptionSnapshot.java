package com.example.quotagate.account;

import com.example.quotagate.billing.QuotaLimits;
import com.example.quotagate.billing.Tier;

import java.time.Instant;
import java.util.UUID;

/** Detached, read-only copy of a {@link Subscription}. */
public record SubscriptionSnapshot(
        UUID id,
        String externalSubscriptionId,
        String externalCustomerId,
        Tier tier,
        SubscriptionStatus status,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        Instant nextBilledAt,
        Instant trialStart,
        Instant trialEnd,
        QuotaLimits limits,
        String limitsVersion,
        String customerPortalUrl
) {

    public static SubscriptionSnapshot of(Subscription s) {
        return new SubscriptionSnapshot(
                s.getId(),
                s.getExternalSubscriptionId(),
                s.getExternalCustomerId(),
                s.getTier(),
                s.getStatus(),
                s.getCurrentPeriodStart(),
                s.getCurrentPeriodEnd(),
                s.getNextBilledAt(),
                s.getTrialStart(),
                s.getTrialEnd(),
                s.getLimits(),
                s.getLimitsVersion(),
                s.getCustomerPortalUrl()
        );
    }
}
