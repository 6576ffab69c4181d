package com.example.quotagate.account;

import com.example.quotagate.billing.QuotaLimits;
import com.example.quotagate.billing.Tier;
import com.example.quotagate.billing.TierCatalog;

import java.util.Optional;
import java.util.UUID;

/**
 * Account state as seen by one admission decision.
 *
 * @param subscription latest non-cancelled subscription, or null
 */
public record AccountSnapshot(UUID accountId, Tier tier, SubscriptionStatus status, SubscriptionSnapshot subscription) {

    public Optional<SubscriptionSnapshot> entitledSubscription() {
        if (subscription == null || !subscription.status().isEntitled()) return Optional.empty();
        return Optional.of(subscription);
    }

    /** Subscription snapshot when entitled, otherwise the catalog limits of the account tier. */
    public QuotaLimits effectiveLimits(TierCatalog catalog) {
        return entitledSubscription()
                .map(SubscriptionSnapshot::limits)
                .orElseGet(() -> catalog.limits(tier));
    }

    public Tier effectiveTier() {
        return entitledSubscription().map(SubscriptionSnapshot::tier).orElse(tier);
    }
}
