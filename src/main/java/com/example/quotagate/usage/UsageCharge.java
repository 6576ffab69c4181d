package com.example.quotagate.usage;

import java.util.Objects;
import java.util.UUID;

/**
 * @param subscriptionId null for accounts without an entitled subscription
 * @param cost           units consumed, at least 1
 */
public record UsageCharge(UUID accountId, UUID subscriptionId, UsageType usageType, String endpointClass, int cost) {

    public UsageCharge {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(usageType, "usageType");
        if (cost < 1) {
            throw new IllegalArgumentException("cost must be a positive integer: " + cost);
        }
    }

    public static UsageCharge single(UUID accountId, UsageType usageType) {
        return new UsageCharge(accountId, null, usageType, null, 1);
    }
}
