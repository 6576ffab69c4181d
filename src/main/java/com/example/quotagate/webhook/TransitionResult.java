package com.example.quotagate.webhook;

import java.util.UUID;

/**
 * Outcome of applying one event to subscription state.
 *
 * @param applied false when the event was valid but changed nothing (stale, redundant, not allowed from the current status)
 */
public record TransitionResult(
        boolean applied,
        String detail,
        UUID accountId,
        String externalSubscriptionId,
        String externalCustomerId
) {

    public static TransitionResult applied(String detail, UUID accountId, String subscriptionId, String customerId) {
        return new TransitionResult(true, detail, accountId, subscriptionId, customerId);
    }

    public static TransitionResult ignored(String detail, UUID accountId, String subscriptionId, String customerId) {
        return new TransitionResult(false, detail, accountId, subscriptionId, customerId);
    }
}
