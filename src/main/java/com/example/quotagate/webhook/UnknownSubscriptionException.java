package com.example.quotagate.webhook;

/** Event refers to a subscription that has not been created yet. Retryable. */
public class UnknownSubscriptionException extends RuntimeException {

    public UnknownSubscriptionException(String externalSubscriptionId) {
        super("Subscription not found: " + externalSubscriptionId);
    }
}
