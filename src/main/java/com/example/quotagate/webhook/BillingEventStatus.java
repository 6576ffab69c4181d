package com.example.quotagate.webhook;

public enum BillingEventStatus {
    /** Claimed by a processor, outcome not yet known. */
    RECEIVED,
    PROCESSED,
    /** Accepted without state change: unknown type, stale or redundant event. */
    IGNORED,
    FAILED;

    public boolean isSuccessful() {
        return this == PROCESSED || this == IGNORED;
    }
}
