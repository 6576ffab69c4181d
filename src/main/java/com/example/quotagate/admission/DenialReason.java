package com.example.quotagate.admission;

import java.util.Locale;

public enum DenialReason {
    /** Monthly quota for the usage type is used up; stable until the period resets. */
    MONTHLY_LIMIT,
    /** Too many requests in the short window; clears after Retry-After. */
    BURST_LIMIT;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
