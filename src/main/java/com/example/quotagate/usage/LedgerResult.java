package com.example.quotagate.usage;

import com.example.quotagate.billing.QuotaLimits;

/**
 * @param used  units on the ledger for the period; includes this request when permitted
 * @param limit monthly limit, {@link QuotaLimits#UNLIMITED} for no limit
 */
public record LedgerResult(boolean permitted, long used, long limit) {

    public boolean unlimited() {
        return QuotaLimits.isUnlimited(limit);
    }

    /** Units left in the period, or -1 when unlimited. */
    public long remaining() {
        if (unlimited()) return -1L;
        return Math.max(0L, limit - used);
    }
}
