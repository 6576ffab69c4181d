package com.example.quotagate.admission;

import com.example.quotagate.billing.BillingPeriod;
import com.example.quotagate.billing.QuotaLimits;
import com.example.quotagate.billing.Tier;
import com.example.quotagate.burst.BurstDecision;
import com.example.quotagate.usage.LedgerResult;
import com.example.quotagate.usage.UsageType;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one admission evaluation plus the response headers the caller should send.
 *
 * @param reason      null when permitted
 * @param used        monthly units used in the period, including this request when permitted
 * @param limit       monthly limit, {@link QuotaLimits#UNLIMITED} for none
 * @param burstCurrent requests counted in the burst window; 0 when the burst check did not run
 * @param retryAfterSeconds seconds until a retry can succeed; 0 when permitted
 */
public record AdmissionDecision(
        boolean permitted,
        DenialReason reason,
        Tier tier,
        UsageType usageType,
        String endpointClass,
        long used,
        long limit,
        Instant periodStart,
        Instant periodEnd,
        boolean periodStale,
        int burstCurrent,
        int burstLimit,
        long retryAfterSeconds,
        Map<String, String> headers
) {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String TYPE = "X-RateLimit-Type";
    public static final String WINDOW = "X-RateLimit-Window";
    public static final String CURRENT = "X-RateLimit-Current";
    public static final String RETRY_AFTER = "Retry-After";
    public static final String USER_TIER = "X-User-Tier";

    private static final String UNLIMITED = "unlimited";

    static AdmissionDecision permitted(Tier tier, String endpointClass, UsageType type,
                                       LedgerResult ledger, BillingPeriod period, BurstDecision burst) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(LIMIT, ledger.unlimited() ? UNLIMITED : String.valueOf(ledger.limit()));
        h.put(REMAINING, ledger.unlimited() ? UNLIMITED : String.valueOf(ledger.remaining()));
        h.put(RESET, String.valueOf(period.end().getEpochSecond()));
        h.put(USER_TIER, tier.headerValue());
        return new AdmissionDecision(true, null, tier, type, endpointClass,
                ledger.used(), ledger.limit(), period.start(), period.end(), period.stale(),
                burst.currentCount(), burst.limit(), 0L, Collections.unmodifiableMap(h));
    }

    static AdmissionDecision monthlyLimit(Tier tier, String endpointClass, UsageType type,
                                          LedgerResult ledger, BillingPeriod period, Instant now) {
        long retryAfter = Math.max(1L, Duration.between(now, period.end()).toSeconds());
        Map<String, String> h = new LinkedHashMap<>();
        h.put(TYPE, "monthly");
        h.put(LIMIT, String.valueOf(ledger.limit()));
        h.put(REMAINING, String.valueOf(ledger.remaining()));
        h.put(RESET, String.valueOf(period.end().getEpochSecond()));
        h.put(RETRY_AFTER, String.valueOf(retryAfter));
        h.put(USER_TIER, tier.headerValue());
        return new AdmissionDecision(false, DenialReason.MONTHLY_LIMIT, tier, type, endpointClass,
                ledger.used(), ledger.limit(), period.start(), period.end(), period.stale(),
                0, 0, retryAfter, Collections.unmodifiableMap(h));
    }

    static AdmissionDecision burstLimit(Tier tier, String endpointClass, UsageType type,
                                        LedgerResult ledger, BillingPeriod period,
                                        BurstDecision burst, Duration window) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(TYPE, "burst");
        h.put(WINDOW, windowLabel(window));
        h.put(CURRENT, String.valueOf(burst.currentCount()));
        h.put(LIMIT, String.valueOf(burst.limit()));
        h.put(RETRY_AFTER, String.valueOf(burst.retryAfterSeconds()));
        h.put(USER_TIER, tier.headerValue());
        return new AdmissionDecision(false, DenialReason.BURST_LIMIT, tier, type, endpointClass,
                ledger.used(), ledger.limit(), period.start(), period.end(), period.stale(),
                burst.currentCount(), burst.limit(), burst.retryAfterSeconds(), Collections.unmodifiableMap(h));
    }

    /** {@code 5_minutes}, {@code 1_minutes}, {@code 30_seconds}. */
    static String windowLabel(Duration window) {
        if (window.toSeconds() % 60 == 0) {
            return window.toMinutes() + "_minutes";
        }
        return window.toSeconds() + "_seconds";
    }
}
