package com.example.quotagate.usage;

import com.example.quotagate.billing.BillingPeriod;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides how many units a charge writes to the ledger.
 *
 * With a sample rate N > 1 a charge that finds no prepaid credit writes up to
 * {@code cost * N} units, capped at the headroom left under the limit, and keeps the
 * surplus as credit for the following charges of the same account, usage type and
 * period. Those charges are admitted from credit without a ledger write. Credit lives
 * in this JVM only; another instance starts with none, so the ledger can run ahead of
 * real use but never past the limit.
 */
@Component
public class UsageSampler {

    private final UsageProperties props;

    private final Map<Key, Long> credits = new ConcurrentHashMap<>();

    public UsageSampler(UsageProperties props) {
        this.props = props;
    }

    public boolean sampled(UsageType type) {
        return props.sampleRateFor(type) > 1;
    }

    /** Prepaid units not yet drawn for this charge's account, usage type and period. */
    public long credit(UsageCharge charge, BillingPeriod period) {
        Long credit = credits.get(key(charge, period));
        return credit == null ? 0L : credit;
    }

    /** Draws {@code charge.cost()} from prepaid credit. @return false when credit does not cover it */
    public boolean tryDrawCredit(UsageCharge charge, BillingPeriod period) {
        if (!sampled(charge.usageType())) return false;

        boolean[] drawn = new boolean[1];
        credits.computeIfPresent(key(charge, period), (k, credit) -> {
            if (credit < charge.cost()) return credit;
            drawn[0] = true;
            long left = credit - charge.cost();
            return left == 0L ? null : left;
        });
        return drawn[0];
    }

    /**
     * @param headroom units left under the limit, at least {@code charge.cost()};
     *                 {@link Long#MAX_VALUE} when unlimited
     * @return units to write for this charge
     */
    public long unitsToRecord(UsageCharge charge, BillingPeriod period, long headroom) {
        int rate = props.sampleRateFor(charge.usageType());
        if (rate <= 1) return charge.cost();

        long units = Math.max(charge.cost(), Math.min((long) charge.cost() * rate, headroom));
        long surplus = units - charge.cost();
        if (surplus > 0) {
            credits.merge(key(charge, period), surplus, Long::sum);
        }
        return units;
    }

    /** Undoes {@link #unitsToRecord} after the ledger write failed. */
    public void refund(UsageCharge charge, BillingPeriod period, long recorded) {
        long surplus = recorded - charge.cost();
        if (!sampled(charge.usageType()) || surplus <= 0) return;
        credits.computeIfPresent(key(charge, period), (k, credit) -> {
            long next = credit - surplus;
            return next <= 0L ? null : next;
        });
    }

    /** Drops credit of periods that ended before {@code cutoff}. */
    public int evictEndedBefore(Instant cutoff) {
        int before = credits.size();
        credits.keySet().removeIf(k -> k.periodEnd().isBefore(cutoff));
        return before - credits.size();
    }

    private static Key key(UsageCharge charge, BillingPeriod period) {
        return new Key(charge.accountId(), charge.usageType(), period.start(), period.end());
    }

    private record Key(UUID accountId, UsageType usageType, Instant periodStart, Instant periodEnd) {}
}
