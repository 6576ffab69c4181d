package com.example.quotagate.usage;

import com.example.quotagate.account.AccountNotFoundException;
import com.example.quotagate.account.AccountRepository;
import com.example.quotagate.billing.BillingPeriod;
import com.example.quotagate.billing.QuotaLimits;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Monthly quota per account and usage type.
 *
 * The enforcement total is always the sum of recorded cost units for the exact
 * billing period. {@link #checkAndRecord} holds a row lock on the account while it
 * reads that sum and appends, so concurrent requests of one account cannot both take
 * the last unit. Other accounts are not blocked.
 *
 * With sampling on, a charge covered by prepaid credit from an earlier write is
 * admitted without touching the ledger, and a new prepayment never writes past the
 * limit, so the recorded total stays within it.
 *
 * Store failures propagate: an unreadable ledger denies the request.
 */
@Service
public class UsageLedger {

    private final AccountRepository accounts;
    private final UsageRecordRepository records;
    private final UsageSampler sampler;
    private final Clock clock;

    public UsageLedger(AccountRepository accounts, UsageRecordRepository records, UsageSampler sampler, Clock clock) {
        this.accounts = accounts;
        this.records = records;
        this.sampler = sampler;
        this.clock = clock;
    }

    /** Read-only check; records nothing. */
    @Transactional(readOnly = true)
    public LedgerResult check(UsageCharge charge, BillingPeriod period, long limit) {
        long used = used(charge.accountId(), charge.usageType(), period);
        boolean permitted = QuotaLimits.isUnlimited(limit)
                || used + charge.cost() <= limit
                || sampler.credit(charge, period) >= charge.cost();
        return new LedgerResult(permitted, used, limit);
    }

    @Transactional
    public LedgerResult checkAndRecord(UUID accountId, UsageType usageType, BillingPeriod period, long limit) {
        return checkAndRecord(UsageCharge.single(accountId, usageType), period, limit);
    }

    /**
     * Admits from prepaid credit when there is enough; otherwise denies when
     * {@code used + cost > limit} and appends a record stamped with {@code period}.
     */
    @Transactional
    public LedgerResult checkAndRecord(UsageCharge charge, BillingPeriod period, long limit) {
        accounts.lockById(charge.accountId())
                .orElseThrow(() -> new AccountNotFoundException(charge.accountId()));

        long used = used(charge.accountId(), charge.usageType(), period);
        if (sampler.tryDrawCredit(charge, period)) {
            return new LedgerResult(true, used, limit);
        }
        boolean unlimited = QuotaLimits.isUnlimited(limit);
        if (!unlimited && used + charge.cost() > limit) {
            return new LedgerResult(false, used, limit);
        }

        long headroom = unlimited ? Long.MAX_VALUE : limit - used;
        long units = sampler.unitsToRecord(charge, period, headroom);
        try {
            records.saveAndFlush(new UsageRecord(
                    UUID.randomUUID(),
                    charge.accountId(),
                    charge.subscriptionId(),
                    charge.usageType(),
                    charge.endpointClass(),
                    units,
                    period.start(),
                    period.end(),
                    clock.instant()
            ));
        } catch (RuntimeException e) {
            sampler.refund(charge, period, units);
            throw e;
        }
        return new LedgerResult(true, used + units, limit);
    }

    /** Records of one account stamped with {@code period}, oldest first. */
    @Transactional(readOnly = true)
    public List<UsageRecord> records(UUID accountId, BillingPeriod period) {
        return records.findByAccountIdAndBillingPeriodStartAndBillingPeriodEndOrderByCreatedAtAsc(
                accountId, period.start(), period.end());
    }

    @Transactional(readOnly = true)
    public long used(UUID accountId, UsageType usageType, BillingPeriod period) {
        return records.sumCostUnits(accountId, usageType, period.start(), period.end());
    }
}
