package com.example.quotagate.admission;

import com.example.quotagate.account.AccountSnapshot;
import com.example.quotagate.account.AccountSnapshotService;
import com.example.quotagate.account.SubscriptionSnapshot;
import com.example.quotagate.billing.BillingPeriod;
import com.example.quotagate.billing.BillingPeriodResolver;
import com.example.quotagate.billing.Tier;
import com.example.quotagate.billing.TierCatalog;
import com.example.quotagate.burst.BurstDecision;
import com.example.quotagate.burst.BurstLimiter;
import com.example.quotagate.usage.LedgerResult;
import com.example.quotagate.usage.UsageCharge;
import com.example.quotagate.usage.UsageLedger;
import com.example.quotagate.usage.UsageType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Single admission decision per request.
 *
 * <ol>
 *   <li>load the account snapshot and resolve its billing period</li>
 *   <li>monthly quota check; a used-up quota denies before the burst window is touched</li>
 *   <li>burst check for the endpoint class</li>
 *   <li>record the usage under the account lock; a request that lost the race for the
 *       last unit is denied as MONTHLY_LIMIT and its burst slot stays consumed</li>
 * </ol>
 *
 * Ledger failures propagate to the caller. Burst store failures never do.
 */
@Service
public class AdmissionControl {

    private static final Logger log = LoggerFactory.getLogger(AdmissionControl.class);

    private final AccountSnapshotService accounts;
    private final BillingPeriodResolver periods;
    private final TierCatalog catalog;
    private final UsageLedger ledger;
    private final BurstLimiter burst;
    private final Clock clock;

    private final Counter allowed;
    private final Counter monthlyDenied;
    private final Counter burstDenied;
    private final Counter stalePeriods;

    public AdmissionControl(
            AccountSnapshotService accounts,
            BillingPeriodResolver periods,
            TierCatalog catalog,
            UsageLedger ledger,
            BurstLimiter burst,
            Clock clock,
            MeterRegistry registry
    ) {
        this.accounts = accounts;
        this.periods = periods;
        this.catalog = catalog;
        this.ledger = ledger;
        this.burst = burst;
        this.clock = clock;
        this.allowed = decisionCounter(registry, "allowed", "none");
        this.monthlyDenied = decisionCounter(registry, "denied", DenialReason.MONTHLY_LIMIT.code());
        this.burstDenied = decisionCounter(registry, "denied", DenialReason.BURST_LIMIT.code());
        this.stalePeriods = Counter.builder("billing_period_stale_total").register(registry);
    }

    public AdmissionDecision evaluate(UUID accountId, String endpointClass, UsageType usageType) {
        if (endpointClass == null || endpointClass.isBlank()) {
            throw new IllegalArgumentException("endpointClass must not be blank");
        }
        Instant now = clock.instant();

        AccountSnapshot account = accounts.load(accountId);
        BillingPeriod period = periods.resolve(account, now);
        if (period.stale()) {
            stalePeriods.increment();
            log.warn("Billing period of account {} is missing or over; using calendar month {} - {}",
                    accountId, period.start(), period.end());
        }

        Tier tier = account.effectiveTier();
        long limit = account.effectiveLimits(catalog).limitFor(usageType);
        UUID subscriptionId = account.entitledSubscription().map(SubscriptionSnapshot::id).orElse(null);
        UsageCharge charge = new UsageCharge(accountId, subscriptionId, usageType, endpointClass, 1);

        LedgerResult monthly = ledger.check(charge, period, limit);
        if (!monthly.permitted()) {
            monthlyDenied.increment();
            return AdmissionDecision.monthlyLimit(tier, endpointClass, usageType, monthly, period, now);
        }

        BurstDecision window = burst.allow(accountId.toString(), endpointClass, now);
        if (!window.permitted()) {
            burstDenied.increment();
            return AdmissionDecision.burstLimit(tier, endpointClass, usageType, monthly, period, window, burst.window());
        }

        LedgerResult recorded = ledger.checkAndRecord(charge, period, limit);
        if (!recorded.permitted()) {
            monthlyDenied.increment();
            return AdmissionDecision.monthlyLimit(tier, endpointClass, usageType, recorded, period, now);
        }

        allowed.increment();
        return AdmissionDecision.permitted(tier, endpointClass, usageType, recorded, period, window);
    }

    /**
     * Same as {@link #evaluate} but throws on denial.
     *
     * @throws QuotaExceededException when the monthly quota is used up
     * @throws BurstExceededException when the burst window is full
     */
    public AdmissionDecision admit(UUID accountId, String endpointClass, UsageType usageType) {
        AdmissionDecision decision = evaluate(accountId, endpointClass, usageType);
        if (decision.permitted()) {
            return decision;
        }
        if (decision.reason() == DenialReason.BURST_LIMIT) {
            throw new BurstExceededException(decision);
        }
        throw new QuotaExceededException(decision);
    }

    private static Counter decisionCounter(MeterRegistry registry, String outcome, String reason) {
        return Counter.builder("admission_decisions_total")
                .tag("outcome", outcome)
                .tag("reason", reason)
                .register(registry);
    }
}
