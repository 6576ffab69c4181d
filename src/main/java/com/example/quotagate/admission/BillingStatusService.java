package com.example.quotagate.admission;

import com.example.quotagate.account.AccountSnapshot;
import com.example.quotagate.account.AccountSnapshotService;
import com.example.quotagate.account.SubscriptionSnapshot;
import com.example.quotagate.billing.BillingPeriod;
import com.example.quotagate.billing.BillingPeriodResolver;
import com.example.quotagate.billing.QuotaLimits;
import com.example.quotagate.billing.TierCatalog;
import com.example.quotagate.usage.UsageLedger;
import com.example.quotagate.usage.UsageType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
public class BillingStatusService {

    private final AccountSnapshotService accounts;
    private final BillingPeriodResolver periods;
    private final TierCatalog catalog;
    private final UsageLedger ledger;
    private final Clock clock;

    public BillingStatusService(
            AccountSnapshotService accounts,
            BillingPeriodResolver periods,
            TierCatalog catalog,
            UsageLedger ledger,
            Clock clock
    ) {
        this.accounts = accounts;
        this.periods = periods;
        this.catalog = catalog;
        this.ledger = ledger;
        this.clock = clock;
    }

    public BillingStatus status(UUID accountId) {
        AccountSnapshot account = accounts.load(accountId);
        BillingPeriod period = periods.resolve(account, clock.instant());
        QuotaLimits limits = account.effectiveLimits(catalog);

        Map<String, BillingStatus.Usage> usage = new LinkedHashMap<>();
        for (UsageType type : UsageType.values()) {
            long used = ledger.used(accountId, type, period);
            long limit = limits.limitFor(type);
            usage.put(type.code(), usage(used, limit));
        }

        String limitsVersion = account.entitledSubscription()
                .map(SubscriptionSnapshot::limitsVersion)
                .orElse(catalog.version());
        BillingStatus.Subscription subscription = account.subscription() == null ? null : subscription(account.subscription());

        return new BillingStatus(
                accountId,
                account.effectiveTier(),
                account.status(),
                limitsVersion,
                BillingStatus.Period.of(period),
                usage,
                subscription
        );
    }

    private static BillingStatus.Usage usage(long used, long limit) {
        if (QuotaLimits.isUnlimited(limit)) {
            return new BillingStatus.Usage(used, QuotaLimits.UNLIMITED, -1L, 0.0);
        }
        long remaining = Math.max(0L, limit - used);
        double percentage = limit == 0 ? 100.0 : Math.round(used * 1000.0 / limit) / 10.0;
        return new BillingStatus.Usage(used, limit, remaining, percentage);
    }

    private static BillingStatus.Subscription subscription(SubscriptionSnapshot s) {
        return new BillingStatus.Subscription(
                s.externalSubscriptionId(),
                s.externalCustomerId(),
                s.tier(),
                s.status(),
                s.nextBilledAt(),
                s.trialEnd(),
                s.customerPortalUrl()
        );
    }
}
