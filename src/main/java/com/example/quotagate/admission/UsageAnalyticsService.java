package com.example.quotagate.admission;

import com.example.quotagate.account.AccountSnapshot;
import com.example.quotagate.account.AccountSnapshotService;
import com.example.quotagate.billing.BillingPeriod;
import com.example.quotagate.billing.BillingPeriodResolver;
import com.example.quotagate.usage.UsageLedger;
import com.example.quotagate.usage.UsageRecord;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@Service
public class UsageAnalyticsService {

    static final String UNKNOWN_ENDPOINT = "unknown";

    private final AccountSnapshotService accounts;
    private final BillingPeriodResolver periods;
    private final UsageLedger ledger;
    private final Clock clock;

    public UsageAnalyticsService(
            AccountSnapshotService accounts,
            BillingPeriodResolver periods,
            UsageLedger ledger,
            Clock clock
    ) {
        this.accounts = accounts;
        this.periods = periods;
        this.ledger = ledger;
        this.clock = clock;
    }

    public UsageAnalytics analytics(UUID accountId) {
        AccountSnapshot account = accounts.load(accountId);
        Instant now = clock.instant();
        BillingPeriod period = periods.resolve(account, now);
        List<UsageRecord> records = ledger.records(accountId, period);

        Map<LocalDate, Map<String, Long>> daily = new TreeMap<>();
        Map<String, Long> endpoints = new TreeMap<>();
        Map<String, Long> totals = new TreeMap<>();
        Map<LocalDate, Long> perDay = new TreeMap<>();
        for (UsageRecord r : records) {
            LocalDate day = LocalDate.ofInstant(r.getCreatedAt(), ZoneOffset.UTC);
            String type = r.getUsageType().code();
            String endpoint = r.getEndpointClass() == null ? UNKNOWN_ENDPOINT : r.getEndpointClass();

            daily.computeIfAbsent(day, d -> new TreeMap<>()).merge(type, r.getCostUnits(), Long::sum);
            endpoints.merge(endpoint, r.getCostUnits(), Long::sum);
            totals.merge(type, r.getCostUnits(), Long::sum);
            perDay.merge(day, r.getCostUnits(), Long::sum);
        }

        return new UsageAnalytics(
                accountId,
                BillingStatus.Period.of(period),
                daily,
                endpoints,
                totals,
                trends(period, now, totals, perDay, endpoints)
        );
    }

    private static UsageAnalytics.Trends trends(
            BillingPeriod period,
            Instant now,
            Map<String, Long> totals,
            Map<LocalDate, Long> perDay,
            Map<String, Long> endpoints
    ) {
        Instant elapsedUntil = now.isBefore(period.end()) ? now : period.end();
        long elapsedDays = Math.max(1L, daysBetween(period.start(), elapsedUntil));
        long periodDays = Math.max(1L, daysBetween(period.start(), period.end()));

        Map<String, Double> averageDaily = new LinkedHashMap<>();
        Map<String, Long> projected = new LinkedHashMap<>();
        totals.forEach((type, units) -> {
            double avg = (double) units / elapsedDays;
            averageDaily.put(type, Math.round(avg * 100.0) / 100.0);
            projected.put(type, Math.round(avg * periodDays));
        });

        return new UsageAnalytics.Trends(averageDaily, projected, maxKey(perDay), maxKey(endpoints));
    }

    // rounds a partial day up
    private static long daysBetween(Instant from, Instant to) {
        Duration d = Duration.between(from, to);
        long days = d.toDays();
        return d.minusDays(days).isZero() ? days : days + 1;
    }

    // first key wins on ties; keys are sorted
    private static <K> K maxKey(Map<K, Long> values) {
        K best = null;
        long max = Long.MIN_VALUE;
        for (Map.Entry<K, Long> e : values.entrySet()) {
            if (e.getValue() > max) {
                best = e.getKey();
                max = e.getValue();
            }
        }
        return best;
    }
}
