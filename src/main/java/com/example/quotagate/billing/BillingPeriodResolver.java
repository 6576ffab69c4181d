package com.example.quotagate.billing;

import com.example.quotagate.account.AccountSnapshot;
import com.example.quotagate.account.SubscriptionSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Accounting window for quota checks. Pure: the same snapshot and instant always
 * give the same period.
 *
 * No entitled subscription: the UTC calendar month containing {@code now}.
 * Entitled subscription: its current period bounds, unless they are missing or
 * already over, in which case the calendar month is used and the result is
 * flagged stale.
 */
@Component
public class BillingPeriodResolver {

    public BillingPeriod resolve(AccountSnapshot account, Instant now) {
        Optional<SubscriptionSnapshot> subscription = account.entitledSubscription();
        if (subscription.isEmpty()) {
            return calendarMonth(now, false);
        }

        Instant start = subscription.get().currentPeriodStart();
        Instant end = subscription.get().currentPeriodEnd();
        if (start == null || end == null || !end.isAfter(start) || !end.isAfter(now)) {
            return calendarMonth(now, true);
        }
        return new BillingPeriod(start, end, BillingPeriod.Source.SUBSCRIPTION, false);
    }

    static BillingPeriod calendarMonth(Instant now, boolean stale) {
        LocalDate first = now.atOffset(ZoneOffset.UTC).toLocalDate().withDayOfMonth(1);
        Instant start = first.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = first.plusMonths(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return new BillingPeriod(start, end, BillingPeriod.Source.CALENDAR_MONTH, stale);
    }
}
