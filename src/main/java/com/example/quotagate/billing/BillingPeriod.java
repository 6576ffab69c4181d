package com.example.quotagate.billing;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open accounting window {@code [start, end)}.
 *
 * @param stale true when the account has an entitled subscription whose stored
 *              bounds were missing or already over, and the calendar month was used instead
 */
public record BillingPeriod(Instant start, Instant end, Source source, boolean stale) {

    public enum Source {
        CALENDAR_MONTH,
        SUBSCRIPTION
    }

    public BillingPeriod {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(source, "source");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("billing period end " + end + " must be after start " + start);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
