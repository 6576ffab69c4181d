package com.example.quotagate.admission;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Breakdown of the recorded units of one account in its current billing period.
 * With sampled writes the figures follow the ledger, not the individual requests.
 *
 * @param daily     UTC day -> usage type -> units
 * @param endpoints endpoint class -> units, all usage types
 * @param totals    usage type -> units
 */
public record UsageAnalytics(
        UUID accountId,
        BillingStatus.Period period,
        Map<LocalDate, Map<String, Long>> daily,
        Map<String, Long> endpoints,
        Map<String, Long> totals,
        Trends trends
) {

    /**
     * @param averageDaily     units per elapsed day of the period
     * @param projectedPeriod  average daily units times the period length in days
     * @param busiestDay       null when nothing was recorded
     * @param mostUsedEndpoint null when nothing was recorded
     */
    public record Trends(
            Map<String, Double> averageDaily,
            Map<String, Long> projectedPeriod,
            LocalDate busiestDay,
            String mostUsedEndpoint
    ) {}
}
