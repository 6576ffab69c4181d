package com.example.quotagate.admission;

import com.example.quotagate.billing.QuotaLimits;

import java.util.List;
import java.util.Map;

/** Tier key ({@code free}, {@code pro}, ...) to its current limits. */
public record TierListing(String version, Map<String, Entry> tiers) {

    public record Entry(QuotaLimits limits, List<String> priceIds) {}
}
