package com.example.quotagate.billing;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable tier -> limits table built from {@link TierProperties} at startup.
 * Later edits to the configuration need a restart and never touch limits already
 * snapshotted onto subscriptions.
 */
@Component
public class TierCatalog {

    private final String version;
    private final Map<Tier, QuotaLimits> limits;
    private final Map<String, Tier> tiersByPriceId;

    public TierCatalog(TierProperties props) {
        this.version = props.getVersion();

        Map<Tier, QuotaLimits> byTier = new EnumMap<>(Tier.class);
        Map<String, Tier> byPrice = new HashMap<>();
        for (Tier tier : Tier.values()) {
            TierProperties.Plan plan = props.getPlans().get(tier.configKey());
            if (plan == null) {
                throw new IllegalStateException("No plan configured for tier " + tier
                        + " (admission.tiers.plans." + tier.configKey() + ")");
            }
            byTier.put(tier, new QuotaLimits(
                    plan.getApiCalls(),
                    plan.getExports(),
                    plan.getSentimentAnalysis(),
                    plan.getDataRetentionDays()
            ));
            for (String priceId : plan.getPriceIds()) {
                if (priceId == null || priceId.isBlank()) continue;
                Tier previous = byPrice.put(priceId.trim(), tier);
                if (previous != null && previous != tier) {
                    throw new IllegalStateException("Price id " + priceId + " mapped to both " + previous + " and " + tier);
                }
            }
        }
        this.limits = Collections.unmodifiableMap(byTier);
        this.tiersByPriceId = Collections.unmodifiableMap(byPrice);
    }

    public String version() {
        return version;
    }

    /** Every tier in declaration order. */
    public Map<Tier, QuotaLimits> all() {
        return limits;
    }

    /** Configured price ids of one tier, sorted. */
    public List<String> priceIds(Tier tier) {
        return tiersByPriceId.entrySet().stream()
                .filter(e -> e.getValue() == tier)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public QuotaLimits limits(Tier tier) {
        return limits.get(tier);
    }

    public Optional<Tier> tierForPriceId(String priceId) {
        if (priceId == null) return Optional.empty();
        return Optional.ofNullable(tiersByPriceId.get(priceId.trim()));
    }
}
