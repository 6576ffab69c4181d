package com.example.quotagate.billing;

import java.util.Locale;

public enum Tier {
    FREE,
    PRO,
    ENTERPRISE;

    /** Key of this tier under {@code admission.tiers.plans}. */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String headerValue() {
        return configKey();
    }
}
