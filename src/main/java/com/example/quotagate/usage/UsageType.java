package com.example.quotagate.usage;

import java.util.Locale;

/** Billable action category, tracked against its own monthly limit. */
public enum UsageType {
    API_CALLS("api_calls"),
    EXPORTS("exports"),
    SENTIMENT_ANALYSIS("sentiment_analysis");

    private final String code;

    UsageType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Accepts the wire code ({@code api_calls}) or the constant name. */
    public static UsageType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("usage type is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (UsageType t : values()) {
            if (t.code.equals(v)) return t;
        }
        throw new IllegalArgumentException("unknown usage type: " + value);
    }
}
