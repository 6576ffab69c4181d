package com.example.quotagate.billing;

import com.example.quotagate.usage.UsageType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Monthly limits of one tier, copied onto a subscription when the tier is assigned.
 * {@link #UNLIMITED} disables the check for that usage type.
 */
@Embeddable
public class QuotaLimits {

    public static final long UNLIMITED = -1L;

    @Column(name = "monthly_api_calls_limit", nullable = false)
    private long apiCalls;

    @Column(name = "monthly_exports_limit", nullable = false)
    private long exports;

    @Column(name = "monthly_sentiment_limit", nullable = false)
    private long sentimentAnalysis;

    @Column(name = "data_retention_days", nullable = false)
    private int dataRetentionDays;

    protected QuotaLimits() {}

    public QuotaLimits(long apiCalls, long exports, long sentimentAnalysis, int dataRetentionDays) {
        this.apiCalls = apiCalls;
        this.exports = exports;
        this.sentimentAnalysis = sentimentAnalysis;
        this.dataRetentionDays = dataRetentionDays;
    }

    public long limitFor(UsageType type) {
        return switch (type) {
            case API_CALLS -> apiCalls;
            case EXPORTS -> exports;
            case SENTIMENT_ANALYSIS -> sentimentAnalysis;
        };
    }

    public static boolean isUnlimited(long limit) {
        return limit < 0;
    }

    public long getApiCalls() { return apiCalls; }
    public long getExports() { return exports; }
    public long getSentimentAnalysis() { return sentimentAnalysis; }
    public int getDataRetentionDays() { return dataRetentionDays; }

    @Override
    public String toString() {
        return "QuotaLimits{apiCalls=" + apiCalls + ", exports=" + exports
                + ", sentimentAnalysis=" + sentimentAnalysis + ", dataRetentionDays=" + dataRetentionDays + "}";
    }
}
