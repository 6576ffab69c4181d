package com.example.quotagate.billing;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * プランごとの上限テーブル。キーは小文字のプラン名。起動時に1回だけ読む。
 * 上限 -1 は無制限。
 */
@ConfigurationProperties(prefix = "admission.tiers")
public class TierProperties {

    /** このテーブルの版。サブスクリプションに写した上限と一緒に保存する */
    private String version = "unversioned";

    private Map<String, Plan> plans = new HashMap<>();

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public Map<String, Plan> getPlans() { return plans; }
    public void setPlans(Map<String, Plan> plans) { this.plans = plans; }

    public static class Plan {
        private long apiCalls;
        private long exports;
        private long sentimentAnalysis;
        private int dataRetentionDays = 30;

        /** このプランとして売っている決済側の price id */
        private List<String> priceIds = new ArrayList<>();

        public long getApiCalls() { return apiCalls; }
        public void setApiCalls(long apiCalls) { this.apiCalls = apiCalls; }

        public long getExports() { return exports; }
        public void setExports(long exports) { this.exports = exports; }

        public long getSentimentAnalysis() { return sentimentAnalysis; }
        public void setSentimentAnalysis(long sentimentAnalysis) { this.sentimentAnalysis = sentimentAnalysis; }

        public int getDataRetentionDays() { return dataRetentionDays; }
        public void setDataRetentionDays(int dataRetentionDays) { this.dataRetentionDays = dataRetentionDays; }

        public List<String> getPriceIds() { return priceIds; }
        public void setPriceIds(List<String> priceIds) { this.priceIds = priceIds; }
    }
}
