package com.example.quotagate.usage;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Period;
import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "admission.usage")
public class UsageProperties {

    /**
     * 利用種別ごとの台帳書き込みサンプリング (キー: {@code api-calls}, {@code exports}, ...)。
     *  - 1: 毎リクエスト書く
     *  - N > 1: 最大 N 単位分を1行で先払いし (上限は超えない)、後続のリクエストはそこから引く。
     *    台帳は実利用より先行することはあっても遅れることはない
     */
    private Map<String, Integer> sampleRates = new HashMap<>();

    /** 請求期間が終わってから利用記録を残しておく期間 */
    private Period retention = Period.ofDays(400);

    private Duration purgeInterval = Duration.ofHours(1);

    public int sampleRateFor(UsageType type) {
        Integer rate = sampleRates.get(type.code().replace('_', '-'));
        if (rate == null) rate = sampleRates.get(type.code());
        return rate == null || rate < 1 ? 1 : rate;
    }

    public Map<String, Integer> getSampleRates() { return sampleRates; }
    public void setSampleRates(Map<String, Integer> sampleRates) { this.sampleRates = sampleRates; }

    public Period getRetention() { return retention; }
    public void setRetention(Period retention) { this.retention = retention; }

    public Duration getPurgeInterval() { return purgeInterval; }
    public void setPurgeInterval(Duration purgeInterval) { this.purgeInterval = purgeInterval; }
}
