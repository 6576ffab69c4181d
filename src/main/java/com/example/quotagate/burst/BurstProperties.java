package com.example.quotagate.burst;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * バーストリミッターの設定値。
 *
 * store:
 *   "memory" -> インスタンス内のスライディングウィンドウだけを使う (単一インスタンス)
 *   "redis"  -> Redis の sorted set で共有し、インスタンス内のウィンドウはフォールバック用
 *
 * failureMode:
 *   共有ストアに届かないときの振る舞い
 */
@ConfigurationProperties(prefix = "admission.burst")
public class BurstProperties {

    /** "memory" (デフォルト) or "redis" */
    private String store = "memory";

    /** スライディングウィンドウの長さ */
    private Duration window = Duration.ofMinutes(5);

    /** {@link #limits} に無いエンドポイント種別の上限 */
    private int defaultLimit = 20;

    /** エンドポイント種別ごとの、1ウィンドウあたりのリクエスト上限 */
    private Map<String, Integer> limits = new HashMap<>();

    /** カウンタキーの接頭辞。空ならキーはそのまま {@code account:endpointClass} */
    private String keyPrefix = "";

    /**
     * 共有ストア障害時の振る舞い:
     *  - FALLBACK: インスタンス内のウィンドウで数える (インスタンス間で共有されない)
     *  - OPEN: 許可方向
     *  - CLOSED: 拒否方向
     */
    private FailMode failureMode = FailMode.FALLBACK;

    /** 空になったインスタンス内ウィンドウを掃除する間隔 (ISO-8601, 例: PT5M) */
    private Duration sweepInterval = Duration.ofMinutes(5);

    public int limitFor(String endpointClass) {
        Integer limit = limits.get(endpointClass);
        return limit != null ? limit : defaultLimit;
    }

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }

    public Duration getWindow() { return window; }
    public void setWindow(Duration window) { this.window = window; }

    public int getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

    public Map<String, Integer> getLimits() { return limits; }
    public void setLimits(Map<String, Integer> limits) { this.limits = limits; }

    public String getKeyPrefix() { return keyPrefix; }
    public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

    public FailMode getFailureMode() { return failureMode; }
    public void setFailureMode(FailMode failureMode) { this.failureMode = failureMode; }

    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
}
