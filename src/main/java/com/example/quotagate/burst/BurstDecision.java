package com.example.quotagate.burst;

import java.time.Duration;

/**
 * バーストチェック1回分の結果。
 *
 * @param currentCount この呼び出し後のウィンドウ内件数 (許可時は今回のリクエストを含む)
 * @param retryAfter   最古のエントリがウィンドウから抜けるまでの時間。許可時は0
 */
public record BurstDecision(boolean permitted, int currentCount, int limit, Duration retryAfter) {

    public static BurstDecision permitted(int currentCount, int limit) {
        return new BurstDecision(true, currentCount, limit, Duration.ZERO);
    }

    public static BurstDecision denied(int currentCount, int limit, Duration retryAfter) {
        return new BurstDecision(false, currentCount, limit, retryAfter);
    }

    /** Retry-After (秒)。切り上げで、拒否時は最低1秒。 */
    public long retryAfterSeconds() {
        if (permitted) return 0L;
        long ms = retryAfter.toMillis();
        return Math.max(1L, (ms + 999L) / 1000L);
    }
}
