package com.example.quotagate.burst;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 1キー分のスライディングウィンドウ (スレッドセーフ)。
 * リクエスト時刻 (epoch ms) を古い順に保持する。時刻 {@code t} のエントリは
 * {@code t > now - window} の間だけ数える。
 */
final class SlidingWindow {

    private final Deque<Long> entries = new ArrayDeque<>();

    // 掃除でマップから外されたら lock 内で true にする
    private boolean retired;

    /**
     * 期限切れを落としてから、残りが {@code limit} 未満なら {@code now} を記録する。
     *
     * @return 掃除済みのウィンドウなら null (呼び出し側で新しいものを取り直す)
     */
    synchronized BurstDecision tryAcquire(Instant now, Duration window, int limit) {
        if (retired) return null;

        long nowMs = now.toEpochMilli();
        long windowMs = window.toMillis();
        evictUpTo(nowMs - windowMs);

        int count = entries.size();
        if (count < limit) {
            entries.addLast(nowMs);
            return BurstDecision.permitted(count + 1, limit);
        }

        long oldest = entries.isEmpty() ? nowMs : entries.peekFirst();
        long retryMs = Math.max(1L, oldest + windowMs - nowMs);
        return BurstDecision.denied(count, limit, Duration.ofMillis(retryMs));
    }

    /**
     * 期限切れを落とし、空になったらウィンドウを退役させる。
     *
     * @return 退役したら true
     */
    synchronized boolean retireIfEmpty(Instant now, Duration window) {
        evictUpTo(now.toEpochMilli() - window.toMillis());
        if (entries.isEmpty()) {
            retired = true;
        }
        return retired;
    }

    synchronized int size() {
        return entries.size();
    }

    private void evictUpTo(long cutoffMs) {
        while (!entries.isEmpty() && entries.peekFirst() <= cutoffMs) {
            entries.pollFirst();
        }
    }
}
