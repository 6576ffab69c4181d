package com.example.quotagate.burst;

import java.time.Duration;
import java.time.Instant;

/**
 * キーごとのスライディングウィンドウカウンタ。
 * 期限切れエントリの削除と件数チェックと追加は、キー単位で1つのアトミックな操作として行う。
 */
public interface BurstCounterStore {

    /**
     * @param now 呼び出し元の時刻。自前の時計を持つストア (Redis) は使わないことがある
     * @throws CounterStoreUnavailableException ストアに到達できないとき
     */
    BurstDecision tryAcquire(String key, Instant now, Duration window, int limit);
}
