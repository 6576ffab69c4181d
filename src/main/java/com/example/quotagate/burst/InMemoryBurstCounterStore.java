package com.example.quotagate.burst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 単一インスタンス用のスライディングウィンドウ。
 * アプリ内メモリ (ConcurrentHashMap) にキーごとのウィンドウを保持し、各ウィンドウは自分のモニタで守る。
 *
 * store=memory のときはメインのストア、それ以外では Redis 障害時のフォールバックになる。
 * 他インスタンスとはカウントを共有しない。
 */
@Component
public class InMemoryBurstCounterStore implements BurstCounterStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBurstCounterStore.class);

    private final BurstProperties props;
    private final Clock clock;

    private final Map<String, SlidingWindow> windows = new ConcurrentHashMap<>();

    public InMemoryBurstCounterStore(BurstProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @Override
    public BurstDecision tryAcquire(String key, Instant now, Duration window, int limit) {
        while (true) {
            SlidingWindow w = windows.computeIfAbsent(key, k -> new SlidingWindow());
            BurstDecision decision = w.tryAcquire(now, window, limit);
            if (decision != null) {
                return decision;
            }
            // 取得から lock までの間に掃除された
            windows.remove(key, w);
        }
    }

    @Scheduled(
            fixedDelayString = "${admission.burst.sweep-interval:PT5M}",
            initialDelayString = "${admission.burst.sweep-interval:PT5M}"
    )
    public void sweep() {
        int removed = evictExpired(clock.instant());
        if (removed > 0) {
            log.debug("Swept {} empty burst windows", removed);
        }
    }

    int evictExpired(Instant now) {
        Duration window = props.getWindow();
        int removed = 0;
        for (Map.Entry<String, SlidingWindow> e : windows.entrySet()) {
            if (e.getValue().retireIfEmpty(now, window) && windows.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    int trackedKeys() {
        return windows.size();
    }
}
