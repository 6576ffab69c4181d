package com.example.quotagate.burst;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * (アカウント, エンドポイント種別) ごとの短時間リクエスト制限。
 *
 * 共有ストアが設定されていればそちらで数える。ストアが例外を投げたら
 * {@link FailMode} に従う (ローカルで数える / 許可 / 拒否)。ストアの障害は呼び出し元に漏らさない。
 */
@Service
public class BurstLimiter {

    private static final Logger log = LoggerFactory.getLogger(BurstLimiter.class);

    private final BurstProperties props;
    private final BurstCounterStore shared;
    private final InMemoryBurstCounterStore local;
    private final Counter allowedCounter;
    private final Counter deniedCounter;
    private final Counter fallbackCounter;

    private final AtomicBoolean degraded = new AtomicBoolean(false);

    @Autowired
    public BurstLimiter(
            BurstProperties props,
            InMemoryBurstCounterStore local,
            ObjectProvider<RedisBurstCounterStore> redisStore,
            MeterRegistry registry
    ) {
        this(props, redisStore.getIfAvailable(), local, registry);
    }

    /**
     * @param shared インスタンス間で共有するストア。null ならインスタンス内だけで数える
     */
    public BurstLimiter(
            BurstProperties props,
            BurstCounterStore shared,
            InMemoryBurstCounterStore local,
            MeterRegistry registry
    ) {
        this.props = props;
        this.shared = shared;
        this.local = local;
        this.allowedCounter = Counter.builder("burst_requests_total")
                .tag("outcome", "allowed")
                .register(registry);
        this.deniedCounter = Counter.builder("burst_requests_total")
                .tag("outcome", "denied")
                .register(registry);
        this.fallbackCounter = Counter.builder("burst_store_fallback_total")
                .register(registry);
    }

    public BurstDecision allow(String accountId, String endpointClass, Instant now) {
        String key = key(accountId, endpointClass);
        int limit = props.limitFor(endpointClass);
        Duration window = props.getWindow();

        BurstDecision decision = shared == null
                ? local.tryAcquire(key, now, window, limit)
                : acquireShared(key, now, window, limit);

        if (decision.permitted()) allowedCounter.increment(); else deniedCounter.increment();
        return decision;
    }

    public Duration window() {
        return props.getWindow();
    }

    String key(String accountId, String endpointClass) {
        return props.getKeyPrefix() + accountId + ":" + endpointClass;
    }

    private BurstDecision acquireShared(String key, Instant now, Duration window, int limit) {
        try {
            BurstDecision decision = shared.tryAcquire(key, now, window, limit);
            if (degraded.compareAndSet(true, false)) {
                log.info("Burst counter store recovered, shared counting resumed");
            }
            return decision;
        } catch (CounterStoreUnavailableException e) {
            fallbackCounter.increment();
            if (degraded.compareAndSet(false, true)) {
                log.warn("Burst counter store unavailable, failure mode {}: {}",
                        props.getFailureMode(), e.getMessage());
            }
            return onStoreDown(key, now, window, limit);
        }
    }

    private BurstDecision onStoreDown(String key, Instant now, Duration window, int limit) {
        return switch (props.getFailureMode()) {
            case FALLBACK -> local.tryAcquire(key, now, window, limit);
            case OPEN -> BurstDecision.permitted(0, limit);
            case CLOSED -> BurstDecision.denied(0, limit, Duration.ofSeconds(1));
        };
    }
}
