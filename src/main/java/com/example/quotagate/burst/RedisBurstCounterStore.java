package com.example.quotagate.burst;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Redis の sorted set (score = リクエスト時刻) によるスライディングウィンドウ。
 *
 * 古いエントリの削除・件数チェック・追加を Lua スクリプト1回でまとめて実行するので、
 * 複数インスタンスが同時に最後の1枠を取り合っても通るのは1つだけ。
 *
 * 時刻は Redis サーバーの TIME を使う。インスタンスごとの時計のズレで
 * 他インスタンスのエントリを早く消してしまうことがない。
 */
@Component
@ConditionalOnProperty(prefix = "admission.burst", name = "store", havingValue = "redis")
public class RedisBurstCounterStore implements BurstCounterStore {

    private static final String SCRIPT = """
        -- KEYS[1] : counter key ("{account}:{endpointClass}")
        -- ARGV[1] : window (ms)
        -- ARGV[2] : limit
        -- ARGV[3] : unique member for this request

        local key = KEYS[1]
        local window_ms = tonumber(ARGV[1])
        local limit = tonumber(ARGV[2])

        -- use server time to avoid client clock skew
        local t = redis.call('TIME')
        local now_ms = t[1] * 1000 + math.floor(t[2] / 1000)

        -- entries at or before now - window are outside the window
        redis.call('ZREMRANGEBYSCORE', key, '-inf', now_ms - window_ms)

        local count = redis.call('ZCARD', key)
        if count < limit then
          redis.call('ZADD', key, now_ms, ARGV[3])
          redis.call('PEXPIRE', key, window_ms)
          return {1, count + 1, 0}
        end

        local retry_ms = 1
        local oldest = redis.call('ZRANGE', key, 0, 0, 'WITHSCORES')
        if oldest[2] then
          retry_ms = math.max(1, tonumber(oldest[2]) + window_ms - now_ms)
        end
        return {0, count, retry_ms}
        """;

    private final StringRedisTemplate redis;

    private final DefaultRedisScript<List> luaScript =
            new DefaultRedisScript<>(SCRIPT, List.class);

    public RedisBurstCounterStore(StringRedisTemplate redisTemplate) {
        this.redis = redisTemplate;
    }

    /** {@code now} は使わない（Redis サーバー時刻で判定する）。 */
    @Override
    public BurstDecision tryAcquire(String key, Instant now, Duration window, int limit) {
        List<?> res;
        try {
            // execute(script, keys, args...)
            res = redis.execute(
                    luaScript,
                    Collections.singletonList(key),
                    String.valueOf(window.toMillis()),
                    String.valueOf(limit),
                    UUID.randomUUID().toString()
            );
        } catch (DataAccessException e) {
            throw new CounterStoreUnavailableException("Redis burst counter unavailable", e);
        }

        if (res == null || res.size() < 3) {
            throw new CounterStoreUnavailableException("Unexpected burst script result: " + res, null);
        }

        boolean permitted = toLong(res.get(0)) == 1L;
        int count = (int) toLong(res.get(1));
        if (permitted) {
            return BurstDecision.permitted(count, limit);
        }
        return BurstDecision.denied(count, limit, Duration.ofMillis(toLong(res.get(2))));
    }

    String scriptText() {
        return luaScript.getScriptAsString();
    }

    private long toLong(Object o) {
        if (o instanceof Number n) return n.longValue();
        return Long.parseLong(String.valueOf(o));
    }
}
