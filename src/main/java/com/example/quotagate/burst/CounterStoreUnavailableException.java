package com.example.quotagate.burst;

/** 共有カウンタストアの障害。BurstLimiter が吸収し、呼び出し元には投げない。 */
public class CounterStoreUnavailableException extends RuntimeException {

    public CounterStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
