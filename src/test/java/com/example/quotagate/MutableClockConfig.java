package com.example.quotagate;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;

/** Replaces the system clock with a {@link MutableClock} starting mid-March 2025. */
@TestConfiguration
public class MutableClockConfig {

    public static final Instant START = Instant.parse("2025-03-14T10:00:00Z");

    @Bean
    @Primary
    MutableClock testClock() {
        return new MutableClock(START);
    }
}
