package com.example.jduel.service;

import com.example.jduel.config.GameProperties;
import com.example.jduel.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-01T00:00:00Z"));
        limiter = new RateLimiter("join", new GameProperties.Limit(3, Duration.ofSeconds(30)), clock);
    }

    @Test
    void burstUpToCapacity() {
        assertTrue(limiter.tryAcquire("a"));
        assertTrue(limiter.tryAcquire("a"));
        assertTrue(limiter.tryAcquire("a"));
        assertFalse(limiter.tryAcquire("a"));
        assertEquals(0, limiter.remaining("a"));
    }

    @Test
    void keysAreIndependent() {
        for (int i = 0; i < 3; i++) limiter.tryAcquire("a");
        assertTrue(limiter.tryAcquire("b"));
        assertEquals(3, limiter.remaining("c"));
    }

    @Test
    void refillsOverTime() {
        for (int i = 0; i < 3; i++) limiter.tryAcquire("a");

        clock.advance(Duration.ofSeconds(9));
        assertFalse(limiter.tryAcquire("a"));

        clock.advance(Duration.ofSeconds(2));
        assertTrue(limiter.tryAcquire("a"));

        clock.advance(Duration.ofMinutes(5));
        assertEquals(3, limiter.remaining("a"));
    }

    @Test
    void checkOrThrowCarriesRetryHint() {
        for (int i = 0; i < 3; i++) limiter.checkOrThrow("a");
        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class, () -> limiter.checkOrThrow("a"));
        assertEquals(10, ex.getRetryAfterSeconds());
    }

    @Test
    void resetAndEviction() {
        limiter.tryAcquire("a");
        limiter.tryAcquire("b");
        limiter.reset("a");
        assertEquals(1, limiter.size());

        clock.advance(Duration.ofMinutes(2));
        limiter.tryAcquire("c");
        assertEquals(1, limiter.evictIdle(Duration.ofMinutes(1)));
        assertEquals(1, limiter.size());
    }
}
