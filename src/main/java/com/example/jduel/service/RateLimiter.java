package com.example.jduel.service;

import com.example.jduel.config.GameProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket per key (client IP, socket id, ...). A bucket holds up to {@code capacity}
 * tokens and refills continuously at {@code capacity / window}.
 */
public class RateLimiter {

    private record Bucket(double tokens, Instant updatedAt, boolean granted) { }

    private final String name;
    private final int capacity;
    private final long windowMillis;
    private final double refillPerMilli;
    private final Clock clock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimiter(String name, GameProperties.Limit limit, Clock clock) {
        this.name = name;
        this.capacity = limit.capacity();
        this.windowMillis = limit.window().toMillis();
        this.refillPerMilli = (double) limit.capacity() / windowMillis;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    /** Consumes one token if available. */
    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        Bucket b = buckets.compute(key, (k, old) -> {
            double tokens = refilled(old, now);
            return (tokens >= 1.0)
                    ? new Bucket(tokens - 1.0, now, true)
                    : new Bucket(tokens, now, false);
        });
        return b.granted();
    }

    /** @throws RateLimitExceededException when no token is left */
    public void checkOrThrow(String key) {
        if (!tryAcquire(key)) {
            throw new RateLimitExceededException(retryAfterSeconds());
        }
    }

    /** Seconds until one token is back, rounded up (at least 1). */
    public long retryAfterSeconds() {
        long perTokenMillis = windowMillis / capacity;
        return Math.max(1L, (perTokenMillis + 999) / 1000);
    }

    public int remaining(String key) {
        Bucket b = buckets.get(key);
        return (int) Math.floor(refilled(b, clock.instant()));
    }

    public void reset(String key) {
        buckets.remove(key);
    }

    /** Drops buckets untouched for longer than {@code idle}; a full bucket behaves like a missing one. */
    public int evictIdle(Duration idle) {
        Instant cutoff = clock.instant().minus(idle);
        int before = buckets.size();
        buckets.entrySet().removeIf(e -> e.getValue().updatedAt().isBefore(cutoff));
        return before - buckets.size();
    }

    public int size() {
        return buckets.size();
    }

    private double refilled(Bucket b, Instant now) {
        if (b == null) return capacity;
        long elapsed = Math.max(0L, Duration.between(b.updatedAt(), now).toMillis());
        return Math.min(capacity, b.tokens() + elapsed * refillPerMilli);
    }
}
