package com.example.jduel.service;

import com.example.jduel.config.GameProperties;
import com.example.jduel.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class IdleRoomReaperTest {

    @Test
    void sweepReapsRoomsAndEvictsBuckets() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        GameProperties properties = GameProperties.defaults();
        RateLimiter limiter = new RateLimiter("join", new GameProperties.Limit(5, Duration.ofMinutes(1)), clock);
        limiter.tryAcquire("10.0.0.1");
        GameOrchestrator orchestrator = mock(GameOrchestrator.class);

        IdleRoomReaper reaper = new IdleRoomReaper(orchestrator, properties, List.of(limiter));
        clock.advance(properties.idleRoomTtl().plusSeconds(1));
        reaper.sweep();

        verify(orchestrator).reapIdle(properties.idleRoomTtl());
        assertEquals(0, limiter.size());
    }
}
