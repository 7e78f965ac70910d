package com.example.jduel.service;

import com.example.jduel.config.GameProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic sweep for rooms nobody ever joined (or everybody left without a detach being seen),
 * plus stale rate-limit buckets.
 */
@Component
public class IdleRoomReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleRoomReaper.class);

    private final GameOrchestrator orchestrator;
    private final GameProperties properties;
    private final List<RateLimiter> limiters;

    public IdleRoomReaper(GameOrchestrator orchestrator, GameProperties properties, List<RateLimiter> limiters) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.limiters = limiters;
    }

    @Scheduled(fixedDelayString = "${app.game.reaper-interval-ms:60000}",
               initialDelayString = "${app.game.reaper-interval-ms:60000}")
    public void sweep() {
        orchestrator.reapIdle(properties.idleRoomTtl());
        for (RateLimiter limiter : limiters) {
            int evicted = limiter.evictIdle(properties.idleRoomTtl());
            if (evicted > 0) log.debug("Evicted {} idle buckets from {}", evicted, limiter.getName());
        }
    }
}
