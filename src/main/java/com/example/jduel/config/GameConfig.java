package com.example.jduel.config;

import com.example.jduel.service.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(GameProperties.class)
public class GameConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random random() {
        return new SecureRandom();
    }

    /** Delays only; expiry work is handed to the room mailboxes. */
    @Bean(name = "gameTimers", destroyMethod = "shutdownNow")
    public ScheduledExecutorService gameTimers() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "game-timers");
            t.setDaemon(true);
            return t;
        });
    }

    /** Drains room mailboxes; one room is never drained by two threads at once. */
    @Bean(name = "roomWorker", destroyMethod = "shutdown")
    public ExecutorService roomWorker() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "room-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public RateLimiter createRoomLimiter(GameProperties properties, Clock clock) {
        return new RateLimiter("create-room", properties.rateLimits().createRoom(), clock);
    }

    @Bean
    public RateLimiter joinRoomLimiter(GameProperties properties, Clock clock) {
        return new RateLimiter("join-room", properties.rateLimits().joinRoom(), clock);
    }

    @Bean
    public RateLimiter messageLimiter(GameProperties properties, Clock clock) {
        return new RateLimiter("ws-messages", properties.rateLimits().messages(), clock);
    }
}
