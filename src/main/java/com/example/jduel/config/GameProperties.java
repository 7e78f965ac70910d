package com.example.jduel.config;

import com.example.jduel.model.Reaction;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Tunables under {@code app.game.*}. Anything left unset falls back to the defaults below.
 */
@ConfigurationProperties(prefix = "app.game")
public record GameProperties(
        Duration questionTime,
        Duration resultsTime,
        Duration cleanupTime,
        Integer questionsPerGame,
        Duration reactionCooldown,
        List<Reaction> reactions,
        Integer maxAnswerLength,
        Integer maxPlayerIdLength,
        Duration idleRoomTtl,
        RateLimits rateLimits
) {

    public static final List<Reaction> DEFAULT_REACTIONS = List.of(
            new Reaction(1, "👍"),
            new Reaction(2, "😂"),
            new Reaction(3, "😮"),
            new Reaction(4, "🔥"),
            new Reaction(5, "👏"),
            new Reaction(6, "🤯"));

    public GameProperties {
        if (questionTime == null) questionTime = Duration.ofSeconds(15);
        if (resultsTime == null) resultsTime = Duration.ofSeconds(10);
        if (cleanupTime == null) cleanupTime = Duration.ofSeconds(60);
        if (questionsPerGame == null || questionsPerGame < 1) questionsPerGame = 10;
        if (reactionCooldown == null) reactionCooldown = Duration.ofSeconds(3);
        reactions = (reactions == null || reactions.isEmpty()) ? DEFAULT_REACTIONS : List.copyOf(reactions);
        if (maxAnswerLength == null || maxAnswerLength < 1) maxAnswerLength = 200;
        if (maxPlayerIdLength == null || maxPlayerIdLength < 1) maxPlayerIdLength = 20;
        if (idleRoomTtl == null) idleRoomTtl = Duration.ofMinutes(10);
        if (rateLimits == null) rateLimits = new RateLimits(null, null, null);
    }

    /** All defaults; used by tests and as a fallback when nothing is bound. */
    public static GameProperties defaults() {
        return new GameProperties(null, null, null, null, null, null, null, null, null, null);
    }

    public boolean isKnownReaction(int reactionId) {
        return reactions.stream().anyMatch(r -> r.id() == reactionId);
    }

    /** Token-bucket settings: {@code capacity} requests per {@code window}. */
    public record Limit(int capacity, Duration window) {
        public Limit {
            if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
            if (window == null || window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("window must be positive");
            }
        }
    }

    public record RateLimits(Limit createRoom, Limit joinRoom, Limit messages) {
        public RateLimits {
            if (createRoom == null) createRoom = new Limit(10, Duration.ofMinutes(1));
            if (joinRoom == null) joinRoom = new Limit(20, Duration.ofMinutes(1));
            if (messages == null) messages = new Limit(30, Duration.ofSeconds(10));
        }
    }
}
