package com.example.jduel.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Room phases. Allowed moves:
 * WAITING → PLAYING → RESULTS → (PLAYING | FINISHED) → WAITING.
 */
public enum GameStatus {
    WAITING,
    PLAYING,
    RESULTS,
    FINISHED;

    public boolean canTransitionTo(GameStatus next) {
        if (next == null) return false;
        switch (this) {
            case WAITING:  return next == PLAYING;
            case PLAYING:  return next == RESULTS;
            case RESULTS:  return next == PLAYING || next == FINISHED;
            case FINISHED: return next == WAITING;
            default:       return false;
        }
    }

    /** Lower-case form used on the wire ("waiting", "playing", ...). */
    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
