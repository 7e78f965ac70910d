package com.example.jduel.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Host-selectable difficulty; each maps to an inclusive range of question levels. */
public enum Difficulty {
    ENJOYER("enjoyer", 1, 2),
    NERD("nerd", 3, 4),
    BEAST("beast", 4, 5);

    public static final Difficulty DEFAULT = ENJOYER;

    private final String id;
    private final int minLevel;
    private final int maxLevel;

    Difficulty(String id, int minLevel, int maxLevel) {
        this.id = id;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
    }

    @JsonValue
    public String id() { return id; }

    public int minLevel() { return minLevel; }

    public int maxLevel() { return maxLevel; }

    public boolean accepts(int level) {
        return level >= minLevel && level <= maxLevel;
    }

    public static Optional<Difficulty> fromId(String raw) {
        if (raw == null) return Optional.empty();
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (Difficulty d : values()) {
            if (d.id.equals(key)) return Optional.of(d);
        }
        return Optional.empty();
    }
}
