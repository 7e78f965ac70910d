package com.example.jduel.model;

/** Host-controlled settings; only changeable while the room is WAITING. */
public record RoomConfig(Difficulty difficulty, boolean multipleChoiceEnabled) {

    public static final RoomConfig DEFAULT = new RoomConfig(Difficulty.DEFAULT, false);

    public RoomConfig {
        if (difficulty == null) difficulty = Difficulty.DEFAULT;
    }

    public RoomConfig withDifficulty(Difficulty d) {
        return new RoomConfig(d, multipleChoiceEnabled);
    }

    public RoomConfig withMultipleChoice(boolean enabled) {
        return new RoomConfig(difficulty, enabled);
    }
}
