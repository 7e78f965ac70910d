package com.example.jduel.model.message;

import com.example.jduel.model.state.RoomStateView;

/** Frames pushed to clients. Each carries its own {@code type} discriminator. */
public final class ServerMessages {

    public static final String ROOM_STATE = "ROOM_STATE";
    public static final String REACTION = "REACTION";
    public static final String ERROR = "ERROR";
    public static final String ROOM_CLOSED = "ROOM_CLOSED";

    private ServerMessages() {
    }

    public record RoomState(String type, RoomStateView roomState) {
    }

    public record Reaction(String type, String playerId, int reactionId) {
    }

    public record Error(String type, String message) {
    }

    public record RoomClosed(String type) {
    }

    public static RoomState roomState(RoomStateView view) {
        return new RoomState(ROOM_STATE, view);
    }

    public static Reaction reaction(String playerId, int reactionId) {
        return new Reaction(REACTION, playerId, reactionId);
    }

    public static Error error(String message) {
        return new Error(ERROR, message);
    }

    public static RoomClosed roomClosed() {
        return new RoomClosed(ROOM_CLOSED);
    }
}
