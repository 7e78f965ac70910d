package com.example.jduel.model.message;

import java.util.Optional;

/** Command frames a client may send over the game socket. */
public enum ClientMessageType {
    START_GAME,
    ANSWER,
    UPDATE_CONFIG,
    REACTION,
    PLAY_AGAIN;

    public static Optional<ClientMessageType> fromWire(String raw) {
        if (raw == null) return Optional.empty();
        for (ClientMessageType t : values()) {
            if (t.name().equals(raw.trim())) return Optional.of(t);
        }
        return Optional.empty();
    }
}
