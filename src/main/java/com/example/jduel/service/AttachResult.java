package com.example.jduel.service;

import org.springframework.web.socket.CloseStatus;

/** Outcome of binding a socket to a registered player; failures carry their close code. */
public enum AttachResult {
    ACCEPTED(null),
    ROOM_NOT_FOUND(new CloseStatus(4004, "Room not found")),
    NOT_REGISTERED(new CloseStatus(4003, "Player not registered")),
    INVALID_SESSION(new CloseStatus(4003, "Invalid session token")),
    ALREADY_CONNECTED(new CloseStatus(4009, "Player already connected"));

    private final CloseStatus closeStatus;

    AttachResult(CloseStatus closeStatus) {
        this.closeStatus = closeStatus;
    }

    public boolean accepted() {
        return this == ACCEPTED;
    }

    /** Null for {@link #ACCEPTED}. */
    public CloseStatus closeStatus() {
        return closeStatus;
    }
}
