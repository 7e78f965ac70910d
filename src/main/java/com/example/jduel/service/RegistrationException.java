package com.example.jduel.service;

/** A lobby request that cannot be served; carries the code the API reports. */
public class RegistrationException extends RuntimeException {

    private final ErrorCode code;

    public RegistrationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static RegistrationException roomNotFound(String roomCode) {
        return new RegistrationException(ErrorCode.ROOM_NOT_FOUND, "Room " + roomCode + " not found");
    }
}
