package com.example.jduel.service;

import org.springframework.http.HttpStatus;

/** Failure codes of the HTTP lobby API and the status each maps to. */
public enum ErrorCode {
    ROOM_NOT_FOUND(HttpStatus.NOT_FOUND),
    NAME_TAKEN(HttpStatus.CONFLICT),
    GAME_STARTED(HttpStatus.CONFLICT),
    INVALID_SESSION(HttpStatus.FORBIDDEN),
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
