package com.example.jduel.handler;

/** A client frame that cannot be decoded into a command; answered with an ERROR frame. */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
