package com.example.jduel.service;

/** Per-room timer slots; at most one pending timer per kind. */
public enum TimerKind {
    QUESTION,
    RESULTS,
    CLEANUP
}
