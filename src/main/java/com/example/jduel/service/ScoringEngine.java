package com.example.jduel.service;

import org.springframework.stereotype.Component;

/**
 * Arrival-order scoring: the fastest correct answer gets {@value #BASE_POINTS}, every following
 * correct answer half of the previous one (rounded down, never below {@value #FLOOR_POINTS}).
 * Wrong or missing answers get 0.
 */
@Component
public class ScoringEngine {

    public static final int BASE_POINTS = 1000;
    public static final int FLOOR_POINTS = 1;

    /**
     * @param correct verdict of the answer verifier
     * @param rank    1-based position of this answer among the round's correct answers (ignored when wrong)
     */
    public int points(boolean correct, int rank) {
        if (!correct) return 0;
        if (rank < 1) throw new IllegalArgumentException("rank must be >= 1, was " + rank);
        int shift = Math.min(rank - 1, 31);
        return Math.max(FLOOR_POINTS, BASE_POINTS >> shift);
    }
}
