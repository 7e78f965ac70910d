package com.example.jduel.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Scratch state of a single question. A fresh instance is installed whenever the room
 * enters PLAYING, so nothing here survives into the next question.
 */
public class RoundState {

    private final Instant questionStartedAt;

    /** playerId → submitted answer, in arrival order. */
    private final Map<String, String> answers = new LinkedHashMap<>();

    /** playerId → points awarded this round. */
    private final Map<String, Integer> points = new LinkedHashMap<>();

    private int correctCount;

    /** Multiple-choice ordering, computed once per question. */
    private List<String> shuffledOptions;

    public RoundState() {
        this(null);
    }

    public RoundState(Instant questionStartedAt) {
        this.questionStartedAt = questionStartedAt;
    }

    public Instant getQuestionStartedAt() {
        return questionStartedAt;
    }

    /** Records the first answer of a player; later submissions are ignored (returns false). */
    public boolean recordAnswer(String playerId, String answer) {
        if (playerId == null || answers.containsKey(playerId)) return false;
        answers.put(playerId, answer == null ? "" : answer);
        return true;
    }

    public boolean hasAnswered(String playerId) {
        return answers.containsKey(playerId);
    }

    public Map<String, String> getAnswers() {
        return Collections.unmodifiableMap(answers);
    }

    public Map<String, Integer> getPoints() {
        return Collections.unmodifiableMap(points);
    }

    public int pointsOf(String playerId) {
        return points.getOrDefault(playerId, 0);
    }

    public void award(String playerId, int value) {
        points.put(playerId, value);
    }

    /** 1-based rank of the correct answer being scored now. */
    public int nextCorrectRank() {
        return ++correctCount;
    }

    public int getCorrectCount() {
        return correctCount;
    }

    public boolean hasShuffledOptions() {
        return shuffledOptions != null;
    }

    /** Returns the cached ordering, computing it on first use. */
    public List<String> shuffledOptions(Supplier<List<String>> shuffler) {
        if (shuffledOptions == null) {
            shuffledOptions = List.copyOf(shuffler.get());
        }
        return shuffledOptions;
    }
}
