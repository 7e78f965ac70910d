package com.example.jduel.model;

import java.util.List;

/**
 * A trivia question as loaded from the question bank. Immutable.
 * {@code wrongAnswers} are the distractors shown in multiple-choice mode (may be empty).
 */
public record Question(String text, String category, String answer, int difficulty, List<String> wrongAnswers) {

    public Question {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Question text cannot be empty");
        if (answer == null || answer.isBlank()) throw new IllegalArgumentException("Question answer cannot be empty");
        if (category == null || category.isBlank()) throw new IllegalArgumentException("Question category cannot be empty");
        wrongAnswers = (wrongAnswers == null) ? List.of() : List.copyOf(wrongAnswers);
    }

    public static Question of(String text, String category, String answer) {
        return new Question(text, category, answer, 1, List.of());
    }

    public boolean hasDistractors() {
        return !wrongAnswers.isEmpty();
    }
}
