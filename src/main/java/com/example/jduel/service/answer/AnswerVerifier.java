package com.example.jduel.service.answer;

/** Decides whether a submitted answer matches the canonical one. */
@FunctionalInterface
public interface AnswerVerifier {

    boolean isCorrect(String candidate, String canonical);
}
