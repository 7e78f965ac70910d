package com.example.jduel.service.question;

import com.example.jduel.model.Difficulty;
import com.example.jduel.model.Question;

import java.util.List;

/** Source of questions for a new game. */
@FunctionalInterface
public interface QuestionProvider {

    /**
     * Up to {@code count} questions matching {@code difficulty}, already in play order.
     * Empty when nothing matches.
     */
    List<Question> questionsFor(Difficulty difficulty, int count);
}
