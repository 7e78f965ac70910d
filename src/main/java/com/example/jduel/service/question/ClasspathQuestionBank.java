package com.example.jduel.service.question;

import com.example.jduel.model.Difficulty;
import com.example.jduel.model.Question;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Question bank read once from a JSON array on the classpath ({@code questions.json} by default).
 */
@Component
public class ClasspathQuestionBank implements QuestionProvider {

    private static final Logger log = LoggerFactory.getLogger(ClasspathQuestionBank.class);

    private final List<Question> questions;
    private final Random random;

    @Autowired
    public ClasspathQuestionBank(ObjectMapper objectMapper,
                                 Random random,
                                 @Value("${app.game.question-bank:questions.json}") String location) {
        this(load(objectMapper, location), random);
        log.info("Question bank loaded: {} questions from {}", questions.size(), location);
    }

    public ClasspathQuestionBank(List<Question> questions, Random random) {
        this.questions = List.copyOf(questions);
        this.random = random;
    }

    static List<Question> load(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<Question>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read question bank " + location, e);
        }
    }

    @Override
    public List<Question> questionsFor(Difficulty difficulty, int count) {
        Difficulty d = (difficulty == null) ? Difficulty.DEFAULT : difficulty;
        List<Question> matching = new ArrayList<>();
        for (Question q : questions) {
            if (d.accepts(q.difficulty())) matching.add(q);
        }
        Collections.shuffle(matching, random);
        if (matching.size() < count) {
            log.debug("Only {} questions available for difficulty {} (wanted {})", matching.size(), d.id(), count);
            return matching;
        }
        return new ArrayList<>(matching.subList(0, Math.max(0, count)));
    }

    public int size() {
        return questions.size();
    }
}
