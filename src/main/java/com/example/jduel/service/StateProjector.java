package com.example.jduel.service;

import com.example.jduel.config.GameProperties;
import com.example.jduel.model.GameStatus;
import com.example.jduel.model.Question;
import com.example.jduel.model.Room;
import com.example.jduel.model.RoundState;
import com.example.jduel.model.state.RoomStateView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Builds the client-facing snapshot of a room. Only exposes what the current phase needs:
 * the prompt while PLAYING, answers and points in RESULTS, the winner once FINISHED.
 * Must run on the room's mailbox (it may fill the round's option cache).
 */
@Component
public class StateProjector {

    private static final Logger log = LoggerFactory.getLogger(StateProjector.class);

    private final Clock clock;
    private final GameProperties properties;
    private final ConnectionTable connections;
    private final Random random;

    public StateProjector(Clock clock, GameProperties properties, ConnectionTable connections, Random random) {
        this.clock = clock;
        this.properties = properties;
        this.connections = connections;
        this.random = random;
    }

    public RoomStateView project(Room room) {
        GameStatus status = room.getStatus();
        Instant now = clock.instant();
        RoundState round = room.getRound();

        Set<String> online = connections.connectedPlayers(room.getCode());
        List<String> connected = new ArrayList<>();
        for (String p : room.getPlayers()) {
            if (online.contains(p)) connected.add(p);
        }

        RoomStateView.CurrentQuestion currentQuestion = null;
        RoomStateView.Results results = null;
        List<String> answered = null;
        Long timeRemaining = null;
        String winner = null;
        String stateError = null;

        switch (status) {
            case PLAYING, RESULTS -> {
                Optional<Question> q = room.currentQuestion();
                if (q.isEmpty()) {
                    log.error("Question index {} out of bounds ({} questions) in room {} during {}",
                            room.getQuestionIndex(), room.getTotalQuestions(), room.getCode(), status);
                    stateError = RoomStateView.QUESTION_OUT_OF_SYNC;
                } else if (status == GameStatus.PLAYING) {
                    currentQuestion = new RoomStateView.CurrentQuestion(
                            q.get().text(), q.get().category(), optionsFor(room, q.get()));
                    answered = new ArrayList<>(round.getAnswers().keySet());
                    timeRemaining = remaining(round.getQuestionStartedAt(), properties.questionTime(), now);
                } else {
                    results = resultsFor(room, q.get());
                    timeRemaining = remaining(room.getResultsStartedAt(), properties.resultsTime(), now);
                }
            }
            case FINISHED -> {
                winner = winnerOf(room.getScores());
                timeRemaining = remaining(room.getFinishedAt(), properties.cleanupTime(), now);
            }
            default -> { }
        }

        return new RoomStateView(
                room.getCode(),
                room.getScores(),
                connected,
                status,
                room.getQuestionIndex(),
                room.getTotalQuestions(),
                room.getHostId(),
                new RoomStateView.Config(room.getConfig().multipleChoiceEnabled(), room.getConfig().difficulty()),
                properties.reactions(),
                currentQuestion,
                answered,
                timeRemaining,
                results,
                winner,
                stateError);
    }

    /** Cached per round, so reconnecting players see the same order as everybody else. */
    private List<String> optionsFor(Room room, Question q) {
        if (!room.getConfig().multipleChoiceEnabled() || !q.hasDistractors()) return null;
        return room.getRound().shuffledOptions(() -> {
            List<String> options = new ArrayList<>(q.wrongAnswers().size() + 1);
            options.add(q.answer());
            options.addAll(q.wrongAnswers());
            Collections.shuffle(options, random);
            return options;
        });
    }

    private static RoomStateView.Results resultsFor(Room room, Question q) {
        RoundState round = room.getRound();
        Map<String, Integer> perPlayer = new LinkedHashMap<>();
        for (String p : room.getPlayers()) {
            perPlayer.put(p, round.pointsOf(p));
        }
        return new RoomStateView.Results(q.answer(), round.getAnswers(), perPlayer);
    }

    /** Highest score; ties go to whoever registered first. */
    static String winnerOf(Map<String, Integer> scores) {
        String best = null;
        int bestScore = Integer.MIN_VALUE;
        for (Map.Entry<String, Integer> e : scores.entrySet()) {
            if (e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }
        return best;
    }

    private static Long remaining(Instant since, Duration length, Instant now) {
        if (since == null) return null;
        long left = length.toMillis() - Duration.between(since, now).toMillis();
        return Math.max(0L, left);
    }
}
