package com.example.jduel.model.state;

import com.example.jduel.model.Difficulty;
import com.example.jduel.model.GameStatus;
import com.example.jduel.model.Reaction;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client-safe snapshot of a room. Phase-specific parts are null (and omitted on the wire)
 * outside their phase: {@code currentQuestion} in PLAYING, {@code results} in RESULTS,
 * {@code winner} in FINISHED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomStateView(
        String roomId,
        Map<String, Integer> players,
        List<String> connectedPlayers,
        GameStatus status,
        int questionIndex,
        int totalQuestions,
        String hostId,
        Config config,
        List<Reaction> reactions,
        CurrentQuestion currentQuestion,
        List<String> answeredPlayers,
        Long timeRemainingMs,
        Results results,
        String winner,
        String stateError
) {

    public static final String QUESTION_OUT_OF_SYNC = "QUESTION_OUT_OF_SYNC";

    public RoomStateView {
        players = (players == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(players));
        connectedPlayers = (connectedPlayers == null) ? List.of() : List.copyOf(connectedPlayers);
        reactions = (reactions == null) ? List.of() : List.copyOf(reactions);
        answeredPlayers = (answeredPlayers == null) ? null : List.copyOf(answeredPlayers);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return stateError != null;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Config(boolean multipleChoiceEnabled, Difficulty difficulty) {
    }

    /** Prompt of the running question; never carries the answer. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CurrentQuestion(String text, String category, List<String> options) {
        public CurrentQuestion {
            options = (options == null) ? null : List.copyOf(options);
        }
    }

    public record Results(String correctAnswer,
                          Map<String, String> playerAnswers,
                          Map<String, Integer> playerResults) {
        public Results {
            playerAnswers = Collections.unmodifiableMap(new LinkedHashMap<>(playerAnswers));
            playerResults = Collections.unmodifiableMap(new LinkedHashMap<>(playerResults));
        }
    }
}
