package com.example.jduel.service;

import com.example.jduel.config.GameProperties;
import com.example.jduel.model.Difficulty;
import com.example.jduel.model.GameStatus;
import com.example.jduel.model.Question;
import com.example.jduel.model.Room;
import com.example.jduel.model.RoomConfig;
import com.example.jduel.model.RoundState;
import com.example.jduel.model.message.ClientMessage;
import com.example.jduel.model.message.ServerMessages;
import com.example.jduel.service.answer.AnswerVerifier;
import com.example.jduel.service.question.QuestionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Room state machine. Every command, detach and timer expiry for a room runs on that room's
 * mailbox, so the methods below never see a room concurrently.
 *
 * <pre>
 * WAITING  --START_GAME (host)-----------------&gt; PLAYING
 * PLAYING  --all connected answered / timeout--&gt; RESULTS
 * RESULTS  --timeout, more questions-----------&gt; PLAYING
 * RESULTS  --timeout, last question------------&gt; FINISHED
 * FINISHED --PLAY_AGAIN (host)-----------------&gt; WAITING
 * FINISHED --cleanup timeout-------------------&gt; (room closed)
 * </pre>
 */
@Service
public class GameOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GameOrchestrator.class);

    static final CloseStatus ROOM_CLOSED = new CloseStatus(4000, "Room closed");

    private final RoomRegistry registry;
    private final RoomDispatcher dispatcher;
    private final ConnectionTable connections;
    private final TimerScheduler timers;
    private final ScoringEngine scoring;
    private final StateProjector projector;
    private final AnswerVerifier verifier;
    private final QuestionProvider questions;
    private final GameProperties properties;
    private final Clock clock;

    public GameOrchestrator(RoomRegistry registry,
                            RoomDispatcher dispatcher,
                            ConnectionTable connections,
                            TimerScheduler timers,
                            ScoringEngine scoring,
                            StateProjector projector,
                            AnswerVerifier verifier,
                            QuestionProvider questions,
                            GameProperties properties,
                            Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.connections = connections;
        this.timers = timers;
        this.scoring = scoring;
        this.projector = projector;
        this.verifier = verifier;
        this.questions = questions;
        this.properties = properties;
        this.clock = clock;
    }

    // ========================================================================
    //  CONNECTIONS
    // ========================================================================

    /**
     * Binds a socket to an already registered player. On success everyone in the room
     * (including the new socket) receives a fresh ROOM_STATE.
     *
     * @param sessionToken optional; if given it must match the token issued at registration
     */
    public CompletableFuture<AttachResult> attach(String roomCode, String playerId, String sessionToken,
                                                  WebSocketSession session) {
        return dispatcher.call(roomCode,
                room -> attachTo(room, playerId, sessionToken, session),
                () -> AttachResult.ROOM_NOT_FOUND);
    }

    private AttachResult attachTo(Room room, String playerId, String sessionToken, WebSocketSession session) {
        if (!room.hasPlayer(playerId)) {
            log.warn("Attach rejected (not registered): room={} player={}", room.getCode(), playerId);
            return AttachResult.NOT_REGISTERED;
        }
        if (sessionToken != null && !sessionToken.equals(room.getSessionToken(playerId))) {
            log.warn("Attach rejected (bad session token): room={} player={}", room.getCode(), playerId);
            return AttachResult.INVALID_SESSION;
        }
        if (!connections.attach(room.getCode(), playerId, session)) {
            log.warn("Attach rejected (already connected): room={} player={}", room.getCode(), playerId);
            return AttachResult.ALREADY_CONNECTED;
        }
        room.touch(clock.instant());
        log.info("Player attached: room={} player={} status={}", room.getCode(), playerId, room.getStatus());
        broadcastState(room);
        return AttachResult.ACCEPTED;
    }

    /**
     * Unbinds the socket (if it is still the one attached). The player stays registered.
     * A room left without any socket is deleted, unless it is FINISHED.
     */
    public void detach(String roomCode, String playerId, WebSocketSession session) {
        dispatcher.dispatch(roomCode, room -> {
            if (!connections.detach(room.getCode(), playerId, session)) {
                log.debug("Detach ignored (socket superseded): room={} player={}", room.getCode(), playerId);
                return;
            }
            room.touch(clock.instant());
            log.info("Player detached: room={} player={}", room.getCode(), playerId);

            if (connections.count(room.getCode()) == 0 && room.getStatus() != GameStatus.FINISHED) {
                log.info("No live connections left in room {}, deleting it", room.getCode());
                deleteRoom(room);
                return;
            }
            if (room.getStatus() == GameStatus.PLAYING && allConnectedAnswered(room)) {
                enterResults(room);
                return;
            }
            broadcastState(room);
        });
    }

    // ========================================================================
    //  COMMANDS
    // ========================================================================

    /** Routes a decoded command. Commands from a socket that is not the attached one are dropped. */
    public void handle(String roomCode, String playerId, WebSocketSession session, ClientMessage message) {
        dispatcher.dispatch(roomCode, room -> {
            if (!connections.isAttached(room.getCode(), playerId, session)) {
                log.debug("Dropped {} from unattached socket: room={} player={}", message.type(), room.getCode(), playerId);
                return;
            }
            room.touch(clock.instant());
            switch (message.type()) {
                case START_GAME -> startGame(room, playerId);
                case ANSWER -> submitAnswer(room, playerId, message.answer());
                case UPDATE_CONFIG -> updateConfig(room, playerId, message.config());
                case REACTION -> react(room, playerId, message.reactionId());
                case PLAY_AGAIN -> playAgain(room, playerId);
            }
        });
    }

    private void startGame(Room room, String playerId) {
        if (!isHostCommandAllowed(room, playerId, GameStatus.WAITING, "START_GAME")) return;
        if (connections.count(room.getCode()) < 1) return;

        Difficulty difficulty = room.getConfig().difficulty();
        List<Question> loaded = questions.questionsFor(difficulty, properties.questionsPerGame());
        if (loaded == null || loaded.isEmpty()) {
            log.error("Game start failed (no questions): room={} difficulty={}", room.getCode(), difficulty.id());
            connections.send(room.getCode(), playerId,
                    ServerMessages.error("No questions available for difficulty " + difficulty.id()));
            return;
        }

        Instant now = clock.instant();
        transition(room, GameStatus.PLAYING, () -> room.beginGame(loaded, now));
        scheduleQuestionTimer(room);
        log.info("Game started: room={} players={} difficulty={} questions={}",
                room.getCode(), room.getPlayers(), difficulty.id(), loaded.size());
        broadcastState(room);
    }

    private void submitAnswer(Room room, String playerId, String answer) {
        if (room.getStatus() != GameStatus.PLAYING) {
            log.debug("Answer dropped (phase {}): room={} player={}", room.getStatus(), room.getCode(), playerId);
            return;
        }
        Question question = room.currentQuestion().orElse(null);
        if (question == null) {
            log.error("Answer dropped, no current question: room={} index={}", room.getCode(), room.getQuestionIndex());
            return;
        }
        RoundState round = room.getRound();
        if (!round.recordAnswer(playerId, answer)) {
            log.debug("Duplicate answer ignored: room={} player={}", room.getCode(), playerId);
            return;
        }

        Instant now = clock.instant();
        boolean late = round.getQuestionStartedAt() != null
                && Duration.between(round.getQuestionStartedAt(), now).compareTo(properties.questionTime()) > 0;
        boolean correct = !late && verifier.isCorrect(answer, question.answer());
        int points = correct ? scoring.points(true, round.nextCorrectRank()) : 0;
        round.award(playerId, points);
        room.addPoints(playerId, points);
        log.debug("Answer: room={} player={} correct={} late={} points={}",
                room.getCode(), playerId, correct, late, points);

        if (allConnectedAnswered(room)) {
            enterResults(room);
        } else {
            broadcastState(room);
        }
    }

    private void updateConfig(Room room, String playerId, ClientMessage.ConfigPatch patch) {
        if (!isHostCommandAllowed(room, playerId, GameStatus.WAITING, "UPDATE_CONFIG")) return;
        if (patch == null) return;

        RoomConfig config = room.getConfig();
        if (patch.multipleChoiceEnabled() != null) {
            config = config.withMultipleChoice(patch.multipleChoiceEnabled());
        }
        if (patch.difficulty() != null) {
            Difficulty d = Difficulty.fromId(patch.difficulty()).orElse(null);
            if (d == null) {
                log.warn("Unknown difficulty ignored: room={} difficulty={}", room.getCode(), patch.difficulty());
            } else {
                config = config.withDifficulty(d);
            }
        }
        room.setConfig(config);
        log.info("Config updated: room={} multipleChoice={} difficulty={}",
                room.getCode(), config.multipleChoiceEnabled(), config.difficulty().id());
        broadcastState(room);
    }

    private void react(Room room, String playerId, Integer reactionId) {
        GameStatus status = room.getStatus();
        if (status != GameStatus.PLAYING && status != GameStatus.RESULTS) {
            log.debug("Reaction dropped (phase {}): room={} player={}", status, room.getCode(), playerId);
            return;
        }
        if (reactionId == null || !properties.isKnownReaction(reactionId)) return;
        if (!room.tryReact(playerId, clock.instant(), properties.reactionCooldown())) {
            log.debug("Reaction dropped (cooldown): room={} player={}", room.getCode(), playerId);
            return;
        }
        connections.broadcast(room.getCode(), ServerMessages.reaction(playerId, reactionId));
    }

    private void playAgain(Room room, String playerId) {
        if (!isHostCommandAllowed(room, playerId, GameStatus.FINISHED, "PLAY_AGAIN")) return;

        Set<String> online = connections.connectedPlayers(room.getCode());
        List<String> pruned = new ArrayList<>();
        transition(room, GameStatus.WAITING, () -> pruned.addAll(room.resetForNewGame(online)));
        log.info("Room reset for a new game: room={} pruned={}", room.getCode(), pruned);
        broadcastState(room);
    }

    private boolean isHostCommandAllowed(Room room, String playerId, GameStatus required, String command) {
        if (!room.isHost(playerId)) {
            log.warn("{} ignored: {} is not host of {}", command, playerId, room.getCode());
            return false;
        }
        if (room.getStatus() != required) {
            log.debug("{} ignored in phase {}: room={}", command, room.getStatus(), room.getCode());
            return false;
        }
        return true;
    }

    // ========================================================================
    //  TIMERS
    // ========================================================================

    private void scheduleQuestionTimer(Room room) {
        timers.schedule(room, TimerKind.QUESTION, properties.questionTime(), () -> onQuestionTimeout(room));
    }

    void onQuestionTimeout(Room room) {
        if (room.getStatus() != GameStatus.PLAYING) return;
        log.debug("Question time is up: room={} index={}", room.getCode(), room.getQuestionIndex());
        enterResults(room);
    }

    void onResultsTimeout(Room room) {
        if (room.getStatus() != GameStatus.RESULTS) return;
        Instant now = clock.instant();

        if (room.hasNextQuestion()) {
            transition(room, GameStatus.PLAYING, () -> room.advanceQuestion(now));
            scheduleQuestionTimer(room);
            log.info("Advancing to question {}: room={}", room.getQuestionIndex() + 1, room.getCode());
        } else {
            transition(room, GameStatus.FINISHED, () -> room.markFinished(now));
            timers.schedule(room, TimerKind.CLEANUP, properties.cleanupTime(), () -> onCleanupTimeout(room));
            log.info("Game finished: room={} winner={} scores={}",
                    room.getCode(), StateProjector.winnerOf(room.getScores()), room.getScores());
        }
        broadcastState(room);
    }

    void onCleanupTimeout(Room room) {
        if (room.getStatus() != GameStatus.FINISHED) return;
        log.info("Closing finished room {}", room.getCode());
        connections.broadcast(room.getCode(), ServerMessages.roomClosed());
        connections.closeRoom(room.getCode(), ROOM_CLOSED);
        deleteRoom(room);
    }

    private void enterResults(Room room) {
        Instant now = clock.instant();
        transition(room, GameStatus.RESULTS, () -> room.markResultsStarted(now));
        timers.schedule(room, TimerKind.RESULTS, properties.resultsTime(), () -> onResultsTimeout(room));
        broadcastState(room);
    }

    // ========================================================================
    //  HOUSEKEEPING
    // ========================================================================

    /**
     * Deletes rooms nobody is connected to that have been idle longer than {@code ttl}
     * (e.g. created but never joined). FINISHED rooms are left to their cleanup timer.
     */
    public void reapIdle(Duration ttl) {
        for (Room room : registry.all()) {
            dispatcher.dispatch(room, () -> {
                if (room.getStatus() == GameStatus.FINISHED) return;
                if (connections.count(room.getCode()) > 0) return;
                Instant cutoff = clock.instant().minus(ttl);
                if (room.getLastActivityAt().isBefore(cutoff)) {
                    log.info("Reaping idle room {} (last activity {})", room.getCode(), room.getLastActivityAt());
                    deleteRoom(room);
                }
            });
        }
    }

    // ========================================================================
    //  INTERNALS
    // ========================================================================

    /** Cancels the room's timers, then applies {@code mutation} and moves to {@code next}. */
    private void transition(Room room, GameStatus next, Runnable mutation) {
        GameStatus from = room.getStatus();
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + from + " -> " + next + " in room " + room.getCode());
        }
        timers.cancelAll(room);
        mutation.run();
        room.setStatus(next);
        log.debug("Room {}: {} -> {}", room.getCode(), from, next);
    }

    /** True if at least one registered player is connected and every connected one has answered. */
    private boolean allConnectedAnswered(Room room) {
        boolean any = false;
        for (String p : connections.connectedPlayers(room.getCode())) {
            if (!room.hasPlayer(p)) continue;
            any = true;
            if (!room.getRound().hasAnswered(p)) return false;
        }
        return any;
    }

    private void deleteRoom(Room room) {
        timers.cancelAll(room);
        connections.forget(room.getCode());
        registry.delete(room);
    }

    private void broadcastState(Room room) {
        connections.broadcast(room.getCode(), ServerMessages.roomState(projector.project(room)));
    }
}
