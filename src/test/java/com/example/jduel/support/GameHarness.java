package com.example.jduel.support;

import com.example.jduel.config.GameProperties;
import com.example.jduel.model.Question;
import com.example.jduel.model.message.ClientMessage;
import com.example.jduel.service.*;
import com.example.jduel.service.answer.FuzzyAnswerVerifier;
import com.example.jduel.service.question.QuestionProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * The whole engine wired by hand: direct executor (mailbox tasks run inline), manual timers,
 * mutable clock and mocked sockets.
 */
public class GameHarness {

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
    public final ObjectMapper mapper = new ObjectMapper();
    public final GameProperties properties;
    public final ManualScheduler scheduler = new ManualScheduler();
    public final RoomRegistry registry;
    public final RoomDispatcher dispatcher;
    public final ConnectionTable connections;
    public final TimerScheduler timers;
    public final StateProjector projector;
    public final GameOrchestrator orchestrator;
    public final LobbyService lobby;

    public GameHarness(List<Question> questions) {
        this(GameProperties.defaults(), (difficulty, count) -> new ArrayList<>(questions.subList(0, Math.min(count, questions.size()))), () -> "AB3D");
    }

    public GameHarness(GameProperties properties, QuestionProvider questions, Supplier<String> codes) {
        this.properties = properties;
        this.registry = new RoomRegistry(clock, Runnable::run, codes);
        this.dispatcher = new RoomDispatcher(registry);
        this.connections = new ConnectionTable(mapper);
        this.timers = new TimerScheduler(scheduler.executor(), dispatcher);
        this.projector = new StateProjector(clock, properties, connections, new Random(7));
        this.orchestrator = new GameOrchestrator(registry, dispatcher, connections, timers, new ScoringEngine(),
                projector, new FuzzyAnswerVerifier(), questions, properties, clock);
        GameProperties.Limit generous = new GameProperties.Limit(1_000, Duration.ofSeconds(1));
        this.lobby = new LobbyService(registry, dispatcher, connections, properties,
                new RateLimiter("create", generous, clock), new RateLimiter("join", generous, clock), clock);
    }

    public String createRoom() {
        return lobby.createRoom("127.0.0.1").roomId();
    }

    /** Registers over the lobby and attaches a fresh socket. */
    public Player join(String roomCode, String playerId) {
        LobbyService.Registration reg = lobby.register(roomCode, playerId, null, "127.0.0.1");
        Player p = new Player(roomCode, playerId, reg.sessionToken(), TestSessions.open("sid-" + playerId + "-" + System.nanoTime()));
        AttachResult result = RoomDispatcher.await(orchestrator.attach(roomCode, playerId, reg.sessionToken(), p.socket.session));
        if (!result.accepted()) throw new AssertionError("attach failed: " + result);
        return p;
    }

    public JsonNode json(String payload) {
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public class Player {
        public final String roomCode;
        public final String id;
        public final String token;
        public final TestSessions.Recorded socket;

        Player(String roomCode, String id, String token, TestSessions.Recorded socket) {
            this.roomCode = roomCode;
            this.id = id;
            this.token = token;
            this.socket = socket;
        }

        public void send(ClientMessage message) {
            orchestrator.handle(roomCode, id, socket.session, message);
        }

        public void answer(String text) {
            send(ClientMessage.answer(text));
        }

        /** Peer closes; the handler would report the detach. */
        public void disconnect() {
            socket.drop();
            orchestrator.detach(roomCode, id, socket.session);
        }

        /** Last ROOM_STATE payload ({@code roomState} node) this player received. */
        public JsonNode lastState() {
            for (int i = socket.sent.size() - 1; i >= 0; i--) {
                JsonNode n = json(socket.sent.get(i));
                if ("ROOM_STATE".equals(n.path("type").asText())) return n.get("roomState");
            }
            throw new AssertionError("no ROOM_STATE received by " + id);
        }

        public List<JsonNode> framesOfType(String type) {
            List<JsonNode> out = new ArrayList<>();
            for (String s : socket.sent) {
                JsonNode n = json(s);
                if (type.equals(n.path("type").asText())) out.add(n);
            }
            return out;
        }
    }
}
