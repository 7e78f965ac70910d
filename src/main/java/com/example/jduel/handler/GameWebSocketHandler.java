package com.example.jduel.handler;

import com.example.jduel.model.message.ClientMessage;
import com.example.jduel.model.message.ServerMessages;
import com.example.jduel.service.AttachResult;
import com.example.jduel.service.ConnectionTable;
import com.example.jduel.service.GameOrchestrator;
import com.example.jduel.service.RateLimiter;
import com.example.jduel.service.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for the game socket ({@code /ws?roomId=..&playerId=..&sessionToken=..}).
 * - Attaches the socket to a player registered over HTTP; rejections close with 4003/4004/4009
 * - Decodes JSON command frames and hands them to the orchestrator
 * - Heartbeat: replies "pong" to "ping"
 * - Per-socket message rate limit; excess frames are dropped
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final GameOrchestrator orchestrator;
    private final ConnectionTable connections;
    private final MessageCodec codec;
    private final RateLimiter messageLimiter;

    /** Per WebSocket session → (room, player, send-safe session) */
    private final Map<String, Conn> bySession = new ConcurrentHashMap<>();

    public GameWebSocketHandler(GameOrchestrator orchestrator,
                                ConnectionTable connections,
                                MessageCodec codec,
                                @Qualifier("messageLimiter") RateLimiter messageLimiter) {
        this.orchestrator = orchestrator;
        this.connections = connections;
        this.codec = codec;
        this.messageLimiter = messageLimiter;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        Map<String, String> q = parseQuery(session.getUri());
        final String roomCode = RoomRegistry.normalizeCode(q.getOrDefault("roomId", ""));
        final String playerId = q.getOrDefault("playerId", "").trim();
        final String token = blankToNull(q.get("sessionToken"));

        log.info("WS OPEN room={} player={} sid={}", roomCode, playerId, session.getId());

        if (roomCode.isEmpty()) {
            reject(session, roomCode, playerId, AttachResult.ROOM_NOT_FOUND);
            return;
        }
        if (playerId.isEmpty()) {
            reject(session, roomCode, playerId, AttachResult.NOT_REGISTERED);
            return;
        }

        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        // tracked before attaching; commands from a not-yet-attached socket are dropped by the orchestrator
        bySession.put(session.getId(), new Conn(roomCode, playerId, safe));

        orchestrator.attach(roomCode, playerId, token, safe).whenComplete((result, error) -> {
            if (error != null) {
                log.error("WS attach failed (room={}, player={})", roomCode, playerId, error);
                bySession.remove(session.getId());
                closeQuietly(session, CloseStatus.SERVER_ERROR);
            } else if (!result.accepted()) {
                bySession.remove(session.getId());
                reject(session, roomCode, playerId, result);
            }
        });
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        Conn c = bySession.get(session.getId());
        if (c == null) {
            log.warn("WS message from unknown session sid={}", session.getId());
            return;
        }
        final String payload = message.getPayload();

        // Heartbeat
        if ("ping".equals(payload)) {
            try {
                if (c.session().isOpen()) c.session().sendMessage(new TextMessage("pong"));
            } catch (IOException e) {
                log.warn("WS pong send failed (room={}, player={}): {}", c.room(), c.player(), e.toString());
            }
            return;
        }

        if (!messageLimiter.tryAcquire(session.getId())) {
            log.warn("WS rate limit hit, frame dropped (room={}, player={})", c.room(), c.player());
            return;
        }

        ClientMessage command;
        try {
            command = codec.decode(payload);
        } catch (MalformedMessageException e) {
            log.debug("WS malformed frame (room={}, player={}): {}", c.room(), c.player(), e.getMessage());
            connections.send(c.session(), ServerMessages.error(e.getMessage()));
            return;
        }
        orchestrator.handle(c.room(), c.player(), c.session(), command);
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} uri={} : transport error", session.getId(), safeUri(session), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        messageLimiter.reset(session.getId());
        Conn c = bySession.remove(session.getId());
        if (c == null) {
            log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
            return;
        }
        log.info("WS CLOSE room={} player={} code={} reason={}", c.room(), c.player(), status.getCode(), status.getReason());
        orchestrator.detach(c.room(), c.player(), c.session());
    }

    /* ---------------- helpers ---------------- */

    private void reject(WebSocketSession session, String roomCode, String playerId, AttachResult result) {
        CloseStatus close = result.closeStatus();
        log.warn("WS REJECT room={} player={} code={} reason={}", roomCode, playerId, close.getCode(), close.getReason());
        closeQuietly(session, close);
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) session.close(status);
        } catch (IOException e) {
            log.warn("WS close failed sid={}: {}", session.getId(), e.toString());
        }
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new HashMap<>();
        if (uri == null || uri.getQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (RuntimeException e) { return "n/a"; }
    }

    private record Conn(String room, String player, WebSocketSession session) { }
}
