package com.example.jduel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * (room, player) → live socket. A player without an entry is still registered in the room,
 * just disconnected. At most one open socket per player.
 */
@Component
public class ConnectionTable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionTable.class);

    private final Map<String, Map<String, WebSocketSession>> byRoom = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public ConnectionTable(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ---------------------------------------------------------------------
    // Attach / detach
    // ---------------------------------------------------------------------

    /**
     * Binds {@code session} to the player. Refused if another open socket already holds the slot;
     * an entry whose socket is no longer open is replaced.
     */
    public boolean attach(String roomCode, String playerId, WebSocketSession session) {
        Map<String, WebSocketSession> room = byRoom.computeIfAbsent(roomCode, k -> new ConcurrentHashMap<>());
        boolean[] accepted = {false};
        room.compute(playerId, (k, existing) -> {
            if (existing == null || existing == session || !existing.isOpen()) {
                if (existing != null && existing != session) {
                    log.info("Replacing stale socket room={} player={} sid={}", roomCode, playerId, existing.getId());
                }
                accepted[0] = true;
                return session;
            }
            return existing;
        });
        return accepted[0];
    }

    /** Removes the entry only if it still points at {@code session}. */
    public boolean detach(String roomCode, String playerId, WebSocketSession session) {
        Map<String, WebSocketSession> room = byRoom.get(roomCode);
        if (room == null) return false;
        boolean removed = room.remove(playerId, session);
        if (room.isEmpty()) byRoom.remove(roomCode, room);
        return removed;
    }

    public boolean isAttached(String roomCode, String playerId, WebSocketSession session) {
        Map<String, WebSocketSession> room = byRoom.get(roomCode);
        return room != null && room.get(playerId) == session;
    }

    public boolean isConnected(String roomCode, String playerId) {
        Map<String, WebSocketSession> room = byRoom.get(roomCode);
        if (room == null || playerId == null) return false;
        WebSocketSession s = room.get(playerId);
        return s != null && s.isOpen();
    }

    public Set<String> connectedPlayers(String roomCode) {
        Map<String, WebSocketSession> room = byRoom.get(roomCode);
        if (room == null) return Collections.emptySet();
        return room.entrySet().stream()
                .filter(e -> e.getValue().isOpen())
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    public int count(String roomCode) {
        return connectedPlayers(roomCode).size();
    }

    // ---------------------------------------------------------------------
    // Sending
    // ---------------------------------------------------------------------

    /** Serializes once and sends to every open socket of the room. */
    public void broadcast(String roomCode, Object message) {
        Map<String, WebSocketSession> room = byRoom.get(roomCode);
        if (room == null || room.isEmpty()) return;
        String json = toJson(message);
        if (json == null) return;
        room.forEach((playerId, session) -> sendRaw(session, json, roomCode, playerId));
    }

    public void send(String roomCode, String playerId, Object message) {
        Map<String, WebSocketSession> room = byRoom.get(roomCode);
        WebSocketSession session = (room == null) ? null : room.get(playerId);
        if (session == null) return;
        String json = toJson(message);
        if (json != null) sendRaw(session, json, roomCode, playerId);
    }

    /** Sends to a socket that may not be attached (e.g. during rejection). */
    public void send(WebSocketSession session, Object message) {
        String json = toJson(message);
        if (json != null) sendRaw(session, json, null, null);
    }

    private String toJson(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {}", message.getClass().getSimpleName(), e);
            return null;
        }
    }

    private void sendRaw(WebSocketSession session, String json, String roomCode, String playerId) {
        if (!session.isOpen()) return;
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | IllegalStateException e) {
            log.warn("WS send failed (room={}, player={}, sid={}): {}", roomCode, playerId, session.getId(), e.toString());
        }
    }

    // ---------------------------------------------------------------------
    // Room teardown
    // ---------------------------------------------------------------------

    /** Closes every socket of the room and drops all entries. */
    public void closeRoom(String roomCode, CloseStatus status) {
        Map<String, WebSocketSession> room = byRoom.remove(roomCode);
        if (room == null) return;
        room.forEach((playerId, session) -> {
            try {
                if (session.isOpen()) session.close(status);
            } catch (IOException e) {
                log.warn("WS close failed (room={}, player={}): {}", roomCode, playerId, e.toString());
            }
        });
    }

    public void forget(String roomCode) {
        byRoom.remove(roomCode);
    }
}
