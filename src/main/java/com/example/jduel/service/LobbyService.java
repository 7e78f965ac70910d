package com.example.jduel.service;

import com.example.jduel.config.GameProperties;
import com.example.jduel.model.GameStatus;
import com.example.jduel.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.function.Supplier;

/**
 * Out-of-band lobby operations: create a room, look one up, register a player identity.
 * Registration runs on the room's mailbox like every other mutation.
 */
@Service
public class LobbyService {

    private static final Logger log = LoggerFactory.getLogger(LobbyService.class);

    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();

    public record RoomSummary(String roomId, GameStatus status, List<String> players, int playerCount) { }

    public record Registration(String roomId, String playerId, GameStatus status, String sessionToken) { }

    private final RoomRegistry registry;
    private final RoomDispatcher dispatcher;
    private final ConnectionTable connections;
    private final GameProperties properties;
    private final RateLimiter createLimiter;
    private final RateLimiter joinLimiter;
    private final Clock clock;
    private final Supplier<String> tokenMinter;

    @Autowired
    public LobbyService(RoomRegistry registry,
                        RoomDispatcher dispatcher,
                        ConnectionTable connections,
                        GameProperties properties,
                        @Qualifier("createRoomLimiter") RateLimiter createLimiter,
                        @Qualifier("joinRoomLimiter") RateLimiter joinLimiter,
                        Clock clock) {
        this(registry, dispatcher, connections, properties, createLimiter, joinLimiter, clock, LobbyService::newSessionToken);
    }

    LobbyService(RoomRegistry registry,
                 RoomDispatcher dispatcher,
                 ConnectionTable connections,
                 GameProperties properties,
                 RateLimiter createLimiter,
                 RateLimiter joinLimiter,
                 Clock clock,
                 Supplier<String> tokenMinter) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.connections = connections;
        this.properties = properties;
        this.createLimiter = createLimiter;
        this.joinLimiter = joinLimiter;
        this.clock = clock;
        this.tokenMinter = tokenMinter;
    }

    /** 24 random bytes, URL-safe Base64 without padding. */
    static String newSessionToken() {
        byte[] bytes = new byte[24];
        TOKEN_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public RoomSummary createRoom(String clientKey) {
        createLimiter.checkOrThrow(clientKey);
        Room room = registry.create();
        log.info("Room created via HTTP: room={} client={}", room.getCode(), clientKey);
        return new RoomSummary(room.getCode(), GameStatus.WAITING, List.of(), 0);
    }

    public RoomSummary roomInfo(String roomId) {
        String code = RoomRegistry.normalizeCode(roomId);
        return RoomDispatcher.await(dispatcher.call(code,
                room -> new RoomSummary(room.getCode(), room.getStatus(), room.getPlayers(), room.getPlayers().size()),
                () -> { throw RegistrationException.roomNotFound(code); }));
    }

    /**
     * Reserves {@code playerId} in the room, or re-admits a registered identity that is
     * currently disconnected (same token, score kept).
     *
     * @param sessionToken optional; if present it must match the identity's token
     */
    public Registration register(String roomId, String playerId, String sessionToken, String clientKey) {
        joinLimiter.checkOrThrow(clientKey);

        String name = (playerId == null) ? "" : playerId.trim();
        if (name.isEmpty() || name.length() > properties.maxPlayerIdLength()) {
            throw new RegistrationException(ErrorCode.VALIDATION_ERROR,
                    "playerId must be 1-" + properties.maxPlayerIdLength() + " characters");
        }
        String code = RoomRegistry.normalizeCode(roomId);
        return RoomDispatcher.await(dispatcher.call(code,
                room -> registerIn(room, name, sessionToken),
                () -> { throw RegistrationException.roomNotFound(code); }));
    }

    private Registration registerIn(Room room, String playerId, String sessionToken) {
        String code = room.getCode();
        if (room.hasPlayer(playerId)) {
            if (connections.isConnected(code, playerId)) {
                log.warn("NAME_TAKEN: room={} player={} connected={}", code, playerId, connections.connectedPlayers(code));
                throw new RegistrationException(ErrorCode.NAME_TAKEN, "Name '" + playerId + "' is already taken");
            }
            if (sessionToken != null && !sessionToken.equals(room.getSessionToken(playerId))) {
                log.warn("INVALID_SESSION: room={} player={}", code, playerId);
                throw new RegistrationException(ErrorCode.INVALID_SESSION, "Invalid session token");
            }
            String token = room.issueSessionToken(playerId, tokenMinter);
            room.touch(clock.instant());
            log.info("Player reconnecting (was disconnected): room={} player={}", code, playerId);
            return new Registration(code, playerId, room.getStatus(), token);
        }

        if (room.getStatus() != GameStatus.WAITING) {
            throw new RegistrationException(ErrorCode.GAME_STARTED, "Game has already started");
        }
        room.registerPlayer(playerId);
        String token = room.issueSessionToken(playerId, tokenMinter);
        room.touch(clock.instant());
        log.info("Player registered: room={} player={} host={}", code, playerId, room.isHost(playerId));
        return new Registration(code, playerId, room.getStatus(), token);
    }
}
