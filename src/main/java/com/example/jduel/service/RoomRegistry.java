package com.example.jduel.service;

import com.example.jduel.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Owns the set of live rooms and their short public codes.
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int CODE_LENGTH = 4;
    static final int FALLBACK_CODE_LENGTH = 6;
    static final int MAX_ATTEMPTS = 100;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Executor worker;
    private final Supplier<String> codes;
    private final Supplier<String> fallbackCodes;

    @Autowired
    public RoomRegistry(Clock clock, @Qualifier("roomWorker") Executor worker) {
        this(clock, worker, randomCodes(new SecureRandom(), CODE_LENGTH), randomCodes(new SecureRandom(), FALLBACK_CODE_LENGTH));
    }

    /** Test constructor: deterministic codes. */
    public RoomRegistry(Clock clock, Executor worker, Supplier<String> codes) {
        this(clock, worker, codes, randomCodes(new SecureRandom(), FALLBACK_CODE_LENGTH));
    }

    RoomRegistry(Clock clock, Executor worker, Supplier<String> codes, Supplier<String> fallbackCodes) {
        this.clock = clock;
        this.worker = worker;
        this.codes = codes;
        this.fallbackCodes = fallbackCodes;
    }

    static Supplier<String> randomCodes(Random rnd, int length) {
        return () -> {
            StringBuilder sb = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                sb.append(CODE_ALPHABET.charAt(rnd.nextInt(CODE_ALPHABET.length())));
            }
            return sb.toString();
        };
    }

    /** Room codes are case-insensitive on input. */
    public static String normalizeCode(String raw) {
        return (raw == null) ? null : raw.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Allocates a new empty room under a fresh code. After {@value #MAX_ATTEMPTS} collisions a
     * longer code is used.
     */
    public Room create() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            Room room = tryClaim(codes.get());
            if (room != null) return room;
        }
        log.warn("Room code space crowded ({} rooms), falling back to {}-char codes", rooms.size(), FALLBACK_CODE_LENGTH);
        while (true) {
            Room room = tryClaim(fallbackCodes.get());
            if (room != null) return room;
        }
    }

    private Room tryClaim(String code) {
        String normalized = normalizeCode(code);
        if (normalized == null || normalized.isEmpty()) return null;
        Room fresh = new Room(normalized, clock.instant(), new RoomMailbox(normalized, worker));
        if (rooms.putIfAbsent(normalized, fresh) == null) {
            log.info("Room created: {}", normalized);
            return fresh;
        }
        return null;
    }

    public Optional<Room> find(String code) {
        String normalized = normalizeCode(code);
        if (normalized == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(normalized));
    }

    /** True while {@code room} is the instance registered under its code. */
    public boolean isLive(Room room) {
        return room != null && rooms.get(room.getCode()) == room;
    }

    /** Removes exactly this instance; a newer room that reused the code is left alone. */
    public boolean delete(Room room) {
        if (room == null) return false;
        boolean removed = rooms.remove(room.getCode(), room);
        if (removed) log.info("Room deleted: {}", room.getCode());
        return removed;
    }

    public Collection<Room> all() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }
}
