package com.example.jduel.service;

import com.example.jduel.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single entry point for touching a room: work is enqueued on the room's mailbox and re-checks
 * that the room is still registered once it runs. Work for a deleted room is a no-op.
 */
@Component
public class RoomDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RoomDispatcher.class);

    private final RoomRegistry registry;

    public RoomDispatcher(RoomRegistry registry) {
        this.registry = registry;
    }

    public void dispatch(String roomCode, Consumer<Room> work) {
        registry.find(roomCode).ifPresentOrElse(
                room -> dispatch(room, () -> work.accept(room)),
                () -> log.debug("Dropped work for unknown room {}", roomCode));
    }

    public void dispatch(Room room, Runnable work) {
        room.mailbox().execute(() -> {
            if (!registry.isLive(room)) {
                log.debug("Dropped work for deleted room {}", room.getCode());
                return;
            }
            work.run();
        });
    }

    /**
     * Runs {@code work} on the room's mailbox and completes with its result. Completes with
     * {@code whenMissing} if the room does not exist (or is deleted before the work runs).
     */
    public <T> CompletableFuture<T> call(String roomCode, Function<Room, T> work, Supplier<T> whenMissing) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Room room = registry.find(roomCode).orElse(null);
        if (room == null) {
            completeWith(result, whenMissing);
            return result;
        }
        room.mailbox().execute(() -> {
            if (!registry.isLive(room)) {
                completeWith(result, whenMissing);
                return;
            }
            try {
                result.complete(work.apply(room));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private static <T> void completeWith(CompletableFuture<T> result, Supplier<T> supplier) {
        try {
            result.complete(supplier.get());
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    /** Blocks for the result, rethrowing the work's own runtime exception. */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }
}
