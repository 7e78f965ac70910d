package com.example.jduel.service;

import com.example.jduel.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cancellable delayed callbacks per (room, kind).
 *
 * <p>Each schedule gets a fresh generation. On expiry the callback is queued on the room's
 * mailbox and only runs if its handle is still the current one for its key, so a callback
 * that was already in flight when it got cancelled or replaced does nothing.</p>
 */
@Component
public class TimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    record TimerKey(String roomCode, TimerKind kind) { }

    private static final class Handle {
        final long generation;
        volatile ScheduledFuture<?> future;

        Handle(long generation) {
            this.generation = generation;
        }
    }

    private final ScheduledExecutorService scheduler;
    private final RoomDispatcher dispatcher;
    private final AtomicLong generations = new AtomicLong();
    private final Map<TimerKey, Handle> pending = new ConcurrentHashMap<>();

    public TimerScheduler(@Qualifier("gameTimers") ScheduledExecutorService scheduler, RoomDispatcher dispatcher) {
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
    }

    /** Schedules {@code callback}, replacing any pending timer of the same kind. */
    public void schedule(Room room, TimerKind kind, Duration delay, Runnable callback) {
        TimerKey key = new TimerKey(room.getCode(), kind);
        Handle handle = new Handle(generations.incrementAndGet());
        // registered before the future exists so an immediate expiry already sees it as current
        Handle previous = pending.put(key, handle);
        cancelFuture(previous);

        handle.future = scheduler.schedule(
                () -> dispatcher.dispatch(room, () -> fire(key, handle, callback)),
                Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
        log.debug("Timer scheduled room={} kind={} gen={} delay={}ms", key.roomCode(), kind, handle.generation, delay.toMillis());
    }

    private void fire(TimerKey key, Handle handle, Runnable callback) {
        // only the current generation may act; remove() also clears the slot
        if (!pending.remove(key, handle)) {
            log.debug("Stale timer ignored room={} kind={} gen={}", key.roomCode(), key.kind(), handle.generation);
            return;
        }
        callback.run();
    }

    public void cancel(Room room, TimerKind kind) {
        cancelFuture(pending.remove(new TimerKey(room.getCode(), kind)));
    }

    public void cancelAll(Room room) {
        for (TimerKind kind : TimerKind.values()) {
            cancel(room, kind);
        }
    }

    public boolean isPending(Room room, TimerKind kind) {
        return pending.containsKey(new TimerKey(room.getCode(), kind));
    }

    private static void cancelFuture(Handle handle) {
        if (handle == null) return;
        ScheduledFuture<?> f = handle.future;
        if (f != null) f.cancel(false);
    }
}
