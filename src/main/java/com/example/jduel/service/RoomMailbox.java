package com.example.jduel.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-consumer FIFO queue for one room. Tasks are drained by at most one worker at a time,
 * so everything submitted here observes a strictly sequential view of the room.
 *
 * <p>Works with any backing executor; with a direct one ({@code Runnable::run}) tasks run on the
 * submitting thread, and tasks submitted from inside a running task are queued behind it.</p>
 */
public class RoomMailbox implements Executor {

    private static final Logger log = LoggerFactory.getLogger(RoomMailbox.class);

    private final String roomCode;
    private final Executor worker;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public RoomMailbox(String roomCode, Executor worker) {
        this.roomCode = roomCode;
        this.worker = worker;
    }

    @Override
    public void execute(Runnable task) {
        queue.add(task);
        scheduleDrain();
    }

    public int pending() {
        return queue.size();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            worker.execute(this::drain);
        }
    }

    private void drain() {
        try {
            Runnable next;
            while ((next = queue.poll()) != null) {
                try {
                    next.run();
                } catch (RuntimeException e) {
                    log.error("Room task failed (room={})", roomCode, e);
                }
            }
        } finally {
            draining.set(false);
        }
        // a task may have slipped in between the last poll and the flag reset
        if (!queue.isEmpty()) scheduleDrain();
    }
}
