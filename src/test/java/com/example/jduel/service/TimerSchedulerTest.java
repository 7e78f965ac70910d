package com.example.jduel.service;

import com.example.jduel.model.Room;
import com.example.jduel.support.ManualScheduler;
import com.example.jduel.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TimerSchedulerTest {

    private ManualScheduler scheduler;
    private RoomRegistry registry;
    private TimerScheduler timers;
    private Room room;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        registry = new RoomRegistry(new MutableClock(Instant.EPOCH), Runnable::run, () -> "T1M3");
        timers = new TimerScheduler(scheduler.executor(), new RoomDispatcher(registry));
        room = registry.create();
    }

    @Test
    @DisplayName("expiry runs the callback once and clears the slot")
    void firesOnce() {
        AtomicInteger calls = new AtomicInteger();
        timers.schedule(room, TimerKind.QUESTION, Duration.ofSeconds(15), calls::incrementAndGet);
        assertTrue(timers.isPending(room, TimerKind.QUESTION));

        ManualScheduler.Task task = scheduler.tasks().get(0);
        assertEquals(15_000L, task.delayMs);
        scheduler.runAnyway(task);
        scheduler.runAnyway(task);

        assertEquals(1, calls.get());
        assertFalse(timers.isPending(room, TimerKind.QUESTION));
    }

    @Test
    @DisplayName("a cancelled callback that still gets delivered is a no-op")
    void cancelledCallbackIsNoOp() {
        AtomicInteger calls = new AtomicInteger();
        timers.schedule(room, TimerKind.RESULTS, Duration.ofSeconds(10), calls::incrementAndGet);
        ManualScheduler.Task task = scheduler.tasks().get(0);

        timers.cancel(room, TimerKind.RESULTS);
        assertTrue(task.isCancelled());

        scheduler.runAnyway(task);
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("scheduling the same kind again supersedes the previous timer")
    void rescheduleSupersedes() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        timers.schedule(room, TimerKind.QUESTION, Duration.ofSeconds(15), first::incrementAndGet);
        timers.schedule(room, TimerKind.QUESTION, Duration.ofSeconds(15), second::incrementAndGet);

        ManualScheduler.Task old = scheduler.tasks().get(0);
        ManualScheduler.Task current = scheduler.tasks().get(1);
        assertTrue(old.isCancelled());

        scheduler.runAnyway(old);
        scheduler.runAnyway(current);
        assertEquals(0, first.get());
        assertEquals(1, second.get());
    }

    @Test
    @DisplayName("cancelAll clears every kind; other kinds are independent")
    void cancelAll() {
        timers.schedule(room, TimerKind.QUESTION, Duration.ofSeconds(15), () -> { });
        timers.schedule(room, TimerKind.CLEANUP, Duration.ofSeconds(60), () -> { });
        assertTrue(timers.isPending(room, TimerKind.QUESTION));
        assertTrue(timers.isPending(room, TimerKind.CLEANUP));

        timers.cancelAll(room);

        assertFalse(timers.isPending(room, TimerKind.QUESTION));
        assertFalse(timers.isPending(room, TimerKind.CLEANUP));
        assertTrue(scheduler.tasks().stream().allMatch(ManualScheduler.Task::isCancelled));
    }

    @Test
    @DisplayName("callbacks for a deleted room never run")
    void deletedRoomIgnored() {
        AtomicInteger calls = new AtomicInteger();
        timers.schedule(room, TimerKind.CLEANUP, Duration.ofSeconds(60), calls::incrementAndGet);
        registry.delete(room);

        scheduler.runAnyway(scheduler.tasks().get(0));
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("expiry is queued on the room mailbox, not run on the timer thread")
    void expiryGoesThroughMailbox() {
        ScheduledExecutorService exec = mock(ScheduledExecutorService.class);
        doReturn(mock(ScheduledFuture.class)).when(exec).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        RoomDispatcher dispatcher = mock(RoomDispatcher.class);
        TimerScheduler t = new TimerScheduler(exec, dispatcher);

        t.schedule(room, TimerKind.RESULTS, Duration.ofMillis(250), () -> { });

        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(exec).schedule(captor.capture(), eq(250L), eq(TimeUnit.MILLISECONDS));
        captor.getValue().run();
        verify(dispatcher).dispatch(eq(room), any(Runnable.class));
    }
}
