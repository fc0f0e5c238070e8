package com.github.rudygunawan.kura.schedule;

import com.github.rudygunawan.kura.time.Ticker;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.observers.TestObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MainThreadSchedulerTest {

    private VirtualMainThread main;
    private MainThreadScheduler scheduler;

    @BeforeEach
    void setUp() {
        main = new VirtualMainThread();
        scheduler = main.scheduler();
    }

    @Test
    void testScheduleFromOtherThreadIsPosted() {
        List<String> ran = new ArrayList<>();

        scheduler.schedule(() -> ran.add("task"));

        assertTrue(ran.isEmpty());
        assertEquals(1, main.runPending());
        assertEquals(List.of("task"), ran);
    }

    @Test
    void testScheduleOnMainThreadRunsInline() {
        List<String> ran = new ArrayList<>();

        scheduler.schedule(() -> {
            ran.add("outer-start");
            scheduler.schedule(() -> ran.add("inner"));
            ran.add("outer-end");
        });
        main.runPending();

        assertEquals(List.of("outer-start", "inner", "outer-end"), ran);
    }

    @Test
    void testTasksRunInPostingOrder() {
        List<Integer> ran = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int n = i;
            scheduler.schedule(() -> ran.add(n));
        }

        main.runPending();

        assertEquals(List.of(0, 1, 2, 3, 4), ran);
    }

    @Test
    void testDisposeBeforeRunCancels() {
        AtomicBoolean ran = new AtomicBoolean();

        Disposable handle = scheduler.schedule(() -> ran.set(true));
        handle.dispose();
        main.runPending();

        assertFalse(ran.get());
        assertTrue(handle.isDisposed());
    }

    @Test
    void testScheduleAfterWaitsForDelay() {
        List<Long> ranAt = new ArrayList<>();

        scheduler.scheduleAfter(() -> ranAt.add(scheduler.now(TimeUnit.MILLISECONDS)), 100, TimeUnit.MILLISECONDS);

        main.advance(99, TimeUnit.MILLISECONDS);
        assertTrue(ranAt.isEmpty());
        main.advance(1, TimeUnit.MILLISECONDS);
        assertEquals(List.of(100L), ranAt);
    }

    @Test
    void testScheduleAfterZeroIsStillAsynchronous() {
        AtomicBoolean ran = new AtomicBoolean();
        AtomicBoolean ranBeforeReturn = new AtomicBoolean();

        scheduler.schedule(() -> {
            scheduler.scheduleAfter(() -> ran.set(true), 0, TimeUnit.MILLISECONDS);
            ranBeforeReturn.set(ran.get());
        });
        main.runPending();

        assertFalse(ranBeforeReturn.get());
        assertTrue(ran.get());
    }

    @Test
    void testDelayedActionsRunInDueOrder() {
        List<String> ran = new ArrayList<>();

        scheduler.scheduleAfter(() -> ran.add("late"), 300, TimeUnit.MILLISECONDS);
        scheduler.scheduleAfter(() -> ran.add("early"), 100, TimeUnit.MILLISECONDS);
        scheduler.scheduleAfter(() -> ran.add("middle"), 200, TimeUnit.MILLISECONDS);
        main.advance(1, TimeUnit.SECONDS);

        assertEquals(List.of("early", "middle", "late"), ran);
    }

    @Test
    void testScheduleAtDueTime() {
        List<String> ran = new ArrayList<>();
        long start = scheduler.nanoTime();

        scheduler.schedule(() -> ran.add("future"), start + TimeUnit.MILLISECONDS.toNanos(50));
        scheduler.schedule(() -> ran.add("past"), start - 1);

        main.runPending();
        assertEquals(List.of("past"), ran);
        main.advance(50, TimeUnit.MILLISECONDS);
        assertEquals(List.of("past", "future"), ran);
    }

    @Test
    void testDisposingDelayedActionSkipsItWhenTimerFires() {
        AtomicBoolean ran = new AtomicBoolean();

        Disposable handle = scheduler.scheduleAfter(() -> ran.set(true), 1, TimeUnit.SECONDS);
        main.advance(500, TimeUnit.MILLISECONDS);
        handle.dispose();
        main.advance(1, TimeUnit.SECONDS);

        assertFalse(ran.get());
        assertEquals(0, main.pendingTimers());
    }

    @Test
    void testDisposeAfterPostBeforeDrainCancels() {
        AtomicBoolean ran = new AtomicBoolean();

        Disposable handle = scheduler.scheduleAfter(() -> ran.set(true), 0, TimeUnit.MILLISECONDS);
        assertEquals(1, main.pendingTasks());
        handle.dispose();
        main.runPending();

        assertFalse(ran.get());
    }

    @Test
    void testSelfReschedulingDoesNotGrowStack() {
        AtomicInteger runs = new AtomicInteger();
        Runnable[] loop = new Runnable[1];
        loop[0] = () -> {
            if (runs.incrementAndGet() < 10_000) {
                scheduler.scheduleAfter(loop[0], 0, TimeUnit.MILLISECONDS);
            }
        };

        scheduler.schedule(loop[0]);
        main.runPending();

        assertEquals(10_000, runs.get());
    }

    @Test
    void testExceptionInActionIsLoggedAndSwallowed() {
        List<String> ran = new ArrayList<>();

        scheduler.schedule(() -> {
            throw new IllegalStateException("broken action");
        });
        scheduler.schedule(() -> ran.add("next"));
        main.runPending();

        assertEquals(List.of("next"), ran);
    }

    @Test
    void testWorkerDisposeCancelsPendingActions() {
        Scheduler.Worker worker = scheduler.createWorker();
        List<String> ran = new ArrayList<>();

        worker.schedule(() -> ran.add("now"));
        worker.schedule(() -> ran.add("later"), 1, TimeUnit.SECONDS);
        main.runPending();
        worker.dispose();
        main.advance(2, TimeUnit.SECONDS);

        assertEquals(List.of("now"), ran);
        assertTrue(worker.isDisposed());
        assertTrue(worker.schedule(() -> ran.add("after-dispose")).isDisposed());
    }

    @Test
    void testWorkerReadsTicker() {
        Scheduler.Worker worker = scheduler.createWorker();

        main.advance(1500, TimeUnit.MILLISECONDS);

        assertEquals(1500, worker.now(TimeUnit.MILLISECONDS));
        assertEquals(1500, scheduler.now(TimeUnit.MILLISECONDS));
        worker.dispose();
    }

    @Test
    void testObserveOnDeliversThroughDispatcher() {
        TestObserver<Integer> observer = Observable.just(1, 2, 3)
                .observeOn(scheduler)
                .test();

        observer.assertEmpty();
        main.runPending();

        observer.assertResult(1, 2, 3);
    }

    @Test
    void testIntervalUsesVirtualTime() {
        TestObserver<Long> observer = Observable.interval(1, TimeUnit.SECONDS, scheduler)
                .take(3)
                .test();

        main.advance(2, TimeUnit.SECONDS);
        observer.assertValues(0L, 1L);
        main.advance(1, TimeUnit.SECONDS);
        observer.assertResult(0L, 1L, 2L);
    }

    @Test
    @Timeout(5)
    void testEventLoopDispatcherRunsOnItsThread() throws Exception {
        try (EventLoopDispatcher loop = new EventLoopDispatcher("kura-test-loop")) {
            MainThreadScheduler real = new MainThreadScheduler(loop,
                    DelayTimer.daemon("kura-test-timer"), Ticker.systemTicker());
            AtomicReference<String> threadName = new AtomicReference<>();
            AtomicBoolean wasMain = new AtomicBoolean();
            CountDownLatch done = new CountDownLatch(2);

            assertFalse(loop.isMainThread());
            real.schedule(() -> {
                threadName.set(Thread.currentThread().getName());
                wasMain.set(loop.isMainThread());
                done.countDown();
            });
            real.scheduleAfter(done::countDown, 20, TimeUnit.MILLISECONDS);

            assertTrue(done.await(2, TimeUnit.SECONDS));
            assertEquals("kura-test-loop", threadName.get());
            assertTrue(wasMain.get());
        }
    }
}
