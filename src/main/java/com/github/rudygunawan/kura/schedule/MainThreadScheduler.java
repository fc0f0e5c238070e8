package com.github.rudygunawan.kura.schedule;

import com.github.rudygunawan.kura.time.Ticker;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.plugins.RxJavaPlugins;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs work on the host's designated thread, immediately or after a delay.
 *
 * <p>This is an RxJava {@link Scheduler}, so it can be handed to {@code observeOn}, {@code debounce}
 * and friends. Delayed work arms the {@link DelayTimer}; when it fires, the action is posted
 * through the {@link MainThreadDispatcher}, never run on the timer thread.
 *
 * <p>Every scheduled action carries a liveness flag. Disposing the returned handle (or the
 * worker that scheduled it) clears the flag, and an action whose flag is clear is skipped when its
 * turn comes. An action that is already running is not interrupted.
 *
 * <p>The scheduler has no error channel: an action that throws is logged and dropped.
 *
 * <p>Collaborators are injected so tests can substitute a manually advanced clock and queue:
 * <pre>{@code
 * MainThreadScheduler scheduler = new MainThreadScheduler(SwingDispatcher.INSTANCE,
 *     DelayTimer.daemon("ui-timer"), Ticker.systemTicker());
 * }</pre>
 */
public class MainThreadScheduler extends Scheduler {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.Scheduler");

    private final MainThreadDispatcher dispatcher;
    private final DelayTimer timer;
    private final Ticker ticker;

    public MainThreadScheduler(MainThreadDispatcher dispatcher, DelayTimer timer, Ticker ticker) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
        this.timer = Objects.requireNonNull(timer, "timer cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
    }

    /**
     * Creates a scheduler on {@code dispatcher} with a daemon timer thread and the system ticker.
     */
    public static MainThreadScheduler create(MainThreadDispatcher dispatcher) {
        return new MainThreadScheduler(dispatcher, DelayTimer.daemon("kura-scheduler-timer"), Ticker.systemTicker());
    }

    public MainThreadDispatcher dispatcher() {
        return dispatcher;
    }

    @Override
    public long now(TimeUnit unit) {
        return unit.convert(ticker.read(), TimeUnit.NANOSECONDS);
    }

    /**
     * Returns the current ticker reading in nanoseconds, the time base for
     * {@link #schedule(Runnable, long)}.
     */
    public long nanoTime() {
        return ticker.read();
    }

    /**
     * Runs {@code action} on the designated thread. Called from that thread, the action runs
     * inline before this method returns.
     *
     * @return a handle whose {@code dispose()} cancels the action if it has not started
     */
    public Disposable schedule(Runnable action) {
        ScheduledAction scheduled = new ScheduledAction(action, null);
        if (dispatcher.isMainThread()) {
            scheduled.run();
        } else {
            dispatcher.post(scheduled);
        }
        return scheduled;
    }

    /**
     * Runs {@code action} on the designated thread at {@code dueTimeNanos} (a {@link #nanoTime()}
     * reading). A due time that has passed dispatches immediately like {@link #schedule(Runnable)}.
     */
    public Disposable schedule(Runnable action, long dueTimeNanos) {
        long delay = dueTimeNanos - ticker.read();
        if (delay <= 0) {
            return schedule(action);
        }
        return scheduleAfter(action, delay, TimeUnit.NANOSECONDS);
    }

    /**
     * Runs {@code action} on the designated thread after {@code delay}. Always asynchronous, even
     * for a zero delay, so an action may reschedule itself without growing the stack.
     */
    public Disposable scheduleAfter(Runnable action, long delay, TimeUnit unit) {
        ScheduledAction scheduled = new ScheduledAction(action, null);
        dispatchLater(scheduled, unit.toNanos(delay));
        return scheduled;
    }

    public Disposable scheduleAfter(Runnable action, Duration delay) {
        return scheduleAfter(action, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public Worker createWorker() {
        return new MainThreadWorker();
    }

    private void dispatchLater(ScheduledAction action, long delayNanos) {
        if (delayNanos <= 0) {
            dispatcher.post(action);
            return;
        }
        timer.callAfterDelay(delayNanos, TimeUnit.NANOSECONDS, () -> {
            if (!action.isDisposed()) {
                dispatcher.post(action);
            }
        });
    }

    /**
     * An action plus its liveness flag. Runs at most once.
     */
    private static final class ScheduledAction implements Runnable, Disposable {
        private final Runnable action;
        private final CompositeDisposable parent;
        private final AtomicBoolean done = new AtomicBoolean(false);

        ScheduledAction(Runnable action, CompositeDisposable parent) {
            this.action = Objects.requireNonNull(action, "action cannot be null");
            this.parent = parent;
        }

        @Override
        public void run() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            try {
                action.run();
            } catch (Throwable t) {
                LOGGER.log(Level.WARNING, "Scheduled action threw exception", t);
            } finally {
                if (parent != null) {
                    parent.delete(this);
                }
            }
        }

        @Override
        public void dispose() {
            if (done.compareAndSet(false, true) && parent != null) {
                parent.delete(this);
            }
        }

        @Override
        public boolean isDisposed() {
            return done.get();
        }
    }

    /**
     * RxJava worker. Disposing it clears the liveness flag of every action it has pending.
     */
    private final class MainThreadWorker extends Worker {
        private final CompositeDisposable tasks = new CompositeDisposable();

        @Override
        public Disposable schedule(Runnable run, long delay, TimeUnit unit) {
            if (tasks.isDisposed()) {
                return Disposable.disposed();
            }
            ScheduledAction action = new ScheduledAction(RxJavaPlugins.onSchedule(run), tasks);
            if (!tasks.add(action)) {
                return Disposable.disposed();
            }
            dispatchLater(action, unit.toNanos(delay));
            return action;
        }

        @Override
        public long now(TimeUnit unit) {
            return MainThreadScheduler.this.now(unit);
        }

        @Override
        public void dispose() {
            tasks.dispose();
        }

        @Override
        public boolean isDisposed() {
            return tasks.isDisposed();
        }
    }
}
