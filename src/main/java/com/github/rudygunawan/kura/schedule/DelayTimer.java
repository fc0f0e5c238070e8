package com.github.rudygunawan.kura.schedule;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a task once after a delay, on an unspecified thread. The scheduler uses it only to decide
 * when to hand work to the {@link MainThreadDispatcher}.
 */
@FunctionalInterface
public interface DelayTimer {

    /**
     * Runs {@code task} once after {@code delay}.
     */
    void callAfterDelay(long delay, TimeUnit unit, Runnable task);

    /**
     * Returns a timer backed by {@code executor}.
     */
    static DelayTimer fromExecutor(ScheduledExecutorService executor) {
        return (delay, unit, task) -> executor.schedule(task, delay, unit);
    }

    /**
     * Returns a timer backed by a new single-thread executor on a daemon thread named
     * {@code name}.
     */
    static DelayTimer daemon(String name) {
        return fromExecutor(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }));
    }
}
