package com.github.rudygunawan.kura.schedule;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link MainThreadDispatcher} that owns its designated thread: a single named daemon thread
 * draining a FIFO queue. Used by headless hosts and by tests that need a real second thread.
 */
public class EventLoopDispatcher implements MainThreadDispatcher, AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.Scheduler");

    private final ExecutorService executor;
    private volatile Thread loopThread;

    public EventLoopDispatcher(String threadName) {
        Objects.requireNonNull(threadName, "threadName cannot be null");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    @Override
    public boolean isMainThread() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void post(Runnable task) {
        Objects.requireNonNull(task, "task cannot be null");
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Task on event loop threw exception", e);
            }
        });
    }

    /**
     * Stops accepting tasks and waits briefly for queued ones to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
