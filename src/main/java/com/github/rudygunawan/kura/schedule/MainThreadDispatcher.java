package com.github.rudygunawan.kura.schedule;

/**
 * The host's "run on the designated thread" primitive.
 *
 * <p>Implementations must accept {@link #post} from any thread and run posted tasks one at a
 * time, in posting order, on the designated thread.
 */
public interface MainThreadDispatcher {

    /**
     * Returns true if the calling thread is the designated thread.
     */
    boolean isMainThread();

    /**
     * Queues {@code task} to run on the designated thread. Never runs it inline.
     */
    void post(Runnable task);
}
