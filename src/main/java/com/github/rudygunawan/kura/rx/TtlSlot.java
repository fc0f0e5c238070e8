package com.github.rudygunawan.kura.rx;

import java.util.Optional;

/**
 * One memoized value with an expiry time, shared by every observable built from
 * {@link Rx#cacheWithTTL(io.reactivex.rxjava3.core.Observable, java.time.Duration, TtlSlot)}.
 *
 * @param <T> the value type
 */
public final class TtlSlot<T> {
    private T value;
    private long expiresAtNanos;
    private boolean present;

    /**
     * Returns the value if one was stored and {@code nowNanos} is before its expiry.
     */
    public synchronized Optional<T> get(long nowNanos) {
        if (!present || nowNanos - expiresAtNanos >= 0) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    synchronized void set(T value, long expiresAtNanos) {
        this.value = value;
        this.expiresAtNanos = expiresAtNanos;
        this.present = true;
    }

    /**
     * Drops the stored value so the next subscription goes to the source.
     */
    public synchronized void invalidate() {
        value = null;
        present = false;
    }
}
