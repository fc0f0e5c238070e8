package com.github.rudygunawan.kura.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A cache entry that wraps a value with the metadata used for expiration and LRU eviction.
 *
 * <p>All times are {@link com.github.rudygunawan.kura.time.Ticker} readings in nanoseconds. The
 * access fields are atomic so a reader holding only the shared lock can refresh recency.
 *
 * @param <V> the type of the cached value
 */
public class CacheEntry<V> {
    private final V value;
    private final long createdAt;
    private final long ttlNanos;
    private final long sizeBytes;
    private final AtomicLong lastAccessedAt;
    private final AtomicLong accessOrder;

    /**
     * Creates a new cache entry.
     *
     * @param value the value to cache
     * @param now the current ticker reading
     * @param ttlNanos the time-to-live in nanoseconds, or 0 for no expiration
     * @param sizeBytes the size of the entry for the byte bound
     * @param order the access sequence number, used to break ties between equal timestamps
     */
    public CacheEntry(V value, long now, long ttlNanos, long sizeBytes, long order) {
        this.value = value;
        this.createdAt = now;
        this.ttlNanos = Math.max(0, ttlNanos);
        this.sizeBytes = sizeBytes;
        this.lastAccessedAt = new AtomicLong(now);
        this.accessOrder = new AtomicLong(order);
    }

    public V getValue() {
        return value;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getTtlNanos() {
        return ttlNanos;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getLastAccessedAt() {
        return lastAccessedAt.get();
    }

    public long getAccessOrder() {
        return accessOrder.get();
    }

    /**
     * Records an access at {@code now}.
     */
    public void touch(long now, long order) {
        lastAccessedAt.set(now);
        accessOrder.set(order);
    }

    /**
     * Returns true if this entry has a TTL and more than TTL nanoseconds have passed since it was
     * created.
     */
    public boolean isExpired(long now) {
        return ttlNanos > 0 && now - createdAt > ttlNanos;
    }

    /**
     * Returns true if this entry was used less recently than {@code other}.
     */
    public boolean isOlderThan(CacheEntry<?> other) {
        long mine = getLastAccessedAt();
        long theirs = other.getLastAccessedAt();
        if (mine != theirs) {
            return mine < theirs;
        }
        return getAccessOrder() < other.getAccessOrder();
    }
}
