package com.github.rudygunawan.kura.api;

import com.github.rudygunawan.kura.model.CacheStats;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A bounded in-memory mapping from keys to values with per-entry time-to-live and
 * least-recently-used eviction.
 *
 * <p>Implementations are thread-safe: lookups share a read lock, mutations take an exclusive
 * lock, and removal listeners run after the lock is released.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
public interface Cache<K, V> {

    /**
     * Associates {@code value} with {@code key} using the cache's default time-to-live.
     */
    void put(K key, V value);

    /**
     * Associates {@code value} with {@code key}. A zero or negative {@code ttl} means the entry
     * never expires. The entry's size comes from the configured {@link Weigher}.
     *
     * @param key the key
     * @param value the value
     * @param ttl time-to-live measured from this call
     */
    void put(K key, V value, Duration ttl);

    /**
     * Associates {@code value} with {@code key} with an explicit size in bytes.
     *
     * @param key the key
     * @param value the value
     * @param ttl time-to-live measured from this call, zero or negative for no expiry
     * @param sizeBytes the size charged against the byte bound
     */
    void put(K key, V value, Duration ttl, long sizeBytes);

    /**
     * Returns the live value for {@code key}. An expired entry is removed on the way out and
     * reported as absent. A hit refreshes the entry's recency.
     */
    Optional<V> get(K key);

    /**
     * Returns the live value for {@code key}, or computes it with {@code factory} and stores it.
     *
     * <p>The lock is not held while {@code factory} runs, so two threads missing on the same key
     * may both call it; the last {@code put} wins.
     */
    V getOrCreate(K key, Supplier<? extends V> factory, Duration ttl);

    /**
     * Same as {@link #getOrCreate(Object, Supplier, Duration)} with the default time-to-live.
     */
    V getOrCreate(K key, Supplier<? extends V> factory);

    /**
     * Returns true if {@code key} has a live entry. Does not refresh recency.
     */
    boolean contains(K key);

    /**
     * Discards any cached value for {@code key}.
     *
     * @return true if an entry was removed
     */
    boolean remove(K key);

    /**
     * Discards all entries.
     */
    void clear();

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    int cleanupExpired();

    /**
     * Returns the number of entries, including expired entries not yet swept.
     */
    long size();

    /**
     * Returns the summed size in bytes of all entries.
     */
    long weightedSize();

    /**
     * Returns a snapshot of this cache's statistics. All values are zero unless the cache was
     * built with {@code recordStats()}.
     */
    CacheStats stats();
}
