package com.github.rudygunawan.kura.metrics;

/**
 * Read-only counters a cache exposes for monitoring. Implemented by the memory cache and by the
 * file caches, and consumed by {@link MicrometerCacheMetrics}.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long size();

    /**
     * Returns the summed size of the entries in bytes.
     */
    long weightedSize();

    /**
     * Returns the byte bound of the cache, or {@code -1} when unbounded.
     */
    long capacityBytes();

    long hitCount();

    long missCount();

    long evictionCount();
}
