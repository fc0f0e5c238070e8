package com.github.rudygunawan.kura.model;

import java.util.Objects;

/**
 * Statistics about the performance of a cache. Instances of this class are immutable.
 *
 * <ul>
 *   <li>A lookup that finds a live entry increments {@code hitCount}.
 *   <li>A lookup that finds nothing, an expired entry or a stale file increments
 *       {@code missCount}.
 *   <li>A factory call from {@code getOrCreate} increments {@code loadSuccessCount} or
 *       {@code loadFailureCount}.
 *   <li>An entry removed for size or expiry increments {@code evictionCount}.
 * </ul>
 */
public class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long loadSuccessCount;
    private final long loadFailureCount;
    private final long evictionCount;

    public CacheStats(
            long hitCount,
            long missCount,
            long loadSuccessCount,
            long loadFailureCount,
            long evictionCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.loadSuccessCount = loadSuccessCount;
        this.loadFailureCount = loadFailureCount;
        this.evictionCount = evictionCount;
    }

    /**
     * Returns an empty {@code CacheStats}.
     */
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }

    /**
     * Returns {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    public long hitCount() {
        return hitCount;
    }

    /**
     * Returns {@code hitCount / requestCount}, or {@code 1.0} when there were no requests.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
    }

    public long missCount() {
        return missCount;
    }

    /**
     * Returns {@code missCount / requestCount}, or {@code 0.0} when there were no requests.
     */
    public double missRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
    }

    public long loadCount() {
        return loadSuccessCount + loadFailureCount;
    }

    public long loadSuccessCount() {
        return loadSuccessCount;
    }

    public long loadFailureCount() {
        return loadFailureCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    /**
     * Returns a new {@code CacheStats} representing the difference between this {@code CacheStats}
     * and {@code other}.
     */
    public CacheStats minus(CacheStats other) {
        return new CacheStats(
                Math.max(0, hitCount - other.hitCount),
                Math.max(0, missCount - other.missCount),
                Math.max(0, loadSuccessCount - other.loadSuccessCount),
                Math.max(0, loadFailureCount - other.loadFailureCount),
                Math.max(0, evictionCount - other.evictionCount));
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, loadSuccessCount, loadFailureCount, evictionCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return hitCount == other.hitCount
                && missCount == other.missCount
                && loadSuccessCount == other.loadSuccessCount
                && loadFailureCount == other.loadFailureCount
                && evictionCount == other.evictionCount;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", loadSuccessCount=" + loadSuccessCount
                + ", loadFailureCount=" + loadFailureCount
                + ", evictionCount=" + evictionCount
                + '}';
    }
}
