package com.github.rudygunawan.kura.policy;

/**
 * The reason why a cached entry was removed.
 */
public enum RemovalCause {
    /**
     * The entry was removed through {@code remove} or {@code clear}.
     */
    EXPLICIT,

    /**
     * The entry was removed because a new value was put under the same key.
     */
    REPLACED,

    /**
     * The entry was evicted because the cache exceeded its entry count or byte bound.
     */
    SIZE,

    /**
     * The entry's time-to-live had elapsed.
     */
    EXPIRED;

    /**
     * Returns {@code true} if the removal was caused by eviction (either SIZE or EXPIRED),
     * rather than manual removal or replacement.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED;
    }
}
