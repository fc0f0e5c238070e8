package com.github.rudygunawan.kura.api;

/**
 * Calculates the size in bytes of a cache entry, used for the cache's byte bound.
 *
 * <p>The weigher is called once per {@code put}. Keep it cheap: an approximation proportional to
 * the real footprint is enough.
 *
 * <pre>{@code
 * Cache<String, byte[]> thumbnails = CacheBuilder.newBuilder()
 *     .maximumWeight(10 * 1024 * 1024)
 *     .weigher(Weigher.byteArrayWeigher())
 *     .build();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface Weigher<K, V> {

    /**
     * Returns the size of an entry in bytes. Must not be negative.
     *
     * @param key the cache key (never null)
     * @param value the cache value (never null)
     * @return the weight of the entry
     */
    long weigh(K key, V value);

    /**
     * Returns a weigher that gives every entry zero weight, so only the entry count bound applies.
     */
    static <K, V> Weigher<K, V> zeroWeigher() {
        return (key, value) -> 0L;
    }

    /**
     * Returns a weigher that weighs entries by the byte array value length.
     */
    static <K> Weigher<K, byte[]> byteArrayWeigher() {
        return (key, value) -> value.length;
    }

    /**
     * Returns a weigher that weighs entries by value string length, two bytes per char.
     */
    static <K> Weigher<K, String> stringWeigher() {
        return (key, value) -> 2L * value.length();
    }
}
