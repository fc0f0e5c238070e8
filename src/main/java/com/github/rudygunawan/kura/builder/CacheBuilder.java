package com.github.rudygunawan.kura.builder;

import com.github.rudygunawan.kura.api.Cache;
import com.github.rudygunawan.kura.api.Weigher;
import com.github.rudygunawan.kura.impl.BoundedMemoryCache;
import com.github.rudygunawan.kura.listener.RemovalListener;
import com.github.rudygunawan.kura.time.Ticker;

import java.time.Duration;
import java.util.Objects;

/**
 * A builder of bounded in-memory {@link Cache} instances.
 *
 * <p>Every cache is bounded twice: by entry count and by summed entry size in bytes. After each
 * {@code put} the least recently accessed entries are evicted until both bounds hold.
 *
 * <pre>{@code
 * Cache<String, byte[]> waveforms = CacheBuilder.newBuilder()
 *     .maximumSize(500)
 *     .maximumWeight(32 * CacheDefaults.MIB)
 *     .weigher(Weigher.byteArrayWeigher())
 *     .defaultTimeToLive(Duration.ofMinutes(10))
 *     .recordStats()
 *     .build();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class CacheBuilder<K, V> {
    private long maximumSize = CacheDefaults.MEMORY_MAXIMUM_SIZE;
    private long maximumWeight = CacheDefaults.MEMORY_MAXIMUM_WEIGHT;
    private Weigher<? super K, ? super V> weigher;
    private Duration defaultTimeToLive = Duration.ZERO;
    private RemovalListener<? super K, ? super V> removalListener;
    private Ticker ticker;
    private boolean recordStats = false;

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings.
     */
    public static CacheBuilder<Object, Object> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * Specifies the maximum number of entries the cache may contain.
     *
     * @param maximumSize the maximum size of the cache
     * @return this builder instance
     * @throws IllegalArgumentException if {@code maximumSize} is negative
     */
    public CacheBuilder<K, V> maximumSize(long maximumSize) {
        if (maximumSize < 0) {
            throw new IllegalArgumentException("maximum size must not be negative");
        }
        this.maximumSize = maximumSize;
        return this;
    }

    /**
     * Specifies the maximum summed size in bytes of the entries the cache may contain.
     *
     * @param maximumWeight the byte bound
     * @return this builder instance
     * @throws IllegalArgumentException if {@code maximumWeight} is negative
     */
    public CacheBuilder<K, V> maximumWeight(long maximumWeight) {
        if (maximumWeight < 0) {
            throw new IllegalArgumentException("maximum weight must not be negative");
        }
        this.maximumWeight = maximumWeight;
        return this;
    }

    /**
     * Specifies how the size of an entry is computed when {@code put} is called without an
     * explicit size. Without a weigher such entries weigh zero bytes.
     */
    @SuppressWarnings("unchecked")
    public <K1 extends K, V1 extends V> CacheBuilder<K1, V1> weigher(Weigher<? super K1, ? super V1> weigher) {
        Objects.requireNonNull(weigher, "weigher cannot be null");
        CacheBuilder<K1, V1> me = (CacheBuilder<K1, V1>) this;
        me.weigher = weigher;
        return me;
    }

    /**
     * Specifies the time-to-live used by {@code put(key, value)} and {@code getOrCreate(key, factory)}.
     * Zero (the default) means entries never expire.
     *
     * @throws IllegalArgumentException if {@code ttl} is negative
     */
    public CacheBuilder<K, V> defaultTimeToLive(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("default time-to-live must not be negative");
        }
        this.defaultTimeToLive = ttl;
        return this;
    }

    /**
     * Specifies a listener notified each time an entry is removed. The listener runs outside the
     * cache lock.
     */
    @SuppressWarnings("unchecked")
    public <K1 extends K, V1 extends V> CacheBuilder<K1, V1> removalListener(
            RemovalListener<? super K1, ? super V1> listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        CacheBuilder<K1, V1> me = (CacheBuilder<K1, V1>) this;
        me.removalListener = listener;
        return me;
    }

    /**
     * Specifies a nanosecond-precision time source. By default {@link Ticker#systemTicker()}.
     */
    public CacheBuilder<K, V> ticker(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        return this;
    }

    /**
     * Enables the accumulation of {@link com.github.rudygunawan.kura.model.CacheStats}.
     */
    public CacheBuilder<K, V> recordStats() {
        this.recordStats = true;
        return this;
    }

    /**
     * Builds a cache which does not automatically load values when keys are requested.
     */
    public <K1 extends K, V1 extends V> Cache<K1, V1> build() {
        return new BoundedMemoryCache<K1, V1>(this);
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public long getMaximumWeight() {
        return maximumWeight;
    }

    public Weigher<? super K, ? super V> getWeigher() {
        return weigher == null ? Weigher.zeroWeigher() : weigher;
    }

    public Duration getDefaultTimeToLive() {
        return defaultTimeToLive;
    }

    public RemovalListener<? super K, ? super V> getRemovalListener() {
        return removalListener;
    }

    public Ticker getTicker() {
        return ticker == null ? Ticker.systemTicker() : ticker;
    }

    public boolean isRecordStats() {
        return recordStats;
    }
}
