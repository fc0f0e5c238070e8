package com.github.rudygunawan.kura.impl;

import com.github.rudygunawan.kura.api.Cache;
import com.github.rudygunawan.kura.api.Weigher;
import com.github.rudygunawan.kura.builder.CacheBuilder;
import com.github.rudygunawan.kura.listener.RemovalListener;
import com.github.rudygunawan.kura.metrics.CacheMetrics;
import com.github.rudygunawan.kura.model.CacheEntry;
import com.github.rudygunawan.kura.model.CacheStats;
import com.github.rudygunawan.kura.policy.RemovalCause;
import com.github.rudygunawan.kura.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory cache bounded by entry count and by summed entry size, with per-entry TTL and LRU
 * eviction.
 *
 * <p>Locking: one {@link ReentrantReadWriteLock} guards the map. {@code get} and {@code contains}
 * share the read lock; recency is refreshed through atomic fields on the entry. Mutations take
 * the write lock. Removal notifications are collected while the lock is held and delivered after
 * it is released, so a {@link RemovalListener} may call back into this cache.
 *
 * <p>Eviction picks the entry with the oldest {@code lastAccessedAt}; equal timestamps fall back
 * to access order. The victim scan is linear, which is fine for the few thousand entries a UI
 * cache holds.
 *
 * <p>Logging: This class uses java.util.logging. See {@link #LOGGER} for the logger name.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class BoundedMemoryCache<K, V> implements Cache<K, V>, CacheMetrics {
    /**
     * Logger for cache operations. Logger name: "com.github.rudygunawan.kura.Cache"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>WARNING: Errors in removal listeners or factories (operations continue)</li>
     *   <li>FINE: Evictions and expiry sweeps</li>
     *   <li>FINER: Entry-level operations (put, remove)</li>
     * </ul>
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.Cache");

    private final Map<K, CacheEntry<V>> storage = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong accessSequence = new AtomicLong();

    private final long maximumSize;
    private final long maximumWeight;
    private final long defaultTtlNanos;
    private final Weigher<? super K, ? super V> weigher;
    private final RemovalListener<? super K, ? super V> removalListener;
    private final Ticker ticker;
    private final boolean recordStats;

    // Guarded by lock.writeLock()
    private long totalWeight;

    // Statistics
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong loadSuccessCount = new AtomicLong(0);
    private final AtomicLong loadFailureCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);

    @SuppressWarnings("unchecked")
    public BoundedMemoryCache(CacheBuilder<?, ?> builder) {
        this.maximumSize = builder.getMaximumSize();
        this.maximumWeight = builder.getMaximumWeight();
        this.defaultTtlNanos = builder.getDefaultTimeToLive().toNanos();
        this.weigher = (Weigher<? super K, ? super V>) builder.getWeigher();
        this.removalListener = (RemovalListener<? super K, ? super V>) builder.getRemovalListener();
        this.ticker = builder.getTicker();
        this.recordStats = builder.isRecordStats();
    }

    @Override
    public void put(K key, V value) {
        putInternal(key, value, defaultTtlNanos, weigh(key, value));
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        putInternal(key, value, ttl.toNanos(), weigh(key, value));
    }

    @Override
    public void put(K key, V value, Duration ttl, long sizeBytes) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("size must not be negative");
        }
        putInternal(key, value, ttl.toNanos(), sizeBytes);
    }

    private long weigh(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        long weight = weigher.weigh(key, value);
        if (weight < 0) {
            throw new IllegalStateException("weigher returned negative weight for key: " + key);
        }
        return weight;
    }

    private void putInternal(K key, V value, long ttlNanos, long sizeBytes) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");

        List<Removal<K, V>> removals = new ArrayList<>();
        lock.writeLock().lock();
        try {
            long now = ticker.read();
            CacheEntry<V> entry = new CacheEntry<>(value, now, ttlNanos, sizeBytes, accessSequence.incrementAndGet());
            CacheEntry<V> previous = storage.put(key, entry);
            totalWeight += sizeBytes;
            if (previous != null) {
                totalWeight -= previous.getSizeBytes();
                removals.add(new Removal<>(key, previous.getValue(), RemovalCause.REPLACED));
            }
            evictIfNeeded(removals);
        } finally {
            lock.writeLock().unlock();
        }

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Put entry: key=" + key + ", size=" + sizeBytes + " bytes, ttl=" + ttlNanos + " ns");
        }
        fireRemovals(removals);
    }

    /**
     * Evicts least recently accessed entries until both bounds hold. Must hold the write lock.
     */
    private void evictIfNeeded(List<Removal<K, V>> removals) {
        while (!storage.isEmpty() && (storage.size() > maximumSize || totalWeight > maximumWeight)) {
            K victimKey = null;
            CacheEntry<V> victim = null;
            for (Map.Entry<K, CacheEntry<V>> candidate : storage.entrySet()) {
                if (victim == null || candidate.getValue().isOlderThan(victim)) {
                    victimKey = candidate.getKey();
                    victim = candidate.getValue();
                }
            }
            storage.remove(victimKey);
            totalWeight -= victim.getSizeBytes();
            removals.add(new Removal<>(victimKey, victim.getValue(), RemovalCause.SIZE));
            if (recordStats) {
                evictionCount.incrementAndGet();
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry due to size limit: key=" + victimKey
                        + ", entries=" + storage.size() + ", weight=" + totalWeight);
            }
        }
    }

    @Override
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key cannot be null");

        CacheEntry<V> expired;
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = storage.get(key);
            if (entry == null) {
                if (recordStats) missCount.incrementAndGet();
                return Optional.empty();
            }
            long now = ticker.read();
            if (!entry.isExpired(now)) {
                entry.touch(now, accessSequence.incrementAndGet());
                if (recordStats) hitCount.incrementAndGet();
                return Optional.of(entry.getValue());
            }
            expired = entry;
        } finally {
            lock.readLock().unlock();
        }

        if (recordStats) missCount.incrementAndGet();
        Removal<K, V> removal = null;
        lock.writeLock().lock();
        try {
            // Only purge the entry we saw; a concurrent put may have replaced it already
            if (storage.get(key) == expired) {
                storage.remove(key);
                totalWeight -= expired.getSizeBytes();
                removal = new Removal<>(key, expired.getValue(), RemovalCause.EXPIRED);
                if (recordStats) evictionCount.incrementAndGet();
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removal != null) {
            fireRemovals(List.of(removal));
        }
        return Optional.empty();
    }

    @Override
    public V getOrCreate(K key, Supplier<? extends V> factory, Duration ttl) {
        Objects.requireNonNull(factory, "factory cannot be null");
        Objects.requireNonNull(ttl, "ttl cannot be null");
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = create(key, factory);
        put(key, value, ttl);
        return value;
    }

    @Override
    public V getOrCreate(K key, Supplier<? extends V> factory) {
        Objects.requireNonNull(factory, "factory cannot be null");
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = create(key, factory);
        put(key, value);
        return value;
    }

    private V create(K key, Supplier<? extends V> factory) {
        try {
            V value = factory.get();
            if (value == null) {
                throw new NullPointerException("factory returned null value for key: " + key);
            }
            if (recordStats) loadSuccessCount.incrementAndGet();
            return value;
        } catch (RuntimeException e) {
            if (recordStats) loadFailureCount.incrementAndGet();
            throw e;
        }
    }

    @Override
    public boolean contains(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = storage.get(key);
            return entry != null && !entry.isExpired(ticker.read());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean remove(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        CacheEntry<V> removed;
        lock.writeLock().lock();
        try {
            removed = storage.remove(key);
            if (removed != null) {
                totalWeight -= removed.getSizeBytes();
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            return false;
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Removed entry: key=" + key);
        }
        fireRemovals(List.of(new Removal<>(key, removed.getValue(), RemovalCause.EXPLICIT)));
        return true;
    }

    @Override
    public void clear() {
        List<Removal<K, V>> removals = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (Map.Entry<K, CacheEntry<V>> entry : storage.entrySet()) {
                removals.add(new Removal<>(entry.getKey(), entry.getValue().getValue(), RemovalCause.EXPLICIT));
            }
            storage.clear();
            totalWeight = 0;
        } finally {
            lock.writeLock().unlock();
        }
        fireRemovals(removals);
    }

    @Override
    public int cleanupExpired() {
        List<Removal<K, V>> removals = new ArrayList<>();
        lock.writeLock().lock();
        try {
            long now = ticker.read();
            Iterator<Map.Entry<K, CacheEntry<V>>> it = storage.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, CacheEntry<V>> entry = it.next();
                if (entry.getValue().isExpired(now)) {
                    it.remove();
                    totalWeight -= entry.getValue().getSizeBytes();
                    removals.add(new Removal<>(entry.getKey(), entry.getValue().getValue(), RemovalCause.EXPIRED));
                }
            }
            if (recordStats) {
                evictionCount.addAndGet(removals.size());
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (!removals.isEmpty() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Expired " + removals.size() + " entries");
        }
        fireRemovals(removals);
        return removals.size();
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return storage.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long weightedSize() {
        lock.readLock().lock();
        try {
            return totalWeight;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long capacityBytes() {
        return maximumWeight;
    }

    /**
     * Returns the maximum number of entries.
     */
    public long capacity() {
        return maximumSize;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(
                hitCount.get(),
                missCount.get(),
                loadSuccessCount.get(),
                loadFailureCount.get(),
                evictionCount.get());
    }

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long evictionCount() {
        return evictionCount.get();
    }

    private void fireRemovals(List<Removal<K, V>> removals) {
        if (removalListener == null) {
            return;
        }
        for (Removal<K, V> removal : removals) {
            try {
                removalListener.onRemoval(removal.key, removal.value, removal.cause);
            } catch (Exception e) {
                // Log and swallow exceptions from listener
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + removal.key
                        + ", cause: " + removal.cause, e);
            }
        }
    }

    private static final class Removal<K, V> {
        final K key;
        final V value;
        final RemovalCause cause;

        Removal(K key, V value, RemovalCause cause) {
            this.key = key;
            this.value = value;
            this.cause = cause;
        }
    }
}
