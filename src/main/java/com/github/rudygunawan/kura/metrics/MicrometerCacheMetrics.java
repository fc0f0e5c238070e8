package com.github.rudygunawan.kura.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for Kura caches. Works for both the memory cache and the file caches.
 *
 * <p>Exposes the following metrics, all tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.weight - Summed size of the entries in bytes
 *   <li>cache.capacity - Byte bound of the cache
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Total number of evictions
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 * </ul>
 *
 * <pre>{@code
 * CacheRoot caches = CacheRoot.open(root);
 * MicrometerCacheMetrics.monitor(registry, caches.audio(), "audio");
 * MicrometerCacheMetrics.monitor(registry, caches.images(), "images");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Binds {@code cache} to {@code registry} under {@code cacheName}.
     *
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Binds {@code cache} to {@code registry} under {@code cacheName} with additional tags.
     *
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("cache.weight", cache, CacheMetrics::weightedSize)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Summed size of the cached entries")
                .register(registry);

        Gauge.builder("cache.capacity", cache, CacheMetrics::capacityBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Byte bound of the cache, -1 when unbounded")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long hits = c.hitCount();
                    long total = hits + c.missCount();
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);
    }
}
