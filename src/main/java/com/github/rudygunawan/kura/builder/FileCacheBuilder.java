package com.github.rudygunawan.kura.builder;

import com.github.rudygunawan.kura.file.FileCache;
import com.github.rudygunawan.kura.file.KeyExtractor;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * A builder of manifest-backed {@link FileCache} instances.
 *
 * <pre>{@code
 * FileCache<String> stems = FileCacheBuilder.newBuilder(KeyExtractor.identity())
 *     .directory(cacheRoot.resolve("stems"))
 *     .maximumBytes(2 * CacheDefaults.GIB)
 *     .build();
 * }</pre>
 *
 * @param <K> the domain type the cache is keyed by
 */
public class FileCacheBuilder<K> {
    private final KeyExtractor<? super K> keyExtractor;
    private Path directory;
    private long maximumBytes = CacheDefaults.AUDIO_MAXIMUM_BYTES;
    private Clock clock = Clock.systemUTC();

    private FileCacheBuilder(KeyExtractor<? super K> keyExtractor) {
        this.keyExtractor = keyExtractor;
    }

    /**
     * Constructs a new builder for a cache whose keys are derived with {@code keyExtractor}.
     */
    public static <K> FileCacheBuilder<K> newBuilder(KeyExtractor<? super K> keyExtractor) {
        return new FileCacheBuilder<>(Objects.requireNonNull(keyExtractor, "keyExtractor cannot be null"));
    }

    /**
     * Specifies the directory holding the cached files and the manifest. Created if missing.
     */
    public FileCacheBuilder<K> directory(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        return this;
    }

    /**
     * Specifies the byte budget. Once exceeded, entries are evicted until usage is at most half
     * of it.
     *
     * @throws IllegalArgumentException if {@code maximumBytes} is not positive
     */
    public FileCacheBuilder<K> maximumBytes(long maximumBytes) {
        if (maximumBytes <= 0) {
            throw new IllegalArgumentException("maximum bytes must be positive");
        }
        this.maximumBytes = maximumBytes;
        return this;
    }

    /**
     * Specifies the wall clock used for manifest access times. By default {@link Clock#systemUTC()}.
     */
    public FileCacheBuilder<K> clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        return this;
    }

    /**
     * Builds the cache, loading any manifest already present in the directory.
     *
     * @throws IllegalStateException if no directory was configured
     */
    public FileCache<K> build() {
        return new FileCache<>(this);
    }

    public KeyExtractor<? super K> getKeyExtractor() {
        return keyExtractor;
    }

    public Path getDirectory() {
        if (directory == null) {
            throw new IllegalStateException("directory must be set");
        }
        return directory;
    }

    public long getMaximumBytes() {
        return maximumBytes;
    }

    public Clock getClock() {
        return clock;
    }
}
