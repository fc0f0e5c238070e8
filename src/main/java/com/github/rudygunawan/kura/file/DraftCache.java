package com.github.rudygunawan.kura.file;

import com.github.rudygunawan.kura.builder.CacheDefaults;
import com.github.rudygunawan.kura.builder.FileCacheBuilder;

import java.nio.file.Path;
import java.time.Clock;

/**
 * File cache for draft recordings, keyed by {@link DraftKey}, 100 MiB by default.
 */
public class DraftCache extends FileCache<DraftKey> {

    public DraftCache(Path directory) {
        this(directory, CacheDefaults.DRAFT_MAXIMUM_BYTES, Clock.systemUTC());
    }

    public DraftCache(Path directory, long maximumBytes, Clock clock) {
        super(FileCacheBuilder.<DraftKey>newBuilder(DraftKey::asCacheKey)
                .directory(directory)
                .maximumBytes(maximumBytes)
                .clock(clock));
    }
}
