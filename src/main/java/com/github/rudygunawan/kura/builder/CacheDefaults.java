package com.github.rudygunawan.kura.builder;

import java.time.Duration;

/**
 * Default limits and names shared by the builders and the cache directory layout.
 */
public final class CacheDefaults {

    public static final long KIB = 1024L;
    public static final long MIB = 1024L * KIB;
    public static final long GIB = 1024L * MIB;

    // Memory cache
    public static final long MEMORY_MAXIMUM_SIZE = 1000;
    public static final long MEMORY_MAXIMUM_WEIGHT = 100 * MIB;

    // File caches
    public static final long AUDIO_MAXIMUM_BYTES = 5 * GIB;
    public static final long IMAGE_MAXIMUM_BYTES = 500 * MIB;
    public static final long DRAFT_MAXIMUM_BYTES = 100 * MIB;

    /** Eviction drains a file cache down to this fraction of its byte bound. */
    public static final double EVICTION_TARGET_RATIO = 0.5;

    public static final String MANIFEST_FILE_NAME = "cache_manifest.json";
    public static final int MANIFEST_VERSION = 1;

    public static final String AUDIO_DIRECTORY = "audio";
    public static final String IMAGE_DIRECTORY = "images";
    public static final String DRAFT_DIRECTORY = "drafts";

    // Decoded images kept next to the image file cache
    public static final long DECODED_IMAGE_MAXIMUM_SIZE = 200;
    public static final long DECODED_IMAGE_MAXIMUM_WEIGHT = 100 * MIB;

    // Combinators
    public static final Duration SEARCH_DEBOUNCE = Duration.ofMillis(300);
    public static final int RETRY_MAXIMUM_RETRIES = 3;
    public static final Duration RETRY_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration RETRY_MAXIMUM_DELAY = Duration.ofSeconds(30);
    public static final double RETRY_MULTIPLIER = 2.0;

    private CacheDefaults() {
    }
}
