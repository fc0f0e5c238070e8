package com.github.rudygunawan.kura.file;

/**
 * Maps a domain object to the string key a {@link FileCache} stores it under.
 *
 * <p>The key is hashed to name the backing file and written verbatim to the manifest, so it must
 * be stable across process restarts.
 *
 * @param <K> the domain type
 */
@FunctionalInterface
public interface KeyExtractor<K> {

    /**
     * Returns the cache key for {@code item}. Never null.
     */
    String extractKey(K item);

    /**
     * Returns the extractor for caches keyed directly by a string such as a URL.
     */
    static KeyExtractor<String> identity() {
        return item -> item;
    }
}
