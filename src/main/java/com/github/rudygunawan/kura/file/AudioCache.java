package com.github.rudygunawan.kura.file;

import com.github.rudygunawan.kura.builder.CacheDefaults;
import com.github.rudygunawan.kura.builder.FileCacheBuilder;

import java.nio.file.Path;
import java.time.Clock;

/**
 * URL-keyed file cache for downloaded audio clips and stems, 5 GiB by default.
 *
 * <p>Hands out file paths only. Decoding is left to the audio engine that reads the file.
 */
public class AudioCache extends FileCache<String> {

    public AudioCache(Path directory) {
        this(directory, CacheDefaults.AUDIO_MAXIMUM_BYTES, Clock.systemUTC());
    }

    public AudioCache(Path directory, long maximumBytes, Clock clock) {
        super(FileCacheBuilder.newBuilder(KeyExtractor.identity())
                .directory(directory)
                .maximumBytes(maximumBytes)
                .clock(clock));
    }
}
