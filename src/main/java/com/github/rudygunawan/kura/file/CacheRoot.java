package com.github.rudygunawan.kura.file;

import com.github.rudygunawan.kura.builder.CacheDefaults;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * The on-disk cache layout of the client: one subdirectory per cache domain under a root.
 *
 * <pre>
 * root/
 *   audio/    AudioCache
 *   images/   ImageCache
 *   drafts/   DraftCache
 * </pre>
 *
 * <p>Call {@link #flushAll()} on shutdown so refreshed access times survive the restart.
 */
public class CacheRoot {
    private final Path root;
    private final AudioCache audio;
    private final ImageCache images;
    private final DraftCache drafts;

    public CacheRoot(Path root, long audioBytes, long imageBytes, long draftBytes, Clock clock) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.audio = new AudioCache(root.resolve(CacheDefaults.AUDIO_DIRECTORY), audioBytes, clock);
        this.images = new ImageCache(root.resolve(CacheDefaults.IMAGE_DIRECTORY), imageBytes, clock);
        this.drafts = new DraftCache(root.resolve(CacheDefaults.DRAFT_DIRECTORY), draftBytes, clock);
    }

    /**
     * Opens the caches under {@code root} with the default budgets.
     */
    public static CacheRoot open(Path root) {
        return new CacheRoot(root,
                CacheDefaults.AUDIO_MAXIMUM_BYTES,
                CacheDefaults.IMAGE_MAXIMUM_BYTES,
                CacheDefaults.DRAFT_MAXIMUM_BYTES,
                Clock.systemUTC());
    }

    public Path root() {
        return root;
    }

    public AudioCache audio() {
        return audio;
    }

    public ImageCache images() {
        return images;
    }

    public DraftCache drafts() {
        return drafts;
    }

    /**
     * Writes every manifest to disk.
     */
    public void flushAll() {
        images.flush();
        audio.flush();
        drafts.flush();
    }

    /**
     * Deletes every cached file in all three caches.
     */
    public void clearAll() {
        images.clear();
        audio.clear();
        drafts.clear();
    }

    /**
     * Returns the summed size in bytes of all three caches.
     */
    public long totalBytes() {
        return audio.totalBytes() + images.totalBytes() + drafts.totalBytes();
    }
}
