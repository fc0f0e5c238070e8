package com.github.rudygunawan.kura.file;

import java.util.Objects;

/**
 * One manifest record: the cache key, the backing file name inside the cache directory, the file
 * size and the last access time in epoch seconds.
 *
 * <p>Only {@code lastAccessTime} is mutable; lookups refresh it while holding the shared lock.
 */
public final class ManifestEntry {
    private final String key;
    private final String filename;
    private final long fileSize;
    private volatile double lastAccessTime;

    public ManifestEntry(String key, String filename, long fileSize, double lastAccessTime) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.filename = Objects.requireNonNull(filename, "filename cannot be null");
        this.fileSize = fileSize;
        this.lastAccessTime = lastAccessTime;
    }

    public String getKey() {
        return key;
    }

    public String getFilename() {
        return filename;
    }

    public long getFileSize() {
        return fileSize;
    }

    public double getLastAccessTime() {
        return lastAccessTime;
    }

    void touch(double epochSeconds) {
        this.lastAccessTime = epochSeconds;
    }

    ManifestEntry copy() {
        return new ManifestEntry(key, filename, fileSize, lastAccessTime);
    }

    @Override
    public String toString() {
        return "ManifestEntry{key=" + key + ", filename=" + filename
                + ", fileSize=" + fileSize + ", lastAccessTime=" + lastAccessTime + '}';
    }
}
