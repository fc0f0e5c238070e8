package com.github.rudygunawan.kura.file;

import com.github.rudygunawan.kura.builder.CacheDefaults;
import com.github.rudygunawan.kura.builder.FileCacheBuilder;
import com.github.rudygunawan.kura.metrics.CacheMetrics;
import com.github.rudygunawan.kura.model.CacheStats;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Persistent key to file cache with a JSON manifest and LRU eviction by byte budget.
 *
 * <p>Each cached file is named after the SHA-256 of its key plus the source extension and lives
 * directly in {@link #directory()}. The manifest is rewritten synchronously on every insertion
 * and removal. Access times refreshed by {@link #getFile} are written on the next mutation or
 * {@link #flush()}.
 *
 * <p>Locking: the manifest map and the byte total share one {@link ReentrantReadWriteLock}.
 * Eviction runs after {@link #cacheFile} releases its write lock, so for a short window the cache
 * may exceed its budget by the size of the entry just inserted. Once triggered, eviction removes
 * the least recently accessed entries until usage is at most half the budget.
 *
 * <p>I/O failures never escape: {@link #cacheFile} returns {@link Optional#empty()} and logs a
 * warning. All methods do blocking file I/O and must not be called from the UI thread.
 *
 * @param <K> the domain type the cache is keyed by
 */
public class FileCache<K> implements CacheMetrics {
    /**
     * Logger for file cache operations. Logger name: "com.github.rudygunawan.kura.FileCache"
     *
     * <ul>
     *   <li>WARNING: Copy failures, manifest write failures, corrupt manifests</li>
     *   <li>FINE: Evictions and stale entry purges</li>
     *   <li>FINER: Entry-level operations</li>
     * </ul>
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.FileCache");

    private static final Pattern EXTENSION = Pattern.compile("[A-Za-z0-9]{1,8}");

    private final Path directory;
    private final long maximumBytes;
    private final KeyExtractor<? super K> keyExtractor;
    private final Clock clock;
    private final ManifestFile manifest;

    private final Map<String, ManifestEntry> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock.writeLock()
    private long totalBytes;

    // Statistics
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);

    public FileCache(FileCacheBuilder<K> builder) {
        this.directory = builder.getDirectory().toAbsolutePath().normalize();
        this.maximumBytes = builder.getMaximumBytes();
        this.keyExtractor = builder.getKeyExtractor();
        this.clock = builder.getClock();
        this.manifest = new ManifestFile(directory.resolve(CacheDefaults.MANIFEST_FILE_NAME));

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not create cache directory: " + directory, e);
        }
        load();
        evictIfOverBudget();
    }

    private void load() {
        lock.writeLock().lock();
        try {
            boolean dropped = false;
            for (ManifestEntry entry : manifest.read()) {
                Path file = resolve(entry.getFilename());
                if (file == null || !Files.isRegularFile(file)) {
                    dropped = true;
                    continue;
                }
                ManifestEntry previous = entries.put(entry.getKey(), entry);
                if (previous != null) {
                    totalBytes -= previous.getFileSize();
                }
                totalBytes += entry.getFileSize();
            }
            if (dropped) {
                LOGGER.fine("Dropped manifest entries without backing files in " + directory);
                saveManifestLocked();
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Loaded file cache " + directory + ": entries=" + entries.size()
                        + ", bytes=" + totalBytes);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the cached file for {@code item}. If the manifest knows the key but its file has been
     * deleted behind the cache's back, the entry is purged and the lookup is a miss.
     */
    public Optional<Path> getFile(K item) {
        String key = keyOf(item);

        ManifestEntry stale;
        lock.readLock().lock();
        try {
            ManifestEntry entry = entries.get(key);
            if (entry == null) {
                missCount.incrementAndGet();
                return Optional.empty();
            }
            Path file = resolve(entry.getFilename());
            if (file != null && Files.isRegularFile(file)) {
                entry.touch(nowSeconds());
                hitCount.incrementAndGet();
                return Optional.of(file);
            }
            stale = entry;
        } finally {
            lock.readLock().unlock();
        }

        missCount.incrementAndGet();
        lock.writeLock().lock();
        try {
            if (entries.get(key) == stale) {
                entries.remove(key);
                totalBytes -= stale.getFileSize();
                saveManifestLocked();
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Purged stale manifest entry, file missing: key=" + key);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return Optional.empty();
    }

    /**
     * Copies {@code source} into the cache under {@code item}'s key, replacing any previous file,
     * and writes the manifest.
     *
     * @return the cached copy, or empty if the source is missing or the copy failed
     */
    public Optional<Path> cacheFile(K item, Path source) {
        String key = keyOf(item);
        Objects.requireNonNull(source, "source cannot be null");
        if (!Files.isRegularFile(source)) {
            LOGGER.warning("Cannot cache missing source file: " + source + " (key=" + key + ")");
            failureCount.incrementAndGet();
            return Optional.empty();
        }
        String extension = extensionOf(source.getFileName().toString());
        return store(key, extension, temp -> Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING));
    }

    /**
     * Writes {@code data} into the cache under {@code item}'s key, for callers holding a
     * downloaded body in memory.
     *
     * @param extension file extension without the dot, may be empty
     * @return the cached file, or empty if the write failed
     */
    public Optional<Path> cacheBytes(K item, byte[] data, String extension) {
        String key = keyOf(item);
        Objects.requireNonNull(data, "data cannot be null");
        String normalized = extension == null ? "" : extension.startsWith(".") ? extension.substring(1) : extension;
        if (!normalized.isEmpty() && !EXTENSION.matcher(normalized).matches()) {
            normalized = "";
        }
        return store(key, normalized.toLowerCase(Locale.ROOT), temp -> Files.write(temp, data));
    }

    private Optional<Path> store(String key, String extension, FileWriter writer) {
        String filename = filenameFor(key, extension);
        Path target = directory.resolve(filename);
        Path temp = null;
        boolean overBudget;
        try {
            temp = Files.createTempFile(directory, "kura-", ".tmp");
            writer.write(temp);
            long size = Files.size(temp);

            lock.writeLock().lock();
            try {
                ManifestFile.moveReplacing(temp, target);
                ManifestEntry previous = entries.put(key, new ManifestEntry(key, filename, size, nowSeconds()));
                if (previous != null) {
                    totalBytes -= previous.getFileSize();
                    if (!previous.getFilename().equals(filename)) {
                        deleteQuietly(resolve(previous.getFilename()));
                    }
                }
                totalBytes += size;
                saveManifestLocked();
                overBudget = totalBytes > maximumBytes;
            } finally {
                lock.writeLock().unlock();
            }

            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Cached file: key=" + key + ", file=" + filename + ", size=" + size);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to cache file for key: " + key, e);
            failureCount.incrementAndGet();
            return Optional.empty();
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }

        // Runs after the write lock is released
        if (overBudget) {
            evictIfOverBudget();
            if (!isCached(key, filename)) {
                LOGGER.warning("Cached file was evicted immediately, larger than the eviction target: key="
                        + key + " (maximumBytes=" + maximumBytes + ")");
                return Optional.empty();
            }
        }
        return Optional.of(target);
    }

    private boolean isCached(String key, String filename) {
        lock.readLock().lock();
        try {
            ManifestEntry entry = entries.get(key);
            return entry != null && entry.getFilename().equals(filename);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void evictIfOverBudget() {
        int evicted = 0;
        lock.writeLock().lock();
        try {
            if (totalBytes <= maximumBytes) {
                return;
            }
            long target = (long) (maximumBytes * CacheDefaults.EVICTION_TARGET_RATIO);
            List<ManifestEntry> byAge = new ArrayList<>(entries.values());
            byAge.sort(Comparator.comparingDouble(ManifestEntry::getLastAccessTime));
            for (ManifestEntry entry : byAge) {
                if (totalBytes <= target) {
                    break;
                }
                entries.remove(entry.getKey());
                totalBytes -= entry.getFileSize();
                deleteQuietly(resolve(entry.getFilename()));
                evicted++;
            }
            evictionCount.addAndGet(evicted);
            saveManifestLocked();
        } finally {
            lock.writeLock().unlock();
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted " + evicted + " files from " + directory + ", now " + totalBytes
                    + " of " + maximumBytes + " bytes");
        }
    }

    /**
     * Removes {@code item}'s entry and deletes its file.
     *
     * @return true if an entry was removed
     */
    public boolean removeFile(K item) {
        String key = keyOf(item);
        lock.writeLock().lock();
        try {
            ManifestEntry removed = entries.remove(key);
            if (removed == null) {
                return false;
            }
            totalBytes -= removed.getFileSize();
            deleteQuietly(resolve(removed.getFilename()));
            saveManifestLocked();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Deletes every cached file and empties the manifest.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            for (ManifestEntry entry : entries.values()) {
                deleteQuietly(resolve(entry.getFilename()));
            }
            entries.clear();
            totalBytes = 0;
            saveManifestLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes the manifest, including access times refreshed since the last write.
     */
    public void flush() {
        lock.writeLock().lock();
        try {
            saveManifestLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns true if the manifest has an entry for {@code item}. Does not check the file.
     */
    public boolean contains(K item) {
        String key = keyOf(item);
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns copies of the current manifest entries.
     */
    public List<ManifestEntry> entries() {
        lock.readLock().lock();
        try {
            List<ManifestEntry> copies = new ArrayList<>(entries.size());
            for (ManifestEntry entry : entries.values()) {
                copies.add(entry.copy());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the summed size of the cached files.
     */
    public long totalBytes() {
        lock.readLock().lock();
        try {
            return totalBytes;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long maximumBytes() {
        return maximumBytes;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Returns a snapshot of lookup and eviction counts. File caches have no loader, so load
     * counts are always zero.
     */
    public CacheStats stats() {
        return new CacheStats(hitCount.get(), missCount.get(), 0, 0, evictionCount.get());
    }

    /**
     * Returns the number of {@code cacheFile}/{@code cacheBytes} calls that failed.
     */
    public long failureCount() {
        return failureCount.get();
    }

    @Override
    public long weightedSize() {
        return totalBytes();
    }

    @Override
    public long capacityBytes() {
        return maximumBytes;
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

    protected String keyOf(K item) {
        Objects.requireNonNull(item, "key cannot be null");
        String key = keyExtractor.extractKey(item);
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key extractor returned an empty key for: " + item);
        }
        return key;
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    /**
     * Resolves a manifest filename inside the cache directory, or null if it would escape it.
     */
    private Path resolve(String filename) {
        Path file = directory.resolve(filename).normalize();
        return directory.equals(file.getParent()) ? file : null;
    }

    /**
     * Must hold the write lock.
     */
    private void saveManifestLocked() {
        try {
            manifest.write(entries.values(), clock.millis() / 1000);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to write cache manifest: " + manifest.path(), e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to delete cache file: " + file, e);
        }
    }

    static String filenameFor(String key, String extension) {
        String hash = sha256Hex(key);
        return extension.isEmpty() ? hash : hash + "." + extension;
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return "";
        }
        String extension = filename.substring(dot + 1);
        return EXTENSION.matcher(extension).matches() ? extension.toLowerCase(Locale.ROOT) : "";
    }

    private static String sha256Hex(String key) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @FunctionalInterface
    private interface FileWriter {
        void write(Path target) throws IOException;
    }
}
