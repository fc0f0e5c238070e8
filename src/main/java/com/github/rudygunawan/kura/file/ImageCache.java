package com.github.rudygunawan.kura.file;

import com.github.rudygunawan.kura.api.Cache;
import com.github.rudygunawan.kura.builder.CacheBuilder;
import com.github.rudygunawan.kura.builder.CacheDefaults;
import com.github.rudygunawan.kura.builder.FileCacheBuilder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * URL-keyed image cache, 500 MiB on disk by default, with a bounded map of decoded images in
 * front of it.
 *
 * <p>{@link #getImage(String)} checks the decoded map first. On a miss that the file cache can
 * serve, the file is decoded once and the result kept in memory, so redisplaying an avatar never
 * touches the disk twice.
 */
public class ImageCache extends FileCache<String> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.FileCache");

    private final Cache<String, BufferedImage> decoded;

    public ImageCache(Path directory) {
        this(directory, CacheDefaults.IMAGE_MAXIMUM_BYTES, Clock.systemUTC());
    }

    public ImageCache(Path directory, long maximumBytes, Clock clock) {
        super(FileCacheBuilder.newBuilder(KeyExtractor.identity())
                .directory(directory)
                .maximumBytes(maximumBytes)
                .clock(clock));
        this.decoded = CacheBuilder.newBuilder()
                .maximumSize(CacheDefaults.DECODED_IMAGE_MAXIMUM_SIZE)
                .maximumWeight(CacheDefaults.DECODED_IMAGE_MAXIMUM_WEIGHT)
                .weigher((String url, BufferedImage image) -> 4L * image.getWidth() * image.getHeight())
                .recordStats()
                .build();
    }

    /**
     * Returns the decoded image for {@code url} from memory, or decodes it from the file cache.
     *
     * @return the image, or empty if it is not cached or cannot be decoded
     */
    public Optional<BufferedImage> getImage(String url) {
        Optional<BufferedImage> inMemory = decoded.get(url);
        if (inMemory.isPresent()) {
            return inMemory;
        }
        Optional<Path> file = getFile(url);
        if (file.isEmpty()) {
            return Optional.empty();
        }
        BufferedImage image = decode(file.get());
        if (image == null) {
            return Optional.empty();
        }
        decoded.put(url, image);
        return Optional.of(image);
    }

    /**
     * Encodes {@code image} as PNG into the file cache and keeps the decoded copy in memory.
     *
     * @return the cached file, or empty if encoding or writing failed
     */
    public Optional<Path> cacheImage(String url, BufferedImage image) {
        Objects.requireNonNull(image, "image cannot be null");
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", png)) {
                LOGGER.warning("No PNG writer for image, not caching: " + url);
                return Optional.empty();
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to encode image for: " + url, e);
            return Optional.empty();
        }
        Optional<Path> file = cacheBytes(url, png.toByteArray(), "png");
        if (file.isPresent()) {
            decoded.put(url, image);
        }
        return file;
    }

    @Override
    public Optional<Path> cacheFile(String url, Path source) {
        decoded.remove(url);
        return super.cacheFile(url, source);
    }

    @Override
    public Optional<Path> cacheBytes(String url, byte[] data, String extension) {
        decoded.remove(url);
        return super.cacheBytes(url, data, extension);
    }

    @Override
    public boolean removeFile(String url) {
        decoded.remove(url);
        return super.removeFile(url);
    }

    @Override
    public void clear() {
        decoded.clear();
        super.clear();
    }

    /**
     * Drops the decoded images only, keeping the files. Call when the host is low on memory.
     */
    public void clearDecoded() {
        decoded.clear();
    }

    /**
     * Returns the number of decoded images held in memory.
     */
    public long decodedCount() {
        return decoded.size();
    }

    private static BufferedImage decode(Path file) {
        try {
            BufferedImage image = ImageIO.read(file.toFile());
            if (image == null) {
                LOGGER.warning("Cached file is not a readable image: " + file);
            }
            return image;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to decode cached image: " + file, e);
            return null;
        }
    }
}
