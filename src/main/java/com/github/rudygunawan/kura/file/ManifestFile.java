package com.github.rudygunawan.kura.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.rudygunawan.kura.builder.CacheDefaults;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes a cache directory's JSON manifest:
 *
 * <pre>{@code
 * {"version": 1, "timestamp": 1760000000,
 *  "entries": [{"url": "...", "filename": "...", "fileSize": 123, "lastAccessTime": 1760000000.25}]}
 * }</pre>
 *
 * <p>Reading never fails: a missing or unparseable file yields no entries, and a malformed entry is
 * skipped without affecting the others. Writes go to a temporary file that is then moved over the
 * manifest.
 */
final class ManifestFile {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.FileCache");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;

    ManifestFile(Path path) {
        this.path = path;
    }

    Path path() {
        return path;
    }

    List<ManifestEntry> read() {
        List<ManifestEntry> entries = new ArrayList<>();
        if (!Files.isRegularFile(path)) {
            return entries;
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Unreadable cache manifest, starting empty: " + path, e);
            return entries;
        }
        if (root == null || !root.isObject()) {
            LOGGER.warning("Cache manifest is not a JSON object, starting empty: " + path);
            return entries;
        }
        int version = root.path("version").asInt(-1);
        if (version != CacheDefaults.MANIFEST_VERSION) {
            LOGGER.warning("Unsupported cache manifest version " + version + ", starting empty: " + path);
            return entries;
        }
        JsonNode array = root.path("entries");
        if (!array.isArray()) {
            LOGGER.warning("Cache manifest has no entries array, starting empty: " + path);
            return entries;
        }

        for (JsonNode node : array) {
            ManifestEntry entry = parseEntry(node);
            if (entry == null) {
                LOGGER.warning("Skipping malformed cache manifest entry in " + path + ": " + node);
            } else {
                entries.add(entry);
            }
        }
        return entries;
    }

    private static ManifestEntry parseEntry(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode key = node.get("url");
        JsonNode filename = node.get("filename");
        JsonNode fileSize = node.get("fileSize");
        JsonNode lastAccessTime = node.get("lastAccessTime");
        if (key == null || !key.isTextual() || key.asText().isEmpty()
                || filename == null || !filename.isTextual() || filename.asText().isEmpty()
                || fileSize == null || !fileSize.isNumber() || fileSize.asLong() < 0
                || lastAccessTime == null || !lastAccessTime.isNumber()) {
            return null;
        }
        return new ManifestEntry(key.asText(), filename.asText(), fileSize.asLong(), lastAccessTime.asDouble());
    }

    void write(Collection<ManifestEntry> entries, long timestampSeconds) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", CacheDefaults.MANIFEST_VERSION);
        root.put("timestamp", timestampSeconds);
        ArrayNode array = root.putArray("entries");
        for (ManifestEntry entry : entries) {
            ObjectNode node = array.addObject();
            node.put("url", entry.getKey());
            node.put("filename", entry.getFilename());
            node.put("fileSize", entry.getFileSize());
            node.put("lastAccessTime", entry.getLastAccessTime());
        }

        Path temp = Files.createTempFile(path.getParent(), "manifest-", ".tmp");
        try {
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
            moveReplacing(temp, path);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
