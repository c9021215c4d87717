package com.dingdangmaoup.contentpool.storage;

import com.dingdangmaoup.contentpool.config.properties.StorageProperties;
import com.dingdangmaoup.contentpool.hash.ContentHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Blocking access to the content-addressable object store.
 * Layout: {basePath}/cas-objects/{first two hex chars}/{full lowercase hash}.
 * Objects are never modified once written, only added or deleted.
 */
@Slf4j
@Component
public class CasObjectStore {

    public static final String OBJECTS_DIRECTORY = "cas-objects";

    private final Path objectsRoot;
    private final Path tempDir;
    private final ContentHasher hasher;
    private final boolean verifyIntegrity;

    public CasObjectStore(StorageProperties storageProperties, ContentHasher hasher) {
        this.objectsRoot = storageProperties.resolveBasePath().resolve(OBJECTS_DIRECTORY);
        this.tempDir = storageProperties.resolveTempDir();
        this.hasher = hasher;
        this.verifyIntegrity = storageProperties.isVerifyIntegrity();
    }

    public Path getObjectsRoot() {
        return objectsRoot;
    }

    /**
     * Deterministic object location for a hash; no I/O
     *
     * @throws IllegalArgumentException if the hash is not hex or is shorter than two characters
     */
    public Path getObjectPath(String hash) {
        String normalized = normalizeHash(hash);
        return objectsRoot.resolve(normalized.substring(0, 2)).resolve(normalized);
    }

    public boolean exists(String hash) {
        return Files.isRegularFile(getObjectPath(hash));
    }

    /**
     * Copy a source file into the store under the given hash
     *
     * @return true if a new object was written, false if it was already present
     */
    public boolean store(Path source, String hash) throws IOException {
        Path finalPath = getObjectPath(hash);
        if (Files.exists(finalPath)) {
            log.debug("Object {} already present, skipping write", hash);
            return false;
        }

        Files.createDirectories(finalPath.getParent());
        Files.createDirectories(tempDir);
        Path tempFile = tempDir.resolve("object-" + UUID.randomUUID());
        try {
            Files.copy(source, tempFile);

            if (verifyIntegrity) {
                String actual = hasher.hashFile(tempFile);
                if (!actual.equalsIgnoreCase(hash)) {
                    throw new StorageException("Hash mismatch while storing " + source
                            + ": expected " + hash + ", got " + actual);
                }
            }

            moveIntoPlace(tempFile, finalPath);
            log.debug("Stored object {} at {}", hash, finalPath);
            return true;
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    /**
     * Copy an object out of the store
     */
    public void copyTo(String hash, Path target) throws IOException {
        Path objectPath = getObjectPath(hash);
        if (!Files.isRegularFile(objectPath)) {
            throw new StorageException("Object not found: " + hash);
        }
        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.copy(objectPath, target, StandardCopyOption.REPLACE_EXISTING);
    }

    public boolean delete(String hash) throws IOException {
        Path objectPath = getObjectPath(hash);
        boolean deleted = Files.deleteIfExists(objectPath);
        if (deleted) {
            log.debug("Deleted object {}", hash);
            deleteIfEmpty(objectPath.getParent());
        }
        return deleted;
    }

    /**
     * Hashes of every object currently in the store
     */
    public List<String> listHashes() throws IOException {
        List<String> hashes = new ArrayList<>();
        if (!Files.isDirectory(objectsRoot)) {
            return hashes;
        }
        try (Stream<Path> paths = Files.walk(objectsRoot, 2)) {
            paths.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .forEach(hashes::add);
        }
        return hashes;
    }

    public long totalSize() throws IOException {
        if (!Files.isDirectory(objectsRoot)) {
            return 0L;
        }
        try (Stream<Path> paths = Files.walk(objectsRoot, 2)) {
            return paths.filter(Files::isRegularFile)
                    .mapToLong(path -> {
                        try {
                            return Files.size(path);
                        } catch (IOException e) {
                            log.warn("Failed to get size of object: {}", path, e);
                            return 0L;
                        }
                    })
                    .sum();
        }
    }

    private String normalizeHash(String hash) {
        if (hash == null || hash.length() < 2) {
            throw new IllegalArgumentException("Invalid hash (too short): " + hash);
        }
        String normalized = hash.toLowerCase(Locale.ROOT);
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                throw new IllegalArgumentException("Invalid hash (not hex): " + hash);
            }
        }
        return normalized;
    }

    private void deleteIfEmpty(Path shard) {
        try (Stream<Path> entries = Files.list(shard)) {
            if (entries.findAny().isEmpty()) {
                Files.deleteIfExists(shard);
            }
        } catch (IOException e) {
            // another writer may have just populated the shard
            log.debug("Shard {} not removed: {}", shard, e.getMessage());
        }
    }

    static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
