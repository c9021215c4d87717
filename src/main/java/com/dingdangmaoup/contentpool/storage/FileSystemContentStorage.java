package com.dingdangmaoup.contentpool.storage;

import com.dingdangmaoup.contentpool.config.properties.StorageProperties;
import com.dingdangmaoup.contentpool.hash.ContentHasher;
import com.dingdangmaoup.contentpool.metrics.PoolMetrics;
import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ManifestFile;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.dingdangmaoup.contentpool.model.StorageStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * File-system-based implementation of ContentStorage
 * Stores data in the directory structure:
 * <pre>
 * {basePath}/manifests/{id}.manifest.json     manifest records
 * {basePath}/cas-objects/{hh}/{hash}          content objects, sharded by hash prefix
 * {basePath}/content/{id}/                    logical content root per manifest
 * {basePath}/temp/                            in-flight writes
 * </pre>
 * Manifest ids are lowercased in file names.
 */
@Slf4j
@Component
public class FileSystemContentStorage implements ContentStorage {

    public static final String MANIFESTS_DIRECTORY = "manifests";
    public static final String CONTENT_DIRECTORY = "content";
    public static final String MANIFEST_FILE_SUFFIX = ".manifest.json";

    private final Path basePath;
    private final Path manifestsPath;
    private final Path contentPath;
    private final Path tempDir;
    private final boolean verifyIntegrity;
    private final ContentHasher hasher;
    private final CasObjectStore objectStore;
    private final ManifestSerializer serializer;
    private final ManifestLocks locks;
    private final PoolMetrics metrics;

    public FileSystemContentStorage(StorageProperties storageProperties,
                                    ContentHasher hasher,
                                    CasObjectStore objectStore,
                                    ManifestSerializer serializer,
                                    ManifestLocks locks,
                                    PoolMetrics metrics) {
        this.basePath = storageProperties.resolveBasePath();
        this.manifestsPath = basePath.resolve(MANIFESTS_DIRECTORY);
        this.contentPath = basePath.resolve(CONTENT_DIRECTORY);
        this.tempDir = storageProperties.resolveTempDir();
        this.verifyIntegrity = storageProperties.isVerifyIntegrity();
        this.hasher = hasher;
        this.objectStore = objectStore;
        this.serializer = serializer;
        this.locks = locks;
        this.metrics = metrics;
        initializeDirectories();
    }

    private void initializeDirectories() {
        try {
            Files.createDirectories(manifestsPath);
            Files.createDirectories(objectStore.getObjectsRoot());
            Files.createDirectories(contentPath);
            Files.createDirectories(tempDir);
            log.info("Initialized content storage at: {}", basePath.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to initialize content storage directories", e);
            throw new StorageException("Failed to initialize content storage", e);
        }
    }

    @Override
    public Path getStorageRoot() {
        return basePath;
    }

    @Override
    public Mono<ContentManifest> storeContent(ContentManifest manifest, Path sourceDirectory) {
        ManifestId id = manifest.getId();
        List<ManifestFile> files = manifest.getFiles() == null ? List.of() : manifest.getFiles();

        // Phase 1: verify every source file; cancellation is honoured between files
        return Flux.fromIterable(files)
                .concatMap(file -> Mono.fromCallable(() -> prepare(id, file, sourceDirectory))
                        .subscribeOn(Schedulers.boundedElastic()))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collectList()
                // Phase 2: write objects, then the record
                .flatMap(prepared -> Mono.fromCallable(() -> locks.withWrite(id, () -> commit(manifest, prepared)))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doOnSuccess(stored -> log.info("Stored content for manifest {} ({} files)",
                        id, stored.getFiles().size()))
                .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("Failed to store content: " + e.getMessage(), id, e));
    }

    private Optional<PreparedFile> prepare(ManifestId id, ManifestFile file, Path sourceDirectory) throws IOException {
        if (!file.isContentAddressable()) {
            return Optional.of(new PreparedFile(file, null, null));
        }

        String relativePath = file.getRelativePath();
        Path source = resolveInside(sourceDirectory, relativePath);
        if (!Files.isRegularFile(source)) {
            if (file.isRequired()) {
                throw new StorageException("Required file not found: " + relativePath, id);
            }
            log.warn("Optional file {} of manifest {} not found, skipping", relativePath, id);
            return Optional.empty();
        }

        String actualHash = hasher.hashFile(source);
        long actualSize = Files.size(source);

        if (verifyIntegrity) {
            String declared = file.getHash();
            if (declared != null && !declared.isBlank() && !declared.equalsIgnoreCase(actualHash)) {
                throw new StorageException("Hash mismatch for " + relativePath
                        + ": expected " + declared + ", got " + actualHash, id);
            }
            if (file.getSize() > 0 && file.getSize() != actualSize) {
                throw new StorageException("Size mismatch for " + relativePath
                        + ": expected " + file.getSize() + " bytes, got " + actualSize, id);
            }
        }

        log.debug("Verified {} of manifest {} ({} bytes, {})", relativePath, id, actualSize, actualHash);
        ManifestFile normalized = file.toBuilder().hash(actualHash).size(actualSize).build();
        return Optional.of(new PreparedFile(normalized, source, actualHash));
    }

    private ContentManifest commit(ContentManifest manifest, List<PreparedFile> prepared) throws Exception {
        ManifestId id = manifest.getId();
        Path contentDir = getContentDirectoryPath(id);
        boolean existedBefore = Files.exists(getManifestStoragePath(id));

        try {
            return locks.withObjectsShared(() -> {
                List<ManifestFile> storedFiles = new ArrayList<>(prepared.size());
                for (PreparedFile file : prepared) {
                    if (file.source() != null) {
                        if (objectStore.store(file.source(), file.hash())) {
                            metrics.recordObjectWritten();
                        } else {
                            metrics.recordObjectDeduplicated();
                        }
                    }
                    storedFiles.add(file.file());
                }

                ContentManifest stored = manifest.toBuilder().files(storedFiles).build();

                Files.createDirectories(contentDir);
                if (stored.getRequiredDirectories() != null) {
                    for (String directory : stored.getRequiredDirectories()) {
                        Files.createDirectories(resolveInside(contentDir, directory));
                    }
                }

                writeManifest(stored);
                return stored;
            });
        } catch (Exception e) {
            if (!existedBefore) {
                try {
                    deleteRecursively(contentDir);
                } catch (IOException cleanupError) {
                    log.warn("Failed to clean up content directory of manifest {}", id, cleanupError);
                }
            }
            throw e;
        }
    }

    @Override
    public Path getManifestStoragePath(ManifestId id) {
        return entryOf(manifestsPath, id.normalized() + MANIFEST_FILE_SUFFIX);
    }

    @Override
    public Path getContentDirectoryPath(ManifestId id) {
        return entryOf(contentPath, id.normalized());
    }

    @Override
    public Path getObjectPath(String hash) {
        return objectStore.getObjectPath(hash);
    }

    @Override
    public Mono<Boolean> isContentStored(ManifestId id) {
        return Mono.fromCallable(() -> Files.isRegularFile(getManifestStoragePath(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> updateManifest(ContentManifest manifest) {
        ManifestId id = manifest.getId();
        return Mono.fromCallable(() -> locks.<Boolean>withWrite(id, () -> {
                    if (!Files.isRegularFile(getManifestStoragePath(id))) {
                        log.debug("Manifest {} not stored, refusing metadata update", id);
                        return false;
                    }
                    return locks.<Boolean>withObjectsShared(() -> {
                        List<String> missing = manifest.contentHashes().stream()
                                .filter(hash -> !objectStore.exists(hash))
                                .sorted()
                                .toList();
                        if (!missing.isEmpty()) {
                            throw new StorageException("Manifest " + id + " references content not in the pool: "
                                    + String.join(", ", missing), id);
                        }
                        writeManifest(manifest);
                        return true;
                    });
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(updated -> {
                    if (updated) {
                        log.debug("Updated manifest record {}", id);
                    }
                })
                .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("Failed to update manifest: " + e.getMessage(), id, e));
    }

    @Override
    public Mono<Optional<ContentManifest>> readManifest(ManifestId id) {
        return Mono.fromCallable(() -> locks.withRead(id, () -> {
                    Path manifestPath = getManifestStoragePath(id);
                    if (!Files.exists(manifestPath)) {
                        log.debug("Manifest not found: {}", id);
                        return Optional.<ContentManifest>empty();
                    }
                    return Optional.of(read(manifestPath));
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("Failed to read manifest: " + e.getMessage(), id, e));
    }

    @Override
    public Mono<ContentManifest> readManifestFile(Path manifestFile) {
        return Mono.fromCallable(() -> read(manifestFile))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<Path> listManifestFiles() {
        return Mono.fromCallable(this::manifestFiles)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(paths -> paths);
    }

    @Override
    public Mono<Boolean> removeContent(ManifestId id) {
        return Mono.fromCallable(() -> locks.withWrite(id, () -> deleteRecord(id)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(released -> released.isEmpty()
                        ? Mono.just(false)
                        : Mono.fromCallable(() -> locks.withObjectsExclusive(() -> deleteUnreferenced(released.get())))
                                .subscribeOn(Schedulers.boundedElastic())
                                .doOnNext(count -> log.info("Removed manifest {} ({} objects released)", id, count))
                                .thenReturn(true))
                .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("Failed to remove content: " + e.getMessage(), id, e));
    }

    /**
     * Delete the record and content directory of a manifest
     *
     * @return the hashes the record referenced, or empty if there was no record
     */
    private Optional<Set<String>> deleteRecord(ManifestId id) throws IOException {
        Path manifestPath = getManifestStoragePath(id);
        Path contentDir = getContentDirectoryPath(id);

        if (!Files.exists(manifestPath)) {
            if (Files.exists(contentDir)) {
                log.warn("Removing orphaned content directory of manifest {}", id);
                deleteRecursively(contentDir);
            }
            log.debug("Manifest {} not stored, nothing to remove", id);
            return Optional.empty();
        }

        Set<String> hashes;
        try {
            hashes = read(manifestPath).contentHashes();
        } catch (StorageException e) {
            // objects of an unreadable record are left for garbage collection
            log.warn("Manifest record {} is unreadable, removing without releasing objects", id, e);
            hashes = Set.of();
        }

        Files.deleteIfExists(manifestPath);
        deleteRecursively(contentDir);
        return Optional.of(hashes);
    }

    /**
     * Delete the candidate objects that no remaining manifest references.
     * Nothing is deleted if any remaining record cannot be read.
     */
    private long deleteUnreferenced(Set<String> candidates) throws IOException {
        if (candidates.isEmpty()) {
            return 0L;
        }

        Optional<Set<String>> referenced = scanReferences();
        if (referenced.isEmpty()) {
            log.warn("Reference scan incomplete, keeping {} candidate objects", candidates.size());
            return 0L;
        }

        long deleted = 0;
        for (String hash : candidates) {
            if (!referenced.get().contains(hash) && objectStore.delete(hash)) {
                deleted++;
            }
        }
        metrics.recordObjectsCollected(deleted);
        return deleted;
    }

    /**
     * Hashes referenced by every stored manifest, or empty if any record is unreadable
     */
    private Optional<Set<String>> scanReferences() throws IOException {
        Set<String> referenced = new HashSet<>();
        for (Path manifestFile : manifestFiles()) {
            try {
                referenced.addAll(read(manifestFile).contentHashes());
            } catch (StorageException e) {
                log.warn("Unreadable manifest record {} during reference scan", manifestFile, e);
                return Optional.empty();
            }
        }
        return Optional.of(referenced);
    }

    @Override
    public Mono<Path> retrieveContent(ManifestId id, Path targetDirectory) {
        return readManifest(id)
                .flatMap(found -> found
                        .map(manifest -> Mono.fromCallable(() -> locks.withObjectsShared(() ->
                                        copyOut(manifest, targetDirectory)))
                                .subscribeOn(Schedulers.boundedElastic()))
                        .orElseGet(() -> Mono.error(new StorageException("Content not found for manifest " + id, id))))
                .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("Failed to retrieve content: " + e.getMessage(), id, e));
    }

    private Path copyOut(ContentManifest manifest, Path targetDirectory) throws IOException {
        Files.createDirectories(targetDirectory);
        int copied = 0;
        for (ManifestFile file : manifest.getFiles()) {
            if (!file.isContentAddressable() || file.getHash() == null) {
                continue;
            }
            objectStore.copyTo(file.getHash(), resolveInside(targetDirectory, file.getRelativePath()));
            copied++;
        }
        log.debug("Retrieved {} files of manifest {} into {}", copied, manifest.getId(), targetDirectory);
        return targetDirectory;
    }

    @Override
    public Mono<Long> collectGarbage() {
        return Mono.fromCallable(() -> locks.withObjectsExclusive(() -> {
                    Optional<Set<String>> referenced = scanReferences();
                    if (referenced.isEmpty()) {
                        log.warn("Skipping garbage collection: reference scan incomplete");
                        return 0L;
                    }
                    long deleted = 0;
                    for (String hash : objectStore.listHashes()) {
                        if (!referenced.get().contains(hash) && objectStore.delete(hash)) {
                            deleted++;
                        }
                    }
                    metrics.recordObjectsCollected(deleted);
                    log.info("Garbage collection deleted {} unreferenced objects", deleted);
                    return deleted;
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("Garbage collection failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<Long> removeAll() {
        return listManifestFiles()
                .map(this::idFromFileName)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .concatMap(this::removeContent)
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(count -> log.info("Removed all manifests ({} records)", count));
    }

    @Override
    public Mono<StorageStats> getStorageStats() {
        return Mono.fromCallable(() -> {
                    List<Path> records = manifestFiles();
                    long manifestBytes = 0;
                    for (Path record : records) {
                        manifestBytes += Files.size(record);
                    }
                    return StorageStats.builder()
                            .manifestCount(records.size())
                            .manifestBytes(manifestBytes)
                            .objectCount(objectStore.listHashes().size())
                            .objectBytes(objectStore.totalSize())
                            .availableBytes(Files.getFileStore(basePath).getUsableSpace())
                            .build();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("Failed to calculate storage stats: " + e.getMessage(), e));
    }

    private ContentManifest read(Path manifestPath) {
        try {
            return serializer.fromJson(Files.readAllBytes(manifestPath));
        } catch (IOException | RuntimeException e) {
            throw new StorageException("Manifest file is corrupted or invalid: " + manifestPath, e);
        }
    }

    private void writeManifest(ContentManifest manifest) throws IOException {
        Path manifestPath = getManifestStoragePath(manifest.getId());
        Files.createDirectories(manifestPath.getParent());
        Files.createDirectories(tempDir);

        Path tempFile = tempDir.resolve("manifest-" + UUID.randomUUID());
        try {
            Files.write(tempFile, serializer.toJson(manifest));
            CasObjectStore.moveIntoPlace(tempFile, manifestPath);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    private List<Path> manifestFiles() throws IOException {
        if (!Files.isDirectory(manifestsPath)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(manifestsPath)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(MANIFEST_FILE_SUFFIX))
                    .sorted()
                    .toList();
        }
    }

    private Optional<ManifestId> idFromFileName(Path manifestFile) {
        String fileName = manifestFile.getFileName().toString();
        return ManifestId.tryParse(fileName.substring(0, fileName.length() - MANIFEST_FILE_SUFFIX.length()));
    }

    /**
     * Resolve a name that must denote a direct child of root, never root itself or anything above it
     */
    private static Path entryOf(Path root, String name) {
        Path normalizedRoot = root.normalize();
        Path resolved = normalizedRoot.resolve(name).normalize();
        if (!normalizedRoot.equals(resolved.getParent())) {
            throw new StorageException("Name does not denote an entry of " + root + ": " + name);
        }
        return resolved;
    }

    private static Path resolveInside(Path root, String relativePath) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = normalizedRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(normalizedRoot)) {
            throw new StorageException("Path escapes its root: " + relativePath);
        }
        return resolved;
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private record PreparedFile(ManifestFile file, Path source, String hash) {
    }
}
