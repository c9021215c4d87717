package com.dingdangmaoup.contentpool.storage;

import com.dingdangmaoup.contentpool.config.properties.StorageProperties;
import com.dingdangmaoup.contentpool.hash.ContentHasher;
import com.dingdangmaoup.contentpool.hash.Sha256ContentHasher;
import com.dingdangmaoup.contentpool.metrics.PoolMetrics;
import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ContentSourceType;
import com.dingdangmaoup.contentpool.model.ContentType;
import com.dingdangmaoup.contentpool.model.ManifestFile;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.dingdangmaoup.contentpool.model.StorageStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemContentStorageTest {

    @TempDir
    Path tempDir;

    private Path poolRoot;
    private Path source;
    private Sha256ContentHasher hasher;
    private CasObjectStore objectStore;
    private SimpleMeterRegistry meterRegistry;
    private StorageProperties properties;
    private ManifestLocks locks;
    private FileSystemContentStorage storage;

    @BeforeEach
    void setUp() throws IOException {
        poolRoot = tempDir.resolve("pool");
        source = Files.createDirectories(tempDir.resolve("source"));

        properties = new StorageProperties();
        properties.setBasePath(poolRoot.toString());
        hasher = new Sha256ContentHasher(properties);
        objectStore = new CasObjectStore(properties, hasher);
        meterRegistry = new SimpleMeterRegistry();
        locks = new ManifestLocks();
        storage = new FileSystemContentStorage(properties, hasher, objectStore, new ManifestSerializer(),
                locks, new PoolMetrics(meterRegistry));
    }

    private ManifestFile writeSource(String relativePath, String content) throws IOException {
        Path file = source.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return ManifestFile.builder()
                .relativePath(relativePath)
                .hash(hasher.hashFile(file))
                .size(Files.size(file))
                .sourceType(ContentSourceType.CONTENT_ADDRESSABLE)
                .build();
    }

    private static ContentManifest manifest(String id, ManifestFile... files) {
        return ContentManifest.builder()
                .id(ManifestId.of(id))
                .name(id)
                .version("1.0")
                .contentType(ContentType.MOD)
                .files(List.of(files))
                .build();
    }

    @Test
    void testInitialize_createsLayout() {
        assertTrue(Files.isDirectory(poolRoot.resolve("manifests")));
        assertTrue(Files.isDirectory(poolRoot.resolve("cas-objects")));
        assertTrue(Files.isDirectory(poolRoot.resolve("content")));
        assertTrue(Files.isDirectory(poolRoot.resolve("temp")));
    }

    @Test
    void testPaths_lowercasedAndSharded() {
        ManifestId id = ManifestId.of("Pub.Tool.V1");

        assertEquals(poolRoot.resolve("manifests").resolve("pub.tool.v1.manifest.json"),
                storage.getManifestStoragePath(id));
        assertEquals(poolRoot.resolve("content").resolve("pub.tool.v1"), storage.getContentDirectoryPath(id));
        assertEquals(poolRoot.resolve("cas-objects").resolve("ab").resolve("abcdef"),
                storage.getObjectPath("ABCDEF"));
        assertThrows(IllegalArgumentException.class, () -> storage.getObjectPath("a"));
        assertThrows(IllegalArgumentException.class, () -> storage.getObjectPath("zz/../.."));
    }

    @Test
    void testStoreContent_writesObjectsAndRecord() throws Exception {
        ManifestFile exe = writeSource("tool.exe", "binary");
        ManifestFile ini = writeSource("Data/tool.ini", "[settings]");

        StepVerifier.create(storage.storeContent(manifest("pub.tool.v1", exe, ini), source))
                .assertNext(stored -> assertEquals(2, stored.getFiles().size()))
                .verifyComplete();

        ManifestId id = ManifestId.of("pub.tool.v1");
        assertTrue(Files.isRegularFile(storage.getManifestStoragePath(id)));
        assertTrue(Files.isDirectory(storage.getContentDirectoryPath(id)));
        assertTrue(objectStore.exists(exe.getHash()));
        assertTrue(objectStore.exists(ini.getHash()));

        StepVerifier.create(storage.readManifest(id))
                .assertNext(found -> {
                    assertTrue(found.isPresent());
                    assertEquals("pub.tool.v1", found.get().getId().value());
                    assertEquals(exe.getHash(), found.get().getFiles().get(0).getHash());
                })
                .verifyComplete();
    }

    @Test
    void testStoreContent_normalizesHashAndSize() throws Exception {
        ManifestFile exe = writeSource("tool.exe", "binary");
        ManifestFile declared = exe.toBuilder().hash(exe.getHash().toUpperCase()).size(0).build();

        StepVerifier.create(storage.storeContent(manifest("pub.tool.v1", declared), source))
                .assertNext(stored -> {
                    assertEquals(exe.getHash(), stored.getFiles().get(0).getHash());
                    assertEquals(6L, stored.getFiles().get(0).getSize());
                })
                .verifyComplete();
    }

    @Test
    void testStoreContent_identicalContentStoredOnce() throws Exception {
        ManifestFile first = writeSource("a/shared.big", "same bytes");
        ManifestFile second = writeSource("b/copy.big", "same bytes");

        storage.storeContent(manifest("mod.one", first), source).block();
        storage.storeContent(manifest("mod.two", second), source).block();

        assertEquals(1, objectStore.listHashes().size());
        assertEquals(1.0, meterRegistry.counter("contentpool.cas.object.written").count());
        assertEquals(1.0, meterRegistry.counter("contentpool.cas.object.deduplicated").count());
    }

    @Test
    void testStoreContent_hashMismatchWritesNothing() throws Exception {
        ManifestFile good = writeSource("good.big", "good");
        ManifestFile bad = writeSource("bad.big", "bad").toBuilder()
                .hash("0000000000000000000000000000000000000000000000000000000000000000")
                .build();

        StepVerifier.create(storage.storeContent(manifest("mod.bad", good, bad), source))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(StorageException.class, e);
                    assertTrue(e.getMessage().contains("Hash mismatch for bad.big"), e.getMessage());
                })
                .verify();

        ManifestId id = ManifestId.of("mod.bad");
        assertFalse(Files.exists(storage.getManifestStoragePath(id)));
        assertFalse(Files.exists(storage.getContentDirectoryPath(id)));
        assertTrue(objectStore.listHashes().isEmpty(), "No objects should be written before verification passes");
    }

    @Test
    void testStoreContent_sizeMismatch() throws Exception {
        ManifestFile file = writeSource("data.big", "1234").toBuilder().size(99).build();

        StepVerifier.create(storage.storeContent(manifest("mod.size", file), source))
                .expectErrorSatisfies(e -> assertTrue(e.getMessage().contains("Size mismatch for data.big")))
                .verify();
    }

    @Test
    void testStoreContent_missingRequiredFileFails() {
        ManifestFile missing = ManifestFile.builder()
                .relativePath("missing.big")
                .hash("abcd")
                .sourceType(ContentSourceType.CONTENT_ADDRESSABLE)
                .build();

        StepVerifier.create(storage.storeContent(manifest("mod.missing", missing), source))
                .expectErrorSatisfies(e -> assertEquals("Required file not found: missing.big", e.getMessage()))
                .verify();
        assertFalse(Files.exists(storage.getManifestStoragePath(ManifestId.of("mod.missing"))));
    }

    @Test
    void testStoreContent_missingOptionalFileSkipped() throws Exception {
        ManifestFile present = writeSource("present.big", "here");
        ManifestFile optional = ManifestFile.builder()
                .relativePath("optional.big")
                .hash("abcd")
                .required(false)
                .sourceType(ContentSourceType.CONTENT_ADDRESSABLE)
                .build();

        StepVerifier.create(storage.storeContent(manifest("mod.optional", present, optional), source))
                .assertNext(stored -> {
                    assertEquals(1, stored.getFiles().size());
                    assertEquals("present.big", stored.getFiles().get(0).getRelativePath());
                })
                .verifyComplete();
    }

    @Test
    void testStoreContent_createsRequiredDirectories() throws Exception {
        ContentManifest manifest = manifest("map.pack", writeSource("readme.txt", "maps")).toBuilder()
                .requiredDirectories(List.of("Maps", "Data/Scripts"))
                .build();

        storage.storeContent(manifest, source).block();

        Path contentDir = storage.getContentDirectoryPath(ManifestId.of("map.pack"));
        assertTrue(Files.isDirectory(contentDir.resolve("Maps")));
        assertTrue(Files.isDirectory(contentDir.resolve("Data").resolve("Scripts")));
    }

    @Test
    void testRemoveContent_keepsObjectsStillReferenced() throws Exception {
        ManifestFile shared = writeSource("shared.big", "shared");
        ManifestFile own = writeSource("own.big", "own");
        storage.storeContent(manifest("mod.one", shared, own), source).block();
        storage.storeContent(manifest("mod.two", shared), source).block();

        StepVerifier.create(storage.removeContent(ManifestId.of("mod.one")))
                .expectNext(true)
                .verifyComplete();

        assertTrue(objectStore.exists(shared.getHash()), "Shared object must survive");
        assertFalse(objectStore.exists(own.getHash()), "Unreferenced object should be released");
        assertFalse(Files.exists(storage.getContentDirectoryPath(ManifestId.of("mod.one"))));

        StepVerifier.create(storage.removeContent(ManifestId.of("mod.two")))
                .expectNext(true)
                .verifyComplete();
        assertTrue(objectStore.listHashes().isEmpty());
    }

    @Test
    void testRemoveContent_absentIdReturnsFalse() {
        StepVerifier.create(storage.removeContent(ManifestId.of("never.stored")))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void testRemoveContent_unreadableRecordBlocksObjectDeletion() throws Exception {
        ManifestFile file = writeSource("keep.big", "keep");
        storage.storeContent(manifest("mod.keep", file), source).block();
        storage.storeContent(manifest("mod.other", file), source).block();
        Files.writeString(storage.getManifestStoragePath(ManifestId.of("mod.other")), "{ not json");

        storage.removeContent(ManifestId.of("mod.keep")).block();

        assertTrue(objectStore.exists(file.getHash()),
                "Objects must not be deleted while any record cannot be read");
    }

    @Test
    void testReadManifest_notFoundVsCorrupted() throws Exception {
        StepVerifier.create(storage.readManifest(ManifestId.of("absent.id")))
                .expectNext(Optional.empty())
                .verifyComplete();

        Path corrupt = storage.getManifestStoragePath(ManifestId.of("corrupt.id"));
        Files.writeString(corrupt, "{ broken");

        StepVerifier.create(storage.readManifest(ManifestId.of("corrupt.id")))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(StorageException.class, e);
                    assertTrue(e.getMessage().startsWith("Manifest file is corrupted or invalid"), e.getMessage());
                })
                .verify();
    }

    @Test
    void testRetrieveContent_copiesFilesOut() throws Exception {
        ManifestFile exe = writeSource("bin/tool.exe", "tool bytes");
        storage.storeContent(manifest("pub.tool.v1", exe), source).block();
        Path target = tempDir.resolve("out");

        StepVerifier.create(storage.retrieveContent(ManifestId.of("pub.tool.v1"), target))
                .expectNext(target)
                .verifyComplete();

        assertEquals("tool bytes", Files.readString(target.resolve("bin").resolve("tool.exe")));
    }

    @Test
    void testCollectGarbage_deletesOnlyUnreferenced() throws Exception {
        ManifestFile kept = writeSource("kept.big", "kept");
        storage.storeContent(manifest("mod.kept", kept), source).block();
        Path stray = Files.writeString(tempDir.resolve("stray.big"), "stray");
        String strayHash = hasher.hashFile(stray);
        objectStore.store(stray, strayHash);

        StepVerifier.create(storage.collectGarbage())
                .expectNext(1L)
                .verifyComplete();

        assertTrue(objectStore.exists(kept.getHash()));
        assertFalse(objectStore.exists(strayHash));
        assertEquals(1.0, meterRegistry.counter("contentpool.cas.object.collected").count());
    }

    @Test
    void testRemoveAll_andStats() throws Exception {
        storage.storeContent(manifest("mod.one", writeSource("one.big", "one")), source).block();
        storage.storeContent(manifest("mod.two", writeSource("two.big", "two!")), source).block();

        StorageStats stats = storage.getStorageStats().block();
        assertNotNull(stats);
        assertEquals(2, stats.getManifestCount());
        assertEquals(2, stats.getObjectCount());
        assertEquals(7L, stats.getObjectBytes());
        assertTrue(stats.getManifestBytes() > 0);

        StepVerifier.create(storage.removeAll())
                .expectNext(2L)
                .verifyComplete();

        StorageStats empty = storage.getStorageStats().block();
        assertNotNull(empty);
        assertEquals(0, empty.getManifestCount());
        assertEquals(0, empty.getObjectCount());
    }

    @Test
    void testContentDirectory_dotOnlyIdCannotReachSharedRoot() throws Exception {
        ContentManifest kept = manifest("mod.a", writeSource("a.big", "a")).toBuilder()
                .requiredDirectories(List.of("Data"))
                .build();
        storage.storeContent(kept, source).block();

        assertThrows(IllegalArgumentException.class, () -> ManifestId.of("."));
        assertThrows(IllegalArgumentException.class, () -> ManifestId.of(" ."));

        Path contentRoot = poolRoot.resolve("content");
        Path trailingDot = storage.getContentDirectoryPath(ManifestId.of("mod."));
        assertEquals(contentRoot, trailingDot.getParent());
        assertNotEquals(contentRoot, trailingDot);

        StepVerifier.create(storage.removeContent(ManifestId.of("mod.")))
                .expectNext(false)
                .verifyComplete();
        assertTrue(Files.isDirectory(storage.getContentDirectoryPath(ManifestId.of("mod.a")).resolve("Data")),
                "Other manifests' content must be untouched");
    }

    @Test
    void testUpdateManifest_requiresExistingRecord() throws Exception {
        ContentManifest manifest = manifest("mod.meta", writeSource("meta.big", "meta"));

        StepVerifier.create(storage.updateManifest(manifest))
                .expectNext(false)
                .verifyComplete();
        assertFalse(Files.exists(storage.getManifestStoragePath(manifest.getId())));

        storage.storeContent(manifest, source).block();
        StepVerifier.create(storage.updateManifest(manifest.toBuilder().name("Renamed").build()))
                .expectNext(true)
                .verifyComplete();
        assertEquals("Renamed", storage.readManifest(manifest.getId()).block().orElseThrow().getName());
    }

    @Test
    void testUpdateManifest_rejectsMissingObjects() throws Exception {
        ContentManifest manifest = manifest("mod.meta", writeSource("meta.big", "meta"));
        storage.storeContent(manifest, source).block();
        ManifestFile ghost = ManifestFile.builder()
                .relativePath("ghost.big")
                .hash("ffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff")
                .sourceType(ContentSourceType.CONTENT_ADDRESSABLE)
                .build();
        List<ManifestFile> files = new ArrayList<>(manifest.getFiles());
        files.add(ghost);

        StepVerifier.create(storage.updateManifest(manifest.toBuilder().files(files).build()))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(StorageException.class, e);
                    assertTrue(e.getMessage().contains("references content not in the pool"), e.getMessage());
                })
                .verify();
        assertEquals(1, storage.readManifest(manifest.getId()).block().orElseThrow().getFiles().size());
    }

    @Test
    void testUpdateManifest_racingRemovalOfSameIdNeverResurrects() throws Exception {
        for (int i = 0; i < 25; i++) {
            ContentManifest manifest = manifest("mod.race" + i, writeSource("race" + i + ".big", "race " + i));
            storage.storeContent(manifest, source).block();

            Mono.zip(storage.updateManifest(manifest.toBuilder().name("Updated").build()),
                            storage.removeContent(manifest.getId()))
                    .block();

            assertFalse(Files.exists(storage.getManifestStoragePath(manifest.getId())),
                    "A removed manifest must not come back through a metadata update");
        }
    }

    @Test
    void testUpdateManifest_racingRemovalOfOtherIdKeepsContent() throws Exception {
        for (int i = 0; i < 25; i++) {
            ManifestFile borrowed = writeSource("owner" + i + ".big", "owned " + i);
            ContentManifest owner = manifest("mod.owner" + i, borrowed);
            ContentManifest borrower = manifest("mod.borrower" + i, writeSource("own" + i + ".big", "own " + i));
            storage.storeContent(owner, source).block();
            storage.storeContent(borrower, source).block();

            List<ManifestFile> files = new ArrayList<>(borrower.getFiles());
            files.add(borrowed);
            Mono.zip(storage.updateManifest(borrower.toBuilder().files(files).build()).onErrorReturn(false),
                            storage.removeContent(owner.getId()))
                    .block();

            ContentManifest stored = storage.readManifest(borrower.getId()).block().orElseThrow();
            for (String hash : stored.contentHashes()) {
                assertTrue(objectStore.exists(hash), "Record references missing object " + hash);
            }
        }
        assertEquals(0, locks.activeLocks(), "Lock entries are released after use");
    }

    @Test
    void testStoreContent_cancelBetweenFilesWritesNothing() throws Exception {
        ManifestFile first = writeSource("first.big", "first");
        ManifestFile second = writeSource("second.big", "second");
        CountDownLatch hashing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger hashed = new AtomicInteger();
        ContentHasher gated = new ContentHasher() {
            @Override
            public String hash(InputStream input) throws IOException {
                return hasher.hash(input);
            }

            @Override
            public String hashFile(Path file) throws IOException {
                hashed.incrementAndGet();
                hashing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("interrupted while hashing " + file);
                }
                return hasher.hashFile(file);
            }

            @Override
            public Mono<String> computeFileHash(Path file) {
                return Mono.fromCallable(() -> hashFile(file));
            }
        };
        FileSystemContentStorage gatedStorage = new FileSystemContentStorage(properties, gated, objectStore,
                new ManifestSerializer(), locks, new PoolMetrics(meterRegistry));
        ContentManifest manifest = manifest("mod.cancel", first, second);

        StepVerifier.create(gatedStorage.storeContent(manifest, source))
                .then(() -> awaitLatch(hashing))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
        release.countDown();
        Thread.sleep(200);

        assertEquals(1, hashed.get(), "No file after the cancellation point is processed");
        assertFalse(Files.exists(storage.getManifestStoragePath(manifest.getId())));
        assertFalse(Files.exists(storage.getContentDirectoryPath(manifest.getId())));
        assertTrue(objectStore.listHashes().isEmpty());
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS), "Timed out waiting for hashing to start");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
