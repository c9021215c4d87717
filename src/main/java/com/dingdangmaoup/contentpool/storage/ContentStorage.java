package com.dingdangmaoup.contentpool.storage;

import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.dingdangmaoup.contentpool.model.StorageStats;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Persistent layout backing the manifest pool: manifest records plus the
 * content-addressable object store they reference.
 * Errors are signalled as {@link StorageException}.
 */
public interface ContentStorage {

    /**
     * Root directory of the storage layout
     */
    Path getStorageRoot();

    /**
     * Store the content-addressable files of a manifest and write its record
     *
     * @param manifest        the manifest to store
     * @param sourceDirectory directory holding the files by relative path
     * @return Mono emitting the manifest as persisted, with normalized hashes and sizes
     */
    Mono<ContentManifest> storeContent(ContentManifest manifest, Path sourceDirectory);

    /**
     * Location of a manifest record; no I/O
     */
    Path getManifestStoragePath(ManifestId id);

    /**
     * Logical content root of a manifest, used for workspace construction; no I/O
     */
    Path getContentDirectoryPath(ManifestId id);

    /**
     * Location of an object in the content-addressable store; no I/O
     */
    Path getObjectPath(String hash);

    /**
     * Check if a manifest record exists
     */
    Mono<Boolean> isContentStored(ManifestId id);

    /**
     * Rewrite an existing manifest record in place without touching content.
     * The record must already exist and every content hash it names must be in the store;
     * both are checked while holding the manifest lock and the shared object-store lock.
     *
     * @return Mono emitting false if no record exists for the id, true once rewritten
     * @throws StorageException via the Mono if a referenced object is missing
     */
    Mono<Boolean> updateManifest(ContentManifest manifest);

    /**
     * Read a manifest record
     *
     * @return Mono emitting Optional of the manifest, empty if no record exists
     */
    Mono<Optional<ContentManifest>> readManifest(ManifestId id);

    /**
     * Read a manifest record file directly
     */
    Mono<ContentManifest> readManifestFile(Path manifestFile);

    /**
     * Every manifest record file under the storage root
     */
    Flux<Path> listManifestFiles();

    /**
     * Delete a manifest record and every object no remaining manifest references
     *
     * @return Mono emitting true if a record was removed, false if there was none
     */
    Mono<Boolean> removeContent(ManifestId id);

    /**
     * Copy the stored files of a manifest into a directory by relative path
     *
     * @return Mono emitting the target directory
     */
    Mono<Path> retrieveContent(ManifestId id, Path targetDirectory);

    /**
     * Delete every object that no manifest references
     *
     * @return Mono emitting the number of deleted objects
     */
    Mono<Long> collectGarbage();

    /**
     * Remove every manifest in the pool
     *
     * @return Mono emitting the number of removed manifests
     */
    Mono<Long> removeAll();

    Mono<StorageStats> getStorageStats();
}
