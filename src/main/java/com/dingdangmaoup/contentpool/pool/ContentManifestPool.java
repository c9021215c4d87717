package com.dingdangmaoup.contentpool.pool;

import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ContentSearchQuery;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.dingdangmaoup.contentpool.model.OperationResult;
import com.dingdangmaoup.contentpool.model.StorageStats;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

/**
 * Public surface of the manifest pool.
 * Every operation completes with an {@link OperationResult}; expected failures never
 * reach the subscriber as error signals.
 */
public interface ContentManifestPool {

    /**
     * Validate a manifest and store it together with its content files
     *
     * @param manifest        the manifest to admit
     * @param sourceDirectory directory holding the manifest's files by relative path
     * @return Mono emitting true on success
     */
    Mono<OperationResult<Boolean>> addManifest(ContentManifest manifest, Path sourceDirectory);

    /**
     * Update the metadata of a manifest whose content is already stored.
     * Fails if the content has not been added with {@link #addManifest(ContentManifest, Path)} first.
     *
     * @param manifest the updated manifest
     * @return Mono emitting true on success
     */
    Mono<OperationResult<Boolean>> addManifest(ContentManifest manifest);

    /**
     * Get a stored manifest
     *
     * @param id the manifest id
     * @return Mono emitting the manifest, or a successful result with null data if not stored
     */
    Mono<OperationResult<ContentManifest>> getManifest(ManifestId id);

    /**
     * Get every stored manifest; unreadable records are logged and skipped
     */
    Mono<OperationResult<List<ContentManifest>>> getAllManifests();

    /**
     * Search stored manifests; all query filters must match
     *
     * @param query the search filters
     * @return Mono emitting matching manifests ordered by name, newest version first
     */
    Mono<OperationResult<List<ContentManifest>>> searchManifests(ContentSearchQuery query);

    /**
     * Remove a manifest and release content no other manifest references.
     * Removing a manifest that is not stored succeeds.
     *
     * @param id the manifest id
     * @return Mono emitting true on success
     */
    Mono<OperationResult<Boolean>> removeManifest(ManifestId id);

    /**
     * Check if a manifest is stored
     */
    Mono<OperationResult<Boolean>> isManifestAcquired(ManifestId id);

    /**
     * Get the content root of a stored manifest
     *
     * @param id the manifest id
     * @return Mono emitting the directory, or null data if the manifest is not stored
     */
    Mono<OperationResult<Path>> getContentDirectory(ManifestId id);

    /**
     * Copy the stored files of a manifest into a directory
     *
     * @return Mono emitting the target directory
     */
    Mono<OperationResult<Path>> retrieveContent(ManifestId id, Path targetDirectory);

    /**
     * Remove every manifest
     *
     * @return Mono emitting the number of removed manifests
     */
    Mono<OperationResult<Long>> removeAllManifests();

    /**
     * Delete stored objects no manifest references
     *
     * @return Mono emitting the number of deleted objects
     */
    Mono<OperationResult<Long>> collectGarbage();

    Mono<OperationResult<StorageStats>> getStorageStats();
}
