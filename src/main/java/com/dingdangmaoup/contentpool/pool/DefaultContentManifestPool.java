package com.dingdangmaoup.contentpool.pool;

import com.dingdangmaoup.contentpool.cache.ManifestCache;
import com.dingdangmaoup.contentpool.manifest.VersionComparer;
import com.dingdangmaoup.contentpool.metrics.PoolMetrics;
import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ContentSearchQuery;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.dingdangmaoup.contentpool.model.OperationResult;
import com.dingdangmaoup.contentpool.model.StorageStats;
import com.dingdangmaoup.contentpool.storage.ContentStorage;
import com.dingdangmaoup.contentpool.validation.ManifestValidator;
import com.dingdangmaoup.contentpool.validation.ValidationResult;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orchestrates validation, content storage and the manifest cache.
 * Storage failures and unexpected exceptions are converted to failed results here,
 * tagged with the operation and manifest id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultContentManifestPool implements ContentManifestPool {

    private static final Comparator<ContentManifest> SEARCH_ORDER = Comparator
            .comparing((ContentManifest m) -> m.getName() == null ? "" : m.getName().toLowerCase(Locale.ROOT))
            .thenComparing(ContentManifest::getVersion, VersionComparer.INSTANCE.reversed());

    @NonNull
    private final ContentStorage storage;
    @NonNull
    private final ManifestValidator validator;
    @NonNull
    private final ManifestCache cache;
    @NonNull
    private final PoolMetrics metrics;

    @Override
    public Mono<OperationResult<Boolean>> addManifest(@NonNull ContentManifest manifest, Path sourceDirectory) {
        OperationResult<Boolean> rejection = validate(manifest);
        if (rejection != null) {
            return Mono.just(rejection);
        }

        ManifestId id = manifest.getId();
        log.info("Adding manifest {} to pool with content from {}", id, sourceDirectory);

        return Mono.fromCallable(() -> sourceDirectory != null && Files.isDirectory(sourceDirectory))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(exists -> {
                    if (!exists) {
                        log.debug("Source directory {} does not exist", sourceDirectory);
                        return Mono.just(OperationResult.<Boolean>failure(
                                "Source directory " + sourceDirectory + " does not exist"));
                    }
                    return storage.storeContent(manifest, sourceDirectory)
                            .doOnNext(stored -> {
                                cache.upsert(stored);
                                metrics.recordManifestAdded();
                            })
                            .map(stored -> OperationResult.success(true));
                })
                .onErrorResume(e -> failed("Failed to store content for manifest " + id, e));
    }

    @Override
    public Mono<OperationResult<Boolean>> addManifest(@NonNull ContentManifest manifest) {
        OperationResult<Boolean> rejection = validate(manifest);
        if (rejection != null) {
            return Mono.just(rejection);
        }

        ManifestId id = manifest.getId();
        return storage.updateManifest(manifest)
                .map(updated -> {
                    if (!updated) {
                        return OperationResult.<Boolean>failure("Cannot add manifest " + id
                                + " without source directory. Content must be stored first using"
                                + " addManifest(manifest, sourceDirectory).");
                    }
                    cache.upsert(manifest);
                    log.debug("Updated manifest {} in storage", id);
                    return OperationResult.success(true);
                })
                .onErrorResume(e -> failed("Failed to add manifest " + id, e));
    }

    @Override
    public Mono<OperationResult<ContentManifest>> getManifest(@NonNull ManifestId id) {
        return storage.readManifest(id)
                .map(found -> {
                    found.ifPresent(cache::upsert);
                    return OperationResult.<ContentManifest>success(found.orElse(null));
                })
                .onErrorResume(e -> failed("Failed to read manifest " + id, e));
    }

    @Override
    public Mono<OperationResult<List<ContentManifest>>> getAllManifests() {
        return storage.listManifestFiles()
                .concatMap(path -> storage.readManifestFile(path)
                        .onErrorResume(e -> {
                            log.warn("Failed to read manifest from {}", path, e);
                            return Mono.empty();
                        }))
                .doOnNext(cache::upsert)
                .collectList()
                .map(OperationResult::success)
                .onErrorResume(e -> failed("Failed to enumerate manifests", e));
    }

    @Override
    public Mono<OperationResult<List<ContentManifest>>> searchManifests(@NonNull ContentSearchQuery query) {
        return getAllManifests()
                .map(all -> {
                    if (all.isFailure()) {
                        return all;
                    }
                    List<ContentManifest> matches = all.getData().stream()
                            .filter(query::matches)
                            .sorted(SEARCH_ORDER)
                            .toList();
                    log.debug("Search {} matched {} of {} manifests", query, matches.size(), all.getData().size());
                    return OperationResult.success(matches);
                })
                .onErrorResume(e -> failed("Failed to search manifests", e));
    }

    @Override
    public Mono<OperationResult<Boolean>> removeManifest(@NonNull ManifestId id) {
        log.info("Removing manifest {} from pool", id);
        return storage.removeContent(id)
                .doOnNext(removed -> {
                    cache.evict(id);
                    if (removed) {
                        metrics.recordManifestRemoved();
                    }
                })
                .map(removed -> OperationResult.success(true))
                .onErrorResume(e -> failed("Failed to remove manifest " + id, e));
    }

    @Override
    public Mono<OperationResult<Boolean>> isManifestAcquired(@NonNull ManifestId id) {
        return storage.isContentStored(id)
                .map(OperationResult::success)
                .onErrorResume(e -> failed("Failed to check if manifest " + id + " is acquired", e));
    }

    @Override
    public Mono<OperationResult<Path>> getContentDirectory(@NonNull ManifestId id) {
        return storage.isContentStored(id)
                .map(stored -> {
                    Path directory = storage.getContentDirectoryPath(id);
                    return OperationResult.<Path>success(stored && Files.isDirectory(directory) ? directory : null);
                })
                .onErrorResume(e -> failed("Failed to get content directory for manifest " + id, e));
    }

    @Override
    public Mono<OperationResult<Path>> retrieveContent(@NonNull ManifestId id, @NonNull Path targetDirectory) {
        return storage.retrieveContent(id, targetDirectory)
                .map(OperationResult::success)
                .onErrorResume(e -> failed("Failed to retrieve content for manifest " + id, e));
    }

    @Override
    public Mono<OperationResult<Long>> removeAllManifests() {
        return storage.removeAll()
                .doOnNext(count -> cache.clear())
                .map(OperationResult::success)
                .onErrorResume(e -> failed("Failed to remove all manifests", e));
    }

    @Override
    public Mono<OperationResult<Long>> collectGarbage() {
        return storage.collectGarbage()
                .map(OperationResult::success)
                .onErrorResume(e -> failed("Failed to collect unreferenced content", e));
    }

    @Override
    public Mono<OperationResult<StorageStats>> getStorageStats() {
        return storage.getStorageStats()
                .map(OperationResult::success)
                .onErrorResume(e -> failed("Failed to get storage statistics", e));
    }

    /**
     * @return a failed result if the manifest is invalid, otherwise null
     */
    private OperationResult<Boolean> validate(ContentManifest manifest) {
        ValidationResult validation = validator.validate(manifest);
        log.debug("Manifest validation result for {}: valid={}", manifest.getId(), validation.isValid());
        if (validation.isValid()) {
            return null;
        }
        metrics.recordManifestRejected();
        log.warn("Rejected manifest {}: {}", manifest.getId(), validation.joinedErrors());
        return OperationResult.failure("Manifest validation failed: " + validation.joinedErrors());
    }

    private <T> Mono<OperationResult<T>> failed(String context, Throwable error) {
        log.error("{}", context, error);
        String cause = error.getMessage() == null || error.getMessage().isBlank()
                ? error.getClass().getSimpleName()
                : error.getMessage();
        return Mono.just(OperationResult.failure(context + ": " + cause));
    }
}
