package com.dingdangmaoup.contentpool.cache;

import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;

/**
 * Process-local index of persisted manifests. Not the source of truth: it starts
 * empty and is repopulated from storage by {@link ManifestCacheWarmer}.
 * Safe for concurrent use; a single upsert is atomic and the last write wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManifestCache {

    private final Cache<ManifestId, ContentManifest> manifestCacheStore;

    public Optional<ContentManifest> get(ManifestId id) {
        ContentManifest manifest = manifestCacheStore.getIfPresent(id);
        if (manifest != null) {
            log.debug("Manifest cache HIT: {}", id);
            return Optional.of(manifest);
        }
        log.debug("Manifest cache MISS: {}", id);
        return Optional.empty();
    }

    public void upsert(ContentManifest manifest) {
        manifestCacheStore.put(manifest.getId(), manifest);
        log.debug("Manifest cache PUT: {}", manifest.getId());
    }

    public Collection<ContentManifest> getAll() {
        return new ArrayList<>(manifestCacheStore.asMap().values());
    }

    public void evict(ManifestId id) {
        manifestCacheStore.invalidate(id);
        log.debug("Manifest cache EVICT: {}", id);
    }

    public void clear() {
        manifestCacheStore.invalidateAll();
        log.info("Manifest cache CLEARED");
    }

    public long size() {
        return manifestCacheStore.estimatedSize();
    }

    public double hitRate() {
        return manifestCacheStore.stats().hitRate();
    }
}
