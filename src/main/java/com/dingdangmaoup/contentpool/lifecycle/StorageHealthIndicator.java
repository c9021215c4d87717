package com.dingdangmaoup.contentpool.lifecycle;

import com.dingdangmaoup.contentpool.cache.ManifestCache;
import com.dingdangmaoup.contentpool.storage.ContentStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reports the pool as healthy while its storage root is writable
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorageHealthIndicator implements ReactiveHealthIndicator {

    private final ContentStorage storage;
    private final ManifestCache cache;

    @Override
    public Mono<Health> health() {
        Path root = storage.getStorageRoot();
        return Mono.fromCallable(() -> Files.isDirectory(root) && Files.isWritable(root))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(writable -> {
                    if (!writable) {
                        return Mono.just(Health.down()
                                .withDetail("storageRoot", root.toString())
                                .withDetail("reason", "Storage root is missing or not writable")
                                .build());
                    }
                    return storage.getStorageStats()
                            .map(stats -> Health.up()
                                    .withDetail("storageRoot", root.toString())
                                    .withDetail("manifests", stats.getManifestCount())
                                    .withDetail("objects", stats.getObjectCount())
                                    .withDetail("objectBytes", stats.getObjectBytes())
                                    .withDetail("availableBytes", stats.getAvailableBytes())
                                    .withDetail("cachedManifests", cache.size())
                                    .build());
                })
                .onErrorResume(error -> {
                    log.error("Health check error", error);
                    return Mono.just(Health.down()
                            .withException(error)
                            .build());
                });
    }
}
