package com.dingdangmaoup.contentpool.cache;

import com.dingdangmaoup.contentpool.pool.ContentManifestPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Discovery pass that repopulates the manifest cache from storage on startup
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "contentpool.cache.warm-on-startup", havingValue = "true", matchIfMissing = true)
public class ManifestCacheWarmer {

    private final ContentManifestPool pool;
    private final ManifestCache cache;

    @EventListener(ApplicationReadyEvent.class)
    public void warmCache() {
        log.debug("Warming manifest cache from storage");

        pool.getAllManifests()
                .subscribe(result -> {
                    if (result.isSuccess()) {
                        log.info("Manifest cache warmed with {} manifests", cache.size());
                    } else {
                        log.warn("Manifest cache warm-up failed: {}", result.allErrors());
                    }
                });
    }
}
