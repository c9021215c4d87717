package com.dingdangmaoup.contentpool.config;

import com.dingdangmaoup.contentpool.config.properties.CacheProperties;
import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private final CacheProperties cacheProperties;

    @Bean
    public Cache<ManifestId, ContentManifest> manifestCacheStore() {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(cacheProperties.getMaxEntries())
                .recordStats();
        if (cacheProperties.getTtl() != null) {
            builder.expireAfterWrite(cacheProperties.getTtl());
        }

        log.info("Initialized Caffeine manifest cache with maxEntries={}, ttl={}",
                cacheProperties.getMaxEntries(), cacheProperties.getTtl());
        return builder.build();
    }
}
