package com.dingdangmaoup.contentpool.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Manifest cache configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "contentpool.cache")
public class CacheProperties {

    /**
     * Maximum number of cached manifests
     */
    private int maxEntries = 10000;

    /**
     * Time to live for cached manifests; null keeps entries until evicted
     */
    private Duration ttl;

    /**
     * Repopulate the cache from storage once the application is ready
     */
    private boolean warmOnStartup = true;
}
