package com.dingdangmaoup.contentpool.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Pool storage configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "contentpool.storage")
public class StorageProperties {

    /**
     * Storage root holding manifests/, cas-objects/, content/ and temp/
     */
    private String basePath = Paths.get(System.getProperty("user.home"), ".contentpool").toString();

    /**
     * Scratch directory for in-flight writes; defaults to {basePath}/temp
     */
    private String tempDir;

    /**
     * Chunk size for streaming hash and copy operations
     */
    private int hashBufferSize = 65536;

    /**
     * Compare declared hashes and sizes against the actual source files
     */
    private boolean verifyIntegrity = true;

    public Path resolveBasePath() {
        return Paths.get(basePath);
    }

    public Path resolveTempDir() {
        return tempDir == null || tempDir.isBlank() ? resolveBasePath().resolve("temp") : Paths.get(tempDir);
    }
}
