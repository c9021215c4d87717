package com.dingdangmaoup.contentpool.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Manifest pool metrics collection
 */
@Component
public class PoolMetrics {

    private final Counter manifestsAdded;
    private final Counter manifestsRemoved;
    private final Counter manifestsRejected;
    private final Counter objectsWritten;
    private final Counter objectsDeduplicated;
    private final Counter objectsCollected;

    public PoolMetrics(MeterRegistry meterRegistry) {
        this.manifestsAdded = Counter.builder("contentpool.manifest.added")
                .description("Number of manifests stored with content")
                .register(meterRegistry);

        this.manifestsRemoved = Counter.builder("contentpool.manifest.removed")
                .description("Number of manifests removed from the pool")
                .register(meterRegistry);

        this.manifestsRejected = Counter.builder("contentpool.manifest.rejected")
                .description("Number of manifests rejected by validation")
                .register(meterRegistry);

        this.objectsWritten = Counter.builder("contentpool.cas.object.written")
                .description("Number of new objects written to the content store")
                .register(meterRegistry);

        this.objectsDeduplicated = Counter.builder("contentpool.cas.object.deduplicated")
                .description("Number of object writes skipped because the content was already stored")
                .register(meterRegistry);

        this.objectsCollected = Counter.builder("contentpool.cas.object.collected")
                .description("Number of unreferenced objects deleted")
                .register(meterRegistry);
    }

    public void recordManifestAdded() {
        manifestsAdded.increment();
    }

    public void recordManifestRemoved() {
        manifestsRemoved.increment();
    }

    public void recordManifestRejected() {
        manifestsRejected.increment();
    }

    public void recordObjectWritten() {
        objectsWritten.increment();
    }

    public void recordObjectDeduplicated() {
        objectsDeduplicated.increment();
    }

    public void recordObjectsCollected(long count) {
        objectsCollected.increment(count);
    }
}
