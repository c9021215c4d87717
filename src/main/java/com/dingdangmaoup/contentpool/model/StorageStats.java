package com.dingdangmaoup.contentpool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of pool storage usage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageStats {
    private long manifestCount;
    private long manifestBytes;
    private long objectCount;
    private long objectBytes;
    private long availableBytes;
}
