package com.dingdangmaoup.contentpool.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One file entry of a manifest.
 * The companion field required by {@link #sourceType} (hash, downloadUrl or patchSourceFile)
 * is checked by the validator, not here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ManifestFile {
    private String relativePath;
    private String hash;
    private long size;
    @Builder.Default
    private ContentSourceType sourceType = ContentSourceType.UNKNOWN;
    private boolean executable;
    @Builder.Default
    private boolean required = true;
    private FilePermissions permissions;
    private String downloadUrl;
    private String patchSourceFile;
    private String sourcePath;

    @JsonIgnore
    public boolean isContentAddressable() {
        return sourceType == ContentSourceType.CONTENT_ADDRESSABLE;
    }
}
