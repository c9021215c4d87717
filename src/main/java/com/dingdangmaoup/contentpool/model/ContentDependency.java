package com.dingdangmaoup.contentpool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Another manifest required or suggested before this one is usable
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentDependency {
    private ManifestId id;
    private String name;
    private ContentType dependencyType;
    private String minVersion;
    private String maxVersion;
    @Builder.Default
    private DependencyInstallBehavior installBehavior = DependencyInstallBehavior.REQUIRE_EXISTING;
    private boolean optional;
}
