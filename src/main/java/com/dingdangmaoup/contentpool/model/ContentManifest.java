package com.dingdangmaoup.contentpool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Unit of installable content: identity, declared files and dependencies.
 * Instances are built by resolvers and admitted to the pool through
 * {@code ContentManifestPool#addManifest}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContentManifest {

    public static final String CURRENT_MANIFEST_VERSION = "1.1";

    @Builder.Default
    private String manifestVersion = CURRENT_MANIFEST_VERSION;
    private ManifestId id;
    private String name;
    private String version;
    @Builder.Default
    private ContentType contentType = ContentType.UNKNOWN;
    @Builder.Default
    private GameType targetGame = GameType.UNKNOWN;
    private PublisherInfo publisher;
    private ContentMetadata metadata;
    @Builder.Default
    private List<ManifestFile> files = new ArrayList<>();
    @Builder.Default
    private List<ContentDependency> dependencies = new ArrayList<>();
    @Builder.Default
    private List<String> requiredDirectories = new ArrayList<>();

    /**
     * Lowercase hashes of every content-addressable file
     */
    public Set<String> contentHashes() {
        Set<String> hashes = new HashSet<>();
        if (files == null) {
            return hashes;
        }
        for (ManifestFile file : files) {
            if (file.isContentAddressable() && file.getHash() != null && !file.getHash().isBlank()) {
                hashes.add(file.getHash().toLowerCase(Locale.ROOT));
            }
        }
        return hashes;
    }
}
