package com.dingdangmaoup.contentpool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Filters for manifest search; null fields match everything
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentSearchQuery {
    private String searchTerm;
    private ContentType contentType;
    private GameType targetGame;

    public boolean matches(ContentManifest manifest) {
        if (searchTerm != null && !searchTerm.isBlank()) {
            String term = searchTerm.trim().toLowerCase(Locale.ROOT);
            boolean nameMatches = manifest.getName() != null
                    && manifest.getName().toLowerCase(Locale.ROOT).contains(term);
            boolean idMatches = manifest.getId() != null && manifest.getId().contains(term);
            if (!nameMatches && !idMatches) {
                return false;
            }
        }
        if (contentType != null && manifest.getContentType() != contentType) {
            return false;
        }
        return targetGame == null || manifest.getTargetGame() == targetGame;
    }
}
