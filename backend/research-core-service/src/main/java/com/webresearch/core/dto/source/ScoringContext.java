package com.webresearch.core.dto.source;

import java.util.List;

/**
 * Page-level signals used to refresh a domain score
 */
public record ScoringContext(
        String url,
        String content,
        Long timestamp,
        List<String> existingClaims
) {

    public static ScoringContext ofContent(String url, String content) {
        return new ScoringContext(url, content, null, List.of());
    }
}
