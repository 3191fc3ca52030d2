package com.webresearch.core.dto.cache;

import java.util.Map;

public record CachedPage(
        String url,
        String html,
        String text,
        Map<String, Object> extractedData,
        long timestamp,
        long ttlMs,
        int version
) {
}
