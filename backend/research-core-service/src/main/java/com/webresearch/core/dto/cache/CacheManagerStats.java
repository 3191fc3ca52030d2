package com.webresearch.core.dto.cache;

public record CacheManagerStats(
        double hitRate,
        long hits,
        long misses,
        CacheStats pageCache,
        CacheStats extractionCache,
        int domainMapSize,
        int queryCacheSize
) {
}
