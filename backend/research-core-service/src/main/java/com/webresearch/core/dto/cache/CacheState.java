package com.webresearch.core.dto.cache;

import com.webresearch.core.dto.claim.ExtractionResult;

import java.util.List;

/**
 * Exported contents of every sub-cache
 */
public record CacheState(
        List<CacheEntry<CachedPage>> pageCache,
        List<CacheEntry<List<ExtractionResult>>> extractionCache,
        List<CacheEntry<DomainMapEntry>> domainMap,
        List<CacheEntry<List<String>>> queryCache
) {
}
