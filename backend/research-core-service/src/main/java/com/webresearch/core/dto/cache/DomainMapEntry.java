package com.webresearch.core.dto.cache;

import java.util.List;

/**
 * Navigation knowledge gathered for one domain
 */
public record DomainMapEntry(
        String domain,
        List<String> highSignalUrls,
        List<String> navigationPaths,
        long lastUpdated
) {
}
