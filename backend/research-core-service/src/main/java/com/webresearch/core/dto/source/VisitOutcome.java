package com.webresearch.core.dto.source;

import java.util.List;

/**
 * Result of one page visit, fed back into source intelligence
 */
public record VisitOutcome(
        boolean success,
        String url,
        int extractionYield,
        List<UrlPattern> patterns,
        List<String> blockedPaths
) {

    public static VisitOutcome success(String url, int extractionYield) {
        return new VisitOutcome(true, url, extractionYield, List.of(), List.of());
    }

    public static VisitOutcome failure(String url) {
        return new VisitOutcome(false, url, 0, List.of(), List.of(url));
    }
}
