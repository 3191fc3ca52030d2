package com.webresearch.core.dto.claim;

import com.webresearch.core.entity.SourceTier;

public record ClaimSource(
        String url,
        String domain,
        SourceTier tier,
        long timestamp,
        String snippetHash
) {
}
