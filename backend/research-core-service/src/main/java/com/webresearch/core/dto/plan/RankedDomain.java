package com.webresearch.core.dto.plan;

import com.webresearch.core.entity.SourceTier;

import java.util.List;

public record RankedDomain(
        String domain,
        SourceTier expectedTier,
        double relevanceScore,
        List<String> expectedContent,
        List<String> urlPatterns
) {
}
