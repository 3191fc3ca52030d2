package com.webresearch.core.dto.source;

import java.util.Map;

public record SourceIntelligenceState(
        Map<String, DomainScore> domainScores,
        Map<String, SourceIntelligence> sourceIntelligence
) {
}
