package com.webresearch.core.dto.plan;

import com.webresearch.core.entity.OperatorMode;
import com.webresearch.core.entity.SourceTier;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Optional overrides of the mode budget preset and domain filters
 */
@Value
@Builder
public class ResearchConstraints {
    Long maxTimeMs;
    Integer maxPages;
    Integer maxConcurrency;
    Integer maxCostUnits;
    OperatorMode mode;
    @Builder.Default
    List<SourceTier> allowedTiers = List.of();
    @Builder.Default
    List<String> blockedDomains = List.of();
}
