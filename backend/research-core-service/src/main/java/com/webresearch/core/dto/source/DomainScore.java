package com.webresearch.core.dto.source;

import com.webresearch.core.entity.SourceTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DomainScore {
    private String domain;
    private SourceTier tier;
    private DimensionScores scores;
    private double overallScore;
    private long lastUpdated;
    private int sampleSize;

    public DomainScore copy() {
        return new DomainScore(domain, tier, scores != null ? scores.copy() : null,
                overallScore, lastUpdated, sampleSize);
    }
}
