package com.webresearch.core.dto.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Five independent 0-1 quality dimensions of a domain
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionScores {
    private double authority;
    private double originality;
    private double freshness;
    private double specificity;
    private double consistency;

    public static DimensionScores neutral() {
        return new DimensionScores(0.5, 0.5, 0.5, 0.5, 0.5);
    }

    public DimensionScores copy() {
        return new DimensionScores(authority, originality, freshness, specificity, consistency);
    }
}
