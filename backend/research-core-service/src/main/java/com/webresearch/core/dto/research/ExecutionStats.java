package com.webresearch.core.dto.research;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStats {
    private long totalTimeMs;
    private int pagesVisited;
    private int claimsFound;
    /** Claims at VERIFIED or HIGH */
    private int claimsVerified;
    private int contradictionsFound;
    private long cacheHits;
    private long cacheMisses;
    private int pathsExecuted;
    private int pathsTerminatedEarly;
    private double avgConfidencePerPage;
}
