package com.webresearch.core.dto.claim;

import java.util.List;

public record ClaimStats(
        int totalClaims,
        int verified,
        int high,
        int medium,
        int low,
        int uncertain,
        int contradicted,
        double avgConfidence,
        List<String> categories,
        int contradictionPairs
) {
}
