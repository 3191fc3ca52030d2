package com.webresearch.core.dto.research;

import com.webresearch.core.dto.claim.ClaimSource;
import com.webresearch.core.entity.ClaimConfidence;

import java.util.List;
import java.util.Map;

public record ResearchAnswer(
        String questionId,
        String question,
        Map<String, Object> answer,
        ClaimConfidence confidence,
        double confidenceScore,
        List<ClaimSource> sources,
        String reasoning
) {
}
