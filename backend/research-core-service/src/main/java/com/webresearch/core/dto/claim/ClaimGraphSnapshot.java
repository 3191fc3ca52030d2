package com.webresearch.core.dto.claim;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the claim graph
 *
 * @param overallConfidence  mean confidence score over all claims
 * @param questionConfidence maximum confidence score per question
 */
public record ClaimGraphSnapshot(
        List<Claim> claims,
        List<ClaimRelationship> relationships,
        double overallConfidence,
        Map<String, Double> questionConfidence
) {
}
