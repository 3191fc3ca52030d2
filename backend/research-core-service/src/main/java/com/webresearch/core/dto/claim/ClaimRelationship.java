package com.webresearch.core.dto.claim;

import com.webresearch.core.entity.RelationshipType;

public record ClaimRelationship(
        String claimId1,
        String claimId2,
        RelationshipType type,
        double strength
) {

    public boolean involves(String claimId) {
        return claimId1.equals(claimId) || claimId2.equals(claimId);
    }
}
