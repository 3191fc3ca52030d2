package com.webresearch.core.dto.claim;

import java.util.List;

public record ClaimGraphState(
        List<Claim> claims,
        List<ClaimRelationship> relationships
) {
}
