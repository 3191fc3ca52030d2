package com.webresearch.core.dto.claim;

import com.webresearch.core.entity.ClaimConfidence;
import com.webresearch.core.entity.VerificationType;

public record VerificationEvent(
        long timestamp,
        VerificationType type,
        String sourceUrl,
        ClaimConfidence previousConfidence,
        ClaimConfidence newConfidence,
        String note
) {
}
