package com.webresearch.core.dto.research;

public record MarginalGain(
        long timestamp,
        String action,
        double gainBefore,
        double gainAfter,
        double marginalGain
) {
}
