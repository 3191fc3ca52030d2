package com.webresearch.core.dto.telemetry;

import com.webresearch.core.entity.StopReason;

public record StopCondition(
        StopReason reason,
        String details,
        double finalConfidence,
        long timestamp
) {
}
