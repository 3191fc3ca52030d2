package com.webresearch.core.dto.telemetry;

import com.webresearch.core.entity.NavigationEventType;

import java.util.Map;

public record TelemetryStats(
        String sessionId,
        long durationMs,
        int eventCount,
        Map<NavigationEventType, Long> eventsByType,
        long errorsCount,
        long blockedCount
) {
}
