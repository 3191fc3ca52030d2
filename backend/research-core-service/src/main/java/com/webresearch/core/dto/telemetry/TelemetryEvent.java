package com.webresearch.core.dto.telemetry;

import com.webresearch.core.entity.NavigationEventType;

import java.util.Map;

public record TelemetryEvent(
        String id,
        long timestamp,
        NavigationEventType type,
        String sessionId,
        String pathId,
        Map<String, Object> data
) {
}
