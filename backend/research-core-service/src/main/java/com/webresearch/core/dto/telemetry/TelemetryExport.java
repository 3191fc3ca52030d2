package com.webresearch.core.dto.telemetry;

import java.util.List;

public record TelemetryExport(
        String sessionId,
        List<TelemetryEvent> events,
        ProgressState progressState,
        long startTime
) {
}
