package com.webresearch.core.dto.telemetry;

import com.webresearch.core.entity.ControlCommandType;

import java.util.Map;

public record ControlCommand(
        ControlCommandType type,
        Map<String, Object> payload,
        long timestamp
) {
}
