package com.webresearch.core.dto.plan;

import com.webresearch.core.entity.FieldType;

public record ExtractionField(
        String name,
        FieldType type,
        boolean required
) {
}
