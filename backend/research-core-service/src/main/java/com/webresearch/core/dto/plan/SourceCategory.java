package com.webresearch.core.dto.plan;

import com.webresearch.core.entity.SourceCategoryType;

public record SourceCategory(
        SourceCategoryType category,
        int priority,
        int maxSources
) {
}
