package com.webresearch.core.dto.claim;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured data an extraction adapter produced for one page.
 *
 * <p>{@code data} is keyed by the field names of the {@link com.webresearch.core.dto.plan.ExtractionSchema}
 * named by {@code schemaName}. Values are strings, numbers, booleans, lists or nested maps.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResult {
    private String schemaName;
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
    private double confidence;
    private String sourceUrl;
    private long timestamp;
    private String contentHash;
}
