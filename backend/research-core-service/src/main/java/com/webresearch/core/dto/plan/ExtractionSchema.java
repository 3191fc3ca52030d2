package com.webresearch.core.dto.plan;

import com.webresearch.core.service.extraction.ConfidenceRule;

import java.util.List;

/**
 * Named field set an extraction adapter fills. The schema name doubles as the claim category.
 */
public record ExtractionSchema(
        String name,
        List<ExtractionField> fields,
        List<String> sourcePatterns,
        List<ConfidenceRule> confidenceRules
) {
}
