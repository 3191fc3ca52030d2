package com.webresearch.core.service.planner;

import com.webresearch.core.dto.plan.ExtractionField;
import com.webresearch.core.dto.plan.ExtractionSchema;
import com.webresearch.core.entity.FieldType;

import java.util.List;

import static com.webresearch.core.service.extraction.ConfidenceRule.has;
import static com.webresearch.core.service.extraction.ConfidenceRule.lengthAbove;

/**
 * Built-in extraction schemas. The schema name is also the claim category.
 */
final class ExtractionSchemaCatalog {

    static final ExtractionSchema COMPANY_INFO = new ExtractionSchema(
            "company_info",
            List.of(
                    new ExtractionField("name", FieldType.STRING, true),
                    new ExtractionField("description", FieldType.STRING, false),
                    new ExtractionField("founded", FieldType.DATE, false),
                    new ExtractionField("location", FieldType.STRING, false),
                    new ExtractionField("employees", FieldType.NUMBER, false)),
            List.of("about", "company", "team"),
            List.of(
                    has("name", 0.2, "Has company name"),
                    has("description", 0.15, "Has description"),
                    has("founded", 0.1, "Has founding date"),
                    has("location", 0.1, "Has location")));

    static final ExtractionSchema PRICING = new ExtractionSchema(
            "pricing",
            List.of(
                    new ExtractionField("plans", FieldType.LIST, true),
                    new ExtractionField("currency", FieldType.STRING, false),
                    new ExtractionField("billing_options", FieldType.LIST, false),
                    new ExtractionField("free_tier", FieldType.BOOLEAN, false),
                    new ExtractionField("enterprise", FieldType.BOOLEAN, false)),
            List.of("pricing", "plans", "subscribe"),
            List.of(
                    lengthAbove("plans", 0, 0.3, "Has pricing plans"),
                    has("currency", 0.1, "Has currency"),
                    lengthAbove("plans", 2, 0.1, "Multiple plans found")));

    static final ExtractionSchema FEATURES = new ExtractionSchema(
            "features",
            List.of(
                    new ExtractionField("feature_list", FieldType.LIST, true),
                    new ExtractionField("categories", FieldType.LIST, false)),
            List.of("features", "product", "capabilities"),
            List.of(
                    lengthAbove("feature_list", 0, 0.2, "Has features"),
                    lengthAbove("feature_list", 5, 0.1, "Detailed feature list")));

    static final ExtractionSchema TECHNICAL = new ExtractionSchema(
            "technical",
            List.of(
                    new ExtractionField("languages", FieldType.LIST, false),
                    new ExtractionField("frameworks", FieldType.LIST, false),
                    new ExtractionField("infrastructure", FieldType.LIST, false),
                    new ExtractionField("apis", FieldType.LIST, false)),
            List.of("github", "docs", "technical", "stack"),
            List.of(
                    lengthAbove("languages", 0, 0.15, "Has language info"),
                    lengthAbove("frameworks", 0, 0.1, "Has frameworks"),
                    lengthAbove("apis", 0, 0.1, "Has API info")));

    static final ExtractionSchema SECURITY = new ExtractionSchema(
            "security",
            List.of(
                    new ExtractionField("certifications", FieldType.LIST, false),
                    new ExtractionField("compliance", FieldType.LIST, false),
                    new ExtractionField("security_features", FieldType.LIST, false)),
            List.of("security", "trust", "compliance", "privacy"),
            List.of(
                    lengthAbove("certifications", 0, 0.2, "Has certifications"),
                    lengthAbove("compliance", 0, 0.1, "Has compliance frameworks")));

    private ExtractionSchemaCatalog() {
    }
}
