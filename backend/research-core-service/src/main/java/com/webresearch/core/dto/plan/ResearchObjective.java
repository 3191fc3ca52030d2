package com.webresearch.core.dto.plan;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 리서치 목표 (사용자 질의 + 제약 조건)
 * Immutable input to a plan.
 */
@Value
@Builder
public class ResearchObjective {
    String query;
    String context;
    ResearchConstraints constraints;
    /** Required overall confidence (0-1); planner default applies when null */
    Double confidenceRequirement;
    @Builder.Default
    List<String> knownEntities = List.of();
    @Builder.Default
    List<String> knownDomains = List.of();

    public static ResearchObjective of(String query) {
        return ResearchObjective.builder().query(query).build();
    }
}
