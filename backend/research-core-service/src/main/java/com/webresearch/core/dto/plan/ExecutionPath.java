package com.webresearch.core.dto.plan;

import com.webresearch.core.entity.PathStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One independent navigation/extraction sequence of a plan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPath {
    private String id;
    private String goal;
    @Builder.Default
    private List<String> domainScope = new ArrayList<>();
    @Builder.Default
    private List<String> extractionTargets = new ArrayList<>();
    /** Questions this path is expected to answer */
    @Builder.Default
    private List<String> questionIds = new ArrayList<>();
    private double confidenceContribution;
    private int priority;
    /** Priority assigned at planning time; {@code priority} is derived from it as questions get answered */
    private int basePriority;
    @Builder.Default
    private PathStatus status = PathStatus.PENDING;
}
