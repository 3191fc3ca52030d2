package com.webresearch.core.dto.plan;

import com.webresearch.core.entity.OperatorMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded research plan produced from an objective.
 * Execution paths are re-prioritized in place while the run is live.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchPlan {
    private String id;
    private ResearchObjective objective;
    private long createdAt;

    private List<PrimaryQuestion> primaryQuestions;
    private List<AnswerType> expectedAnswerTypes;
    private List<SourceCategory> sourceCategories;
    private List<RankedDomain> targetDomains;
    private List<DomainExpectation> domainExpectations;
    private List<ExtractionSchema> extractionSchemas;

    private double confidenceThreshold;
    private OperatorMode mode;
    private ExecutionBudgets budgets;

    private List<ExecutionPath> executionPaths;

    private boolean valid;
    @Builder.Default
    private List<String> validationErrors = new ArrayList<>();
}
