package com.webresearch.core.dto.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrimaryQuestion {
    private String id;
    private String question;
    /** Classifier category that produced the question, null for generic and contextual questions */
    private String category;
    private int priority;
    private double requiredConfidence;
    @Builder.Default
    private List<String> relatedQuestions = new ArrayList<>();
}
