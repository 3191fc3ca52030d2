package com.webresearch.core.service.planner;

import java.util.List;
import java.util.Optional;

/**
 * Detects which question categories an objective asks about.
 */
public interface QuestionClassifier {

    /**
     * @return matching categories in a stable order, empty when nothing is recognized
     */
    List<QuestionCategory> classify(String text);

    Optional<QuestionCategory> findByName(String name);
}
