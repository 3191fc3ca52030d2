package com.webresearch.core.dto.research;

/**
 * @param timeBudgetUsed fraction of the time budget consumed
 * @param pageBudgetUsed fraction of the page budget consumed
 */
public record ConfidenceSummary(
        double overall,
        int questionsAnswered,
        int questionsTotal,
        double avgMarginalGain,
        int pagesVisited,
        long elapsedMs,
        double timeBudgetUsed,
        double pageBudgetUsed
) {
}
