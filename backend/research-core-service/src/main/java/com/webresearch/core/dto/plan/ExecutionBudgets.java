package com.webresearch.core.dto.plan;

/**
 * Resource budgets of a research run
 *
 * @param marginalGainFloor stop when the recent average confidence gain falls below this value
 */
public record ExecutionBudgets(
        long maxTimeMs,
        int maxPages,
        int maxConcurrency,
        int maxCostUnits,
        double marginalGainFloor
) {
}
