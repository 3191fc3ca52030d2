package com.webresearch.core.dto.research;

import java.util.List;
import java.util.Map;

/**
 * Aggregate confidence of a run
 *
 * @param projectedGain expected gain of the next action, null before the first update
 */
public record ConfidenceState(
        double overall,
        Map<String, Double> perQuestion,
        Map<String, Double> perClaim,
        List<MarginalGain> marginalGainHistory,
        String lastAction,
        Double projectedGain
) {
}
