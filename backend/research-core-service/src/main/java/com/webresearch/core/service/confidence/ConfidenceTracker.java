package com.webresearch.core.service.confidence;

import com.webresearch.core.dto.claim.Claim;
import com.webresearch.core.dto.plan.ExecutionBudgets;
import com.webresearch.core.dto.plan.PrimaryQuestion;
import com.webresearch.core.dto.research.ConfidenceState;
import com.webresearch.core.dto.research.ConfidenceSummary;
import com.webresearch.core.dto.research.MarginalGain;
import com.webresearch.core.dto.telemetry.StopCondition;
import com.webresearch.core.entity.SourceTier;
import com.webresearch.core.entity.StopReason;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks how confident a run is in its answers and decides when further browsing stops paying off.
 *
 * <p>One instance per research session; paths running in parallel share it, so every method is synchronized.
 */
@Slf4j
public class ConfidenceTracker {

    private static final double CORROBORATION_BOOST = 0.15;
    private static final double MAX_CORROBORATION_BOOST = 0.4;
    private static final double CONTRADICTION_PENALTY = 0.3;
    private static final double PROJECTION_DECAY = 0.8;
    private static final double ANSWERED_THRESHOLD = 0.7;

    private final ExecutionBudgets budgets;
    private final Clock clock;

    private final List<PrimaryQuestion> questions = new ArrayList<>();
    private final Map<String, Double> perQuestion = new LinkedHashMap<>();
    private final Map<String, Double> perClaim = new LinkedHashMap<>();
    private final List<MarginalGain> marginalGainHistory = new ArrayList<>();
    private double overall;
    private String lastAction;
    private Double projectedGain;
    private long startTime;
    private int pagesVisited;

    public ConfidenceTracker(ExecutionBudgets budgets, Clock clock) {
        this.budgets = budgets;
        this.clock = clock;
        this.startTime = clock.millis();
    }

    static double tierWeight(SourceTier tier) {
        return switch (tier) {
            case TIER_1 -> 1.0;
            case TIER_2 -> 0.8;
            case TIER_3 -> 0.6;
            case TIER_4 -> 0.3;
            case TIER_5 -> 0.1;
        };
    }

    public synchronized void initialize(List<PrimaryQuestion> primaryQuestions) {
        questions.clear();
        questions.addAll(primaryQuestions);
        startTime = clock.millis();
        pagesVisited = 0;
        for (PrimaryQuestion question : primaryQuestions) {
            perQuestion.put(question.getId(), 0.0);
        }
    }

    public static double calculateClaimConfidence(Claim claim) {
        double score = tierWeight(claim.getPrimarySourceTier()) * 0.5;
        score += Math.min(claim.getCorroborationCount() * CORROBORATION_BOOST, MAX_CORROBORATION_BOOST);
        score -= claim.getContradictionCount() * CONTRADICTION_PENALTY;
        int uniqueDomains = claim.uniqueDomainCount();
        if (uniqueDomains > 1) {
            score += 0.1 * Math.min(uniqueDomains - 1, 3);
        }
        return Math.max(0, Math.min(1, score));
    }

    /**
     * Fold the latest claims into the per-claim and per-question scores and record the marginal gain
     * of the action that produced them. Counts as one page visited.
     */
    public synchronized void update(List<Claim> claims, String action) {
        double previous = overall;

        for (Claim claim : claims) {
            double score = calculateClaimConfidence(claim);
            perClaim.put(claim.getId(), score);
            if (claim.getQuestionId() != null) {
                perQuestion.merge(claim.getQuestionId(), score, Math::max);
            }
        }
        recalculateOverall();

        marginalGainHistory.add(new MarginalGain(clock.millis(), action, previous, overall, overall - previous));
        lastAction = action;
        projectedGain = recentAverageGain(5).orElse(0.1) * PROJECTION_DECAY;
        pagesVisited++;
        log.debug("Confidence after '{}': {} -> {}", action, previous, overall);
    }

    private void recalculateOverall() {
        double weightedSum = 0;
        double totalWeight = 0;
        for (PrimaryQuestion question : questions) {
            weightedSum += perQuestion.getOrDefault(question.getId(), 0.0) * question.getPriority();
            totalWeight += question.getPriority();
        }
        overall = totalWeight > 0 ? weightedSum / totalWeight : 0;
    }

    private Optional<Double> recentAverageGain(int window) {
        if (marginalGainHistory.isEmpty()) {
            return Optional.empty();
        }
        List<MarginalGain> recent = marginalGainHistory.subList(
                Math.max(0, marginalGainHistory.size() - window), marginalGainHistory.size());
        return Optional.of(recent.stream().mapToDouble(MarginalGain::marginalGain).average().orElse(0));
    }

    /**
     * Checks, in order: confidence reached, marginal gain below the floor over the last three actions,
     * time budget, page budget.
     *
     * @return the first condition met, empty while the run should continue
     */
    public synchronized Optional<StopCondition> checkStopCondition(double confidenceThreshold) {
        long now = clock.millis();
        if (overall >= confidenceThreshold) {
            return Optional.of(new StopCondition(StopReason.CONFIDENCE_REACHED,
                    String.format(Locale.ROOT, "Overall confidence %.1f%% reached threshold %.1f%%",
                            overall * 100, confidenceThreshold * 100),
                    overall, now));
        }

        if (marginalGainHistory.size() >= 3) {
            double avgRecentGain = recentAverageGain(3).orElse(0.0);
            if (avgRecentGain < budgets.marginalGainFloor()) {
                return Optional.of(new StopCondition(StopReason.MARGINAL_GAIN_LOW,
                        String.format(Locale.ROOT, "Marginal gain %.2f%% below floor %.2f%%",
                                avgRecentGain * 100, budgets.marginalGainFloor() * 100),
                        overall, now));
            }
        }

        long elapsed = now - startTime;
        if (elapsed >= budgets.maxTimeMs()) {
            return Optional.of(new StopCondition(StopReason.BUDGET_EXHAUSTED,
                    String.format(Locale.ROOT, "Time budget exhausted: %.1fs >= %.1fs",
                            elapsed / 1000.0, budgets.maxTimeMs() / 1000.0),
                    overall, now));
        }

        if (pagesVisited >= budgets.maxPages()) {
            return Optional.of(new StopCondition(StopReason.BUDGET_EXHAUSTED,
                    "Page budget exhausted: " + pagesVisited + " >= " + budgets.maxPages(),
                    overall, now));
        }
        return Optional.empty();
    }

    public boolean shouldContinue(double confidenceThreshold) {
        return checkStopCondition(confidenceThreshold).isEmpty();
    }

    public synchronized List<PrimaryQuestion> getUnderconfidentQuestions() {
        List<PrimaryQuestion> result = new ArrayList<>();
        for (PrimaryQuestion question : questions) {
            if (perQuestion.getOrDefault(question.getId(), 0.0) < question.getRequiredConfidence()) {
                result.add(question);
            }
        }
        return result;
    }

    public synchronized List<String> getUnverifiedClaimIds() {
        List<String> ids = new ArrayList<>();
        perClaim.forEach((id, score) -> {
            if (score < ANSWERED_THRESHOLD) {
                ids.add(id);
            }
        });
        return ids;
    }

    /**
     * Expected value of visiting a domain: tier weight plus the confidence gap of the questions it may
     * answer, discounted by pages already visited.
     */
    public synchronized double calculateDomainExpectedValue(SourceTier tier, List<String> expectedQuestionIds) {
        double value = tierWeight(tier);
        for (String questionId : expectedQuestionIds) {
            double current = perQuestion.getOrDefault(questionId, 0.0);
            for (PrimaryQuestion question : questions) {
                if (question.getId().equals(questionId)) {
                    double gap = question.getRequiredConfidence() - current;
                    if (gap > 0) {
                        value += gap * question.getPriority() * 0.1;
                    }
                    break;
                }
            }
        }
        return value / (1 + pagesVisited * 0.1);
    }

    public synchronized StopCondition forceStop(StopReason reason, String details) {
        return new StopCondition(reason, details, overall, clock.millis());
    }

    /**
     * Penalize a claim that was just contradicted.
     */
    public synchronized void handleContradiction(String claimId) {
        Double current = perClaim.get(claimId);
        if (current != null) {
            perClaim.put(claimId, Math.max(0, current - CONTRADICTION_PENALTY));
            recalculateOverall();
        }
    }

    /**
     * @return estimated milliseconds to reach the threshold, empty when progress is flat or history too short
     */
    public synchronized Optional<Long> estimateTimeToThreshold(double threshold) {
        if (overall >= threshold) {
            return Optional.of(0L);
        }
        double avgGain = projectedGain != null && projectedGain != 0 ? projectedGain : 0.05;
        if (avgGain <= 0 || marginalGainHistory.size() < 2) {
            return Optional.empty();
        }
        double actionsNeeded = (threshold - overall) / avgGain;
        long span = marginalGainHistory.get(marginalGainHistory.size() - 1).timestamp()
                - marginalGainHistory.get(0).timestamp();
        double avgTimePerAction = (double) span / marginalGainHistory.size();
        return Optional.of(Math.round(actionsNeeded * avgTimePerAction));
    }

    public synchronized ConfidenceSummary getSummary() {
        long elapsed = clock.millis() - startTime;
        int answered = (int) perQuestion.values().stream().filter(c -> c >= ANSWERED_THRESHOLD).count();
        return new ConfidenceSummary(
                overall,
                answered,
                questions.size(),
                recentAverageGain(5).orElse(0.0),
                pagesVisited,
                elapsed,
                budgets.maxTimeMs() > 0 ? (double) elapsed / budgets.maxTimeMs() : 0,
                budgets.maxPages() > 0 ? (double) pagesVisited / budgets.maxPages() : 0);
    }

    public synchronized ConfidenceState getState() {
        return new ConfidenceState(overall, new LinkedHashMap<>(perQuestion), new LinkedHashMap<>(perClaim),
                List.copyOf(marginalGainHistory), lastAction, projectedGain);
    }

    public synchronized double getOverallConfidence() {
        return overall;
    }

    public synchronized double getQuestionConfidence(String questionId) {
        return perQuestion.getOrDefault(questionId, 0.0);
    }

    public synchronized int getPagesVisited() {
        return pagesVisited;
    }
}
