package com.webresearch.core.service.source;

import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.source.DimensionScores;
import com.webresearch.core.dto.source.DomainObservation;
import com.webresearch.core.dto.source.DomainScore;
import com.webresearch.core.dto.source.ScoringContext;
import com.webresearch.core.dto.source.SourceIntelligence;
import com.webresearch.core.dto.source.SourceIntelligenceState;
import com.webresearch.core.dto.source.UrlPattern;
import com.webresearch.core.dto.source.VisitOutcome;
import com.webresearch.core.entity.SourceTier;
import com.webresearch.core.exception.StateImportException;
import com.webresearch.core.util.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Source Intelligence Engine
 *
 * 도메인 신뢰도를 5단계 tier와 5개 품질 차원(authority, originality, freshness, specificity,
 * consistency)으로 평가하고, 방문 결과와 교차 검증 결과로 점수를 계속 갱신합니다.
 *
 * Score updates are exponential smoothing and tolerate last-write-wins races.
 */
@Service
@Slf4j
public class SourceIntelligenceService {

    static final double WEIGHT_AUTHORITY = 0.30;
    static final double WEIGHT_ORIGINALITY = 0.25;
    static final double WEIGHT_FRESHNESS = 0.15;
    static final double WEIGHT_SPECIFICITY = 0.20;
    static final double WEIGHT_CONSISTENCY = 0.10;

    private static final double NEUTRAL = 0.5;
    private static final double FRESHNESS_DECAY_PER_YEAR = 0.2;

    /** Social and commerce platforms presumed low-signal */
    static final Set<String> BLOCKED_DOMAINS = Set.of(
            "pinterest.com",
            "pinterest.co.uk",
            "facebook.com",
            "instagram.com",
            "twitter.com",
            "x.com",
            "tiktok.com",
            "youtube.com",
            "amazon.com",
            "ebay.com"
    );

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("updated?\\s*:?\\s*(\\d{4})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d{1,2}/\\d{1,2}/(\\d{4})"),
            Pattern.compile("(?:january|february|march|april|may|june|july|august|september|october"
                    + "|november|december)\\s+\\d{1,2},?\\s+(\\d{4})", Pattern.CASE_INSENSITIVE)
    );

    private final Clock clock;
    private final ResearchProperties.Source settings;
    private final List<TierRule> rules = TierRule.DEFAULT_RULES;

    private final Map<String, DomainScore> domainScores = new ConcurrentHashMap<>();
    private final Map<String, SourceIntelligence> sourceIntelligence = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Double>> consistencyMatrix = new HashMap<>();

    public SourceIntelligenceService(ResearchProperties properties, Clock clock) {
        this.clock = clock;
        this.settings = properties.getSource();
        initializeKnownDomains();
        log.info("SourceIntelligenceService initialized with {} tier rules, {} seeded domains",
                rules.size(), domainScores.size());
    }

    private void initializeKnownDomains() {
        for (TierRule rule : rules) {
            if (rule.seedDomain() == null) {
                continue;
            }
            DimensionScores scores = baseScores(rule);
            domainScores.put(rule.seedDomain(), DomainScore.builder()
                    .domain(rule.seedDomain())
                    .tier(rule.tier())
                    .scores(scores)
                    .overallScore(calculateOverallScore(scores))
                    .lastUpdated(clock.millis())
                    .sampleSize(0)
                    .build());
        }
    }

    // ============================================
    // Classification and scoring
    // ============================================

    /**
     * Deny-list first, then known scores, then static rules. Unknown domains are neutral tier 3.
     */
    public SourceTier classifyDomain(String domain) {
        String normalized = UrlNormalizer.normalizeDomain(domain);
        if (BLOCKED_DOMAINS.contains(normalized)) {
            return SourceTier.TIER_5;
        }
        DomainScore cached = domainScores.get(normalized);
        if (cached != null) {
            return cached.getTier();
        }
        return findRule(normalized).map(TierRule::tier).orElse(SourceTier.TIER_3);
    }

    public DomainScore scoreDomain(String domain) {
        return scoreDomain(domain, null);
    }

    /**
     * Compute and store a fresh score for the domain, refined by page-level signals when given.
     */
    public DomainScore scoreDomain(String domain, ScoringContext context) {
        String normalized = UrlNormalizer.normalizeDomain(domain);
        SourceTier tier = classifyDomain(normalized);

        DimensionScores scores = currentScores(normalized);
        if (context != null) {
            adjustScoresWithContext(scores, context);
        }

        DomainScore previous = domainScores.get(normalized);
        DomainScore score = DomainScore.builder()
                .domain(normalized)
                .tier(tier)
                .scores(scores)
                .overallScore(calculateOverallScore(scores))
                .lastUpdated(clock.millis())
                .sampleSize((previous != null ? previous.getSampleSize() : 0) + 1)
                .build();
        domainScores.put(normalized, score);
        return score.copy();
    }

    public Optional<DomainScore> getDomainScore(String domain) {
        DomainScore score = domainScores.get(UrlNormalizer.normalizeDomain(domain));
        return Optional.ofNullable(score).map(DomainScore::copy);
    }

    static double calculateOverallScore(DimensionScores scores) {
        return scores.getAuthority() * WEIGHT_AUTHORITY
                + scores.getOriginality() * WEIGHT_ORIGINALITY
                + scores.getFreshness() * WEIGHT_FRESHNESS
                + scores.getSpecificity() * WEIGHT_SPECIFICITY
                + scores.getConsistency() * WEIGHT_CONSISTENCY;
    }

    private DimensionScores currentScores(String domain) {
        DomainScore cached = domainScores.get(domain);
        if (cached != null) {
            return cached.getScores().copy();
        }
        return findRule(domain).map(SourceIntelligenceService::baseScores).orElseGet(DimensionScores::neutral);
    }

    private static DimensionScores baseScores(TierRule rule) {
        return new DimensionScores(rule.authority(), rule.originality(), NEUTRAL, rule.specificity(), NEUTRAL);
    }

    private Optional<TierRule> findRule(String domain) {
        for (TierRule rule : rules) {
            if (rule.matches(domain)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    private void adjustScoresWithContext(DimensionScores scores, ScoringContext context) {
        String content = context.content();
        if (content == null || content.isBlank()) {
            return;
        }

        // freshness from the most recent year mentioned
        int latestYear = latestYearMentioned(content);
        if (latestYear > 0) {
            int currentYear = Instant.ofEpochMilli(clock.millis()).atZone(ZoneOffset.UTC).getYear();
            int yearsOld = Math.max(0, currentYear - latestYear);
            scores.setFreshness(Math.max(0, 1 - yearsOld * FRESHNESS_DECAY_PER_YEAR));
        }

        int wordCount = content.trim().split("\\s+").length;
        if (wordCount > 500) {
            scores.setSpecificity(Math.min(1, scores.getSpecificity() + 0.1));
        }
        if (wordCount < 100) {
            scores.setSpecificity(Math.max(0, scores.getSpecificity() - 0.2));
        }
    }

    private static int latestYearMentioned(String content) {
        int latest = 0;
        for (Pattern pattern : DATE_PATTERNS) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                latest = Math.max(latest, Integer.parseInt(matcher.group(1)));
            }
        }
        return latest;
    }

    // ============================================
    // Visit outcomes and cross-source agreement
    // ============================================

    public Optional<SourceIntelligence> getSourceIntelligence(String domain) {
        SourceIntelligence intel = sourceIntelligence.get(UrlNormalizer.normalizeDomain(domain));
        return Optional.ofNullable(intel).map(SourceIntelligence::copy);
    }

    /**
     * Fold one visit into the domain's success rate, extraction yield, URL patterns and blocked paths.
     */
    public void updateSourceIntelligence(String domain, VisitOutcome outcome) {
        String normalized = UrlNormalizer.normalizeDomain(domain);
        double alpha = settings.getSmoothingAlpha();
        long now = clock.millis();

        SourceIntelligence existing = sourceIntelligence.get(normalized);
        SourceIntelligence intel = existing != null ? existing.copy() : SourceIntelligence.builder()
                .domain(normalized)
                .score(scoreDomain(normalized))
                .successRate(1)
                .avgExtractionYield(0)
                .build();

        intel.setSuccessRate(alpha * (outcome.success() ? 1 : 0) + (1 - alpha) * intel.getSuccessRate());
        intel.setAvgExtractionYield(alpha * outcome.extractionYield() + (1 - alpha) * intel.getAvgExtractionYield());
        intel.setLastVisit(now);

        if (outcome.patterns() != null) {
            for (UrlPattern pattern : outcome.patterns()) {
                UrlPattern known = intel.getKnownPatterns().stream()
                        .filter(p -> p.getPattern().equals(pattern.getPattern()))
                        .findFirst()
                        .orElse(null);
                if (known != null) {
                    known.setReliability(alpha * pattern.getReliability() + (1 - alpha) * known.getReliability());
                    known.setLastVerified(now);
                } else {
                    intel.getKnownPatterns().add(pattern.copy());
                }
            }
        }

        if (outcome.blockedPaths() != null && !outcome.blockedPaths().isEmpty()) {
            Set<String> blocked = new LinkedHashSet<>(intel.getBlockedPaths());
            blocked.addAll(outcome.blockedPaths());
            intel.setBlockedPaths(new ArrayList<>(blocked));
        }

        DomainScore latest = domainScores.get(normalized);
        if (latest != null) {
            intel.setScore(latest.copy());
        }
        sourceIntelligence.put(normalized, intel);

        if (intel.getSuccessRate() < settings.getAvoidSuccessRate()) {
            log.warn("Domain {} success rate fell to {}, avoiding", normalized,
                    String.format("%.2f", intel.getSuccessRate()));
        }
    }

    /**
     * Pairwise agreement between domains that reported a value for the same question.
     * Each pair moves toward 1 on agreement and 0 on disagreement; a domain's consistency
     * becomes the mean of its row.
     */
    public synchronized void updateConsistency(List<DomainObservation> observations) {
        double alpha = settings.getConsistencyAlpha();
        for (int i = 0; i < observations.size(); i++) {
            for (int j = i + 1; j < observations.size(); j++) {
                String d1 = UrlNormalizer.normalizeDomain(observations.get(i).domain());
                String d2 = UrlNormalizer.normalizeDomain(observations.get(j).domain());
                if (d1.equals(d2)) {
                    continue;
                }
                boolean agree = observations.get(i).value().equals(observations.get(j).value());
                double update = agree ? 1 : 0;

                Map<String, Double> row1 = consistencyMatrix.computeIfAbsent(d1, k -> new HashMap<>());
                Map<String, Double> row2 = consistencyMatrix.computeIfAbsent(d2, k -> new HashMap<>());
                double current1 = row1.getOrDefault(d2, NEUTRAL);
                double current2 = row2.getOrDefault(d1, NEUTRAL);
                row1.put(d2, alpha * update + (1 - alpha) * current1);
                row2.put(d1, alpha * update + (1 - alpha) * current2);
            }
        }

        for (Map.Entry<String, Map<String, Double>> row : consistencyMatrix.entrySet()) {
            if (row.getValue().isEmpty()) {
                continue;
            }
            double avg = row.getValue().values().stream().mapToDouble(Double::doubleValue).average().orElse(NEUTRAL);
            DomainScore score = domainScores.get(row.getKey());
            if (score != null) {
                DomainScore updated = score.copy();
                updated.getScores().setConsistency(avg);
                updated.setOverallScore(calculateOverallScore(updated.getScores()));
                domainScores.put(row.getKey(), updated);
            }
        }
    }

    /**
     * Agreement between two domains, neutral when they were never compared.
     */
    public synchronized double getPairwiseAgreement(String domain1, String domain2) {
        Map<String, Double> row = consistencyMatrix.get(UrlNormalizer.normalizeDomain(domain1));
        if (row == null) {
            return NEUTRAL;
        }
        return row.getOrDefault(UrlNormalizer.normalizeDomain(domain2), NEUTRAL);
    }

    // ============================================
    // Selection
    // ============================================

    public boolean shouldAvoid(String domain) {
        String normalized = UrlNormalizer.normalizeDomain(domain);
        if (BLOCKED_DOMAINS.contains(normalized)) {
            return true;
        }
        if (classifyDomain(normalized) == SourceTier.TIER_5) {
            return true;
        }
        SourceIntelligence intel = sourceIntelligence.get(normalized);
        return intel != null && intel.getSuccessRate() < settings.getAvoidSuccessRate();
    }

    /**
     * Drop avoided domains, then order by tier ascending and overall score descending.
     * Tier always dominates score.
     */
    public List<String> rankDomains(List<String> domains) {
        List<DomainScore> scored = new ArrayList<>();
        for (String domain : domains) {
            if (!shouldAvoid(domain)) {
                scored.add(rankingScore(UrlNormalizer.normalizeDomain(domain)));
            }
        }
        scored.sort(Comparator.comparingInt((DomainScore s) -> s.getTier().getLevel())
                .thenComparing(Comparator.comparingDouble(DomainScore::getOverallScore).reversed()));

        List<String> ranked = new ArrayList<>();
        for (DomainScore score : scored) {
            ranked.add(score.getDomain());
        }
        return ranked;
    }

    // stored score when known, otherwise a rule-based one that is not recorded as an observation
    private DomainScore rankingScore(String domain) {
        DomainScore stored = domainScores.get(domain);
        if (stored != null) {
            return stored;
        }
        DimensionScores scores = currentScores(domain);
        return DomainScore.builder()
                .domain(domain)
                .tier(classifyDomain(domain))
                .scores(scores)
                .overallScore(calculateOverallScore(scores))
                .lastUpdated(clock.millis())
                .sampleSize(0)
                .build();
    }

    public List<String> getDomainsByTier(SourceTier tier) {
        List<String> domains = new ArrayList<>();
        for (DomainScore score : domainScores.values()) {
            if (score.getTier() == tier) {
                domains.add(score.getDomain());
            }
        }
        domains.sort(Comparator.naturalOrder());
        return domains;
    }

    public List<String> getBestDomainsForCategory(String category) {
        return getBestDomainsForCategory(category, 5);
    }

    public List<String> getBestDomainsForCategory(String category, int limit) {
        List<DomainScore> candidates = new ArrayList<>();
        for (TierRule rule : rules) {
            if (rule.category().equals(category) && rule.seedDomain() != null) {
                DomainScore score = domainScores.get(rule.seedDomain());
                if (score != null) {
                    candidates.add(score);
                }
            }
        }
        return candidates.stream()
                .sorted(Comparator.comparingInt((DomainScore s) -> s.getTier().getLevel())
                        .thenComparing(Comparator.comparingDouble(DomainScore::getOverallScore).reversed()))
                .limit(limit)
                .map(DomainScore::getDomain)
                .toList();
    }

    // ============================================
    // Maintenance
    // ============================================

    /**
     * Move scores and success rates of domains untouched for {@code staleAfter} part of the way back
     * toward neutral, so old evidence stops dominating.
     *
     * @return number of domains decayed
     */
    public int decayStaleScores(Duration staleAfter, double decay) {
        long cutoff = clock.millis() - staleAfter.toMillis();
        int decayed = 0;
        for (Map.Entry<String, DomainScore> entry : domainScores.entrySet()) {
            DomainScore score = entry.getValue();
            if (score.getLastUpdated() >= cutoff) {
                continue;
            }
            DomainScore updated = score.copy();
            DimensionScores s = updated.getScores();
            s.setAuthority(towardNeutral(s.getAuthority(), decay));
            s.setOriginality(towardNeutral(s.getOriginality(), decay));
            s.setFreshness(towardNeutral(s.getFreshness(), decay));
            s.setSpecificity(towardNeutral(s.getSpecificity(), decay));
            s.setConsistency(towardNeutral(s.getConsistency(), decay));
            updated.setOverallScore(calculateOverallScore(s));
            domainScores.put(entry.getKey(), updated);
            decayed++;
        }
        for (Map.Entry<String, SourceIntelligence> entry : sourceIntelligence.entrySet()) {
            SourceIntelligence intel = entry.getValue();
            if (intel.getLastVisit() < cutoff && intel.getSuccessRate() < 1) {
                SourceIntelligence updated = intel.copy();
                updated.setSuccessRate(intel.getSuccessRate() + (1 - intel.getSuccessRate()) * decay);
                sourceIntelligence.put(entry.getKey(), updated);
            }
        }
        return decayed;
    }

    private static double towardNeutral(double value, double decay) {
        return value + (NEUTRAL - value) * decay;
    }

    // ============================================
    // Persistence
    // ============================================

    public SourceIntelligenceState exportState() {
        Map<String, DomainScore> scores = new LinkedHashMap<>();
        domainScores.forEach((domain, score) -> scores.put(domain, score.copy()));
        Map<String, SourceIntelligence> intel = new LinkedHashMap<>();
        sourceIntelligence.forEach((domain, value) -> intel.put(domain, value.copy()));
        return new SourceIntelligenceState(scores, intel);
    }

    /**
     * Validate the whole state first, then apply it. A rejected state leaves the current one untouched.
     *
     * @throws StateImportException when any entry is missing or incomplete
     */
    public void importState(SourceIntelligenceState state) {
        if (state == null) {
            return;
        }
        Map<String, DomainScore> scores = new LinkedHashMap<>();
        if (state.domainScores() != null) {
            for (Map.Entry<String, DomainScore> entry : state.domainScores().entrySet()) {
                DomainScore score = entry.getValue();
                if (score == null || score.getTier() == null || score.getScores() == null) {
                    throw new StateImportException("Domain score for '" + entry.getKey() + "' is incomplete");
                }
                scores.put(UrlNormalizer.normalizeDomain(entry.getKey()), score.copy());
            }
        }
        Map<String, SourceIntelligence> intel = new LinkedHashMap<>();
        if (state.sourceIntelligence() != null) {
            for (Map.Entry<String, SourceIntelligence> entry : state.sourceIntelligence().entrySet()) {
                if (entry.getValue() == null) {
                    throw new StateImportException("Source intelligence for '" + entry.getKey() + "' is missing");
                }
                intel.put(UrlNormalizer.normalizeDomain(entry.getKey()), entry.getValue().copy());
            }
        }

        domainScores.putAll(scores);
        sourceIntelligence.putAll(intel);
        log.info("Imported source intelligence: {} scores, {} visit profiles", scores.size(), intel.size());
    }
}
