package com.webresearch.core.service.claim;

import com.webresearch.core.dto.claim.Claim;
import com.webresearch.core.dto.claim.ClaimGraphSnapshot;
import com.webresearch.core.dto.claim.ClaimGraphState;
import com.webresearch.core.dto.claim.ClaimRelationship;
import com.webresearch.core.dto.claim.ClaimSource;
import com.webresearch.core.dto.claim.ClaimStats;
import com.webresearch.core.dto.claim.ExtractionResult;
import com.webresearch.core.dto.claim.VerificationEvent;
import com.webresearch.core.entity.ClaimConfidence;
import com.webresearch.core.entity.RelationshipType;
import com.webresearch.core.entity.SourceTier;
import com.webresearch.core.entity.VerificationType;
import com.webresearch.core.exception.StateImportException;
import com.webresearch.core.util.ContentHasher;
import com.webresearch.core.util.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Claim Graph (검증 엔진)
 *
 * 추출 결과를 주장(claim)으로 정규화하고, 유사한 주장은 병합(교차 검증)하며
 * 같은 질문에 대해 상충하는 값은 모순 관계로 기록합니다.
 *
 * One instance per research session. Writes are serialized under a single write lock;
 * every claim handed out is a detached copy.
 */
@Slf4j
public class ClaimGraph {

    private static final int MIN_CORROBORATION = 2;
    private static final double CONTRADICTION_FLOOR = 0.3;

    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Claim> claims = new LinkedHashMap<>();
    private final List<ClaimRelationship> relationships = new ArrayList<>();
    private final Map<String, Set<String>> categoryIndex = new LinkedHashMap<>();

    public ClaimGraph(Clock clock) {
        this.clock = clock;
    }

    // ============================================
    // Ingestion
    // ============================================

    public Claim createClaim(ExtractionResult extraction, String sourceUrl, SourceTier tier) {
        return createClaim(extraction, sourceUrl, tier, null, null);
    }

    /**
     * Record an extraction as a claim. A structurally similar claim in the same category absorbs the
     * observation instead of a new node being created.
     *
     * @return the new or merged claim
     */
    public Claim createClaim(ExtractionResult extraction, String sourceUrl, SourceTier tier,
                             String questionId, String category) {
        long now = clock.millis();
        Map<String, Object> data = extraction.getData();

        Claim candidate = Claim.builder()
                .id(UUID.randomUUID().toString())
                .text(ClaimValues.describe(data))
                .normalizedValue(ClaimValues.normalize(data))
                .category(category != null ? category : extraction.getSchemaName())
                .questionId(questionId)
                .primarySourceTier(tier)
                .confidence(ClaimConfidence.UNCERTAIN)
                .confidenceScore(tierBaseline(tier))
                .createdAt(now)
                .lastUpdated(now)
                .build();
        candidate.getSources().add(new ClaimSource(sourceUrl, UrlNormalizer.extractDomain(sourceUrl), tier, now,
                ContentHasher.hash(String.valueOf(data))));

        lock.writeLock().lock();
        try {
            Claim existing = findSimilarClaim(candidate);
            if (existing != null) {
                mergeInto(existing, candidate, now);
                return existing.copy();
            }

            addClaim(candidate);
            checkContradictions(candidate, now);
            log.debug("New claim {} in category '{}': {}", candidate.getId(), candidate.getCategory(),
                    candidate.getText());
            return candidate.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void addClaim(Claim claim) {
        claims.put(claim.getId(), claim);
        categoryIndex.computeIfAbsent(claim.getCategory(), k -> new LinkedHashSet<>()).add(claim.getId());
        claim.setConfidence(determineConfidenceLevel(claim));
    }

    private Claim findSimilarClaim(Claim candidate) {
        Set<String> ids = categoryIndex.get(candidate.getCategory());
        if (ids == null) {
            return null;
        }
        for (String id : ids) {
            Claim existing = claims.get(id);
            if (existing != null && ClaimValues.similar(existing.getNormalizedValue(), candidate.getNormalizedValue())) {
                return existing;
            }
        }
        return null;
    }

    private void mergeInto(Claim existing, Claim candidate, long now) {
        ClaimSource source = candidate.getSources().get(0);
        boolean independent = !existing.hasSourceFromDomain(source.domain());

        existing.getSources().add(source);
        existing.setLastUpdated(now);

        if (!independent) {
            log.debug("Claim {} re-reported by {}, not counted as corroboration", existing.getId(), source.domain());
            return;
        }

        existing.setCorroborationCount(existing.getCorroborationCount() + 1);
        // 더 권위 있는 출처일 때만 승격
        if (candidate.getPrimarySourceTier().isMoreAuthoritativeThan(existing.getPrimarySourceTier())) {
            existing.setPrimarySourceTier(candidate.getPrimarySourceTier());
        }

        ClaimConfidence previous = existing.getConfidence();
        existing.setConfidenceScore(recalculateConfidence(existing));
        existing.setConfidence(determineConfidenceLevel(existing));
        existing.getVerificationHistory().add(new VerificationEvent(now, VerificationType.CORROBORATION,
                source.url(), previous, existing.getConfidence(), "Corroborated by " + source.domain()));
        log.debug("Claim {} corroborated by {} ({} -> {})", existing.getId(), source.domain(),
                previous, existing.getConfidence());
    }

    private void checkContradictions(Claim claim, long now) {
        if (claim.getQuestionId() == null) {
            return;
        }
        Set<String> ids = categoryIndex.get(claim.getCategory());
        for (String id : ids) {
            if (id.equals(claim.getId())) {
                continue;
            }
            Claim existing = claims.get(id);
            if (existing != null && claim.getQuestionId().equals(existing.getQuestionId())
                    && !ClaimValues.similar(existing.getNormalizedValue(), claim.getNormalizedValue())) {
                recordContradiction(existing, claim, now);
            }
        }
    }

    private void recordContradiction(Claim claim1, Claim claim2, long now) {
        relationships.add(new ClaimRelationship(claim1.getId(), claim2.getId(), RelationshipType.CONTRADICTS, 1.0));

        claim1.setContradictionCount(claim1.getContradictionCount() + 1);
        claim2.setContradictionCount(claim2.getContradictionCount() + 1);

        ClaimConfidence previous1 = claim1.getConfidence();
        ClaimConfidence previous2 = claim2.getConfidence();
        applyContradiction(claim1);
        applyContradiction(claim2);

        claim1.getVerificationHistory().add(new VerificationEvent(now, VerificationType.CONTRADICTION,
                firstSourceUrl(claim2), previous1, claim1.getConfidence(), "Contradicted by: " + excerpt(claim2.getText())));
        claim2.getVerificationHistory().add(new VerificationEvent(now, VerificationType.CONTRADICTION,
                firstSourceUrl(claim1), previous2, claim2.getConfidence(), "Contradicted by: " + excerpt(claim1.getText())));

        log.info("Contradiction recorded between claims {} and {} (question {})",
                claim1.getId(), claim2.getId(), claim1.getQuestionId());
    }

    private void applyContradiction(Claim claim) {
        claim.setConfidenceScore(recalculateConfidence(claim));
        claim.setConfidence(determineConfidenceLevel(claim));
        if (claim.getConfidenceScore() < CONTRADICTION_FLOOR) {
            claim.setConfidence(ClaimConfidence.CONTRADICTED);
        }
    }

    private static String firstSourceUrl(Claim claim) {
        return claim.getSources().isEmpty() ? "" : claim.getSources().get(0).url();
    }

    private static String excerpt(String text) {
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }

    // ============================================
    // Scoring
    // ============================================

    static double tierBaseline(SourceTier tier) {
        return switch (tier) {
            case TIER_1 -> 0.7;
            case TIER_2 -> 0.5;
            case TIER_3 -> 0.35;
            case TIER_4 -> 0.2;
            case TIER_5 -> 0.1;
        };
    }

    static double recalculateConfidence(Claim claim) {
        double score = tierBaseline(claim.getPrimarySourceTier());
        score += Math.min(claim.getCorroborationCount() * 0.1, 0.3);
        score += Math.min((claim.uniqueDomainCount() - 1) * 0.05, 0.15);
        score -= claim.getContradictionCount() * 0.2;
        return Math.max(0, Math.min(1, score));
    }

    static ClaimConfidence determineConfidenceLevel(Claim claim) {
        double score = claim.getConfidenceScore();
        boolean authoritative = claim.getPrimarySourceTier() == SourceTier.TIER_1
                || claim.getPrimarySourceTier() == SourceTier.TIER_2;

        if ((claim.getCorroborationCount() >= MIN_CORROBORATION || authoritative)
                && claim.getContradictionCount() == 0 && score >= 0.7) {
            return ClaimConfidence.VERIFIED;
        }
        if (claim.getContradictionCount() > 0 && score < CONTRADICTION_FLOOR) {
            return ClaimConfidence.CONTRADICTED;
        }
        if (score >= 0.7) return ClaimConfidence.HIGH;
        if (score >= 0.5) return ClaimConfidence.MEDIUM;
        if (score >= 0.25) return ClaimConfidence.LOW;
        return ClaimConfidence.UNCERTAIN;
    }

    // ============================================
    // Queries
    // ============================================

    public Optional<Claim> getClaim(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(claims.get(id)).map(Claim::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Claim> getAllClaims() {
        return select(c -> true);
    }

    public List<Claim> getClaimsByCategory(String category) {
        lock.readLock().lock();
        try {
            List<Claim> result = new ArrayList<>();
            for (String id : categoryIndex.getOrDefault(category, Set.of())) {
                Claim claim = claims.get(id);
                if (claim != null) {
                    result.add(claim.copy());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Claim> getClaimsForQuestion(String questionId) {
        return select(c -> questionId.equals(c.getQuestionId()));
    }

    public List<Claim> getVerifiedClaims() {
        return select(c -> c.getConfidence() == ClaimConfidence.VERIFIED);
    }

    /**
     * Claims that still need more sources
     */
    public List<Claim> getUnverifiedClaims() {
        return select(c -> c.getConfidence() == ClaimConfidence.UNCERTAIN || c.getConfidence() == ClaimConfidence.LOW);
    }

    public List<Claim> getContradictedClaims() {
        return select(c -> c.getConfidence() == ClaimConfidence.CONTRADICTED);
    }

    public List<ClaimRelationship> getRelationships() {
        lock.readLock().lock();
        try {
            return List.copyOf(relationships);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Claim> getBestAnswerForQuestion(String questionId) {
        return getClaimsForQuestion(questionId).stream()
                .max(Comparator.comparingDouble(Claim::getConfidenceScore));
    }

    public int size() {
        lock.readLock().lock();
        try {
            return claims.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Claim> select(Predicate<Claim> filter) {
        lock.readLock().lock();
        try {
            List<Claim> result = new ArrayList<>();
            for (Claim claim : claims.values()) {
                if (filter.test(claim)) {
                    result.add(claim.copy());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot with mean confidence overall and maximum confidence per question.
     */
    public ClaimGraphSnapshot getGraph() {
        lock.readLock().lock();
        try {
            List<Claim> all = new ArrayList<>();
            double total = 0;
            Map<String, Double> questionConfidence = new LinkedHashMap<>();
            for (Claim claim : claims.values()) {
                all.add(claim.copy());
                total += claim.getConfidenceScore();
                if (claim.getQuestionId() != null) {
                    questionConfidence.merge(claim.getQuestionId(), claim.getConfidenceScore(), Math::max);
                }
            }
            double overall = all.isEmpty() ? 0 : total / all.size();
            return new ClaimGraphSnapshot(all, List.copyOf(relationships), overall, questionConfidence);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ClaimStats getStats() {
        lock.readLock().lock();
        try {
            int verified = 0, high = 0, medium = 0, low = 0, uncertain = 0, contradicted = 0;
            double total = 0;
            for (Claim claim : claims.values()) {
                total += claim.getConfidenceScore();
                switch (claim.getConfidence()) {
                    case VERIFIED -> verified++;
                    case HIGH -> high++;
                    case MEDIUM -> medium++;
                    case LOW -> low++;
                    case UNCERTAIN -> uncertain++;
                    case CONTRADICTED -> contradicted++;
                }
            }
            int pairs = (int) relationships.stream()
                    .filter(r -> r.type() == RelationshipType.CONTRADICTS)
                    .count();
            return new ClaimStats(claims.size(), verified, high, medium, low, uncertain, contradicted,
                    claims.isEmpty() ? 0 : total / claims.size(), new ArrayList<>(categoryIndex.keySet()), pairs);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ============================================
    // Lifecycle and persistence
    // ============================================

    public void clear() {
        lock.writeLock().lock();
        try {
            claims.clear();
            relationships.clear();
            categoryIndex.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop claims not updated since the cutoff, together with their relationships.
     *
     * @return number of claims removed
     */
    public int pruneOlderThan(Instant cutoff) {
        long cutoffMillis = cutoff.toEpochMilli();
        lock.writeLock().lock();
        try {
            Set<String> removed = new HashSet<>();
            Iterator<Claim> it = claims.values().iterator();
            while (it.hasNext()) {
                Claim claim = it.next();
                if (claim.getLastUpdated() < cutoffMillis) {
                    removed.add(claim.getId());
                    it.remove();
                }
            }
            if (removed.isEmpty()) {
                return 0;
            }
            for (Set<String> ids : categoryIndex.values()) {
                ids.removeAll(removed);
            }
            categoryIndex.values().removeIf(Set::isEmpty);
            relationships.removeIf(r -> removed.contains(r.claimId1()) || removed.contains(r.claimId2()));
            return removed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ClaimGraphState exportState() {
        lock.readLock().lock();
        try {
            List<Claim> copies = new ArrayList<>();
            for (Claim claim : claims.values()) {
                copies.add(claim.copy());
            }
            return new ClaimGraphState(copies, List.copyOf(relationships));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the graph with persisted state and rebuild the category index.
     *
     * @throws StateImportException when a claim lacks an id, category, tier or confidence
     */
    public void importState(ClaimGraphState state) {
        List<Claim> incoming = state != null && state.claims() != null ? state.claims() : List.of();
        for (Claim claim : incoming) {
            if (claim == null || claim.getId() == null || claim.getCategory() == null
                    || claim.getPrimarySourceTier() == null || claim.getConfidence() == null) {
                throw new StateImportException("Claim graph state contains an incomplete claim");
            }
        }

        lock.writeLock().lock();
        try {
            claims.clear();
            relationships.clear();
            categoryIndex.clear();
            for (Claim claim : incoming) {
                Claim copy = claim.copy();
                claims.put(copy.getId(), copy);
                categoryIndex.computeIfAbsent(copy.getCategory(), k -> new LinkedHashSet<>()).add(copy.getId());
            }
            if (state != null && state.relationships() != null) {
                relationships.addAll(state.relationships());
            }
            log.info("Imported claim graph: {} claims, {} relationships", claims.size(), relationships.size());
        } finally {
            lock.writeLock().unlock();
        }
    }
}
