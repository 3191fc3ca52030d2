package com.webresearch.core.dto.claim;

import com.webresearch.core.entity.ClaimConfidence;
import com.webresearch.core.entity.SourceTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 검증 대상 주장 (claim)
 *
 * A deduplicated assertion about one normalized value for a category/question,
 * tracked with every source that reported it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Claim {
    private String id;
    private String text;
    /** Canonical comparison form of the extraction data */
    @Builder.Default
    private Map<String, Object> normalizedValue = new LinkedHashMap<>();
    private String category;
    private String questionId;

    @Builder.Default
    private List<ClaimSource> sources = new ArrayList<>();
    private SourceTier primarySourceTier;

    private int corroborationCount;
    private int contradictionCount;
    private ClaimConfidence confidence;
    private double confidenceScore;

    private long createdAt;
    private long lastUpdated;
    @Builder.Default
    private List<VerificationEvent> verificationHistory = new ArrayList<>();

    public int uniqueDomainCount() {
        Set<String> domains = new HashSet<>();
        for (ClaimSource source : sources) {
            domains.add(source.domain());
        }
        return domains.size();
    }

    public boolean hasSourceFromDomain(String domain) {
        for (ClaimSource source : sources) {
            if (source.domain().equals(domain)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Detached copy; callers never see the graph's live instance.
     */
    public Claim copy() {
        return new Claim(id, text, new LinkedHashMap<>(normalizedValue), category, questionId,
                new ArrayList<>(sources), primarySourceTier, corroborationCount, contradictionCount,
                confidence, confidenceScore, createdAt, lastUpdated, new ArrayList<>(verificationHistory));
    }
}
