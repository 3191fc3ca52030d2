package com.webresearch.core.dto.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Observed visit history of a domain
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceIntelligence {
    private String domain;
    private DomainScore score;
    @Builder.Default
    private List<UrlPattern> knownPatterns = new ArrayList<>();
    private long lastVisit;
    /** Exponential moving average of visits that loaded successfully */
    private double successRate;
    private double avgExtractionYield;
    @Builder.Default
    private List<String> blockedPaths = new ArrayList<>();

    public SourceIntelligence copy() {
        List<UrlPattern> patterns = new ArrayList<>();
        for (UrlPattern pattern : knownPatterns) {
            patterns.add(pattern.copy());
        }
        return new SourceIntelligence(domain, score != null ? score.copy() : null, patterns,
                lastVisit, successRate, avgExtractionYield, new ArrayList<>(blockedPaths));
    }
}
