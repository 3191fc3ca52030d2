package com.webresearch.core.entity;

/**
 * Trust tier of a source domain. Lower level is more authoritative.
 */
public enum SourceTier {
    /**
     * Official domains, documentation, code repositories, filings
     */
    TIER_1(1),

    /**
     * First-party blogs, changelogs, professional-network and funding databases
     */
    TIER_2(2),

    /**
     * Reputable analysis, news and review sites
     */
    TIER_3(3),

    /**
     * Forums and Q&A (corroboration only)
     */
    TIER_4(4),

    /**
     * SEO/content-farm domains (actively penalized)
     */
    TIER_5(5);

    private final int level;

    SourceTier(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isMoreAuthoritativeThan(SourceTier other) {
        return other == null || this.level < other.level;
    }

    public static SourceTier fromLevel(int level) {
        for (SourceTier tier : values()) {
            if (tier.level == level) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown source tier level: " + level);
    }
}
