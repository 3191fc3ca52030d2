package com.webresearch.core.service.source;

import com.webresearch.core.entity.SourceTier;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Static domain classification rule.
 *
 * @param seedDomain concrete domain scored at startup, null for suffix/prefix rules
 */
record TierRule(
        Pattern pattern,
        SourceTier tier,
        String category,
        double authority,
        double originality,
        double specificity,
        String seedDomain
) {

    static final List<TierRule> DEFAULT_RULES = List.of(
            // Tier 1: official domains, docs, repos, filings
            rule("github\\.com$", SourceTier.TIER_1, "code", 0.95, 0.95, 0.9, "github.com"),
            rule("gitlab\\.com$", SourceTier.TIER_1, "code", 0.9, 0.95, 0.9, "gitlab.com"),
            rule("\\.gov$", SourceTier.TIER_1, "official", 1.0, 0.95, 0.8, null),
            rule("sec\\.gov$", SourceTier.TIER_1, "filings", 1.0, 1.0, 0.95, "sec.gov"),
            rule("docs\\.", SourceTier.TIER_1, "docs", 0.9, 0.9, 0.95, null),
            rule("developer\\.", SourceTier.TIER_1, "docs", 0.9, 0.9, 0.9, null),

            // Tier 2: first-party blogs, company and funding databases
            rule("blog\\.", SourceTier.TIER_2, "blog", 0.8, 0.9, 0.7, null),
            rule("crunchbase\\.com$", SourceTier.TIER_2, "company_info", 0.85, 0.7, 0.9, "crunchbase.com"),
            rule("linkedin\\.com$", SourceTier.TIER_2, "company_info", 0.8, 0.75, 0.8, "linkedin.com"),
            rule("pitchbook\\.com$", SourceTier.TIER_2, "funding", 0.9, 0.8, 0.9, "pitchbook.com"),

            // Tier 3: reputable analysis, news, reviews
            rule("techcrunch\\.com$", SourceTier.TIER_3, "news", 0.75, 0.7, 0.6, "techcrunch.com"),
            rule("bloomberg\\.com$", SourceTier.TIER_3, "news", 0.85, 0.75, 0.7, "bloomberg.com"),
            rule("reuters\\.com$", SourceTier.TIER_3, "news", 0.9, 0.8, 0.7, "reuters.com"),
            rule("wsj\\.com$", SourceTier.TIER_3, "news", 0.9, 0.75, 0.7, "wsj.com"),
            rule("g2\\.com$", SourceTier.TIER_3, "reviews", 0.7, 0.65, 0.8, "g2.com"),
            rule("capterra\\.com$", SourceTier.TIER_3, "reviews", 0.7, 0.6, 0.75, "capterra.com"),
            rule("trustradius\\.com$", SourceTier.TIER_3, "reviews", 0.7, 0.65, 0.75, "trustradius.com"),

            // Tier 4: forums and Q&A
            rule("reddit\\.com$", SourceTier.TIER_4, "forum", 0.4, 0.8, 0.5, "reddit.com"),
            rule("quora\\.com$", SourceTier.TIER_4, "forum", 0.35, 0.6, 0.4, "quora.com"),
            rule("stackexchange\\.com$", SourceTier.TIER_4, "forum", 0.6, 0.7, 0.7, "stackexchange.com"),
            rule("stackoverflow\\.com$", SourceTier.TIER_4, "forum", 0.65, 0.7, 0.75, "stackoverflow.com"),
            rule("ycombinator\\.com$", SourceTier.TIER_4, "forum", 0.55, 0.8, 0.6, "ycombinator.com"),

            // Tier 5: SEO/junk
            rule("medium\\.com$", SourceTier.TIER_5, "blog", 0.3, 0.4, 0.3, "medium.com"),
            rule("\\.blogspot\\.", SourceTier.TIER_5, "blog", 0.2, 0.3, 0.2, null),
            rule("wordpress\\.com$", SourceTier.TIER_5, "blog", 0.25, 0.35, 0.25, "wordpress.com"),
            rule("hubspot\\.com$", SourceTier.TIER_5, "seo", 0.3, 0.2, 0.3, "hubspot.com")
    );

    boolean matches(String domain) {
        return pattern.matcher(domain).find();
    }

    private static TierRule rule(String regex, SourceTier tier, String category,
                                 double authority, double originality, double specificity, String seed) {
        return new TierRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), tier, category,
                authority, originality, specificity, seed);
    }
}
