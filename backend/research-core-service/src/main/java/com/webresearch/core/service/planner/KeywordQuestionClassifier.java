package com.webresearch.core.service.planner;

import com.webresearch.core.entity.AnswerKind;
import com.webresearch.core.entity.SourceCategoryType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.webresearch.core.entity.SourceCategoryType.CODE;
import static com.webresearch.core.entity.SourceCategoryType.DOCS;
import static com.webresearch.core.entity.SourceCategoryType.FILINGS;
import static com.webresearch.core.entity.SourceCategoryType.NEWS;
import static com.webresearch.core.entity.SourceCategoryType.OFFICIAL;
import static com.webresearch.core.entity.SourceCategoryType.REVIEWS;

/**
 * 키워드 정규식 기반 질문 분류기 (기본 구현)
 */
@Component
public class KeywordQuestionClassifier implements QuestionClassifier {

    private static final List<QuestionCategory> CATEGORIES = List.of(
            category("pricing", "pricing|cost|price|how much|subscription|plans?", AnswerKind.STRUCTURED,
                    List.of(OFFICIAL, DOCS), List.of("pricing-page", "plans-section", "pricing-table"),
                    "What is the pricing structure for %s?", "USD"),
            category("features", "features?|capabilities|what can|does it|functionality", AnswerKind.LIST,
                    List.of(OFFICIAL, DOCS), List.of("features-section", "product-page", "docs"),
                    "What are the key features and capabilities of %s?", null),
            category("technical", "tech stack|technologies|built with|framework|language", AnswerKind.LIST,
                    List.of(CODE, DOCS), List.of("github-repo", "docs", "blog"),
                    "What technologies and frameworks does %s use?", null),
            category("company_history", "founded|started|when was|history|origin", AnswerKind.DATE,
                    List.of(OFFICIAL, NEWS, FILINGS), List.of("about-page", "press", "crunchbase"),
                    "When was %s founded and what is its history?", null),
            category("company_size", "employees?|team size|headcount|how many people", AnswerKind.NUMBER,
                    List.of(OFFICIAL, FILINGS, NEWS), List.of("about-page", "linkedin", "crunchbase"),
                    "How many employees does %s have?", "employees"),
            category("security", "security|compliance|soc|gdpr|hipaa|certifications?", AnswerKind.STRUCTURED,
                    List.of(OFFICIAL, DOCS), List.of("security-page", "trust-center", "compliance"),
                    "What security certifications and compliance does %s have?", null),
            category("integrations", "integrate|integration|api|connect|webhook", AnswerKind.LIST,
                    List.of(DOCS, OFFICIAL), List.of("integrations-page", "api-docs", "marketplace"),
                    "What integrations and APIs does %s offer?", null),
            category("competitive", "competitors?|alternatives?|vs|compared to|similar", AnswerKind.LIST,
                    List.of(REVIEWS, NEWS), List.of("comparison-sites", "reviews", "g2"),
                    "What are the main competitors and alternatives to %s?", null),
            category("funding", "funding|investors?|raised|valuation|series", AnswerKind.STRUCTURED,
                    List.of(FILINGS, NEWS), List.of("crunchbase", "press-releases", "techcrunch"),
                    "What is the funding history and investors of %s?", "USD"),
            category("contact", "contact|email|phone|address|headquarters|location", AnswerKind.STRUCTURED,
                    List.of(OFFICIAL), List.of("contact-page", "about-page", "footer"),
                    "What are the contact details for %s?", null)
    );

    private static QuestionCategory category(String name, String keywords, AnswerKind kind,
                                             List<SourceCategoryType> sources, List<String> hints,
                                             String template, String unit) {
        return new QuestionCategory(name, Pattern.compile("(?:" + keywords + ")", Pattern.CASE_INSENSITIVE),
                kind, sources, hints, template, unit);
    }

    @Override
    public List<QuestionCategory> classify(String text) {
        List<QuestionCategory> matched = new ArrayList<>();
        for (QuestionCategory category : CATEGORIES) {
            if (category.matches(text)) {
                matched.add(category);
            }
        }
        return matched;
    }

    @Override
    public Optional<QuestionCategory> findByName(String name) {
        return CATEGORIES.stream().filter(c -> c.name().equals(name)).findFirst();
    }
}
