package com.webresearch.core.service.planner;

import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.plan.AnswerType;
import com.webresearch.core.dto.plan.DomainExpectation;
import com.webresearch.core.dto.plan.ExecutionBudgets;
import com.webresearch.core.dto.plan.ExecutionPath;
import com.webresearch.core.dto.plan.ExtractionSchema;
import com.webresearch.core.dto.plan.PlanValidation;
import com.webresearch.core.dto.plan.PrimaryQuestion;
import com.webresearch.core.dto.plan.RankedDomain;
import com.webresearch.core.dto.plan.ResearchConstraints;
import com.webresearch.core.dto.plan.ResearchObjective;
import com.webresearch.core.dto.plan.ResearchPlan;
import com.webresearch.core.dto.plan.SourceCategory;
import com.webresearch.core.entity.AnswerKind;
import com.webresearch.core.entity.NavigationType;
import com.webresearch.core.entity.OperatorMode;
import com.webresearch.core.entity.SourceCategoryType;
import com.webresearch.core.entity.SourceTier;
import com.webresearch.core.service.source.SourceIntelligenceService;
import com.webresearch.core.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Research Planner
 *
 * 브라우징 전에 목표를 질문, 대상 도메인, 추출 스키마, 예산, 실행 경로로 분해합니다.
 * An invalid plan is returned with its validation errors and is never repaired here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResearchPlannerService {

    /** Budget presets. LIGHTNING must stay strictly below DEEP_RESEARCH in pages and time. */
    static final Map<OperatorMode, ExecutionBudgets> MODE_BUDGETS = new EnumMap<>(Map.of(
            OperatorMode.LIGHTNING, new ExecutionBudgets(30_000, 10, 5, 10, 0.05),
            OperatorMode.STANDARD, new ExecutionBudgets(120_000, 30, 3, 50, 0.02),
            OperatorMode.DEEP_RESEARCH, new ExecutionBudgets(600_000, 100, 5, 200, 0.01),
            OperatorMode.COMPLIANCE, new ExecutionBudgets(300_000, 50, 2, 100, 0.03),
            OperatorMode.SIMULATION, new ExecutionBudgets(0, 0, 0, 0, 1)
    ));

    private static final int DEPRIORITIZE_STEP = 5;
    private static final long MIN_TIME_BUDGET_MS = 1000;

    private static final Pattern LEADING_QUESTION_WORDS = Pattern.compile(
            "^(what|who|when|where|how|why|is|are|does|do|can|could|would|tell me about|find|search|look up)\\s+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CAPITALIZED_NAME = Pattern.compile("([A-Z][a-zA-Z]+(?:\\s+[A-Z][a-zA-Z]+)*)");
    private static final Pattern COMPARISON_CONTEXT = Pattern.compile("compare|versus|vs\\.|alternative", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECENCY_CONTEXT = Pattern.compile("recent|latest|new|update", Pattern.CASE_INSENSITIVE);

    private static final List<DomainTemplate> DOMAIN_TEMPLATES = List.of(
            new DomainTemplate("github\\.com", List.of("/", "/blob/main/README.md", "/releases", "/issues")),
            new DomainTemplate("docs\\.|documentation\\.", List.of("/", "/getting-started", "/api")),
            new DomainTemplate("\\.gov$", List.of("/")),
            new DomainTemplate("crunchbase\\.com", List.of("/organization/")),
            new DomainTemplate("linkedin\\.com", List.of("/company/")),
            new DomainTemplate("techcrunch|bloomberg|reuters|wsj", List.of("/")),
            new DomainTemplate("g2\\.com|capterra|trustradius", List.of("/products/")),
            new DomainTemplate("reddit\\.com|quora\\.com", List.of("/"))
    );

    private final ResearchProperties properties;
    private final SourceIntelligenceService sourceIntelligence;
    private final QuestionClassifier questionClassifier;
    private final Clock clock;

    // ============================================
    // Plan generation
    // ============================================

    public ResearchPlan generatePlan(ResearchObjective objective) {
        ResearchProperties.Planner settings = properties.getPlanner();
        String subject = extractSubject(objective.getQuery());

        List<PrimaryQuestion> questions = decompose(objective, subject);
        List<SourceCategory> sourceCategories = identifySourceCategories(questions);
        List<RankedDomain> targetDomains = rankTargetDomains(objective, subject, questions, sourceCategories);
        OperatorMode mode = resolveMode(objective);

        ResearchPlan plan = ResearchPlan.builder()
                .id(UUID.randomUUID().toString())
                .objective(objective)
                .createdAt(clock.millis())
                .primaryQuestions(questions)
                .expectedAnswerTypes(determineAnswerTypes(questions))
                .sourceCategories(sourceCategories)
                .targetDomains(targetDomains)
                .domainExpectations(setDomainExpectations(targetDomains, questions))
                .extractionSchemas(generateExtractionSchemas(questions))
                .confidenceThreshold(objective.getConfidenceRequirement() != null
                        ? objective.getConfidenceRequirement()
                        : settings.getDefaultConfidenceThreshold())
                .mode(mode)
                .budgets(calculateBudgets(objective.getConstraints(), mode))
                .executionPaths(generateExecutionPaths(targetDomains, questions, sourceCategories))
                .build();

        PlanValidation validation = validatePlan(plan);
        plan.setValid(validation.valid());
        plan.setValidationErrors(new ArrayList<>(validation.errors()));

        if (plan.isValid()) {
            log.info("Generated plan {}: mode={}, questions={}, domains={}, paths={}", plan.getId(), mode,
                    questions.size(), targetDomains.size(), plan.getExecutionPaths().size());
        } else {
            log.warn("Generated invalid plan {} for '{}': {}", plan.getId(), objective.getQuery(),
                    plan.getValidationErrors());
        }
        return plan;
    }

    private OperatorMode resolveMode(ResearchObjective objective) {
        ResearchConstraints constraints = objective.getConstraints();
        if (constraints != null && constraints.getMode() != null) {
            return constraints.getMode();
        }
        return properties.getPlanner().getDefaultMode();
    }

    private List<PrimaryQuestion> decompose(ResearchObjective objective, String subject) {
        double requiredConfidence = properties.getPlanner().getDefaultRequiredConfidence();
        List<PrimaryQuestion> questions = new ArrayList<>();

        for (QuestionCategory category : questionClassifier.classify(objective.getQuery())) {
            questions.add(PrimaryQuestion.builder()
                    .id(UUID.randomUUID().toString())
                    .question(category.questionFor(subject))
                    .category(category.name())
                    .priority(questions.isEmpty() ? 10 : 5)
                    .requiredConfidence(requiredConfidence)
                    .build());
        }

        if (questions.isEmpty()) {
            questions.add(PrimaryQuestion.builder()
                    .id(UUID.randomUUID().toString())
                    .question(objective.getQuery())
                    .priority(10)
                    .requiredConfidence(requiredConfidence)
                    .build());
        }

        String context = objective.getContext();
        if (context != null && !context.isBlank()) {
            List<String> relatedIds = questions.stream().map(PrimaryQuestion::getId).toList();
            if (COMPARISON_CONTEXT.matcher(context).find()) {
                questions.add(contextualQuestion("How does this compare to alternatives?", 3, relatedIds));
            }
            if (RECENCY_CONTEXT.matcher(context).find()) {
                questions.add(contextualQuestion("What are the most recent updates or changes?", 4, relatedIds));
            }
        }
        return questions;
    }

    private static PrimaryQuestion contextualQuestion(String text, int priority, List<String> relatedIds) {
        return PrimaryQuestion.builder()
                .id(UUID.randomUUID().toString())
                .question(text)
                .priority(priority)
                .requiredConfidence(0.6)
                .relatedQuestions(new ArrayList<>(relatedIds))
                .build();
    }

    /**
     * Research subject: leading question words and trailing '?' removed, first capitalized name preferred.
     */
    static String extractSubject(String query) {
        String cleaned = LEADING_QUESTION_WORDS.matcher(query.trim()).replaceFirst("");
        cleaned = cleaned.replaceAll("\\?$", "").trim();
        Matcher matcher = CAPITALIZED_NAME.matcher(cleaned);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return cleaned;
    }

    private List<AnswerType> determineAnswerTypes(List<PrimaryQuestion> questions) {
        List<AnswerType> answerTypes = new ArrayList<>();
        for (PrimaryQuestion question : questions) {
            QuestionCategory category = categoryOf(question);
            if (category == null) {
                answerTypes.add(new AnswerType(question.getId(), AnswerKind.STRING, null, null));
            } else {
                answerTypes.add(new AnswerType(question.getId(), category.answerKind(),
                        formatFor(category.answerKind()), category.unit()));
            }
        }
        return answerTypes;
    }

    private static String formatFor(AnswerKind kind) {
        return switch (kind) {
            case DATE -> "ISO8601";
            case NUMBER -> "decimal";
            case STRUCTURED -> "JSON";
            default -> null;
        };
    }

    private List<SourceCategory> identifySourceCategories(List<PrimaryQuestion> questions) {
        Map<SourceCategoryType, Integer> counts = new LinkedHashMap<>();
        for (PrimaryQuestion question : questions) {
            QuestionCategory category = categoryOf(question);
            if (category != null) {
                for (SourceCategoryType type : category.sourceCategories()) {
                    counts.merge(type, 1, Integer::sum);
                }
            }
        }
        // 공식 출처는 항상 포함
        counts.putIfAbsent(SourceCategoryType.OFFICIAL, 5);

        List<SourceCategory> categories = new ArrayList<>();
        counts.forEach((type, priority) -> categories.add(new SourceCategory(type, priority, Math.min(priority * 2, 10))));
        categories.sort(Comparator.comparingInt(SourceCategory::priority).reversed());
        return categories;
    }

    // ============================================
    // Target domains
    // ============================================

    private List<RankedDomain> rankTargetDomains(ResearchObjective objective, String subject,
                                                 List<PrimaryQuestion> questions,
                                                 List<SourceCategory> sourceCategories) {
        Map<String, RankedDomain> domains = new LinkedHashMap<>();
        Set<String> known = new HashSet<>();

        for (String raw : objective.getKnownDomains()) {
            String domain = UrlNormalizer.normalizeDomain(raw);
            known.add(domain);
            domains.putIfAbsent(domain, new RankedDomain(domain, SourceTier.TIER_1, 1.0,
                    List.of("primary"), List.of("https://" + domain + "/*")));
        }

        String primary = inferPrimaryDomain(subject);
        if (!primary.isEmpty()) {
            domains.putIfAbsent(primary, new RankedDomain(primary, SourceTier.TIER_1, 0.95,
                    List.of("official", "product"), List.of("https://" + primary + "/*", "https://www." + primary + "/*")));
        }

        String slug = subject.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        for (PrimaryQuestion question : questions) {
            String category = question.getCategory();
            if ("technical".equals(category)) {
                domains.putIfAbsent("github.com", new RankedDomain("github.com", SourceTier.TIER_1, 0.8,
                        List.of("code", "technical"), List.of("https://github.com/*/" + slug)));
            } else if ("funding".equals(category) || "company_history".equals(category)) {
                domains.putIfAbsent("crunchbase.com", new RankedDomain("crunchbase.com", SourceTier.TIER_2, 0.7,
                        List.of("company", "funding", "filings"), List.of("https://www.crunchbase.com/organization/" + slug)));
            } else if ("competitive".equals(category)) {
                domains.putIfAbsent("g2.com", new RankedDomain("g2.com", SourceTier.TIER_3, 0.6,
                        List.of("reviews", "competitive"), List.of("https://www.g2.com/products/" + slug)));
            }
        }

        int perCategory = properties.getPlanner().getCandidatesPerCategory();
        for (SourceCategory sourceCategory : sourceCategories) {
            SourceCategoryType type = sourceCategory.category();
            for (String candidate : sourceIntelligence.getBestDomainsForCategory(type.getRuleCategory(), perCategory)) {
                domains.putIfAbsent(candidate, new RankedDomain(candidate, sourceIntelligence.classifyDomain(candidate),
                        0.5, List.of(type.label()), List.of("https://" + candidate + "/*")));
            }
        }

        return filterAndOrder(domains, known, objective.getConstraints());
    }

    /**
     * Apply blocked-domain and allowed-tier constraints, drop avoided domains (explicitly known ones
     * are kept), then sort by relevance descending. Equal relevance keeps tier order.
     */
    private List<RankedDomain> filterAndOrder(Map<String, RankedDomain> domains, Set<String> known,
                                              ResearchConstraints constraints) {
        Set<String> blocked = new HashSet<>();
        List<SourceTier> allowedTiers = List.of();
        if (constraints != null) {
            for (String domain : constraints.getBlockedDomains()) {
                blocked.add(UrlNormalizer.normalizeDomain(domain));
            }
            allowedTiers = constraints.getAllowedTiers();
        }

        List<String> candidates = new ArrayList<>();
        for (String domain : domains.keySet()) {
            if (blocked.contains(domain)) {
                continue;
            }
            if (!allowedTiers.isEmpty() && !allowedTiers.contains(sourceIntelligence.classifyDomain(domain))) {
                continue;
            }
            candidates.add(domain);
        }

        List<String> ordered = new ArrayList<>(sourceIntelligence.rankDomains(candidates));
        for (String domain : candidates) {
            if (known.contains(domain) && !ordered.contains(domain)) {
                ordered.add(0, domain);
            }
        }

        List<RankedDomain> result = new ArrayList<>();
        for (String domain : ordered) {
            result.add(domains.get(domain));
        }
        result.sort(Comparator.comparingDouble(RankedDomain::relevanceScore).reversed());
        return result;
    }

    private static String inferPrimaryDomain(String subject) {
        String cleaned = subject.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "");
        return cleaned.isEmpty() ? "" : cleaned + ".com";
    }

    private List<DomainExpectation> setDomainExpectations(List<RankedDomain> domains, List<PrimaryQuestion> questions) {
        Set<String> targets = new LinkedHashSet<>();
        for (PrimaryQuestion question : questions) {
            QuestionCategory category = categoryOf(question);
            if (category != null) {
                targets.addAll(category.extractionHints());
            }
        }

        List<DomainExpectation> expectations = new ArrayList<>();
        for (RankedDomain ranked : domains) {
            String domain = ranked.domain();
            List<String> paths = DOMAIN_TEMPLATES.stream()
                    .filter(t -> t.pattern().matcher(domain).find())
                    .findFirst()
                    .map(DomainTemplate::commonPaths)
                    .orElse(List.of("/", "/about", "/pricing", "/features"));
            List<String> pages = paths.stream().map(p -> "https://" + domain + p).toList();
            expectations.add(new DomainExpectation(domain, pages, new ArrayList<>(targets), NavigationType.DIRECT));
        }
        return expectations;
    }

    private List<ExtractionSchema> generateExtractionSchemas(List<PrimaryQuestion> questions) {
        Set<String> detected = new HashSet<>();
        for (PrimaryQuestion question : questions) {
            if (question.getCategory() != null) {
                detected.add(question.getCategory());
            }
        }

        List<ExtractionSchema> schemas = new ArrayList<>();
        schemas.add(ExtractionSchemaCatalog.COMPANY_INFO);
        if (detected.contains("pricing")) {
            schemas.add(ExtractionSchemaCatalog.PRICING);
        }
        if (detected.contains("features")) {
            schemas.add(ExtractionSchemaCatalog.FEATURES);
        }
        if (detected.contains("technical") || detected.contains("integrations")) {
            schemas.add(ExtractionSchemaCatalog.TECHNICAL);
        }
        if (detected.contains("security")) {
            schemas.add(ExtractionSchemaCatalog.SECURITY);
        }
        return schemas;
    }

    static ExecutionBudgets calculateBudgets(ResearchConstraints constraints, OperatorMode mode) {
        ExecutionBudgets base = MODE_BUDGETS.get(mode);
        if (constraints == null) {
            return base;
        }
        return new ExecutionBudgets(
                constraints.getMaxTimeMs() != null ? constraints.getMaxTimeMs() : base.maxTimeMs(),
                constraints.getMaxPages() != null ? constraints.getMaxPages() : base.maxPages(),
                constraints.getMaxConcurrency() != null ? constraints.getMaxConcurrency() : base.maxConcurrency(),
                constraints.getMaxCostUnits() != null ? constraints.getMaxCostUnits() : base.maxCostUnits(),
                base.marginalGainFloor());
    }

    private List<ExecutionPath> generateExecutionPaths(List<RankedDomain> domains, List<PrimaryQuestion> questions,
                                                       List<SourceCategory> categories) {
        ResearchProperties.Planner settings = properties.getPlanner();
        List<ExecutionPath> paths = new ArrayList<>();
        List<String> allQuestionIds = questions.stream().map(PrimaryQuestion::getId).toList();

        if (!domains.isEmpty()) {
            paths.add(path("Primary source investigation", List.of(domains.get(0).domain()),
                    questions.stream().map(PrimaryQuestion::getQuestion).toList(), allQuestionIds, 0.5, 10));
        }

        for (SourceCategory category : categories.stream().limit(settings.getMaxCategoryPaths()).toList()) {
            String label = category.category().label();
            List<String> scope = domains.stream()
                    .filter(d -> d.expectedContent().contains(label))
                    .map(RankedDomain::domain)
                    .toList();
            if (scope.isEmpty()) {
                continue;
            }
            Set<String> targets = new LinkedHashSet<>();
            List<String> questionIds = new ArrayList<>();
            for (PrimaryQuestion question : questions) {
                QuestionCategory questionCategory = categoryOf(question);
                if (questionCategory != null && questionCategory.sourceCategories().contains(category.category())) {
                    targets.addAll(questionCategory.extractionHints());
                    questionIds.add(question.getId());
                }
            }
            paths.add(path(label + " source investigation", scope, new ArrayList<>(targets), questionIds,
                    0.2, category.priority()));
        }

        // 검증 경로는 마지막에 실행
        paths.add(path("Cross-verification and contradiction detection",
                domains.stream().limit(settings.getVerificationDomainLimit()).map(RankedDomain::domain).toList(),
                List.of("verify", "corroborate"), List.of(), 0.1, 1));
        return paths;
    }

    private static ExecutionPath path(String goal, List<String> scope, List<String> targets, List<String> questionIds,
                                      double contribution, int priority) {
        return ExecutionPath.builder()
                .id(UUID.randomUUID().toString())
                .goal(goal)
                .domainScope(new ArrayList<>(scope))
                .extractionTargets(new ArrayList<>(targets))
                .questionIds(new ArrayList<>(questionIds))
                .confidenceContribution(contribution)
                .priority(priority)
                .basePriority(priority)
                .build();
    }

    private QuestionCategory categoryOf(PrimaryQuestion question) {
        if (question.getCategory() == null) {
            return null;
        }
        return questionClassifier.findByName(question.getCategory()).orElse(null);
    }

    // ============================================
    // Validation and adjustment
    // ============================================

    /**
     * Structural check. Budget minimums do not apply to SIMULATION plans, which are never browsed.
     */
    public PlanValidation validatePlan(ResearchPlan plan) {
        List<String> errors = new ArrayList<>();
        if (plan.getPrimaryQuestions() == null || plan.getPrimaryQuestions().isEmpty()) {
            errors.add("No primary questions generated");
        }
        if (plan.getTargetDomains() == null || plan.getTargetDomains().isEmpty()) {
            errors.add("No target domains identified");
        }
        if (plan.getExecutionPaths() == null || plan.getExecutionPaths().isEmpty()) {
            errors.add("No execution paths generated");
        }
        if (plan.getBudgets() == null) {
            errors.add("No execution budgets");
        } else if (plan.getMode() != OperatorMode.SIMULATION) {
            if (plan.getBudgets().maxPages() < 1) {
                errors.add("Page budget too low");
            }
            if (plan.getBudgets().maxTimeMs() < MIN_TIME_BUDGET_MS) {
                errors.add("Time budget too low");
            }
        }
        return new PlanValidation(errors.isEmpty(), errors);
    }

    /**
     * Re-prioritize paths from live per-question confidence. A path loses 5 priority points (floor 0)
     * for each satisfied question it serves, then paths are stable-sorted by priority descending.
     * Repeated calls with the same confidence give the same order.
     */
    public ResearchPlan adjustPlan(ResearchPlan plan, Map<String, Double> questionConfidence) {
        Set<String> satisfied = new HashSet<>();
        for (PrimaryQuestion question : plan.getPrimaryQuestions()) {
            Double confidence = questionConfidence.get(question.getId());
            if (confidence != null && confidence >= question.getRequiredConfidence()) {
                satisfied.add(question.getId());
            }
        }

        for (ExecutionPath path : plan.getExecutionPaths()) {
            long served = path.getQuestionIds().stream().filter(satisfied::contains).count();
            path.setPriority((int) Math.max(0, path.getBasePriority() - DEPRIORITIZE_STEP * served));
        }
        List<ExecutionPath> sorted = new ArrayList<>(plan.getExecutionPaths());
        sorted.sort(Comparator.comparingInt(ExecutionPath::getPriority).reversed());
        plan.setExecutionPaths(sorted);
        return plan;
    }

    private record DomainTemplate(Pattern pattern, List<String> commonPaths) {
        DomainTemplate(String regex, List<String> commonPaths) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), commonPaths);
        }
    }
}
