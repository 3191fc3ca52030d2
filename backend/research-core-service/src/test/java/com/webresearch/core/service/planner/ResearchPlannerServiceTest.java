package com.webresearch.core.service.planner;

import com.webresearch.core.MutableClock;
import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.plan.ExecutionBudgets;
import com.webresearch.core.dto.plan.ExecutionPath;
import com.webresearch.core.dto.plan.ExtractionSchema;
import com.webresearch.core.dto.plan.PlanValidation;
import com.webresearch.core.dto.plan.PrimaryQuestion;
import com.webresearch.core.dto.plan.RankedDomain;
import com.webresearch.core.dto.plan.ResearchConstraints;
import com.webresearch.core.dto.plan.ResearchObjective;
import com.webresearch.core.dto.plan.ResearchPlan;
import com.webresearch.core.entity.OperatorMode;
import com.webresearch.core.entity.SourceTier;
import com.webresearch.core.service.source.SourceIntelligenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResearchPlannerService 단위 테스트
 */
class ResearchPlannerServiceTest {

    private ResearchPlannerService planner;
    private SourceIntelligenceService sourceIntelligence;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        ResearchProperties properties = new ResearchProperties();
        sourceIntelligence = new SourceIntelligenceService(properties, clock);
        planner = new ResearchPlannerService(properties, sourceIntelligence, new KeywordQuestionClassifier(), clock);
    }

    @Nested
    @DisplayName("계획 생성")
    class Generation {

        @Test
        @DisplayName("가격 질의는 pricing 질문과 스키마를 만든다")
        void pricingObjective() {
            // when
            ResearchPlan plan = planner.generatePlan(ResearchObjective.of("What is the pricing of Acme?"));

            // then
            assertThat(plan.isValid()).isTrue();
            assertThat(plan.getValidationErrors()).isEmpty();
            assertThat(plan.getMode()).isEqualTo(OperatorMode.STANDARD);
            assertThat(plan.getConfidenceThreshold()).isEqualTo(0.8);

            assertThat(plan.getPrimaryQuestions()).hasSize(1);
            PrimaryQuestion question = plan.getPrimaryQuestions().get(0);
            assertThat(question.getCategory()).isEqualTo("pricing");
            assertThat(question.getQuestion()).isEqualTo("What is the pricing structure for Acme?");
            assertThat(question.getPriority()).isEqualTo(10);
            assertThat(question.getRequiredConfidence()).isEqualTo(0.7);

            assertThat(plan.getExtractionSchemas()).extracting(ExtractionSchema::name)
                    .containsExactly("company_info", "pricing");
            assertThat(plan.getTargetDomains().get(0).domain()).isEqualTo("acme.com");
            assertThat(plan.getDomainExpectations().get(0).expectedPages())
                    .contains("https://acme.com/pricing");
        }

        @Test
        @DisplayName("실행 경로는 주 출처 조사로 시작해 교차 검증으로 끝난다")
        void executionPathShape() {
            // when
            ResearchPlan plan = planner.generatePlan(ResearchObjective.of("What is the pricing of Acme?"));

            // then
            List<ExecutionPath> paths = plan.getExecutionPaths();
            assertThat(paths.size()).isGreaterThanOrEqualTo(2);

            ExecutionPath primary = paths.get(0);
            assertThat(primary.getGoal()).isEqualTo("Primary source investigation");
            assertThat(primary.getDomainScope()).containsExactly("acme.com");
            assertThat(primary.getPriority()).isEqualTo(10);
            assertThat(primary.getBasePriority()).isEqualTo(10);

            ExecutionPath verification = paths.get(paths.size() - 1);
            assertThat(verification.getGoal()).isEqualTo("Cross-verification and contradiction detection");
            assertThat(verification.getExtractionTargets()).containsExactly("verify", "corroborate");
            assertThat(verification.getDomainScope()).hasSizeLessThanOrEqualTo(5);
            assertThat(verification.getPriority()).isEqualTo(1);
        }

        @Test
        @DisplayName("분류되지 않는 질의는 원문 그대로 하나의 질문이 된다")
        void genericObjective() {
            // when
            ResearchPlan plan = planner.generatePlan(ResearchObjective.of("Tell me about Zephyr"));

            // then
            assertThat(plan.getPrimaryQuestions()).singleElement()
                    .satisfies(q -> {
                        assertThat(q.getQuestion()).isEqualTo("Tell me about Zephyr");
                        assertThat(q.getCategory()).isNull();
                        assertThat(q.getPriority()).isEqualTo(10);
                    });
            assertThat(plan.getExtractionSchemas()).extracting(ExtractionSchema::name)
                    .containsExactly("company_info");
            assertThat(plan.getTargetDomains()).extracting(RankedDomain::domain).contains("zephyr.com");
        }

        @Test
        @DisplayName("비교·최신 문맥은 보조 질문을 추가한다")
        void contextualQuestions() {
            // given
            ResearchObjective objective = ResearchObjective.builder()
                    .query("What is the pricing of Acme?")
                    .context("compare with the latest offers")
                    .build();

            // when
            ResearchPlan plan = planner.generatePlan(objective);

            // then
            List<PrimaryQuestion> questions = plan.getPrimaryQuestions();
            assertThat(questions).extracting(PrimaryQuestion::getQuestion).containsExactly(
                    "What is the pricing structure for Acme?",
                    "How does this compare to alternatives?",
                    "What are the most recent updates or changes?");
            assertThat(questions.get(1).getRelatedQuestions()).containsExactly(questions.get(0).getId());
            assertThat(questions.get(2).getPriority()).isEqualTo(4);
        }

        @Test
        @DisplayName("질의에서 연구 대상을 추출한다")
        void extractsSubject() {
            assertThat(ResearchPlannerService.extractSubject("What is the pricing of Acme Cloud?")).isEqualTo("Acme Cloud");
            assertThat(ResearchPlannerService.extractSubject("who owns openai?")).isEqualTo("owns openai");
        }
    }

    @Nested
    @DisplayName("도메인 제약")
    class DomainConstraints {

        @Test
        @DisplayName("알려진 도메인은 최고 관련도로 맨 앞에 온다")
        void knownDomainsFirst() {
            // given
            ResearchObjective objective = ResearchObjective.builder()
                    .query("What is the pricing of Acme?")
                    .knownDomains(List.of("www.Acme.io"))
                    .build();

            // when
            ResearchPlan plan = planner.generatePlan(objective);

            // then
            RankedDomain first = plan.getTargetDomains().get(0);
            assertThat(first.domain()).isEqualTo("acme.io");
            assertThat(first.relevanceScore()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("차단 도메인과 허용되지 않은 tier는 제외된다")
        void filtersBlockedAndTiers() {
            // given
            ResearchObjective blocked = ResearchObjective.builder()
                    .query("What is the pricing of Acme?")
                    .constraints(ResearchConstraints.builder().blockedDomains(List.of("ACME.com")).build())
                    .build();
            ResearchObjective tierOne = ResearchObjective.builder()
                    .query("What is the pricing of Acme?")
                    .constraints(ResearchConstraints.builder().allowedTiers(List.of(SourceTier.TIER_1)).build())
                    .build();

            // when
            ResearchPlan blockedPlan = planner.generatePlan(blocked);
            ResearchPlan tierOnePlan = planner.generatePlan(tierOne);

            // then
            assertThat(blockedPlan.getTargetDomains()).extracting(RankedDomain::domain).doesNotContain("acme.com");
            assertThat(tierOnePlan.getTargetDomains()).extracting(RankedDomain::domain).doesNotContain("acme.com");
            assertThat(tierOnePlan.getTargetDomains())
                    .allSatisfy(d -> assertThat(sourceIntelligence.classifyDomain(d.domain())).isEqualTo(SourceTier.TIER_1));
        }
    }

    @Nested
    @DisplayName("예산")
    class Budgets {

        @Test
        @DisplayName("LIGHTNING 예산은 DEEP_RESEARCH보다 작다")
        void lightningBelowDeepResearch() {
            ExecutionBudgets lightning = ResearchPlannerService.calculateBudgets(null, OperatorMode.LIGHTNING);
            ExecutionBudgets deep = ResearchPlannerService.calculateBudgets(null, OperatorMode.DEEP_RESEARCH);

            assertThat(lightning.maxPages()).isLessThan(deep.maxPages());
            assertThat(lightning.maxTimeMs()).isLessThan(deep.maxTimeMs());
        }

        @Test
        @DisplayName("제약 조건은 모드 프리셋을 덮어쓴다")
        void constraintsOverridePreset() {
            // given
            ResearchConstraints constraints = ResearchConstraints.builder().maxPages(7).maxTimeMs(5_000L).build();

            // when
            ExecutionBudgets budgets = ResearchPlannerService.calculateBudgets(constraints, OperatorMode.STANDARD);

            // then
            assertThat(budgets.maxPages()).isEqualTo(7);
            assertThat(budgets.maxTimeMs()).isEqualTo(5_000L);
            assertThat(budgets.maxConcurrency()).isEqualTo(3);
            assertThat(budgets.marginalGainFloor()).isEqualTo(0.02);
        }

        @Test
        @DisplayName("SIMULATION 계획은 예산이 0이어도 유효하다")
        void simulationPlanIsValid() {
            // given
            ResearchObjective objective = ResearchObjective.builder()
                    .query("What is the pricing of Acme?")
                    .constraints(ResearchConstraints.builder().mode(OperatorMode.SIMULATION).build())
                    .build();

            // when
            ResearchPlan plan = planner.generatePlan(objective);

            // then
            assertThat(plan.getMode()).isEqualTo(OperatorMode.SIMULATION);
            assertThat(plan.getBudgets().maxPages()).isZero();
            assertThat(plan.isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("검증")
    class Validation {

        @Test
        @DisplayName("빈 계획은 모든 구조 오류를 보고한다")
        void emptyPlan() {
            PlanValidation validation = planner.validatePlan(ResearchPlan.builder().build());

            assertThat(validation.valid()).isFalse();
            assertThat(validation.errors()).containsExactly(
                    "No primary questions generated",
                    "No target domains identified",
                    "No execution paths generated",
                    "No execution budgets");
        }

        @Test
        @DisplayName("실행 모드에서 부족한 예산은 오류다")
        void budgetMinimums() {
            // given
            ResearchPlan plan = planner.generatePlan(ResearchObjective.of("What is the pricing of Acme?"));
            plan.setBudgets(new ExecutionBudgets(500, 0, 1, 1, 0.02));

            // when
            PlanValidation validation = planner.validatePlan(plan);

            // then
            assertThat(validation.valid()).isFalse();
            assertThat(validation.errors()).containsExactly("Page budget too low", "Time budget too low");
        }
    }

    @Nested
    @DisplayName("계획 조정")
    class Adjustment {

        private ResearchPlan plan;

        @BeforeEach
        void setUp() {
            List<PrimaryQuestion> questions = List.of(
                    PrimaryQuestion.builder().id("q1").question("Pricing?").priority(10).requiredConfidence(0.7).build(),
                    PrimaryQuestion.builder().id("q2").question("Features?").priority(5).requiredConfidence(0.7).build());
            List<ExecutionPath> paths = new ArrayList<>(List.of(
                    ExecutionPath.builder().id("a").priority(10).basePriority(10).questionIds(List.of("q1")).build(),
                    ExecutionPath.builder().id("b").priority(8).basePriority(8).questionIds(List.of("q2")).build(),
                    ExecutionPath.builder().id("verify").priority(1).basePriority(1).build()));
            plan = ResearchPlan.builder().primaryQuestions(questions).executionPaths(paths).build();
        }

        @Test
        @DisplayName("충족된 질문을 담당하는 경로는 우선순위가 5 낮아진다")
        void deprioritizesSatisfiedPaths() {
            // when
            planner.adjustPlan(plan, Map.of("q1", 0.9, "q2", 0.3));

            // then
            assertThat(plan.getExecutionPaths()).extracting(ExecutionPath::getId).containsExactly("b", "a", "verify");
            assertThat(plan.getExecutionPaths().get(1).getPriority()).isEqualTo(5);
        }

        @Test
        @DisplayName("같은 신뢰도로 반복 호출해도 결과가 같다")
        void idempotent() {
            // when
            planner.adjustPlan(plan, Map.of("q1", 0.9));
            planner.adjustPlan(plan, Map.of("q1", 0.9));

            // then
            assertThat(plan.getExecutionPaths()).extracting(ExecutionPath::getPriority).containsExactly(8, 5, 1);

            // 신뢰도가 사라지면 기본 우선순위로 돌아간다
            planner.adjustPlan(plan, Map.of());
            assertThat(plan.getExecutionPaths()).extracting(ExecutionPath::getId).containsExactly("a", "b", "verify");
        }
    }
}
