package com.webresearch.core.service;

import com.webresearch.core.MutableClock;
import com.webresearch.core.client.BrowserDriver;
import com.webresearch.core.client.BrowserPage;
import com.webresearch.core.client.NavigationResult;
import com.webresearch.core.client.PageContent;
import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.claim.ExtractionResult;
import com.webresearch.core.dto.plan.ExecutionPath;
import com.webresearch.core.dto.plan.PrimaryQuestion;
import com.webresearch.core.dto.plan.ResearchConstraints;
import com.webresearch.core.dto.plan.ResearchObjective;
import com.webresearch.core.dto.plan.ResearchPlan;
import com.webresearch.core.dto.research.ResearchAnswer;
import com.webresearch.core.dto.research.ResearchResult;
import com.webresearch.core.dto.telemetry.ProgressState;
import com.webresearch.core.entity.ClaimConfidence;
import com.webresearch.core.entity.ExecutionStatus;
import com.webresearch.core.entity.OperatorMode;
import com.webresearch.core.entity.StopReason;
import com.webresearch.core.exception.InvalidPlanException;
import com.webresearch.core.exception.SessionNotFoundException;
import com.webresearch.core.service.cache.ResearchCacheManager;
import com.webresearch.core.service.extraction.ConfidenceRuleEvaluator;
import com.webresearch.core.service.planner.KeywordQuestionClassifier;
import com.webresearch.core.service.planner.ResearchPlannerService;
import com.webresearch.core.service.source.SourceIntelligenceService;
import com.webresearch.core.service.telemetry.TelemetryEngineFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * ResearchOrchestrationService 단위 테스트
 *
 * 경로는 호출 스레드에서 바로 실행되도록 직접 실행 Executor를 사용합니다.
 */
class ResearchOrchestrationServiceTest {

    private static final String PRICING_QUERY = "What is the pricing of Acme?";

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ResearchProperties properties;
    private SourceIntelligenceService sourceIntelligence;
    private ResearchOrchestrationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        properties = new ResearchProperties();
        properties.getEngine().setPausePollInterval(Duration.ofMillis(5));

        sourceIntelligence = new SourceIntelligenceService(properties, clock);
        service = newService(new ResearchPlannerService(properties, sourceIntelligence,
                new KeywordQuestionClassifier(), clock));
    }

    private ResearchOrchestrationService newService(ResearchPlannerService planner) {
        return new ResearchOrchestrationService(properties, planner, sourceIntelligence,
                new ResearchCacheManager(properties, clock, meterRegistry),
                new TelemetryEngineFactory(properties, clock, meterRegistry),
                new ConfidenceRuleEvaluator(), Runnable::run, clock, meterRegistry);
    }

    /**
     * Planner that runs the given control action on the session while its plan is being generated.
     */
    private ResearchPlannerService plannerCalling(Consumer<String> duringPlanning) {
        ResearchPlannerService planner = spy(new ResearchPlannerService(properties, sourceIntelligence,
                new KeywordQuestionClassifier(), clock));
        doAnswer(invocation -> {
            duringPlanning.accept(service.getActiveSessionIds().get(0));
            return invocation.callRealMethod();
        }).when(planner).generatePlan(any());
        return planner;
    }

    @Nested
    @DisplayName("리서치 실행")
    class Research {

        @Test
        @DisplayName("공식 사이트의 가격 정보로 질문에 답한다")
        void answersFromOfficialSite() {
            // given
            StubDriver driver = new StubDriver(url -> { });

            // when
            ResearchResult result = service.research(ResearchObjective.of(PRICING_QUERY), driver);

            // then
            assertThat(result.getSessionId()).isNotBlank();
            assertThat(result.getObjective()).isEqualTo(PRICING_QUERY);
            assertThat(result.getVisitedUrls()).contains("https://acme.com/");
            assertThat(driver.navigated.get(0)).isEqualTo("https://acme.com/");

            ResearchAnswer answer = result.getAnswers().get(0);
            assertThat(answer.answer()).containsKey("plans");
            assertThat(answer.reasoning()).startsWith("Based on ");
            assertThat(answer.sources()).isNotEmpty();

            assertThat(result.getClaims()).isNotEmpty();
            assertThat(result.getStats().getPagesVisited()).isPositive();
            assertThat(result.getStats().getClaimsFound()).isEqualTo(result.getClaims().size());
            assertThat(result.getStats().getCacheMisses()).isPositive();
            assertThat(result.getStopCondition()).isNotNull();
            assertThat(result.getTelemetry()).isNotEmpty();
            assertThat(driver.openPages).isZero();

            assertThat(service.getActiveSessionIds()).isEmpty();
            assertThat(meterRegistry.counter("research.sessions.started").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("모든 페이지 로드가 실패하면 답이 없는 결과를 반환한다")
        void allNavigationFails() {
            // given
            StubDriver driver = new StubDriver(url -> { });
            driver.failNavigation = true;

            // when
            ResearchResult result = service.research(ResearchObjective.of(PRICING_QUERY), driver);

            // then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getClaims()).isEmpty();
            assertThat(result.getAnswers()).allSatisfy(answer -> {
                assertThat(answer.reasoning()).isEqualTo("No data found");
                assertThat(answer.confidence()).isEqualTo(ClaimConfidence.UNCERTAIN);
                assertThat(answer.answer()).isNull();
            });
            assertThat(result.getStopCondition()).isNotNull();
        }

        @Test
        @DisplayName("SIMULATION 모드는 브라우저를 열지 않고 계획만 반환한다")
        void simulationReturnsPlanOnly() {
            // given
            BrowserDriver driver = mock(BrowserDriver.class);
            ResearchObjective objective = ResearchObjective.builder()
                    .query(PRICING_QUERY)
                    .constraints(ResearchConstraints.builder().mode(OperatorMode.SIMULATION).build())
                    .build();

            // when
            ResearchResult result = service.research(objective, driver);

            // then
            verifyNoInteractions(driver);
            assertThat(result.getPlanId()).isNotBlank();
            assertThat(result.getVisitedUrls()).isEmpty();
            assertThat(result.getStopCondition().reason()).isEqualTo(StopReason.BUDGET_EXHAUSTED);
            assertThat(result.getStopCondition().details()).isEqualTo("Simulation mode: plan only");
        }

        @Test
        @DisplayName("유효하지 않은 계획은 실행하지 않고 예외를 던진다")
        void invalidPlanThrows() {
            // given
            BrowserDriver driver = mock(BrowserDriver.class);
            ResearchObjective objective = ResearchObjective.builder()
                    .query(PRICING_QUERY)
                    .constraints(ResearchConstraints.builder().maxPages(0).build())
                    .build();

            // when & then
            assertThatThrownBy(() -> service.research(objective, driver))
                    .isInstanceOf(InvalidPlanException.class)
                    .satisfies(e -> {
                        InvalidPlanException invalid = (InvalidPlanException) e;
                        assertThat(invalid.getErrorCode()).isEqualTo("PLAN_INVALID");
                        assertThat(invalid.getValidationErrors()).contains("Page budget too low");
                        assertThat(invalid.getSessionId()).isNotNull();
                    });
            verifyNoInteractions(driver);
            assertThat(meterRegistry.counter("research.sessions.failed").count()).isEqualTo(1.0);
            assertThat(service.getActiveSessionIds()).isEmpty();
        }
    }

    @Nested
    @DisplayName("세션 제어")
    class Control {

        @Test
        @DisplayName("실행 중 정지하면 USER_STOP으로 끝나고 이후 페이지를 방문하지 않는다")
        void stopDuringRun() {
            // given
            StubDriver driver = new StubDriver(url -> {
                String sessionId = service.getActiveSessionIds().get(0);
                service.stop(sessionId, "Operator stop");
            });

            // when
            ResearchResult result = service.research(ResearchObjective.of(PRICING_QUERY), driver);

            // then
            assertThat(driver.navigated).hasSize(1);
            assertThat(result.getStopCondition().reason()).isEqualTo(StopReason.USER_STOP);
            assertThat(result.getStopCondition().details()).isEqualTo("Operator stop");
            assertThat(result.getStats().getPathsTerminatedEarly()).isPositive();
        }

        @Test
        @DisplayName("계획 중 정지하면 실행 단계로 넘어가지 않고 COMPLETED로 남는다")
        void stopDuringPlanningKeepsEndState() {
            // given
            service = newService(plannerCalling(sessionId -> service.stop(sessionId, "Stopped while planning")));
            StubDriver driver = new StubDriver(url -> { });

            // when
            ResearchResult result = service.research(ResearchObjective.of(PRICING_QUERY), driver);

            // then
            ProgressState progress = service.getProgress(result.getSessionId());
            assertThat(progress.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(progress.getCurrentPhase()).isNotEqualTo("executing");
            assertThat(driver.navigated).isEmpty();
            assertThat(result.getStopCondition().reason()).isEqualTo(StopReason.USER_STOP);
            assertThat(result.getStopCondition().details()).isEqualTo("Stopped while planning");
        }

        @Test
        @DisplayName("계획 중 pause는 무시되고 세션은 끝까지 실행된다")
        void pauseDuringPlanningIsIgnored() {
            // given
            service = newService(plannerCalling(sessionId -> service.pause(sessionId)));
            StubDriver driver = new StubDriver(url -> { });

            // when
            ResearchResult result = service.research(ResearchObjective.of(PRICING_QUERY), driver);

            // then
            ProgressState progress = service.getProgress(result.getSessionId());
            assertThat(progress.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(driver.navigated).isNotEmpty();
            assertThat(result.getStopCondition().reason()).isNotEqualTo(StopReason.USER_STOP);
        }

        @Test
        @DisplayName("알 수 없는 세션은 SessionNotFoundException")
        void unknownSession() {
            assertThatThrownBy(() -> service.pause("missing"))
                    .isInstanceOf(SessionNotFoundException.class)
                    .hasMessageContaining("missing");
            assertThatThrownBy(() -> service.getProgress("missing"))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("보존 기간이 지난 종료 세션은 제거된다")
        void evictsFinishedSessions() {
            // given
            ResearchResult result = service.research(ResearchObjective.of(PRICING_QUERY), new StubDriver(url -> { }));
            assertThat(service.getClaimGraph(result.getSessionId())).isNotNull();

            // when
            int beforeCutoff = service.evictFinishedSessions(clock.instant().minusSeconds(1));
            clock.advance(Duration.ofHours(1));
            int evicted = service.evictFinishedSessions(clock.instant());

            // then
            assertThat(beforeCutoff).isZero();
            assertThat(evicted).isEqualTo(1);
            assertThatThrownBy(() -> service.getProgress(result.getSessionId()))
                    .isInstanceOf(SessionNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("질문 매칭")
    class QuestionMatching {

        @Test
        @DisplayName("스키마 카테고리에 해당하는 질문을 먼저 고르고, 없으면 우선순위가 가장 높은 질문")
        void matchesBySchemaCategory() {
            // given
            ResearchPlan plan = ResearchPlan.builder()
                    .primaryQuestions(List.of(
                            PrimaryQuestion.builder().id("features").category("features").priority(10).build(),
                            PrimaryQuestion.builder().id("size").category("company_size").priority(5).build(),
                            PrimaryQuestion.builder().id("api").category("integrations").priority(5).build()))
                    .build();

            // when & then
            assertThat(ResearchOrchestrationService.matchQuestion(plan, "company_info")).isEqualTo("size");
            assertThat(ResearchOrchestrationService.matchQuestion(plan, "technical")).isEqualTo("api");
            assertThat(ResearchOrchestrationService.matchQuestion(plan, "pricing")).isEqualTo("features");
        }

        @Test
        @DisplayName("질문이 없으면 null")
        void noQuestions() {
            ResearchPlan plan = ResearchPlan.builder().primaryQuestions(List.of()).build();
            assertThat(ResearchOrchestrationService.matchQuestion(plan, "pricing")).isNull();
        }
    }

    /**
     * acme.com 페이지에서만 가격 정보를 추출하는 가짜 브라우저
     */
    private static class StubDriver implements BrowserDriver {

        private final Consumer<String> onNavigate;
        private final List<String> navigated = Collections.synchronizedList(new ArrayList<>());
        private volatile boolean failNavigation;
        private int openPages;

        StubDriver(Consumer<String> onNavigate) {
            this.onNavigate = onNavigate;
        }

        @Override
        public synchronized BrowserPage openPage(ExecutionPath path) {
            openPages++;
            return new BrowserPage() {
                private String current;

                @Override
                public NavigationResult navigate(String url) {
                    navigated.add(url);
                    onNavigate.accept(url);
                    if (failNavigation) {
                        return NavigationResult.failed(url, "net::ERR_CONNECTION_REFUSED");
                    }
                    current = url;
                    return NavigationResult.ok(url);
                }

                @Override
                public PageContent content() {
                    return new PageContent("<html><body>Acme</body></html>", "Acme pricing plans");
                }

                @Override
                public List<ExtractionResult> extract(List<String> schemaNames) {
                    if (current == null || !current.contains("acme.com") || !schemaNames.contains("pricing")) {
                        return List.of();
                    }
                    return List.of(ExtractionResult.builder()
                            .schemaName("pricing")
                            .data(Map.of("plans", List.of("Free", "Pro", "Enterprise"), "currency", "USD"))
                            .confidence(0.5)
                            .sourceUrl(current)
                            .build());
                }

                @Override
                public void close() {
                    synchronized (StubDriver.this) {
                        openPages--;
                    }
                }
            };
        }
    }
}
