package com.webresearch.core.service;

import com.webresearch.core.client.BrowserDriver;
import com.webresearch.core.client.BrowserPage;
import com.webresearch.core.client.NavigationResult;
import com.webresearch.core.client.PageContent;
import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.claim.Claim;
import com.webresearch.core.dto.claim.ClaimStats;
import com.webresearch.core.dto.claim.ExtractionResult;
import com.webresearch.core.dto.claim.VerificationEvent;
import com.webresearch.core.dto.plan.DomainExpectation;
import com.webresearch.core.dto.plan.ExecutionPath;
import com.webresearch.core.dto.plan.ExtractionSchema;
import com.webresearch.core.dto.plan.PrimaryQuestion;
import com.webresearch.core.dto.plan.ResearchObjective;
import com.webresearch.core.dto.plan.ResearchPlan;
import com.webresearch.core.dto.research.ExecutionStats;
import com.webresearch.core.dto.research.ResearchAnswer;
import com.webresearch.core.dto.research.ResearchResult;
import com.webresearch.core.dto.source.DomainObservation;
import com.webresearch.core.dto.source.ScoringContext;
import com.webresearch.core.dto.source.VisitOutcome;
import com.webresearch.core.dto.telemetry.ProgressState;
import com.webresearch.core.dto.telemetry.StopCondition;
import com.webresearch.core.dto.telemetry.TelemetryEvent;
import com.webresearch.core.entity.ClaimConfidence;
import com.webresearch.core.entity.ExecutionStatus;
import com.webresearch.core.entity.OperatorMode;
import com.webresearch.core.entity.PathStatus;
import com.webresearch.core.entity.SourceTier;
import com.webresearch.core.entity.StopReason;
import com.webresearch.core.entity.VerificationType;
import com.webresearch.core.exception.InvalidPlanException;
import com.webresearch.core.exception.ResearchEngineException;
import com.webresearch.core.exception.SessionNotFoundException;
import com.webresearch.core.service.cache.ResearchCacheManager;
import com.webresearch.core.service.claim.ClaimGraph;
import com.webresearch.core.service.confidence.ConfidenceTracker;
import com.webresearch.core.service.extraction.ConfidenceRuleEvaluator;
import com.webresearch.core.service.planner.ResearchPlannerService;
import com.webresearch.core.service.source.SourceIntelligenceService;
import com.webresearch.core.service.telemetry.TelemetryEngine;
import com.webresearch.core.service.telemetry.TelemetryEngineFactory;
import com.webresearch.core.util.UrlNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Research Orchestration Service
 *
 * 계획 생성 후 실행 경로를 병렬로 돌리면서 페이지 방문 결과를 캐시, 소스 인텔리전스,
 * 클레임 그래프, 신뢰도 추적기에 반영하고 정지 조건을 판단합니다.
 *
 * Pause and stop are signals: paths check them between page visits.
 */
@Service
@Slf4j
public class ResearchOrchestrationService {

    private static final Map<String, Set<String>> SCHEMA_QUESTION_CATEGORIES = Map.of(
            "pricing", Set.of("pricing"),
            "features", Set.of("features"),
            "technical", Set.of("technical", "integrations"),
            "security", Set.of("security"),
            "company_info", Set.of("company_history", "company_size", "contact", "funding")
    );

    private final ResearchProperties properties;
    private final ResearchPlannerService planner;
    private final SourceIntelligenceService sourceIntelligence;
    private final ResearchCacheManager cacheManager;
    private final TelemetryEngineFactory telemetryFactory;
    private final ConfidenceRuleEvaluator ruleEvaluator;
    private final Executor pathExecutor;
    private final Clock clock;

    private final Counter sessionsStarted;
    private final Counter sessionsFailed;

    private final Map<String, ResearchSession> sessions = new ConcurrentHashMap<>();

    public ResearchOrchestrationService(ResearchProperties properties,
                                        ResearchPlannerService planner,
                                        SourceIntelligenceService sourceIntelligence,
                                        ResearchCacheManager cacheManager,
                                        TelemetryEngineFactory telemetryFactory,
                                        ConfidenceRuleEvaluator ruleEvaluator,
                                        @Qualifier("researchPathExecutor") Executor pathExecutor,
                                        Clock clock,
                                        MeterRegistry meterRegistry) {
        this.properties = properties;
        this.planner = planner;
        this.sourceIntelligence = sourceIntelligence;
        this.cacheManager = cacheManager;
        this.telemetryFactory = telemetryFactory;
        this.ruleEvaluator = ruleEvaluator;
        this.pathExecutor = pathExecutor;
        this.clock = clock;
        this.sessionsStarted = Counter.builder("research.sessions.started")
                .description("Research sessions started")
                .register(meterRegistry);
        this.sessionsFailed = Counter.builder("research.sessions.failed")
                .description("Research sessions that ended in FAILED")
                .register(meterRegistry);
    }

    // ============================================
    // Research run
    // ============================================

    /**
     * Plan and execute an objective, blocking until every path has finished or observed a stop.
     *
     * @throws InvalidPlanException when the generated plan fails validation
     */
    public ResearchResult research(ResearchObjective objective, BrowserDriver driver) {
        String sessionId = UUID.randomUUID().toString();
        TelemetryEngine telemetry = telemetryFactory.create(sessionId);
        ResearchSession session = new ResearchSession(sessionId, objective, telemetry,
                new ClaimGraph(clock), clock.millis());
        sessions.put(sessionId, session);
        sessionsStarted.increment();

        telemetry.start("Generating research plan...");
        try {
            ResearchPlan plan = planner.generatePlan(objective);
            if (!plan.isValid()) {
                InvalidPlanException invalid = new InvalidPlanException(sessionId, plan.getValidationErrors());
                session.attachPlan(plan, null);
                telemetry.fail(invalid);
                sessionsFailed.increment();
                throw invalid;
            }

            ConfidenceTracker confidence = new ConfidenceTracker(plan.getBudgets(), clock);
            confidence.initialize(plan.getPrimaryQuestions());
            planner.adjustPlan(plan, Map.of());
            session.attachPlan(plan, confidence);

            if (plan.getMode() == OperatorMode.SIMULATION) {
                telemetry.complete(confidence.forceStop(StopReason.BUDGET_EXHAUSTED, "Simulation mode: plan only"));
                return buildResult(session);
            }

            // a stop during planning keeps its end state
            if (!telemetry.isStopped()) {
                telemetry.updateStatus(ExecutionStatus.EXECUTING);
                telemetry.recordStrategyShift("Plan ready", "planning", "executing", Map.of(
                        "totalPaths", plan.getExecutionPaths().size(),
                        "targetDomains", plan.getTargetDomains().size()));
            }

            executeResearch(session, driver);

            if (!telemetry.isStopped()) {
                telemetry.complete(confidence.checkStopCondition(plan.getConfidenceThreshold())
                        .orElseGet(() -> confidence.forceStop(StopReason.MARGINAL_GAIN_LOW, "All execution paths exhausted")));
            }
            return buildResult(session);
        } catch (InvalidPlanException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Research session {} failed: {}", sessionId, e.getMessage(), e);
            telemetry.fail(e);
            sessionsFailed.increment();
            if (e instanceof ResearchEngineException) {
                throw e;
            }
            throw new ResearchEngineException("RESEARCH_FAILED", "Research failed: " + e.getMessage(), sessionId, e);
        } finally {
            session.markFinished(clock.millis());
            telemetry.close();
        }
    }

    private void executeResearch(ResearchSession session, BrowserDriver driver) {
        ResearchPlan plan = session.getPlan();
        TelemetryEngine telemetry = session.getTelemetry();
        ConfidenceTracker confidence = session.getConfidence();
        int maxConcurrent = Math.max(1, Math.min(plan.getBudgets().maxConcurrency(),
                properties.getEngine().getParallelism()));
        List<CompletableFuture<Void>> active = new ArrayList<>();

        while (true) {
            if (telemetry.hasPendingStop()) {
                log.info("Stop observed for session {}, waiting for {} active path(s)", session.getId(), active.size());
                break;
            }
            var stopCondition = confidence.checkStopCondition(plan.getConfidenceThreshold());
            if (stopCondition.isPresent()) {
                telemetry.complete(stopCondition.get());
                break;
            }

            active.removeIf(CompletableFuture::isDone);
            while (active.size() < maxConcurrent && !telemetry.isPaused()) {
                ExecutionPath next = session.nextPendingPath();
                if (next == null) {
                    break;
                }
                active.add(CompletableFuture.runAsync(() -> executePath(session, next, driver), pathExecutor));
            }
            telemetry.updateActivePaths(active.size());

            if (active.isEmpty() && !session.hasPendingPaths()) {
                break;
            }
            awaitAny(active);
            telemetry.updateConfidence(confidence.getOverallConfidence(),
                    confidence.estimateTimeToThreshold(plan.getConfidenceThreshold()).orElse(null));
        }

        CompletableFuture.allOf(active.toArray(new CompletableFuture[0])).exceptionally(e -> null).join();
        telemetry.updateActivePaths(0);
    }

    private void awaitAny(List<CompletableFuture<Void>> active) {
        long pollMs = properties.getEngine().getPausePollInterval().toMillis();
        if (active.isEmpty()) {
            CompletableFuture.runAsync(() -> { }, CompletableFuture.delayedExecutor(pollMs, TimeUnit.MILLISECONDS)).join();
            return;
        }
        CompletableFuture.anyOf(active.toArray(new CompletableFuture[0]))
                .completeOnTimeout(null, pollMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> null)
                .join();
    }

    /**
     * Visit the path's URLs in order, checking pause, stop and budgets before each page.
     */
    private void executePath(ResearchSession session, ExecutionPath path, BrowserDriver driver) {
        TelemetryEngine telemetry = session.getTelemetry();
        ConfidenceTracker confidence = session.getConfidence();
        ResearchPlan plan = session.getPlan();
        PathStatus finalStatus = PathStatus.COMPLETED;
        String reason = "completed";
        int pages = 0;
        int claims = 0;

        try (BrowserPage page = driver.openPage(path)) {
            for (String url : urlsForPath(path, plan)) {
                if (!awaitWhilePaused(telemetry)) {
                    finalStatus = PathStatus.TERMINATED;
                    reason = "stopped";
                    break;
                }
                if (confidence.getPagesVisited() >= plan.getBudgets().maxPages()) {
                    reason = "page budget exhausted";
                    break;
                }
                if (!session.markVisited(UrlNormalizer.normalize(url), url)) {
                    continue;
                }
                String domain = UrlNormalizer.extractDomain(url);
                if (sourceIntelligence.shouldAvoid(domain)) {
                    telemetry.recordBlocked(url, "Low-quality source", path.getId());
                    continue;
                }

                List<ExtractionResult> extractions = visit(session, page, path, url, domain);
                if (extractions == null) {
                    continue;
                }
                pages++;
                claims += ingest(session, path, url, domain, extractions);

                if (lowMarginalGain(confidence, plan)) {
                    telemetry.recordStrategyShift("Low marginal gain", "exploring", "terminating_path",
                            Map.of("pathId", path.getId(), "avgGain", confidence.getSummary().avgMarginalGain()));
                    finalStatus = PathStatus.TERMINATED;
                    reason = "low marginal gain";
                    break;
                }
            }
        } catch (RuntimeException e) {
            finalStatus = PathStatus.TERMINATED;
            reason = "error";
            telemetry.recordError(e, null, true, path.getId());
        }

        session.updatePathStatus(path, finalStatus);
        telemetry.recordPathTerminated(path.getId(), reason, pages, claims);
        log.debug("Path '{}' of session {} finished: {} ({} pages, {} claims)",
                path.getGoal(), session.getId(), reason, pages, claims);
    }

    private boolean lowMarginalGain(ConfidenceTracker confidence, ResearchPlan plan) {
        return confidence.getState().marginalGainHistory().size() >= 3
                && confidence.getSummary().avgMarginalGain() < plan.getBudgets().marginalGainFloor();
    }

    /**
     * @return false when a stop arrived while waiting
     */
    private boolean awaitWhilePaused(TelemetryEngine telemetry) {
        long pollMs = properties.getEngine().getPausePollInterval().toMillis();
        while (telemetry.isPaused() && !telemetry.hasPendingStop()) {
            CompletableFuture.runAsync(() -> { }, CompletableFuture.delayedExecutor(pollMs, TimeUnit.MILLISECONDS)).join();
        }
        return !telemetry.hasPendingStop();
    }

    private List<String> urlsForPath(ExecutionPath path, ResearchPlan plan) {
        Set<String> urls = new LinkedHashSet<>();
        for (String domain : path.getDomainScope()) {
            int before = urls.size();
            for (DomainExpectation expectation : plan.getDomainExpectations()) {
                if (expectation.domain().equals(domain)) {
                    urls.addAll(expectation.expectedPages());
                }
            }
            urls.addAll(cacheManager.getHighSignalUrls(domain));
            if (urls.size() == before) {
                urls.add("https://" + domain + "/");
            }
        }
        return new ArrayList<>(urls);
    }

    /**
     * Load one page through the cache. Failed navigation is recorded and yields null.
     */
    private List<ExtractionResult> visit(ResearchSession session, BrowserPage page, ExecutionPath path,
                                         String url, String domain) {
        TelemetryEngine telemetry = session.getTelemetry();
        var cached = cacheManager.getExtractions(url);
        if (cached.isPresent()) {
            session.getCacheHits().incrementAndGet();
            telemetry.recordPageLoad(url, true, 0, path.getId());
            return cached.get();
        }
        session.getCacheMisses().incrementAndGet();

        long started = System.nanoTime();
        NavigationResult navigation = page.navigate(url);
        long loadTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        telemetry.recordPageLoad(url, navigation.success(), loadTimeMs, path.getId());

        if (!navigation.success()) {
            sourceIntelligence.updateSourceIntelligence(domain, VisitOutcome.failure(url));
            telemetry.recordError(navigation.error() != null ? navigation.error() : "Navigation failed",
                    url, true, path.getId());
            return null;
        }

        PageContent content = page.content();
        List<String> schemaNames = session.getPlan().getExtractionSchemas().stream()
                .map(ExtractionSchema::name)
                .toList();
        List<ExtractionResult> extractions = page.extract(schemaNames);

        cacheManager.setPage(url, content.html(), content.text());
        cacheManager.setExtractions(url, extractions);
        if (!extractions.isEmpty()) {
            cacheManager.updateDomainMap(domain, List.of(url), null);
        }
        sourceIntelligence.scoreDomain(domain, ScoringContext.ofContent(url, content.text()));
        sourceIntelligence.updateSourceIntelligence(domain, VisitOutcome.success(url, extractions.size()));
        return extractions;
    }

    /**
     * Turn a page's extractions into claims and fold them into confidence.
     *
     * @return number of claims recorded
     */
    private int ingest(ResearchSession session, ExecutionPath path, String url, String domain,
                       List<ExtractionResult> extractions) {
        TelemetryEngine telemetry = session.getTelemetry();
        ClaimGraph graph = session.getClaimGraph();
        ConfidenceTracker confidence = session.getConfidence();
        ResearchPlan plan = session.getPlan();
        SourceTier tier = sourceIntelligence.classifyDomain(domain);
        double minConfidence = properties.getEngine().getMinExtractionConfidence();

        Map<String, ExtractionSchema> schemas = new HashMap<>();
        for (ExtractionSchema schema : plan.getExtractionSchemas()) {
            schemas.put(schema.name(), schema);
        }

        int recorded = 0;
        Set<String> touchedQuestions = new LinkedHashSet<>();
        for (ExtractionResult extraction : extractions) {
            telemetry.recordExtraction(url, extraction.getSchemaName(), extraction.getData().size(), path.getId());

            ExtractionSchema schema = schemas.get(extraction.getSchemaName());
            double score = schema != null
                    ? ruleEvaluator.apply(extraction.getConfidence(), extraction.getData(), schema.confidenceRules())
                    : extraction.getConfidence();
            if (score < minConfidence) {
                log.debug("Ignoring {} extraction from {} (confidence {})", extraction.getSchemaName(), url, score);
                continue;
            }

            String questionId = matchQuestion(plan, extraction.getSchemaName());
            Claim claim = graph.createClaim(extraction.toBuilder().confidence(score).build(), url, tier,
                    questionId, extraction.getSchemaName());
            recorded++;
            if (questionId != null) {
                touchedQuestions.add(questionId);
            }
            telemetry.recordClaimFound(claim.getId(), claim.getCategory(), claim.getConfidenceScore(), url, path.getId());
            reportVerification(telemetry, confidence, claim, url);
        }

        for (String questionId : touchedQuestions) {
            sourceIntelligence.updateConsistency(observationsFor(graph.getClaimsForQuestion(questionId)));
        }

        confidence.update(graph.getAllClaims(), "visited:" + url);
        telemetry.updateConfidence(confidence.getOverallConfidence(),
                confidence.estimateTimeToThreshold(plan.getConfidenceThreshold()).orElse(null));
        if (!telemetry.isStopped()) {
            synchronized (session) {
                planner.adjustPlan(plan, confidence.getState().perQuestion());
            }
        }
        return recorded;
    }

    private void reportVerification(TelemetryEngine telemetry, ConfidenceTracker confidence, Claim claim, String url) {
        List<VerificationEvent> history = claim.getVerificationHistory();
        if (claim.getSources().size() > 1) {
            VerificationEvent last = history.isEmpty() ? null : history.get(history.size() - 1);
            if (last != null && last.type() == VerificationType.CORROBORATION && url.equals(last.sourceUrl())) {
                telemetry.recordVerification(claim.getId(), VerificationType.CORROBORATION, claim.getConfidenceScore(), url);
            }
            return;
        }
        for (VerificationEvent event : history) {
            if (event.type() == VerificationType.CONTRADICTION) {
                telemetry.recordVerification(claim.getId(), VerificationType.CONTRADICTION, claim.getConfidenceScore(), url);
                confidence.handleContradiction(claim.getId());
            }
        }
    }

    /**
     * Domains backing the same claim agree with each other and disagree with domains backing rival claims.
     */
    private static List<DomainObservation> observationsFor(List<Claim> claims) {
        List<DomainObservation> observations = new ArrayList<>();
        for (Claim claim : claims) {
            Set<String> domains = new LinkedHashSet<>();
            claim.getSources().forEach(s -> domains.add(s.domain()));
            for (String domain : domains) {
                observations.add(new DomainObservation(domain, claim.getId()));
            }
        }
        return observations;
    }

    /**
     * Question served by the schema's category, otherwise the top-priority question.
     */
    static String matchQuestion(ResearchPlan plan, String schemaName) {
        Set<String> categories = SCHEMA_QUESTION_CATEGORIES.getOrDefault(schemaName, Set.of(schemaName));
        PrimaryQuestion top = null;
        for (PrimaryQuestion question : plan.getPrimaryQuestions()) {
            if (question.getCategory() != null && categories.contains(question.getCategory())) {
                return question.getId();
            }
            if (top == null || question.getPriority() > top.getPriority()) {
                top = question;
            }
        }
        return top != null ? top.getId() : null;
    }

    // ============================================
    // Result
    // ============================================

    private ResearchResult buildResult(ResearchSession session) {
        ResearchPlan plan = session.getPlan();
        ClaimGraph graph = session.getClaimGraph();
        ConfidenceTracker confidence = session.getConfidence();
        TelemetryEngine telemetry = session.getTelemetry();

        List<ResearchAnswer> answers = new ArrayList<>();
        for (PrimaryQuestion question : plan.getPrimaryQuestions()) {
            answers.add(graph.getBestAnswerForQuestion(question.getId())
                    .map(best -> new ResearchAnswer(question.getId(), question.getQuestion(),
                            best.getNormalizedValue(), best.getConfidence(), best.getConfidenceScore(),
                            best.getSources(), "Based on " + best.getSources().size() + " source(s) with "
                            + best.getCorroborationCount() + " corroboration(s)"))
                    .orElseGet(() -> new ResearchAnswer(question.getId(), question.getQuestion(), null,
                            ClaimConfidence.UNCERTAIN, 0, List.of(), "No data found")));
        }

        ClaimStats claimStats = graph.getStats();
        int pages = confidence.getPagesVisited();
        double overall = confidence.getOverallConfidence();
        ExecutionStats stats = ExecutionStats.builder()
                .totalTimeMs(clock.millis() - session.getStartTime())
                .pagesVisited(pages)
                .claimsFound(claimStats.totalClaims())
                .claimsVerified(claimStats.verified() + claimStats.high())
                .contradictionsFound(claimStats.contradictionPairs())
                .cacheHits(session.getCacheHits().get())
                .cacheMisses(session.getCacheMisses().get())
                .pathsExecuted((int) session.countPaths(PathStatus.COMPLETED))
                .pathsTerminatedEarly((int) session.countPaths(PathStatus.TERMINATED))
                .avgConfidencePerPage(overall / Math.max(pages, 1))
                .build();

        return ResearchResult.builder()
                .sessionId(session.getId())
                .planId(plan.getId())
                .objective(session.getObjective().getQuery())
                .success(answers.stream().anyMatch(a -> a.confidenceScore() > 0.5))
                .answers(answers)
                .claims(graph.getAllClaims())
                .confidence(overall)
                .stats(stats)
                .visitedUrls(session.getVisitedUrls())
                .telemetry(telemetry.getEvents())
                .stopCondition(telemetry.getStopCondition()
                        .orElseGet(() -> confidence.forceStop(StopReason.USER_STOP, "Research completed")))
                .build();
    }

    // ============================================
    // Control
    // ============================================

    public void pause(String sessionId) {
        requireSession(sessionId).getTelemetry().pause();
    }

    public void resume(String sessionId) {
        requireSession(sessionId).getTelemetry().resume();
    }

    public void stop(String sessionId, String reason) {
        requireSession(sessionId).getTelemetry().stop(reason);
    }

    public ProgressState getProgress(String sessionId) {
        return requireSession(sessionId).getTelemetry().getProgress();
    }

    public Flux<ProgressState> subscribeProgress(String sessionId) {
        return requireSession(sessionId).getTelemetry().progressUpdates();
    }

    public Flux<TelemetryEvent> subscribeEvents(String sessionId) {
        return requireSession(sessionId).getTelemetry().events();
    }

    public ClaimGraph getClaimGraph(String sessionId) {
        return requireSession(sessionId).getClaimGraph();
    }

    public List<String> getActiveSessionIds() {
        List<String> ids = new ArrayList<>();
        sessions.forEach((id, session) -> {
            if (!session.isFinished()) {
                ids.add(id);
            }
        });
        return ids;
    }

    private ResearchSession requireSession(String sessionId) {
        ResearchSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    // ============================================
    // Maintenance
    // ============================================

    /**
     * Drop aged telemetry events of sessions still running.
     *
     * @return number of events removed
     */
    public int cleanupTelemetry() {
        int removed = 0;
        for (ResearchSession session : sessions.values()) {
            if (!session.isFinished()) {
                removed += session.getTelemetry().cleanup();
            }
        }
        return removed;
    }

    /**
     * Forget sessions that finished before the cutoff, releasing their claim graphs and event logs.
     *
     * @return number of sessions removed
     */
    public int evictFinishedSessions(Instant cutoff) {
        long cutoffMillis = cutoff.toEpochMilli();
        Map<String, ResearchSession> expired = new LinkedHashMap<>();
        sessions.forEach((id, session) -> {
            Long finishedAt = session.getFinishedAt();
            if (finishedAt != null && finishedAt < cutoffMillis) {
                expired.put(id, session);
            }
        });
        expired.forEach((id, session) -> {
            sessions.remove(id);
            session.getClaimGraph().clear();
            session.getTelemetry().clear();
        });
        return expired.size();
    }
}
