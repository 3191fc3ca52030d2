package com.webresearch.core.service.telemetry;

import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.telemetry.ControlCommand;
import com.webresearch.core.dto.telemetry.ProgressState;
import com.webresearch.core.dto.telemetry.StopCondition;
import com.webresearch.core.dto.telemetry.TelemetryEvent;
import com.webresearch.core.dto.telemetry.TelemetryExport;
import com.webresearch.core.dto.telemetry.TelemetryStats;
import com.webresearch.core.entity.ControlCommandType;
import com.webresearch.core.entity.ExecutionStatus;
import com.webresearch.core.entity.NavigationEventType;
import com.webresearch.core.entity.StopReason;
import com.webresearch.core.entity.VerificationType;
import com.webresearch.core.exception.ResearchEngineException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Telemetry & Control Engine
 *
 * 세션 단위 이벤트 로그, 진행 상태 스냅샷, 그리고 pause/resume/stop 제어 신호를 관리합니다.
 * 제어 명령은 신호일 뿐이며, 실제 작업 중단은 실행 드라이버가 단계 사이에서 확인합니다.
 *
 * All emissions happen while holding this engine's monitor, so the sinks never see concurrent emitters.
 * Streams are live: a subscriber only sees what is emitted after it subscribes.
 */
@Slf4j
public class TelemetryEngine {

    private final String sessionId;
    private final ResearchProperties.Telemetry settings;
    private final Clock clock;
    private final Timer stopTimer;
    private final Counter errorCounter;

    private final Deque<TelemetryEvent> events = new ArrayDeque<>();
    private final List<ControlCommand> commandQueue = new ArrayList<>();
    private ProgressState progress = ProgressState.idle();
    private long startTime;
    private boolean paused;
    private boolean stopped;
    private StopCondition stopCondition;

    private final Sinks.Many<TelemetryEvent> eventSink;
    private final Sinks.Many<ProgressState> progressSink;
    private final Sinks.Many<ControlCommand> commandSink;
    private final Sinks.Many<StopCondition> stopSink;
    private final Sinks.Many<Throwable> errorSink;

    TelemetryEngine(String sessionId, ResearchProperties.Telemetry settings, Clock clock,
                    Timer stopTimer, Counter errorCounter) {
        this.sessionId = sessionId;
        this.settings = settings;
        this.clock = clock;
        this.stopTimer = stopTimer;
        this.errorCounter = errorCounter;
        this.startTime = clock.millis();
        this.eventSink = newSink();
        this.progressSink = newSink();
        this.commandSink = newSink();
        this.stopSink = newSink();
        this.errorSink = newSink();
    }

    // 구독자가 없을 때는 버리고, 느린 구독자는 개별 버퍼로 흡수
    private static <T> Sinks.Many<T> newSink() {
        return Sinks.many().multicast().directBestEffort();
    }

    private <T> Flux<T> live(Sinks.Many<T> sink) {
        return sink.asFlux().onBackpressureBuffer(settings.getSubscriberBuffer());
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Begin the session in PLANNING.
     */
    public synchronized void start(String planSummary) {
        if (stopped) {
            log.debug("Ignoring start of stopped session {}", sessionId);
            return;
        }
        startTime = clock.millis();
        progress = ProgressState.builder()
                .status(ExecutionStatus.PLANNING)
                .planSummary(planSummary)
                .currentPhase("planning")
                .build();
        publishProgress();
        recordEvent(NavigationEventType.STRATEGY_SHIFT, data("phase", "start", "planSummary", planSummary), null);
        log.info("Research session started: sessionId={}, plan={}", sessionId, planSummary);
    }

    // ============================================
    // Event recording
    // ============================================

    public synchronized TelemetryEvent recordEvent(NavigationEventType type, Map<String, Object> data, String pathId) {
        TelemetryEvent event = new TelemetryEvent(UUID.randomUUID().toString(), clock.millis(), type,
                sessionId, pathId, data != null ? data : Map.of());
        events.addLast(event);
        while (events.size() > settings.getMaxEvents()) {
            events.pollFirst();
        }
        emit(eventSink, event);
        return event;
    }

    public synchronized void recordPageLoad(String url, boolean success, long loadTimeMs, String pathId) {
        progress.setPagesVisited(progress.getPagesVisited() + 1);
        progress.setElapsedMs(clock.millis() - startTime);
        recordEvent(NavigationEventType.PAGE_LOAD, data(
                "url", url,
                "success", success,
                "loadTimeMs", loadTimeMs,
                "totalPages", progress.getPagesVisited()), pathId);
        publishProgress();
    }

    public synchronized void recordExtraction(String url, String schemaName, int fieldsExtracted, String pathId) {
        recordEvent(NavigationEventType.EXTRACTION, data(
                "url", url,
                "schemaName", schemaName,
                "fieldsExtracted", fieldsExtracted), pathId);
    }

    public synchronized void recordClaimFound(String claimId, String category, double confidence,
                                              String sourceUrl, String pathId) {
        progress.setClaimsFound(progress.getClaimsFound() + 1);
        recordEvent(NavigationEventType.CLAIM_FOUND, data(
                "claimId", claimId,
                "category", category,
                "confidence", confidence,
                "sourceUrl", sourceUrl,
                "totalClaims", progress.getClaimsFound()), pathId);
        publishProgress();
    }

    public synchronized void recordVerification(String claimId, VerificationType type, double newConfidence,
                                                String sourceUrl) {
        recordEvent(NavigationEventType.VERIFICATION, data(
                "claimId", claimId,
                "verificationType", type.name().toLowerCase(Locale.ROOT),
                "newConfidence", newConfidence,
                "sourceUrl", sourceUrl), null);
    }

    public synchronized void recordStrategyShift(String reason, String from, String to, Map<String, Object> details) {
        progress.setCurrentPhase(to);
        Map<String, Object> payload = data("reason", reason, "from", from, "to", to);
        if (details != null) {
            payload.putAll(details);
        }
        recordEvent(NavigationEventType.STRATEGY_SHIFT, payload, null);
        publishProgress();
    }

    public synchronized void recordPathTerminated(String pathId, String reason, int pagesVisited, int claimsFound) {
        progress.setActivePaths(Math.max(0, progress.getActivePaths() - 1));
        recordEvent(NavigationEventType.PATH_TERMINATED, data(
                "reason", reason,
                "pagesVisited", pagesVisited,
                "claimsFound", claimsFound), pathId);
        publishProgress();
    }

    public void recordError(String message, String url, boolean recoverable, String pathId) {
        recordError(new ResearchEngineException("TELEMETRY_ERROR", message, sessionId), url, recoverable, pathId);
    }

    /**
     * Non-recoverable errors are additionally published on the error channel.
     */
    public synchronized void recordError(Throwable error, String url, boolean recoverable, String pathId) {
        errorCounter.increment();
        recordEvent(NavigationEventType.ERROR, data(
                "error", error.getMessage(),
                "url", url,
                "recoverable", recoverable,
                "exception", error.getClass().getSimpleName()), pathId);
        if (!recoverable) {
            log.error("Unrecoverable error in session {}: {}", sessionId, error.getMessage(), error);
            emit(errorSink, error);
        } else {
            log.debug("Recoverable error in session {} at {}: {}", sessionId, url, error.getMessage());
        }
    }

    public synchronized void recordBlocked(String url, String reason, String pathId) {
        recordEvent(NavigationEventType.BLOCKED, data("url", url, "reason", reason), pathId);
    }

    // ============================================
    // Progress
    // ============================================

    public synchronized void updateConfidence(double confidence, Long estimatedRemainingMs) {
        progress.setConfidence(confidence);
        progress.setElapsedMs(clock.millis() - startTime);
        progress.setEstimatedRemainingMs(estimatedRemainingMs);
        publishProgress();
    }

    public synchronized void updateActivePaths(int count) {
        progress.setActivePaths(count);
        publishProgress();
    }

    /**
     * Report a planning/execution phase change. Pause, stop and failure go through their own methods, so
     * only IDLE to PLANNING and PLANNING to EXECUTING are accepted here. Ignored once the session has stopped.
     */
    public synchronized void updateStatus(ExecutionStatus status) {
        ExecutionStatus current = progress.getStatus();
        if (stopped || status == ExecutionStatus.PAUSED || status == ExecutionStatus.STOPPING
                || status.isTerminal() || !current.canTransitionTo(status)) {
            log.debug("Ignoring status change of session {}: {} -> {}", sessionId, current, status);
            return;
        }
        progress.setStatus(status);
        publishProgress();
    }

    private void publishProgress() {
        emit(progressSink, progress.copy());
    }

    // ============================================
    // Control
    // ============================================

    /**
     * Only an EXECUTING session can be paused.
     */
    public synchronized void pause() {
        if (paused || stopped || progress.getStatus() != ExecutionStatus.EXECUTING) {
            return;
        }
        paused = true;
        progress.setStatus(ExecutionStatus.PAUSED);
        enqueue(new ControlCommand(ControlCommandType.PAUSE, Map.of(), clock.millis()));
        publishProgress();
        log.info("Session {} paused", sessionId);
    }

    public synchronized void resume() {
        if (!paused || stopped) {
            return;
        }
        paused = false;
        progress.setStatus(ExecutionStatus.EXECUTING);
        enqueue(new ControlCommand(ControlCommandType.RESUME, Map.of(), clock.millis()));
        publishProgress();
        log.info("Session {} resumed", sessionId);
    }

    public void stop() {
        stop(null);
    }

    /**
     * User stop. Signals STOP, reports exactly one stop condition and completes without waiting for
     * in-flight page work. Later calls are no-ops.
     */
    public synchronized void stop(String reason) {
        if (stopped) {
            return;
        }
        long started = System.nanoTime();

        stopped = true;
        progress.setStatus(ExecutionStatus.STOPPING);
        publishProgress();
        enqueue(new ControlCommand(ControlCommandType.STOP, data("reason", reason), clock.millis()));

        StopCondition condition = new StopCondition(StopReason.USER_STOP,
                reason != null ? reason : "User requested stop", progress.getConfidence(), clock.millis());
        publishStop(condition);

        long stopTimeNanos = System.nanoTime() - started;
        long stopTimeMs = TimeUnit.NANOSECONDS.toMillis(stopTimeNanos);
        long targetMs = settings.getStopTarget().toMillis();
        stopTimer.record(stopTimeNanos, TimeUnit.NANOSECONDS);
        recordEvent(NavigationEventType.STRATEGY_SHIFT, data(
                "phase", "stopped",
                "stopTimeMs", stopTimeMs,
                "targetMs", targetMs,
                "success", stopTimeMs < targetMs), null);

        progress.setStatus(ExecutionStatus.COMPLETED);
        progress.setElapsedMs(clock.millis() - startTime);
        publishProgress();

        if (stopTimeMs >= targetMs) {
            log.warn("Stop of session {} took {}ms, target {}ms", sessionId, stopTimeMs, targetMs);
        } else {
            log.info("Session {} stopped in {}ms", sessionId, stopTimeMs);
        }
    }

    /**
     * Finish the session with a driver-decided stop condition (confidence reached, budget exhausted...).
     * Ignored once the session has already stopped.
     */
    public synchronized void complete(StopCondition condition) {
        if (stopped) {
            return;
        }
        stopped = true;
        progress.setStatus(ExecutionStatus.STOPPING);
        publishProgress();
        publishStop(condition);
        progress.setStatus(ExecutionStatus.COMPLETED);
        progress.setElapsedMs(clock.millis() - startTime);
        publishProgress();
        log.info("Session {} completed: {} ({})", sessionId, condition.reason(), condition.details());
    }

    /**
     * Unrecoverable failure. Only valid from PLANNING or EXECUTING.
     *
     * @return true when the session moved to FAILED
     */
    public synchronized boolean fail(Throwable error) {
        ExecutionStatus status = progress.getStatus();
        if (stopped || (status != ExecutionStatus.PLANNING && status != ExecutionStatus.EXECUTING)) {
            log.warn("Ignoring failure of session {} in status {}: {}", sessionId, status, error.getMessage());
            return false;
        }
        recordError(error, null, false, null);
        stopped = true;
        publishStop(new StopCondition(StopReason.ERROR, error.getMessage(), progress.getConfidence(), clock.millis()));
        progress.setStatus(ExecutionStatus.FAILED);
        progress.setElapsedMs(clock.millis() - startTime);
        publishProgress();
        return true;
    }

    private void publishStop(StopCondition condition) {
        stopCondition = condition;
        emit(stopSink, condition);
    }

    private void enqueue(ControlCommand command) {
        commandQueue.add(command);
        emit(commandSink, command);
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    /**
     * Take and clear the queued control commands.
     */
    public synchronized List<ControlCommand> drainPendingCommands() {
        List<ControlCommand> commands = new ArrayList<>(commandQueue);
        commandQueue.clear();
        return commands;
    }

    public synchronized boolean hasPendingStop() {
        return stopped || commandQueue.stream().anyMatch(c -> c.type() == ControlCommandType.STOP);
    }

    public synchronized Optional<StopCondition> getStopCondition() {
        return Optional.ofNullable(stopCondition);
    }

    // ============================================
    // Subscriptions
    // ============================================

    public Flux<TelemetryEvent> events() {
        return live(eventSink);
    }

    public Flux<ProgressState> progressUpdates() {
        return live(progressSink);
    }

    public Flux<ControlCommand> commands() {
        return live(commandSink);
    }

    public Flux<StopCondition> stopConditions() {
        return live(stopSink);
    }

    public Flux<Throwable> errors() {
        return live(errorSink);
    }

    public Disposable onEvent(Consumer<TelemetryEvent> listener) {
        return events().subscribe(listener);
    }

    public Disposable onProgress(Consumer<ProgressState> listener) {
        return progressUpdates().subscribe(listener);
    }

    public Disposable onStop(Consumer<StopCondition> listener) {
        return stopConditions().subscribe(listener);
    }

    public Disposable onError(Consumer<Throwable> listener) {
        return errors().subscribe(listener);
    }

    private <T> void emit(Sinks.Many<T> sink, T value) {
        Sinks.EmitResult result = sink.tryEmitNext(value);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Telemetry emission dropped for session {}: {}", sessionId, result);
        }
    }

    // ============================================
    // Queries
    // ============================================

    public synchronized ProgressState getProgress() {
        return progress.copy();
    }

    public synchronized List<TelemetryEvent> getEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<TelemetryEvent> getEventsByType(NavigationEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    public synchronized List<TelemetryEvent> getEventsForPath(String pathId) {
        return events.stream().filter(e -> pathId.equals(e.pathId())).toList();
    }

    public List<TelemetryEvent> getRecentEvents() {
        return getRecentEvents(100);
    }

    public synchronized List<TelemetryEvent> getRecentEvents(int limit) {
        List<TelemetryEvent> all = new ArrayList<>(events);
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    public synchronized TelemetryStats getStats() {
        Map<NavigationEventType, Long> byType = new EnumMap<>(NavigationEventType.class);
        for (TelemetryEvent event : events) {
            byType.merge(event.type(), 1L, Long::sum);
        }
        return new TelemetryStats(sessionId, clock.millis() - startTime, events.size(), byType,
                byType.getOrDefault(NavigationEventType.ERROR, 0L),
                byType.getOrDefault(NavigationEventType.BLOCKED, 0L));
    }

    /**
     * Drop events older than the configured maximum age.
     *
     * @return number of events removed
     */
    public synchronized int cleanup() {
        long cutoff = clock.millis() - settings.getMaxEventAge().toMillis();
        int before = events.size();
        events.removeIf(e -> e.timestamp() <= cutoff);
        return before - events.size();
    }

    /**
     * Drop the event log and queued commands. Pause/stop state and the stop condition are kept.
     */
    public synchronized void clear() {
        events.clear();
        commandQueue.clear();
    }

    public synchronized TelemetryExport export() {
        return new TelemetryExport(sessionId, new ArrayList<>(events), progress.copy(), startTime);
    }

    /**
     * Completes every subscription stream. Further emissions are dropped.
     */
    public synchronized void close() {
        eventSink.tryEmitComplete();
        progressSink.tryEmitComplete();
        commandSink.tryEmitComplete();
        stopSink.tryEmitComplete();
        errorSink.tryEmitComplete();
    }

    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
