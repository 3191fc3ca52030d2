package com.webresearch.core.service;

import com.webresearch.core.dto.plan.ExecutionPath;
import com.webresearch.core.dto.plan.ResearchObjective;
import com.webresearch.core.dto.plan.ResearchPlan;
import com.webresearch.core.entity.PathStatus;
import com.webresearch.core.service.claim.ClaimGraph;
import com.webresearch.core.service.confidence.ConfidenceTracker;
import com.webresearch.core.service.telemetry.TelemetryEngine;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable state of one research run. Plan paths and visited URLs are guarded by this session's monitor.
 */
@Getter
class ResearchSession {

    private final String id;
    private final ResearchObjective objective;
    private final TelemetryEngine telemetry;
    private final ClaimGraph claimGraph;
    private final long startTime;

    private volatile ResearchPlan plan;
    private volatile ConfidenceTracker confidence;
    private volatile Long finishedAt;

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    /** normalized URL -> URL as first visited */
    @Getter(AccessLevel.NONE)
    private final Map<String, String> visited = new LinkedHashMap<>();

    ResearchSession(String id, ResearchObjective objective, TelemetryEngine telemetry,
                    ClaimGraph claimGraph, long startTime) {
        this.id = id;
        this.objective = objective;
        this.telemetry = telemetry;
        this.claimGraph = claimGraph;
        this.startTime = startTime;
    }

    void attachPlan(ResearchPlan plan, ConfidenceTracker confidence) {
        this.plan = plan;
        this.confidence = confidence;
    }

    /**
     * @return false when the URL was already visited in this session
     */
    synchronized boolean markVisited(String normalizedUrl, String url) {
        return visited.putIfAbsent(normalizedUrl, url) == null;
    }

    synchronized List<String> getVisitedUrls() {
        return new ArrayList<>(visited.values());
    }

    /**
     * Highest-priority pending path in the plan's current order, marked ACTIVE.
     */
    synchronized ExecutionPath nextPendingPath() {
        for (ExecutionPath path : plan.getExecutionPaths()) {
            if (path.getStatus() == PathStatus.PENDING) {
                path.setStatus(PathStatus.ACTIVE);
                return path;
            }
        }
        return null;
    }

    synchronized boolean hasPendingPaths() {
        return plan.getExecutionPaths().stream().anyMatch(p -> p.getStatus() == PathStatus.PENDING);
    }

    synchronized void updatePathStatus(ExecutionPath path, PathStatus status) {
        path.setStatus(status);
    }

    synchronized long countPaths(PathStatus status) {
        return plan.getExecutionPaths().stream().filter(p -> p.getStatus() == status).count();
    }

    void markFinished(long now) {
        this.finishedAt = now;
    }

    boolean isFinished() {
        return finishedAt != null;
    }
}
