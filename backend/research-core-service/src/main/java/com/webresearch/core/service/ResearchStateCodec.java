package com.webresearch.core.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webresearch.core.dto.cache.CacheState;
import com.webresearch.core.dto.claim.ClaimGraphState;
import com.webresearch.core.dto.source.SourceIntelligenceState;
import com.webresearch.core.exception.ResearchEngineException;
import com.webresearch.core.exception.StateImportException;
import com.webresearch.core.service.cache.ResearchCacheManager;
import com.webresearch.core.service.claim.ClaimGraph;
import com.webresearch.core.service.source.SourceIntelligenceService;
import com.webresearch.core.service.telemetry.TelemetryEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 캐시 / 소스 인텔리전스 / 클레임 그래프 상태의 JSON 직렬화
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchStateCodec {

    private final ObjectMapper objectMapper;
    private final ResearchCacheManager cacheManager;
    private final SourceIntelligenceService sourceIntelligence;

    public String exportCache() {
        return write(cacheManager.exportState(), "cache");
    }

    public void importCache(String json) {
        importCache(json, null);
    }

    /**
     * Import variants taking a {@link TelemetryEngine} also publish a rejected state on its error channel
     * before rethrowing.
     */
    public void importCache(String json, TelemetryEngine telemetry) {
        importing(telemetry, () -> cacheManager.importState(read(json, CacheState.class, "cache")));
    }

    public String exportSourceIntelligence() {
        return write(sourceIntelligence.exportState(), "source intelligence");
    }

    public void importSourceIntelligence(String json) {
        importSourceIntelligence(json, null);
    }

    public void importSourceIntelligence(String json, TelemetryEngine telemetry) {
        importing(telemetry, () -> sourceIntelligence.importState(
                read(json, SourceIntelligenceState.class, "source intelligence")));
    }

    public String exportClaimGraph(ClaimGraph graph) {
        return write(graph.exportState(), "claim graph");
    }

    /**
     * Replaces the graph's contents. The graph is left untouched when the JSON cannot be read.
     */
    public void importClaimGraph(String json, ClaimGraph graph) {
        importClaimGraph(json, graph, null);
    }

    public void importClaimGraph(String json, ClaimGraph graph, TelemetryEngine telemetry) {
        importing(telemetry, () -> graph.importState(read(json, ClaimGraphState.class, "claim graph")));
    }

    private void importing(TelemetryEngine telemetry, Runnable action) {
        try {
            action.run();
        } catch (StateImportException e) {
            if (telemetry != null) {
                telemetry.recordError(e, null, false, null);
            }
            throw e;
        }
    }

    private String write(Object state, String label) {
        try {
            String json = objectMapper.writeValueAsString(state);
            log.debug("Exported {} state ({} chars)", label, json.length());
            return json;
        } catch (JsonProcessingException e) {
            throw new ResearchEngineException("STATE_EXPORT_FAILED", "Failed to export " + label + " state", null, e);
        }
    }

    private <T> T read(String json, Class<T> type, String label) {
        if (json == null || json.isBlank()) {
            throw new StateImportException("Empty " + label + " state");
        }
        T state;
        try {
            state = objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable {} state: {}", label, e.getOriginalMessage());
            throw new StateImportException("Unreadable " + label + " state: " + e.getOriginalMessage(), e);
        }
        if (state == null) {
            throw new StateImportException("Empty " + label + " state");
        }
        return state;
    }
}
