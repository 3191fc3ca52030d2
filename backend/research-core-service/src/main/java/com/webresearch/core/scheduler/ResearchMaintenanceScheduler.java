package com.webresearch.core.scheduler;

import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.cache.CleanupResult;
import com.webresearch.core.service.ResearchOrchestrationService;
import com.webresearch.core.service.cache.ResearchCacheManager;
import com.webresearch.core.service.source.SourceIntelligenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 주기적 유지보수 스케줄러.
 * 만료된 캐시 항목, 오래된 텔레메트리 이벤트, 갱신되지 않은 도메인 점수, 종료된 세션을 정리합니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "research.maintenance.enabled", havingValue = "true", matchIfMissing = true)
public class ResearchMaintenanceScheduler {

    private final ResearchProperties properties;
    private final ResearchCacheManager cacheManager;
    private final SourceIntelligenceService sourceIntelligence;
    private final ResearchOrchestrationService orchestrationService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${research.maintenance.interval-ms:300000}",
            initialDelayString = "${research.maintenance.interval-ms:300000}")
    public void runMaintenance() {
        try {
            CleanupResult cache = cacheManager.cleanup();
            int events = orchestrationService.cleanupTelemetry();
            int decayed = sourceIntelligence.decayStaleScores(
                    properties.getSource().getStaleAfter(), properties.getSource().getStaleDecay());
            int sessions = orchestrationService.evictFinishedSessions(
                    clock.instant().minus(properties.getEngine().getClaimRetention()));

            if (cache.total() + events + decayed + sessions > 0) {
                log.info("[Maintenance] Removed {} cache entries, {} telemetry events, {} sessions; decayed {} domain scores",
                        cache.total(), events, sessions, decayed);
            } else {
                log.debug("[Maintenance] Nothing to clean up");
            }
        } catch (Exception e) {
            log.error("[Maintenance] Run failed: {}", e.getMessage(), e);
        }
    }
}
