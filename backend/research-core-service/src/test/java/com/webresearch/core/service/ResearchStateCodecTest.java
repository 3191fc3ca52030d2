package com.webresearch.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webresearch.core.MutableClock;
import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.claim.Claim;
import com.webresearch.core.dto.claim.ExtractionResult;
import com.webresearch.core.dto.source.SourceIntelligence;
import com.webresearch.core.dto.source.VisitOutcome;
import com.webresearch.core.entity.NavigationEventType;
import com.webresearch.core.entity.SourceTier;
import com.webresearch.core.exception.StateImportException;
import com.webresearch.core.service.cache.ResearchCacheManager;
import com.webresearch.core.service.claim.ClaimGraph;
import com.webresearch.core.service.source.SourceIntelligenceService;
import com.webresearch.core.service.telemetry.TelemetryEngine;
import com.webresearch.core.service.telemetry.TelemetryEngineFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ResearchStateCodec 단위 테스트
 */
class ResearchStateCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ResearchProperties properties = new ResearchProperties();

    private MutableClock clock;
    private ResearchCacheManager cacheManager;
    private SourceIntelligenceService sourceIntelligence;
    private ResearchStateCodec codec;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        cacheManager = new ResearchCacheManager(properties, clock, new SimpleMeterRegistry());
        sourceIntelligence = new SourceIntelligenceService(properties, clock);
        codec = new ResearchStateCodec(objectMapper, cacheManager, sourceIntelligence);
    }

    private ResearchStateCodec freshCodec(ResearchCacheManager cache, SourceIntelligenceService intelligence) {
        return new ResearchStateCodec(objectMapper, cache, intelligence);
    }

    @Nested
    @DisplayName("내보내기 후 가져오기")
    class RoundTrip {

        @Test
        @DisplayName("캐시 상태를 다른 인스턴스로 옮길 수 있다")
        void cache() {
            // given
            cacheManager.setPage("https://acme.com/pricing", "<html/>", "Pricing");
            cacheManager.setQueryResults("acme pricing", List.of("https://acme.com/pricing"));
            String json = codec.exportCache();

            ResearchCacheManager restored = new ResearchCacheManager(properties, clock, new SimpleMeterRegistry());

            // when
            freshCodec(restored, sourceIntelligence).importCache(json);

            // then
            assertThat(restored.getPage("https://acme.com/pricing"))
                    .hasValueSatisfying(page -> assertThat(page.text()).isEqualTo("Pricing"));
            assertThat(restored.getQueryResults("ACME pricing")).hasValue(List.of("https://acme.com/pricing"));
        }

        @Test
        @DisplayName("방문 이력과 도메인 점수가 유지된다")
        void sourceIntelligence() {
            // given
            sourceIntelligence.updateSourceIntelligence("acme.io", VisitOutcome.success("https://acme.io/", 4));
            SourceIntelligence original = sourceIntelligence.exportState().sourceIntelligence().get("acme.io");
            String json = codec.exportSourceIntelligence();

            SourceIntelligenceService restored = new SourceIntelligenceService(properties, clock);

            // when
            freshCodec(cacheManager, restored).importSourceIntelligence(json);

            // then
            SourceIntelligence imported = restored.exportState().sourceIntelligence().get("acme.io");
            assertThat(imported.getAvgExtractionYield()).isEqualTo(original.getAvgExtractionYield());
            assertThat(imported.getSuccessRate()).isEqualTo(original.getSuccessRate());
            assertThat(restored.scoreDomain("github.com").getTier()).isEqualTo(SourceTier.TIER_1);
        }

        @Test
        @DisplayName("클레임 그래프를 새 그래프로 복원한다")
        void claimGraph() {
            // given
            ClaimGraph graph = new ClaimGraph(clock);
            Claim claim = graph.createClaim(pricingExtraction(), "https://acme.com/pricing", SourceTier.TIER_1,
                    "q1", "pricing");
            String json = codec.exportClaimGraph(graph);
            ClaimGraph restored = new ClaimGraph(clock);

            // when
            codec.importClaimGraph(json, restored);

            // then
            assertThat(restored.getAllClaims()).singleElement().satisfies(c -> {
                assertThat(c.getId()).isEqualTo(claim.getId());
                assertThat(c.getCategory()).isEqualTo("pricing");
                assertThat(c.getSources()).hasSize(1);
                assertThat(c.getConfidence()).isEqualTo(claim.getConfidence());
            });
        }
    }

    @Nested
    @DisplayName("손상된 입력")
    class CorruptInput {

        @Test
        @DisplayName("읽을 수 없는 JSON은 STATE_CORRUPTED이고 그래프는 그대로다")
        void unreadableJson() {
            // given
            ClaimGraph graph = new ClaimGraph(clock);
            graph.createClaim(pricingExtraction(), "https://acme.com/pricing", SourceTier.TIER_1, "q1", "pricing");

            // when & then
            assertThatThrownBy(() -> codec.importClaimGraph("{\"claims\": [", graph))
                    .isInstanceOf(StateImportException.class)
                    .hasMessageStartingWith("Unreadable claim graph state")
                    .extracting(e -> ((StateImportException) e).getErrorCode())
                    .isEqualTo("STATE_CORRUPTED");
            assertThat(graph.getAllClaims()).hasSize(1);
        }

        @Test
        @DisplayName("세션 텔레메트리를 넘기면 거부된 상태가 오류 채널로도 발행된다")
        void publishesRejectedStateToTelemetry() {
            // given
            TelemetryEngine telemetry = new TelemetryEngineFactory(properties, clock, new SimpleMeterRegistry())
                    .create("session-1");
            ClaimGraph graph = new ClaimGraph(clock);

            // when / then
            StepVerifier.create(telemetry.errors())
                    .then(() -> assertThatThrownBy(() -> codec.importClaimGraph("{\"claims\": [", graph, telemetry))
                            .isInstanceOf(StateImportException.class))
                    .assertNext(e -> assertThat(e)
                            .isInstanceOf(StateImportException.class)
                            .hasMessageStartingWith("Unreadable claim graph state"))
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));

            assertThat(telemetry.getStats().errorsCount()).isEqualTo(1);
            assertThat(telemetry.getEventsByType(NavigationEventType.ERROR)).singleElement()
                    .satisfies(event -> assertThat(event.data()).containsEntry("recoverable", false));
        }

        @Test
        @DisplayName("내용 검증에 실패한 소스 인텔리전스도 오류 채널로 발행된다")
        void publishesIncompleteSourceIntelligence() {
            // given
            TelemetryEngine telemetry = new TelemetryEngineFactory(properties, clock, new SimpleMeterRegistry())
                    .create("session-1");
            String json = "{\"domainScores\": {\"broken.io\": {\"domain\": \"broken.io\"}}, \"sourceIntelligence\": {}}";

            // when
            assertThatThrownBy(() -> codec.importSourceIntelligence(json, telemetry))
                    .isInstanceOf(StateImportException.class)
                    .hasMessageContaining("broken.io");

            // then
            assertThat(telemetry.getStats().errorsCount()).isEqualTo(1);
            assertThat(sourceIntelligence.getDomainScore("broken.io")).isEmpty();
        }

        @Test
        @DisplayName("빈 입력과 null 문서는 거부된다")
        void emptyInput() {
            assertThatThrownBy(() -> codec.importCache(""))
                    .isInstanceOf(StateImportException.class)
                    .hasMessage("Empty cache state");
            assertThatThrownBy(() -> codec.importSourceIntelligence("null"))
                    .isInstanceOf(StateImportException.class)
                    .hasMessage("Empty source intelligence state");
        }
    }

    private static ExtractionResult pricingExtraction() {
        return ExtractionResult.builder()
                .schemaName("pricing")
                .data(Map.of("plans", List.of("Free", "Pro"), "currency", "USD"))
                .confidence(0.8)
                .sourceUrl("https://acme.com/pricing")
                .build();
    }
}
