package com.webresearch.core.dto.research;

import com.webresearch.core.dto.claim.Claim;
import com.webresearch.core.dto.telemetry.StopCondition;
import com.webresearch.core.dto.telemetry.TelemetryEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 리서치 실행 결과
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchResult {
    private String sessionId;
    private String planId;
    private String objective;
    /** True when at least one answer scores above 0.5 */
    private boolean success;
    private List<ResearchAnswer> answers;
    private List<Claim> claims;
    private double confidence;
    private ExecutionStats stats;
    private List<String> visitedUrls;
    private List<TelemetryEvent> telemetry;
    private StopCondition stopCondition;
}
