package com.webresearch.core.dto.telemetry;

import com.webresearch.core.entity.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 실행 진행 상태
 * The engine owns the only live instance; everything handed out is a {@link #copy()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressState {
    private ExecutionStatus status;
    private String planSummary;
    private String currentPhase;
    private int pagesVisited;
    private int claimsFound;
    private double confidence;
    private int activePaths;
    private long elapsedMs;
    private Long estimatedRemainingMs;

    public static ProgressState idle() {
        return ProgressState.builder()
                .status(ExecutionStatus.IDLE)
                .currentPhase("initializing")
                .build();
    }

    public ProgressState copy() {
        return new ProgressState(status, planSummary, currentPhase, pagesVisited, claimsFound,
                confidence, activePaths, elapsedMs, estimatedRemainingMs);
    }
}
