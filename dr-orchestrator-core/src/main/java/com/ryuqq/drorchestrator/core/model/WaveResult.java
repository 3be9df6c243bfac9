package com.ryuqq.drorchestrator.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Wave 시작 기록. Execution의 {@code wave_results}에 순서대로 누적됩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WaveResult(
    int waveNumber,
    String waveName,
    String protectionGroupId,
    String jobId,
    String region,
    List<String> serverIds,
    Instant startTime
) {

    public WaveResult {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        serverIds = serverIds == null ? List.of() : List.copyOf(serverIds);
    }
}
