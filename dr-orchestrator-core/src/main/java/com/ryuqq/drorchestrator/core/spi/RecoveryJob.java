package com.ryuqq.drorchestrator.core.spi;

import java.time.Instant;
import java.util.List;

/**
 * 제어 평면 복구 Job 스냅샷.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RecoveryJob(
    String jobId,
    JobType type,
    JobStatus status,
    List<ParticipatingServer> participatingServers,
    Instant creationTime
) {

    public RecoveryJob {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        participatingServers = participatingServers == null ? List.of() : List.copyOf(participatingServers);
    }
}
