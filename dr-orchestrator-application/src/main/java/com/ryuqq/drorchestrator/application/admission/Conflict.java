package com.ryuqq.drorchestrator.application.admission;

import com.ryuqq.drorchestrator.core.model.ExecutionKey;

/**
 * 승인 검사에서 발견된 충돌 또는 할당량 위반.
 *
 * @param kind 유형
 * @param waveNumber 대상 Wave 번호 (리전 단위 할당량이면 null)
 * @param serverId 충돌 서버 (할당량 위반이면 null)
 * @param holder 점유 실행 (EXECUTION 충돌만)
 * @param jobId 점유 Job (DRS_JOB 충돌만)
 * @param quotaType 할당량 종류 (QUOTA_VIOLATION만)
 * @param region 리전
 * @param message 설명
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Conflict(
    ConflictKind kind,
    Integer waveNumber,
    String serverId,
    ExecutionKey holder,
    String jobId,
    QuotaType quotaType,
    String region,
    String message
) {

    public Conflict {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    public static Conflict execution(int waveNumber, String serverId, ExecutionKey holder, String region) {
        return new Conflict(ConflictKind.EXECUTION, waveNumber, serverId, holder, null, null, region,
            "Server " + serverId + " is in use by execution " + holder);
    }

    public static Conflict drsJob(int waveNumber, String serverId, String jobId, String region) {
        return new Conflict(ConflictKind.DRS_JOB, waveNumber, serverId, null, jobId, null, region,
            "Server " + serverId + " is in active DRS job " + jobId);
    }

    public static Conflict quota(QuotaType quotaType, Integer waveNumber, String region, String message) {
        return new Conflict(ConflictKind.QUOTA_VIOLATION, waveNumber, null, null, null, quotaType, region, message);
    }

    public boolean isQuotaViolation() {
        return kind == ConflictKind.QUOTA_VIOLATION;
    }
}
