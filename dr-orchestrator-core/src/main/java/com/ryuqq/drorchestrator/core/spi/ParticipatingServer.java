package com.ryuqq.drorchestrator.core.spi;

/**
 * Job에 참여 중인 서버의 제어 평면 보고값.
 *
 * @param sourceServerId 소스 서버 ID
 * @param launchStatus 제어 평면 기동 상태 문자열 (예: PENDING, IN_PROGRESS, LAUNCHED, FAILED)
 * @param recoveryInstanceId 복구 인스턴스 ID (기동 전 null)
 * @param postLaunchActionsStatus post-launch action 상태 (예: NOT_STARTED, IN_PROGRESS, COMPLETED, null 가능)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ParticipatingServer(
    String sourceServerId,
    String launchStatus,
    String recoveryInstanceId,
    String postLaunchActionsStatus
) {

    public ParticipatingServer {
        if (sourceServerId == null || sourceServerId.isBlank()) {
            throw new IllegalArgumentException("sourceServerId cannot be null or blank");
        }
    }

    public boolean isPostLaunchComplete() {
        return "COMPLETED".equalsIgnoreCase(postLaunchActionsStatus);
    }
}
