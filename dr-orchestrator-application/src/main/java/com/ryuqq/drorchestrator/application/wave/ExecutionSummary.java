package com.ryuqq.drorchestrator.application.wave;

/**
 * 실행 결과 요약.
 *
 * @param outcome 분류
 * @param totalWaves 전체 Wave 수
 * @param completedWaves 완료 Wave 수
 * @param failedWaves 실패 또는 시간 초과 Wave 수
 * @param cancelledWaves 취소 Wave 수
 * @param totalServers 시작된 Wave의 서버 수
 * @param launchedServers 기동 완료 서버 수
 * @param failedServers 기동 실패 서버 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionSummary(
    ExecutionOutcome outcome,
    int totalWaves,
    int completedWaves,
    int failedWaves,
    int cancelledWaves,
    int totalServers,
    int launchedServers,
    int failedServers
) {

    /**
     * 사람이 읽을 수 있는 요약 문장.
     */
    public String summary() {
        StringBuilder text = new StringBuilder()
            .append(completedWaves).append(" of ").append(totalWaves).append(" waves completed");
        if (failedWaves > 0) {
            text.append(", ").append(failedWaves).append(" failed");
        }
        if (cancelledWaves > 0) {
            text.append(", ").append(cancelledWaves).append(" cancelled");
        }
        text.append("; ").append(launchedServers).append('/').append(totalServers).append(" servers launched");
        return text.toString();
    }
}
