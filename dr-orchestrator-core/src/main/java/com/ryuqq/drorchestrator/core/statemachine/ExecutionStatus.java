package com.ryuqq.drorchestrator.core.statemachine;

/**
 * Execution의 생명주기 상태.
 *
 * <p>활성 상태(PENDING, POLLING, RUNNING, PAUSED, CANCELLING)는 서버를 점유하고 있는 것으로
 * 간주되어 승인 제어의 충돌 검사 대상이 됩니다.</p>
 *
 * <p><strong>종료 상태:</strong> COMPLETED, COMPLETED_WITH_WARNINGS, FAILED, TIMEOUT, CANCELLED.
 * 종료 이후에는 어떤 변경도 허용되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionStatus {

    PENDING,
    POLLING,
    RUNNING,
    PAUSED,

    /**
     * 취소 요청됨. 다음 poll에서 CANCELLED로 전환됩니다.
     */
    CANCELLING,

    COMPLETED,
    COMPLETED_WITH_WARNINGS,
    FAILED,
    TIMEOUT,
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return 종료 상태이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED
            || this == COMPLETED_WITH_WARNINGS
            || this == FAILED
            || this == TIMEOUT
            || this == CANCELLED;
    }

    /**
     * 활성 상태인지 확인.
     *
     * @return 종료 상태가 아니면 true
     */
    public boolean isActive() {
        return !isTerminal();
    }
}
