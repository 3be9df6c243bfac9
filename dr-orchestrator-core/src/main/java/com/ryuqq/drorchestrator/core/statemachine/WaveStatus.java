package com.ryuqq.drorchestrator.core.statemachine;

/**
 * Wave의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (Job 생성)
 * STARTED ──► LAUNCHING / CONVERTING ──► IN_PROGRESS
 *    │                                        │
 *    └──────────────┬─────────────────────────┘
 *                   ▼
 *   COMPLETED / FAILED / TIMEOUT / CANCELLED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WaveStatus {

    /**
     * 아직 Job이 생성되지 않음.
     */
    PENDING,

    /**
     * 복구 Job 생성됨.
     */
    STARTED,

    /**
     * 인스턴스 기동 중.
     */
    LAUNCHING,

    /**
     * 스냅샷 변환 중.
     */
    CONVERTING,

    /**
     * 일부 서버 기동 완료.
     */
    IN_PROGRESS,

    COMPLETED,

    FAILED,

    TIMEOUT,

    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, TIMEOUT, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT || this == CANCELLED;
    }

    /**
     * Job이 진행 중인 상태인지 확인.
     *
     * @return STARTED, LAUNCHING, CONVERTING, IN_PROGRESS인 경우 true
     */
    public boolean isRunning() {
        return this == STARTED || this == LAUNCHING || this == CONVERTING || this == IN_PROGRESS;
    }
}
