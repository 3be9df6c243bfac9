package com.ryuqq.drorchestrator.core.spi;

/**
 * 복구 Job 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JobStatus {

    PENDING,
    STARTED,
    COMPLETED;

    /**
     * 서버를 점유 중인 상태인지 확인.
     *
     * @return PENDING 또는 STARTED이면 true
     */
    public boolean isLive() {
        return this == PENDING || this == STARTED;
    }
}
