package com.ryuqq.drorchestrator.core.model;

/**
 * 실행 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionType {

    /**
     * 모의 훈련. 기동된 인스턴스는 훈련용으로 표시됩니다.
     */
    DRILL,

    /**
     * 실제 복구. 서버 기동 후 post-launch action 완료까지 기다립니다.
     */
    RECOVERY;

    public boolean isDrill() {
        return this == DRILL;
    }
}
