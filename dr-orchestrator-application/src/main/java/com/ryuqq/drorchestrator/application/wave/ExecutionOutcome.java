package com.ryuqq.drorchestrator.application.wave;

/**
 * 실행 결과 요약 분류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionOutcome {

    /** 모든 Wave 완료 */
    COMPLETED,

    /** 완료된 Wave 없이 실패 */
    FAILED,

    /** 취소된 Wave 존재 */
    CANCELLED,

    /** 일부 Wave만 완료 */
    PARTIAL
}
