package com.ryuqq.drorchestrator.core.spi;

/**
 * 복구 Job 유형. 충돌 검사에는 LAUNCH만 사용됩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JobType {
    LAUNCH,
    TERMINATE,
    CREATE_CONVERTED_SNAPSHOT
}
