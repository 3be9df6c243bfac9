package com.ryuqq.drorchestrator.core.model;

/**
 * Execution 식별자 (executionId, planId).
 *
 * <p>저장소의 조건부 쓰기는 이 복합 키를 기준으로 수행됩니다.</p>
 *
 * @param executionId 실행 ID (null/blank 불가)
 * @param planId 복구 계획 ID (null/blank 불가)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionKey(String executionId, String planId) {

    public ExecutionKey {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId cannot be null or blank");
        }
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("planId cannot be null or blank");
        }
    }

    public static ExecutionKey of(String executionId, String planId) {
        return new ExecutionKey(executionId, planId);
    }

    @Override
    public String toString() {
        return executionId + "@" + planId;
    }
}
