package com.ryuqq.drorchestrator.core.exception;

/**
 * 서비스 쿼터 초과. 승인 실패로 노출되며 자동 재시도하지 않습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QuotaExceededException extends OrchestrationException {

    public QuotaExceededException(String message) {
        super(ErrorCode.QUOTA_EXCEEDED, message);
    }
}
