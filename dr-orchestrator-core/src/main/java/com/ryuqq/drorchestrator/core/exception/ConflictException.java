package com.ryuqq.drorchestrator.core.exception;

/**
 * 리소스가 다른 실행 또는 외부 Job에 의해 점유된 상태.
 *
 * <p>Wave 시작 시점에서만 제한된 횟수로 재시도됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConflictException extends OrchestrationException {

    public ConflictException(String message) {
        super(ErrorCode.SERVER_CONFLICT, message);
    }

    public ConflictException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
