package com.ryuqq.drorchestrator.core.exception;

/**
 * 하위 호출이 재시도 불가능한 이유로 실패함. 원인 예외를 보존합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ApplicationException extends OrchestrationException {

    public ApplicationException(String message) {
        super(ErrorCode.APPLICATION_ERROR, message);
    }

    public ApplicationException(String message, Throwable cause) {
        super(ErrorCode.APPLICATION_ERROR, message, cause);
    }

    public ApplicationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
