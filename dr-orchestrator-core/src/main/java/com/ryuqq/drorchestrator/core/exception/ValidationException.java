package com.ryuqq.drorchestrator.core.exception;

/**
 * 잘못되었거나 누락된 입력. 즉시 노출되며 재시도하지 않습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationException extends OrchestrationException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
