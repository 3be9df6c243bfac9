package com.ryuqq.drorchestrator.core.exception;

/**
 * 실행, Job 또는 보호 그룹이 존재하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NotFoundException extends OrchestrationException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
