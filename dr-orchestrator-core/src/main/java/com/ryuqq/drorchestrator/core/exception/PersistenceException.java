package com.ryuqq.drorchestrator.core.exception;

/**
 * 저장소 쓰기 실패 또는 조건부 쓰기(버전 가드) 위반.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PersistenceException extends OrchestrationException {

    public PersistenceException(String message) {
        super(ErrorCode.PERSISTENCE_ERROR, message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
