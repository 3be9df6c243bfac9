package com.ryuqq.drorchestrator.core.exception;

/**
 * 오케스트레이터 예외 계층의 최상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorCode}를 가지며, 진입점 경계에서
 * Wave/Execution의 {@code errorCode}로 변환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class OrchestrationException extends RuntimeException {

    private final ErrorCode errorCode;

    protected OrchestrationException(ErrorCode errorCode, String message) {
        super(message);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    protected OrchestrationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
