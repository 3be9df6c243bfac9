package com.ryuqq.drorchestrator.core.spi;

import java.util.Set;

/**
 * 제어 평면 호출 실패.
 *
 * <p>서비스 오류 코드로 throttling/conflict 계열을 구분합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ControlPlaneException extends RuntimeException {

    private static final Set<String> THROTTLING_CODES = Set.of("ThrottlingException", "TooManyRequestsException");
    private static final String CONFLICT_CODE = "ConflictException";
    private static final String VALIDATION_CODE = "ValidationException";
    private static final String NOT_FOUND_CODE = "ResourceNotFoundException";

    private final String errorCode;

    public ControlPlaneException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ControlPlaneException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static ControlPlaneException throttling(String message) {
        return new ControlPlaneException("ThrottlingException", message);
    }

    public static ControlPlaneException conflict(String message) {
        return new ControlPlaneException(CONFLICT_CODE, message);
    }

    public static ControlPlaneException validation(String message) {
        return new ControlPlaneException(VALIDATION_CODE, message);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isThrottling() {
        return errorCode != null && THROTTLING_CODES.contains(errorCode);
    }

    public boolean isConflict() {
        return CONFLICT_CODE.equals(errorCode);
    }

    public boolean isValidation() {
        return VALIDATION_CODE.equals(errorCode);
    }

    public boolean isNotFound() {
        return NOT_FOUND_CODE.equals(errorCode);
    }
}
