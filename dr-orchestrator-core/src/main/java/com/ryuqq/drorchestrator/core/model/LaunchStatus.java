package com.ryuqq.drorchestrator.core.model;

import java.util.Locale;

/**
 * 서버 단위 기동 상태.
 *
 * <p>제어 평면의 문자열 상태를 도메인 상태로 매핑합니다.
 * {@code LAUNCH_FAILED}는 FAILED로, 알 수 없는 값은 IN_PROGRESS로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum LaunchStatus {

    PENDING,
    IN_PROGRESS,
    LAUNCHED,
    FAILED,
    TERMINATED;

    /**
     * 제어 평면 상태 문자열 매핑.
     *
     * @param raw 제어 평면 상태 (null 가능)
     * @return 도메인 상태
     */
    public static LaunchStatus fromControlPlane(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "PENDING" -> PENDING;
            case "LAUNCHED" -> LAUNCHED;
            case "FAILED", "LAUNCH_FAILED" -> FAILED;
            case "TERMINATED" -> TERMINATED;
            default -> IN_PROGRESS;
        };
    }

    /**
     * 더 이상 변하지 않는 상태인지 확인.
     *
     * @return LAUNCHED, FAILED, TERMINATED인 경우 true
     */
    public boolean isTerminal() {
        return this == LAUNCHED || this == FAILED || this == TERMINATED;
    }

    /**
     * 실패로 집계되는 상태인지 확인.
     *
     * @return FAILED 또는 TERMINATED인 경우 true
     */
    public boolean isFailure() {
        return this == FAILED || this == TERMINATED;
    }
}
