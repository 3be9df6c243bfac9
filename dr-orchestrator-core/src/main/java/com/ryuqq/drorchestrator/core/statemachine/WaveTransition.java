package com.ryuqq.drorchestrator.core.statemachine;

/**
 * Wave 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → STARTED, FAILED, CANCELLED</li>
 *   <li>실행 중 상태(STARTED, LAUNCHING, CONVERTING, IN_PROGRESS) → 실행 중 상태 또는 종료 상태</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WaveTransition {

    // Utility class - prevent instantiation
    private WaveTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WaveStatus from, WaveStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal wave state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == WaveStatus.STARTED || to == WaveStatus.FAILED || to == WaveStatus.CANCELLED;
            case STARTED, LAUNCHING, CONVERTING, IN_PROGRESS -> to != WaveStatus.PENDING;
            case COMPLETED, FAILED, TIMEOUT, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid wave state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static WaveStatus transition(WaveStatus current, WaveStatus next) {
        validate(current, next);
        return next;
    }
}
