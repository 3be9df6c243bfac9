package com.ryuqq.drorchestrator.core.statemachine;

/**
 * Execution 상태 전이 검증.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>PENDING으로의 역방향 전이 불가</li>
 *   <li>CANCELLING에서는 CANCELLING 또는 종료 상태로만 전이 가능</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionTransition {

    // Utility class - prevent instantiation
    private ExecutionTransition() {
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
    public static void validate(ExecutionStatus from, ExecutionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal execution state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> true;
            case POLLING, RUNNING, PAUSED -> to != ExecutionStatus.PENDING;
            case CANCELLING -> to == ExecutionStatus.CANCELLING || to.isTerminal();
            case COMPLETED, COMPLETED_WITH_WARNINGS, FAILED, TIMEOUT, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid execution state transition: %s → %s", from, to)
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
    public static ExecutionStatus transition(ExecutionStatus current, ExecutionStatus next) {
        validate(current, next);
        return next;
    }
}
