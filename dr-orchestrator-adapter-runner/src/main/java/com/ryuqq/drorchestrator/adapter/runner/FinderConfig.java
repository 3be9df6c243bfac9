package com.ryuqq.drorchestrator.adapter.runner;

import java.time.Duration;

/**
 * ExecutionFinder 설정 (불변 record).
 *
 * <p>현재 Wave 단계별 poll 간격입니다. Job 생성 직후(STARTED)는 짧게,
 * 아직 Job이 없는 단계(PENDING)는 길게 확인합니다.</p>
 *
 * <ul>
 *   <li>pendingInterval: 기본 45초</li>
 *   <li>startedInterval: 기본 15초</li>
 *   <li>inProgressInterval: LAUNCHING, CONVERTING, IN_PROGRESS 공통 (기본 30초)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pendingInterval PENDING 단계 간격 (양수)
 * @param startedInterval STARTED 단계 간격 (양수)
 * @param inProgressInterval 진행 단계 간격 (양수)
 */
public record FinderConfig(Duration pendingInterval, Duration startedInterval, Duration inProgressInterval) {

    public FinderConfig() {
        this(Duration.ofSeconds(45), Duration.ofSeconds(15), Duration.ofSeconds(30));
    }

    public FinderConfig {
        requirePositive("pendingInterval", pendingInterval);
        requirePositive("startedInterval", startedInterval);
        requirePositive("inProgressInterval", inProgressInterval);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public FinderConfig withPendingInterval(Duration pendingInterval) {
        return new FinderConfig(pendingInterval, startedInterval, inProgressInterval);
    }

    public FinderConfig withStartedInterval(Duration startedInterval) {
        return new FinderConfig(pendingInterval, startedInterval, inProgressInterval);
    }

    public FinderConfig withInProgressInterval(Duration inProgressInterval) {
        return new FinderConfig(pendingInterval, startedInterval, inProgressInterval);
    }
}
