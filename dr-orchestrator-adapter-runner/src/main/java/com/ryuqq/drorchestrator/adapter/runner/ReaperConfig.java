package com.ryuqq.drorchestrator.adapter.runner;

import java.time.Duration;

/**
 * ExecutionReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timeoutThreshold: 실행 시작 후 이 시간이 지나도록 종료되지 않으면 TIMEOUT (기본 365일)</li>
 *   <li>batchSize: 한 번의 scan에서 처리할 최대 실행 수 (기본 50)</li>
 * </ul>
 *
 * <p>기본 임계값은 Wave 최대 대기 시간과 같습니다. 그보다 짧게 설정하면
 * 정상적으로 진행 중인 장기 복구도 종료될 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param timeoutThreshold 타임아웃 임계값 (양수)
 * @param batchSize 배치 크기 (1 이상)
 */
public record ReaperConfig(Duration timeoutThreshold, int batchSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timeoutThreshold=31536000s (365일), batchSize=50</p>
     */
    public ReaperConfig() {
        this(Duration.ofSeconds(31_536_000), 50);
    }

    public ReaperConfig {
        if (timeoutThreshold == null || timeoutThreshold.isZero() || timeoutThreshold.isNegative()) {
            throw new IllegalArgumentException(
                "timeoutThreshold must be positive (current: " + timeoutThreshold + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * timeoutThreshold만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withTimeoutThreshold(Duration timeoutThreshold) {
        return new ReaperConfig(timeoutThreshold, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(timeoutThreshold, batchSize);
    }
}
