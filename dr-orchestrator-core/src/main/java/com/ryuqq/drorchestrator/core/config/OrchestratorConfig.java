package com.ryuqq.drorchestrator.core.config;

import com.ryuqq.drorchestrator.core.retry.RetryPolicy;

import java.time.Duration;

/**
 * 오케스트레이터 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalSeconds: poll 간격, Wave 대기 시간 증가 단위 (기본 30초)</li>
 *   <li>maxWaitSeconds: Wave 최대 대기 시간 (기본 31536000초 = 1년)</li>
 *   <li>jobStartRetry: Job 생성 충돌 재시도 (기본 5회, 10초부터 2배)</li>
 *   <li>throttleRetry: 구성 갱신 throttling 재시도 (기본 3회, 1초부터 2배)</li>
 *   <li>applyTimeoutBudget: 구성 적용 시간 예산 (기본 300초)</li>
 *   <li>quotaLimits: 서비스 쿼터</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    long pollIntervalSeconds,
    long maxWaitSeconds,
    RetryPolicy jobStartRetry,
    RetryPolicy throttleRetry,
    Duration applyTimeoutBudget,
    QuotaLimits quotaLimits
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(30, 31_536_000, RetryPolicy.jobStart(), RetryPolicy.throttling(),
            Duration.ofSeconds(300), new QuotaLimits());
    }

    public OrchestratorConfig {
        if (pollIntervalSeconds <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalSeconds must be positive (current: " + pollIntervalSeconds + ")"
            );
        }
        if (maxWaitSeconds <= 0) {
            throw new IllegalArgumentException(
                "maxWaitSeconds must be positive (current: " + maxWaitSeconds + ")"
            );
        }
        if (jobStartRetry == null) {
            throw new IllegalArgumentException("jobStartRetry cannot be null");
        }
        if (throttleRetry == null) {
            throw new IllegalArgumentException("throttleRetry cannot be null");
        }
        if (applyTimeoutBudget == null || applyTimeoutBudget.isNegative() || applyTimeoutBudget.isZero()) {
            throw new IllegalArgumentException(
                "applyTimeoutBudget must be positive (current: " + applyTimeoutBudget + ")"
            );
        }
        if (quotaLimits == null) {
            throw new IllegalArgumentException("quotaLimits cannot be null");
        }
    }

    public OrchestratorConfig withPollIntervalSeconds(long pollIntervalSeconds) {
        return new OrchestratorConfig(pollIntervalSeconds, maxWaitSeconds, jobStartRetry, throttleRetry,
            applyTimeoutBudget, quotaLimits);
    }

    public OrchestratorConfig withMaxWaitSeconds(long maxWaitSeconds) {
        return new OrchestratorConfig(pollIntervalSeconds, maxWaitSeconds, jobStartRetry, throttleRetry,
            applyTimeoutBudget, quotaLimits);
    }

    public OrchestratorConfig withJobStartRetry(RetryPolicy jobStartRetry) {
        return new OrchestratorConfig(pollIntervalSeconds, maxWaitSeconds, jobStartRetry, throttleRetry,
            applyTimeoutBudget, quotaLimits);
    }

    public OrchestratorConfig withThrottleRetry(RetryPolicy throttleRetry) {
        return new OrchestratorConfig(pollIntervalSeconds, maxWaitSeconds, jobStartRetry, throttleRetry,
            applyTimeoutBudget, quotaLimits);
    }

    public OrchestratorConfig withApplyTimeoutBudget(Duration applyTimeoutBudget) {
        return new OrchestratorConfig(pollIntervalSeconds, maxWaitSeconds, jobStartRetry, throttleRetry,
            applyTimeoutBudget, quotaLimits);
    }

    public OrchestratorConfig withQuotaLimits(QuotaLimits quotaLimits) {
        return new OrchestratorConfig(pollIntervalSeconds, maxWaitSeconds, jobStartRetry, throttleRetry,
            applyTimeoutBudget, quotaLimits);
    }
}
