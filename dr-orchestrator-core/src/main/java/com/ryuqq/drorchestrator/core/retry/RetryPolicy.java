package com.ryuqq.drorchestrator.core.retry;

/**
 * 지수 백오프 재시도 정책 (불변 record).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay(retry) = min(baseDelayMs * multiplier^(retry-1), maxDelayMs)
 * </pre>
 *
 * <p><strong>예시 (jobStart: baseDelay=10000ms, multiplier=2.0, maxAttempts=5):</strong></p>
 * <ul>
 *   <li>1차 재시도 전: 10000ms</li>
 *   <li>2차 재시도 전: 20000ms</li>
 *   <li>3차 재시도 전: 40000ms</li>
 *   <li>4차 재시도 전: 80000ms</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (첫 시도 포함, 1 이상)
 * @param baseDelayMs 첫 재시도 전 대기 시간 (밀리초, 0 이상)
 * @param multiplier 백오프 배수 (1.0 이상)
 * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상)
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, double multiplier, long maxDelayMs) {

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must not be negative (current: " + baseDelayMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
    }

    /**
     * Job 생성 충돌 재시도 기본값: 5회, 10초부터 2배.
     */
    public static RetryPolicy jobStart() {
        return new RetryPolicy(5, 10_000, 2.0, 300_000);
    }

    /**
     * 제어 평면 throttling 재시도 기본값: 3회, 1초부터 2배.
     */
    public static RetryPolicy throttling() {
        return new RetryPolicy(3, 1_000, 2.0, 30_000);
    }

    /**
     * 재시도 없이 한 번만 시도.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, 0, 1.0, 0);
    }

    /**
     * n번째 재시도 전 대기 시간.
     *
     * @param retry 재시도 번호 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException retry가 양수가 아닌 경우
     */
    public long delayBeforeRetry(int retry) {
        if (retry <= 0) {
            throw new IllegalArgumentException("retry must be positive (current: " + retry + ")");
        }
        double delay = baseDelayMs * Math.pow(multiplier, retry - 1);
        return (long) Math.min(delay, maxDelayMs);
    }

    /**
     * 주어진 시도 이후에 재시도할 수 있는지 확인.
     *
     * @param attempt 방금 끝난 시도 번호 (1부터 시작)
     * @return 남은 시도가 있으면 true
     */
    public boolean canRetryAfter(int attempt) {
        return attempt < maxAttempts;
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelayMs, multiplier, maxDelayMs);
    }

    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, multiplier, Math.max(maxDelayMs, baseDelayMs));
    }
}
