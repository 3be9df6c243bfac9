package com.ryuqq.drorchestrator.core.config;

/**
 * 제어 평면 서비스 쿼터 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxServersPerJob: Job 하나(=Wave 하나)의 최대 서버 수 (기본 100)</li>
 *   <li>maxConcurrentJobs: 리전당 동시 활성 Job 수 (기본 20, 현재 수가 이 값 이상이면 위반)</li>
 *   <li>maxServersInAllJobs: 리전당 활성 Job에 포함된 총 서버 수 (기본 500, 초과 시 위반)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxServersPerJob Job당 최대 서버 수 (양수)
 * @param maxConcurrentJobs 동시 Job 최대 수 (양수)
 * @param maxServersInAllJobs 전체 Job 최대 서버 수 (양수)
 */
public record QuotaLimits(int maxServersPerJob, int maxConcurrentJobs, int maxServersInAllJobs) {

    public QuotaLimits() {
        this(100, 20, 500);
    }

    public QuotaLimits {
        if (maxServersPerJob <= 0) {
            throw new IllegalArgumentException(
                "maxServersPerJob must be positive (current: " + maxServersPerJob + ")"
            );
        }
        if (maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentJobs must be positive (current: " + maxConcurrentJobs + ")"
            );
        }
        if (maxServersInAllJobs <= 0) {
            throw new IllegalArgumentException(
                "maxServersInAllJobs must be positive (current: " + maxServersInAllJobs + ")"
            );
        }
    }

    public QuotaLimits withMaxServersPerJob(int maxServersPerJob) {
        return new QuotaLimits(maxServersPerJob, maxConcurrentJobs, maxServersInAllJobs);
    }

    public QuotaLimits withMaxConcurrentJobs(int maxConcurrentJobs) {
        return new QuotaLimits(maxServersPerJob, maxConcurrentJobs, maxServersInAllJobs);
    }

    public QuotaLimits withMaxServersInAllJobs(int maxServersInAllJobs) {
        return new QuotaLimits(maxServersPerJob, maxConcurrentJobs, maxServersInAllJobs);
    }
}
