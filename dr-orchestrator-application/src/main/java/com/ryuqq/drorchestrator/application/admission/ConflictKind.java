package com.ryuqq.drorchestrator.application.admission;

/**
 * 승인 검사 결과 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConflictKind {

    /** 다른 활성 실행이 점유 중인 서버 */
    EXECUTION("execution"),

    /** 오케스트레이터 밖에서 시작된 실행 중 Job에 참여 중인 서버 */
    DRS_JOB("drs_job"),

    /** 제어 평면 할당량 위반 */
    QUOTA_VIOLATION("quota_violation");

    private final String wireValue;

    ConflictKind(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
