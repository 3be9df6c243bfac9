package com.ryuqq.drorchestrator.core.exception;

/**
 * 오케스트레이터 전역 오류 코드.
 *
 * <p>Wave/Execution 실패 시 {@code errorCode} 필드에 그대로 저장되며,
 * UI 레이어가 이 이름을 직접 소비하므로 이름 변경은 마이그레이션 대상입니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>입력/구성 오류: VALIDATION_ERROR, NO_SERVER_SELECTION_CONFIGURED, NO_SERVERS_MATCH_TAGS</li>
 *   <li>조회 실패: NOT_FOUND, PROTECTION_GROUP_NOT_FOUND, DRS_JOB_NOT_FOUND</li>
 *   <li>충돌/쿼터: SERVER_CONFLICT, QUOTA_EXCEEDED, DRS_CONFLICT_EXCEPTION</li>
 *   <li>실행 실패: DRS_START_RECOVERY_FAILED, WAVE_LAUNCH_FAILED, DRS_JOB_NO_SERVERS,
 *       DRS_JOB_COMPLETED_WITHOUT_LAUNCH</li>
 *   <li>시간 초과: WAVE_TIMEOUT, EXECUTION_TIMEOUT</li>
 *   <li>인프라: APPLICATION_ERROR, PERSISTENCE_ERROR, INTERNAL_ERROR</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    VALIDATION_ERROR,
    NOT_FOUND,
    PROTECTION_GROUP_NOT_FOUND,
    NO_SERVER_SELECTION_CONFIGURED,
    NO_SERVERS_MATCH_TAGS,
    SERVER_RESOLUTION_FAILED,
    SERVER_CONFLICT,
    QUOTA_EXCEEDED,
    DRS_CONFLICT_EXCEPTION,
    DRS_START_RECOVERY_FAILED,
    DRS_JOB_NOT_FOUND,
    DRS_JOB_NO_SERVERS,
    DRS_JOB_COMPLETED_WITHOUT_LAUNCH,
    WAVE_LAUNCH_FAILED,
    WAVE_TIMEOUT,
    EXECUTION_TIMEOUT,
    APPLICATION_ERROR,
    PERSISTENCE_ERROR,
    INTERNAL_ERROR
}
