package com.ryuqq.drorchestrator.core.spi;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 복구 제어 평면 클라이언트 SPI.
 *
 * <p>하나의 인스턴스는 하나의 리전/계정 범위에 묶여 있으며,
 * {@link ControlPlaneProvider}를 통해 얻습니다.</p>
 *
 * <p><strong>오류 계약:</strong> 모든 호출 실패는 {@link ControlPlaneException}으로 보고되어야 합니다.
 * 구현체는 블로킹 호출에 타임아웃을 걸어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RecoveryControlPlane {

    /**
     * 복구 Job 생성.
     *
     * @param drill 훈련 여부
     * @param sourceServerIds 대상 서버 ID (비어 있을 수 없음)
     * @return 생성된 Job ID
     * @throws ControlPlaneException 생성 실패 시 (충돌은 {@link ControlPlaneException#isConflict()})
     */
    String startRecovery(boolean drill, List<String> sourceServerIds);

    /**
     * Job 조회.
     *
     * @param jobId Job ID
     * @return Job 스냅샷 (없으면 empty)
     */
    Optional<RecoveryJob> describeJob(String jobId);

    /**
     * 유형과 상태로 필터링한 Job 목록 조회.
     *
     * @param type Job 유형
     * @param statuses 포함할 상태
     * @return Job 목록
     */
    List<RecoveryJob> describeJobs(JobType type, Set<JobStatus> statuses);

    /**
     * Job 이벤트 로그 조회 (오래된 순).
     */
    List<JobLogItem> describeJobLogItems(String jobId);

    /**
     * 서버 단위 기동 구성 갱신.
     *
     * @param sourceServerId 서버 ID
     * @param settings 제어 평면이 허용하는 필드만 포함한 구성
     */
    void updateLaunchConfiguration(String sourceServerId, Map<String, Object> settings);

    /**
     * 서버의 EC2 기동 템플릿 갱신.
     *
     * <p>새 템플릿 버전을 만들고 기본 버전으로 지정합니다.</p>
     *
     * @param sourceServerId 서버 ID
     * @param settings 템플릿 설정 (비어 있지 않음)
     * @throws ControlPlaneException 갱신 실패 시 (서버에 템플릿이 없으면 {@link ControlPlaneException#isNotFound()})
     */
    void updateLaunchTemplate(String sourceServerId, LaunchTemplateSettings settings);

    /**
     * 현재 범위에서 보이는 모든 소스 서버 조회.
     */
    List<SourceServer> describeSourceServers();

    /**
     * 복구 인스턴스 메타데이터 조회.
     */
    Optional<InstanceDetails> describeInstance(String recoveryInstanceId);
}
