package com.ryuqq.drorchestrator.application.wave;

import com.ryuqq.drorchestrator.application.admission.AdmissionController;
import com.ryuqq.drorchestrator.application.admission.Conflict;
import com.ryuqq.drorchestrator.application.admission.MembershipResolver;
import com.ryuqq.drorchestrator.application.launchconfig.ApplyResult;
import com.ryuqq.drorchestrator.application.launchconfig.DriftReport;
import com.ryuqq.drorchestrator.application.launchconfig.LaunchConfigService;
import com.ryuqq.drorchestrator.core.config.OrchestratorConfig;
import com.ryuqq.drorchestrator.core.exception.ApplicationException;
import com.ryuqq.drorchestrator.core.exception.ConflictException;
import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.exception.ValidationException;
import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.LaunchConfigStatus;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.model.WaveResult;
import com.ryuqq.drorchestrator.core.retry.RetryPolicy;
import com.ryuqq.drorchestrator.core.retry.Sleeper;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneProvider;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.spi.ProtectionGroupStore;
import com.ryuqq.drorchestrator.core.spi.RecoveryControlPlane;
import com.ryuqq.drorchestrator.core.spi.ServerReservations;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Wave 시작.
 *
 * <p><strong>처리 순서:</strong></p>
 * <pre>
 * 1. 사전 조건 (Wave 존재, 실행 미종료, 활성 Job 없음)
 * 2. 보호 그룹 조회
 * 3. 구성원 해석
 * 4. 승인 검사 (충돌, 할당량)
 * 5. 기동 구성 준비 (drift 없으면 생략)
 * 6. 서버 예약
 * 7. 복구 Job 생성 (충돌은 RetryPolicy에 따라 재시도)
 * 8. Job 핸들 기록 및 저장
 * </pre>
 *
 * <p>2~7단계의 실패는 Wave를 FAILED로 만들고 실행을 종료합니다.
 * 5단계의 문제는 기록만 하고 Job 생성을 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WaveExecutor {

    private static final Logger log = LoggerFactory.getLogger(WaveExecutor.class);

    static final String DRIFT_DETECTION = "drift-detection";
    static final String SYSTEM_ACTOR = "system";

    private final ExecutionStore executionStore;
    private final ProtectionGroupStore groupStore;
    private final MembershipResolver membershipResolver;
    private final AdmissionController admissionController;
    private final LaunchConfigService launchConfigService;
    private final ServerReservations reservations;
    private final ControlPlaneProvider controlPlaneProvider;
    private final ExecutionFinalizer finalizer;
    private final OrchestratorConfig config;
    private final Sleeper sleeper;
    private final Clock clock;

    public WaveExecutor(ExecutionStore executionStore, ProtectionGroupStore groupStore,
                        MembershipResolver membershipResolver, AdmissionController admissionController,
                        LaunchConfigService launchConfigService, ServerReservations reservations,
                        ControlPlaneProvider controlPlaneProvider, ExecutionFinalizer finalizer,
                        OrchestratorConfig config, Sleeper sleeper, Clock clock) {
        if (executionStore == null || groupStore == null || membershipResolver == null
            || admissionController == null || launchConfigService == null || reservations == null
            || controlPlaneProvider == null || finalizer == null || config == null
            || sleeper == null || clock == null) {
            throw new IllegalArgumentException("WaveExecutor dependencies cannot be null");
        }
        this.executionStore = executionStore;
        this.groupStore = groupStore;
        this.membershipResolver = membershipResolver;
        this.admissionController = admissionController;
        this.launchConfigService = launchConfigService;
        this.reservations = reservations;
        this.controlPlaneProvider = controlPlaneProvider;
        this.finalizer = finalizer;
        this.config = config;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Wave 시작.
     *
     * @param execution 저장된 실행 (전달된 객체는 변경되지 않음)
     * @param waveNumber 시작할 Wave 번호
     * @param accountContext 요청 계정 컨텍스트 (null이면 실행의 컨텍스트)
     * @return 저장된 실행 (성공 시 POLLING, 실패 시 FAILED)
     * @throws ValidationException 사전 조건을 만족하지 않는 경우
     */
    public Execution startWave(Execution execution, int waveNumber, AccountContext accountContext) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        Execution working = execution.copy();
        if (working.getStatus().isTerminal()) {
            throw new ValidationException(
                "Execution " + working.getKey() + " is already " + working.getStatus());
        }
        Wave wave = working.wave(waveNumber)
            .orElseThrow(() -> new ValidationException(
                "Wave " + waveNumber + " not found in execution " + working.getKey()));
        if (!wave.canStartJob()) {
            throw new ValidationException(
                "Wave " + waveNumber + " already has active job " + wave.getJobId());
        }

        log.info("Starting wave: key={}, wave={}, protectionGroup={}",
            working.getKey(), waveNumber, wave.getProtectionGroupId());

        // 2. 보호 그룹
        Optional<ProtectionGroup> found = groupStore.find(wave.getProtectionGroupId());
        if (found.isEmpty()) {
            return failWave(working, wave, ErrorCode.PROTECTION_GROUP_NOT_FOUND,
                "Protection group " + wave.getProtectionGroupId() + " not found");
        }
        ProtectionGroup group = found.get();
        AccountContext context = AccountContexts.effective(
            accountContext == null ? working.getAccountContext() : accountContext, group);

        // 3. 구성원
        if (!group.hasSelection()) {
            return failWave(working, wave, ErrorCode.NO_SERVER_SELECTION_CONFIGURED,
                "Protection group " + group.groupId() + " has no server selection configured");
        }
        List<String> serverIds;
        try {
            serverIds = membershipResolver.resolve(group, context);
        } catch (ApplicationException | ValidationException e) {
            return failWave(working, wave, ErrorCode.SERVER_RESOLUTION_FAILED, e.getMessage());
        }
        if (serverIds.isEmpty()) {
            return failWave(working, wave, ErrorCode.NO_SERVERS_MATCH_TAGS,
                "No servers match tags for protection group " + group.groupId());
        }

        // 4. 승인 검사
        List<Conflict> conflicts = admissionController.checkWave(
            working.getKey(), waveNumber, group.region(), serverIds, context);
        List<Conflict> serverConflicts = conflicts.stream().filter(c -> !c.isQuotaViolation()).toList();
        if (!serverConflicts.isEmpty()) {
            return failWave(working, wave, ErrorCode.SERVER_CONFLICT, describe(serverConflicts));
        }
        if (!conflicts.isEmpty()) {
            return failWave(working, wave, ErrorCode.QUOTA_EXCEEDED, describe(conflicts));
        }

        // 5. 기동 구성
        if (group.hasLaunchConfig()) {
            prepareLaunchConfig(working, wave, group, serverIds, context);
        }

        // 6. 서버 예약
        try {
            reservations.reserve(working.getKey(), serverIds);
        } catch (ConflictException e) {
            return failWave(working, wave, ErrorCode.SERVER_CONFLICT, e.getMessage());
        }

        // 7. Job 생성
        String jobId;
        try {
            jobId = createJob(working, group.region(), context, serverIds);
        } catch (JobStartFailure failure) {
            reservations.release(working.getKey());
            return failWave(working, wave, failure.errorCode, failure.getMessage());
        } catch (RuntimeException e) {
            reservations.release(working.getKey());
            throw e;
        }

        // 8. 기록
        Instant now = clock.instant();
        wave.start(jobId, group.region(), serverIds, now);
        working.recordWaveStarted(wave, new WaveResult(waveNumber, wave.getWaveName(),
            group.groupId(), jobId, group.region(), serverIds, now));
        Execution saved = executionStore.update(working);

        log.info("Wave started: key={}, wave={}, jobId={}, servers={}",
            saved.getKey(), waveNumber, jobId, serverIds.size());
        return saved;
    }

    /**
     * 기동 구성 준비. 실패는 Wave 상태 메시지로만 남깁니다.
     */
    private void prepareLaunchConfig(Execution execution, Wave wave, ProtectionGroup group,
                                     List<String> serverIds, AccountContext context) {
        try {
            Map<String, Map<String, Object>> configs = group.effectiveLaunchConfigs(serverIds);
            if (configs.isEmpty()) {
                return;
            }
            LaunchConfigStatus status = launchConfigService.getStatus(group.groupId());

            List<String> targets;
            String appliedBy;
            if (status.isReady()) {
                DriftReport drift = launchConfigService.detectDrift(group.groupId(), configs);
                if (!drift.hasDrift()) {
                    log.debug("Launch config ready without drift: groupId={}", group.groupId());
                    return;
                }
                targets = drift.driftedServers();
                appliedBy = DRIFT_DETECTION;
            } else {
                targets = new ArrayList<>(configs.keySet());
                appliedBy = execution.getInitiatedBy() == null ? SYSTEM_ACTOR : execution.getInitiatedBy();
            }

            ApplyResult result = launchConfigService.applyConfigs(group.groupId(), group.region(), targets,
                configs, config.applyTimeoutBudget(), context);
            launchConfigService.persistStatus(group.groupId(),
                launchConfigService.merge(status, result, appliedBy, serverIds));

            if (!result.isReady()) {
                String message = String.format("Launch configuration %s: %d applied, %d failed, %d pending",
                    result.status().wireValue(), result.appliedServers(), result.failedServers(),
                    result.pendingServers());
                log.warn("Launch configuration not fully applied: key={}, wave={}, {}",
                    execution.getKey(), wave.getWaveNumber(), message);
                wave.setStatusMessage(message);
            }
        } catch (RuntimeException e) {
            log.warn("Launch configuration preparation failed, continuing: key={}, wave={}",
                execution.getKey(), wave.getWaveNumber(), e);
            wave.setStatusMessage("Launch configuration not applied: " + e.getMessage());
        }
    }

    private String createJob(Execution execution, String region, AccountContext context, List<String> serverIds) {
        RecoveryControlPlane client;
        try {
            client = controlPlaneProvider.clientFor(region, context);
        } catch (ControlPlaneException e) {
            throw new JobStartFailure(ErrorCode.DRS_START_RECOVERY_FAILED,
                "Failed to create DRS client: " + e.getMessage());
        }

        RetryPolicy retry = config.jobStartRetry();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return client.startRecovery(execution.getType().isDrill(), serverIds);
            } catch (ControlPlaneException e) {
                if (!e.isConflict()) {
                    log.error("Recovery job start failed: key={}, code={}", execution.getKey(), e.getErrorCode(), e);
                    throw new JobStartFailure(ErrorCode.DRS_START_RECOVERY_FAILED,
                        "Failed to start DRS recovery: " + e.getMessage());
                }
                if (!retry.canRetryAfter(attempt)) {
                    log.error("Recovery job start conflict persisted: key={}, attempts={}",
                        execution.getKey(), attempt, e);
                    throw new JobStartFailure(ErrorCode.DRS_CONFLICT_EXCEPTION,
                        "DRS conflict after " + attempt + " attempts: " + e.getMessage());
                }
                long delay = retry.delayBeforeRetry(attempt);
                log.warn("Recovery job start conflict, retrying: key={}, attempt={}, delayMs={}",
                    execution.getKey(), attempt, delay);
                sleep(delay);
            }
        }
    }

    private void sleep(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApplicationException("Job start retry interrupted", e);
        }
    }

    private Execution failWave(Execution execution, Wave wave, ErrorCode errorCode, String message) {
        log.warn("Wave failed to start: key={}, wave={}, code={}, message={}",
            execution.getKey(), wave.getWaveNumber(), errorCode, message);
        wave.fail(errorCode, message, clock.instant());
        execution.markWaveFailed(errorCode, message);
        return finalizer.finish(execution, ExecutionStatus.FAILED, message);
    }

    private static String describe(List<Conflict> conflicts) {
        return conflicts.stream().map(Conflict::message).collect(Collectors.joining("; "));
    }

    /**
     * Job 생성 실패 (내부 제어 흐름용).
     */
    private static final class JobStartFailure extends RuntimeException {

        private final ErrorCode errorCode;

        JobStartFailure(ErrorCode errorCode, String message) {
            super(message);
            this.errorCode = errorCode;
        }
    }
}
