package com.ryuqq.drorchestrator.application.wave;

import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.exception.PersistenceException;
import com.ryuqq.drorchestrator.core.exception.WaveTimeoutException;
import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ServerStatus;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.outcome.WaveCompleted;
import com.ryuqq.drorchestrator.core.outcome.WaveClassifier;
import com.ryuqq.drorchestrator.core.outcome.WaveFailed;
import com.ryuqq.drorchestrator.core.outcome.WaveInProgress;
import com.ryuqq.drorchestrator.core.outcome.WaveOutcome;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneProvider;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.spi.InstanceDetails;
import com.ryuqq.drorchestrator.core.spi.JobLogItem;
import com.ryuqq.drorchestrator.core.spi.ProtectionGroupStore;
import com.ryuqq.drorchestrator.core.spi.RecoveryControlPlane;
import com.ryuqq.drorchestrator.core.spi.RecoveryJob;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 실행 중 Wave 폴링.
 *
 * <p><strong>Wave 상태 흐름:</strong></p>
 * <pre>
 * STARTED → {LAUNCHING, CONVERTING} → IN_PROGRESS → {COMPLETED, FAILED, TIMEOUT, CANCELLED}
 * </pre>
 *
 * <p><strong>한 번의 poll:</strong></p>
 * <ol>
 *   <li>취소 요청 확인 (CANCELLING이면 즉시 CANCELLED)</li>
 *   <li>Job 핸들이 없으면 no-op</li>
 *   <li>대기 예산 확인 (초과 시 TIMEOUT, 제어 평면 조회 없음)</li>
 *   <li>Job 조회 및 판정</li>
 *   <li>완료 시 다음 Wave 시작, 일시정지, 또는 실행 종료</li>
 * </ol>
 *
 * <p>lastPolledTime 갱신과 인스턴스 정보 보강은 실패해도 폴링을 계속합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WavePoller {

    private static final Logger log = LoggerFactory.getLogger(WavePoller.class);

    private final ExecutionStore executionStore;
    private final ProtectionGroupStore groupStore;
    private final ControlPlaneProvider controlPlaneProvider;
    private final WaveExecutor waveExecutor;
    private final ExecutionFinalizer finalizer;
    private final Clock clock;

    public WavePoller(ExecutionStore executionStore, ProtectionGroupStore groupStore,
                      ControlPlaneProvider controlPlaneProvider, WaveExecutor waveExecutor,
                      ExecutionFinalizer finalizer, Clock clock) {
        if (executionStore == null || groupStore == null || controlPlaneProvider == null
            || waveExecutor == null || finalizer == null || clock == null) {
            throw new IllegalArgumentException("WavePoller dependencies cannot be null");
        }
        this.executionStore = executionStore;
        this.groupStore = groupStore;
        this.controlPlaneProvider = controlPlaneProvider;
        this.waveExecutor = waveExecutor;
        this.finalizer = finalizer;
        this.clock = clock;
    }

    /**
     * 한 번의 poll 수행.
     *
     * @param execution 저장된 실행 (전달된 객체는 변경되지 않음)
     * @return 갱신된 실행
     */
    public Execution poll(Execution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        Execution working = execution.copy();
        Instant now = clock.instant();

        // 1. 취소 확인
        if (isCancelling(working)) {
            log.info("Cancellation observed at poll start: key={}", working.getKey());
            return finalizer.cancel(reload(working));
        }

        touchLastPolled(working, now);

        // 2. Job 핸들 없음
        if (!working.hasJobHandle()) {
            log.debug("No active job, nothing to poll: key={}", working.getKey());
            working.markNoActiveJob();
            return working;
        }

        Wave wave = working.currentWave()
            .orElseThrow(() -> new IllegalStateException("Current wave missing: " + working.getKey()));

        // 3. 대기 예산
        long totalWait = working.addPollInterval();
        if (working.isWaitBudgetExhausted()) {
            String message = new WaveTimeoutException(wave.getWaveNumber(), totalWait).getMessage();
            log.warn("Wave timed out: key={}, wave={}, waited={}s", working.getKey(), wave.getWaveNumber(), totalWait);
            wave.timeout(message, now);
            working.recordError(ErrorCode.WAVE_TIMEOUT, message);
            return finalizer.finish(working, ExecutionStatus.TIMEOUT, message);
        }

        // 4. Job 조회
        RecoveryControlPlane client = clientFor(working, wave);
        Optional<RecoveryJob> job;
        try {
            job = client.describeJob(working.getJobId());
        } catch (ControlPlaneException e) {
            if (!e.isNotFound()) {
                log.warn("Job query failed, will retry next poll: key={}, jobId={}",
                    working.getKey(), working.getJobId(), e);
                return executionStore.update(working);
            }
            job = Optional.empty();
        }
        if (job.isEmpty()) {
            return failWave(working, wave, ErrorCode.DRS_JOB_NOT_FOUND,
                "DRS job " + working.getJobId() + " not found");
        }

        // 5. 판정
        WaveOutcome outcome = WaveClassifier.classify(job.get(), working.getType());
        if (outcome instanceof WaveFailed failed) {
            if (failed.errorCode() == ErrorCode.DRS_JOB_COMPLETED_WITHOUT_LAUNCH) {
                log.error("Control plane inconsistency, job completed without launch: key={}, jobId={}, {}",
                    working.getKey(), working.getJobId(), failed.message());
            }
            if (!failed.servers().isEmpty()) {
                wave.replaceServers(failed.servers());
            }
            return failWave(working, wave, failed.errorCode(), failed.message());
        }
        if (outcome instanceof WaveInProgress progress) {
            WaveStatus phase = JobPhaseDetector.detect(jobLog(client, working.getJobId()), progress);
            wave.progress(phase, progress.servers().isEmpty() ? wave.getServers() : progress.servers());
            log.debug("Wave in progress: key={}, wave={}, phase={}, launched={}/{}",
                working.getKey(), wave.getWaveNumber(), phase, progress.launchedCount(), progress.total());
            return executionStore.update(working);
        }

        // 6. 완료
        List<ServerStatus> enriched = enrich(client, ((WaveCompleted) outcome).servers(), wave);
        complete(working, wave, enriched, now);
        log.info("Wave completed: key={}, wave={}, servers={}", working.getKey(), wave.getWaveNumber(), enriched.size());

        if (isCancelling(working)) {
            log.info("Cancellation observed after wave completion: key={}", working.getKey());
            Execution fresh = reload(working);
            fresh.currentWave().ifPresent(freshWave -> complete(fresh, freshWave, enriched, now));
            return finalizer.cancel(fresh);
        }

        Optional<Wave> next = working.nextWave(wave.getWaveNumber());
        if (next.isEmpty()) {
            return finalizer.finalizeExecution(working);
        }
        if (next.get().isPauseBeforeWave()) {
            working.pauseBefore(next.get().getWaveNumber());
            log.info("Execution paused before wave: key={}, wave={}", working.getKey(), next.get().getWaveNumber());
            return executionStore.update(working);
        }
        Execution saved = executionStore.update(working);
        return waveExecutor.startWave(saved, next.get().getWaveNumber(), null);
    }

    private void complete(Execution execution, Wave wave, List<ServerStatus> servers, Instant now) {
        if (wave.getStatus().isTerminal()) {
            return;
        }
        wave.complete(servers, now);
        execution.markWaveCompleted();
    }

    private Execution failWave(Execution execution, Wave wave, ErrorCode errorCode, String message) {
        log.warn("Wave failed: key={}, wave={}, code={}, message={}",
            execution.getKey(), wave.getWaveNumber(), errorCode, message);
        wave.fail(errorCode, message, clock.instant());
        execution.markWaveFailed(errorCode, message);
        return finalizer.finish(execution, ExecutionStatus.FAILED, message);
    }

    private boolean isCancelling(Execution execution) {
        try {
            return executionStore.readStatus(execution.getKey())
                .map(status -> status == ExecutionStatus.CANCELLING)
                .orElse(false);
        } catch (RuntimeException e) {
            log.warn("Cancellation check failed, continuing poll: key={}", execution.getKey(), e);
            return false;
        }
    }

    private Execution reload(Execution execution) {
        return executionStore.find(execution.getKey())
            .orElseThrow(() -> new PersistenceException("Execution disappeared: " + execution.getKey()));
    }

    private void touchLastPolled(Execution execution, Instant now) {
        execution.setLastPolledTime(now);
        try {
            executionStore.updateLastPolledTime(execution.getKey(), now);
        } catch (RuntimeException e) {
            log.warn("Failed to update last polled time: key={}", execution.getKey(), e);
        }
    }

    private RecoveryControlPlane clientFor(Execution execution, Wave wave) {
        AccountContext context = AccountContexts.effective(execution.getAccountContext(),
            groupStore.find(wave.getProtectionGroupId()).orElse(null));
        return controlPlaneProvider.clientFor(execution.getRegion(), context);
    }

    private List<JobLogItem> jobLog(RecoveryControlPlane client, String jobId) {
        try {
            return client.describeJobLogItems(jobId);
        } catch (ControlPlaneException e) {
            log.warn("Could not fetch job log items: jobId={}", jobId, e);
            return List.of();
        }
    }

    /**
     * 복구 인스턴스 정보 보강 (best-effort).
     */
    private List<ServerStatus> enrich(RecoveryControlPlane client, List<ServerStatus> servers, Wave wave) {
        List<ServerStatus> enriched = new ArrayList<>(servers.size());
        for (ServerStatus server : servers) {
            ServerStatus current = server;
            String knownName = wave.server(server.sourceServerId()).map(ServerStatus::serverName).orElse(null);
            if (knownName != null) {
                current = current.withServerName(knownName);
            }
            if (server.recoveryInstanceId() != null) {
                try {
                    Optional<InstanceDetails> details = client.describeInstance(server.recoveryInstanceId());
                    if (details.isPresent()) {
                        InstanceDetails instance = details.get();
                        current = current.withInstanceDetails(instance.hostname(), instance.privateIp(),
                            instance.publicIp(), instance.instanceType(), instance.launchTime());
                    }
                } catch (ControlPlaneException e) {
                    log.warn("Instance enrichment failed: serverId={}, instanceId={}",
                        server.sourceServerId(), server.recoveryInstanceId(), e);
                }
            }
            enriched.add(current);
        }
        return enriched;
    }
}
