package com.ryuqq.drorchestrator.core.model;

import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionTransition;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 다중 Wave DR 실행 애그리거트.
 *
 * <p>Execution은 Wave를 값으로 소유합니다. 상태 전이는 {@link ExecutionTransition}으로 검증되며,
 * 종료 상태 이후에는 어떤 변경도 허용되지 않습니다.</p>
 *
 * <p><strong>폴링 예산:</strong></p>
 * <ul>
 *   <li>currentWaveUpdateTime: poll 간격 (초, 기본 30)</li>
 *   <li>currentWaveTotalWaitTime: 현재 Wave의 누적 대기 시간 (초)</li>
 *   <li>currentWaveMaxWaitTime: 현재 Wave의 최대 대기 시간 (초, 기본 31536000)</li>
 * </ul>
 *
 * <p>{@code version}은 저장소의 조건부 쓰기 가드로만 사용되며 저장소가 관리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Execution {

    private final ExecutionKey key;
    private final String planName;
    private final ExecutionType type;
    private final AccountContext accountContext;
    private final String initiatedBy;
    private final List<Wave> waves;
    private final List<WaveResult> waveResults;

    private ExecutionStatus status;
    private Instant startTime;
    private Instant endTime;
    private Long durationSeconds;
    private Instant lastPolledTime;
    private Integer pausedBeforeWave;

    private int currentWaveNumber;
    private String jobId;
    private String region;
    private List<String> serverIds;

    private boolean waveCompleted;
    private boolean allWavesCompleted;
    private int completedWaves;
    private int failedWaves;

    private long currentWaveUpdateTime;
    private long currentWaveTotalWaitTime;
    private long currentWaveMaxWaitTime;

    private String error;
    private ErrorCode errorCode;
    private String statusReason;

    private long version;

    private Execution(ExecutionKey key, String planName, ExecutionType type, AccountContext accountContext,
                      String initiatedBy, List<Wave> waves) {
        this.key = key;
        this.planName = planName;
        this.type = type;
        this.accountContext = accountContext;
        this.initiatedBy = initiatedBy;
        this.waves = waves;
        this.waveResults = new ArrayList<>();
        this.serverIds = List.of();
    }

    /**
     * 계획으로부터 새 실행 생성 (PENDING).
     *
     * @param plan 복구 계획
     * @param executionId 실행 ID
     * @param type 실행 유형
     * @param accountContext 대상 계정 (null이면 현재 계정)
     * @param initiatedBy 요청자
     * @param now 시작 시각
     * @param updateTimeSeconds poll 간격 (초)
     * @param maxWaitSeconds Wave 최대 대기 시간 (초)
     * @return 새 실행
     */
    public static Execution begin(RecoveryPlan plan, String executionId, ExecutionType type,
                                  AccountContext accountContext, String initiatedBy, Instant now,
                                  long updateTimeSeconds, long maxWaitSeconds) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (updateTimeSeconds <= 0 || maxWaitSeconds <= 0) {
            throw new IllegalArgumentException(
                "wait times must be positive (update: " + updateTimeSeconds + ", max: " + maxWaitSeconds + ")"
            );
        }
        List<Wave> waves = new ArrayList<>();
        for (WaveDefinition definition : plan.waves()) {
            waves.add(Wave.from(definition));
        }
        Execution execution = new Execution(
            ExecutionKey.of(executionId, plan.planId()),
            plan.planName(),
            type,
            accountContext == null ? AccountContext.current() : accountContext,
            initiatedBy,
            waves
        );
        execution.status = ExecutionStatus.PENDING;
        execution.startTime = now;
        execution.currentWaveNumber = waves.get(0).getWaveNumber();
        execution.currentWaveUpdateTime = updateTimeSeconds;
        execution.currentWaveMaxWaitTime = maxWaitSeconds;
        return execution;
    }

    /**
     * 깊은 복사본 생성 (Wave 포함).
     */
    public Execution copy() {
        List<Wave> copiedWaves = new ArrayList<>();
        for (Wave wave : waves) {
            copiedWaves.add(wave.copy());
        }
        Execution copy = new Execution(key, planName, type, accountContext, initiatedBy, copiedWaves);
        copy.waveResults.addAll(waveResults);
        copy.status = status;
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.durationSeconds = durationSeconds;
        copy.lastPolledTime = lastPolledTime;
        copy.pausedBeforeWave = pausedBeforeWave;
        copy.currentWaveNumber = currentWaveNumber;
        copy.jobId = jobId;
        copy.region = region;
        copy.serverIds = serverIds;
        copy.waveCompleted = waveCompleted;
        copy.allWavesCompleted = allWavesCompleted;
        copy.completedWaves = completedWaves;
        copy.failedWaves = failedWaves;
        copy.currentWaveUpdateTime = currentWaveUpdateTime;
        copy.currentWaveTotalWaitTime = currentWaveTotalWaitTime;
        copy.currentWaveMaxWaitTime = currentWaveMaxWaitTime;
        copy.error = error;
        copy.errorCode = errorCode;
        copy.statusReason = statusReason;
        copy.version = version;
        return copy;
    }

    /**
     * 지정 버전을 가진 복사본. 저장소 전용입니다.
     */
    public Execution withVersion(long version) {
        Execution copy = copy();
        copy.version = version;
        return copy;
    }

    // ============================================================
    // 상태 변경
    // ============================================================

    public void transitionTo(ExecutionStatus next) {
        this.status = ExecutionTransition.transition(status, next);
    }

    /**
     * Wave 시작 기록. Job 핸들을 저장하고 대기 시간 카운터를 초기화합니다.
     */
    public void recordWaveStarted(Wave wave, WaveResult result) {
        ensureNotTerminal();
        transitionTo(ExecutionStatus.POLLING);
        this.currentWaveNumber = wave.getWaveNumber();
        this.jobId = wave.getJobId();
        this.region = wave.getRegion();
        this.serverIds = wave.getServerIds();
        this.waveCompleted = false;
        this.currentWaveTotalWaitTime = 0;
        this.waveResults.add(result);
    }

    /**
     * 대기 시간을 poll 간격만큼 증가.
     *
     * @return 증가 후 누적 대기 시간 (초)
     */
    public long addPollInterval() {
        ensureNotTerminal();
        this.currentWaveTotalWaitTime += currentWaveUpdateTime;
        return currentWaveTotalWaitTime;
    }

    public boolean isWaitBudgetExhausted() {
        return currentWaveTotalWaitTime >= currentWaveMaxWaitTime;
    }

    public void markWaveCompleted() {
        ensureNotTerminal();
        this.completedWaves++;
        this.waveCompleted = true;
    }

    public void markWaveFailed(ErrorCode errorCode, String error) {
        ensureNotTerminal();
        this.failedWaves++;
        this.waveCompleted = true;
        this.errorCode = errorCode;
        this.error = error;
    }

    /**
     * 현재 Wave를 완료로 간주 (Job 핸들이 없는 경우).
     */
    public void markNoActiveJob() {
        this.waveCompleted = true;
    }

    public void recordError(ErrorCode errorCode, String error) {
        ensureNotTerminal();
        this.errorCode = errorCode;
        this.error = error;
    }

    /**
     * 다음 Wave 시작 전 일시정지.
     */
    public void pauseBefore(int waveNumber) {
        transitionTo(ExecutionStatus.PAUSED);
        this.pausedBeforeWave = waveNumber;
        this.currentWaveNumber = waveNumber;
        this.jobId = null;
        this.region = null;
        this.serverIds = List.of();
    }

    /**
     * 일시정지 해제.
     *
     * @return 재개할 Wave 번호
     * @throws IllegalStateException 일시정지 상태가 아닌 경우
     */
    public int clearPause() {
        if (status != ExecutionStatus.PAUSED || pausedBeforeWave == null) {
            throw new IllegalStateException("Execution " + key + " is not paused (status: " + status + ")");
        }
        int resumeAt = pausedBeforeWave;
        this.pausedBeforeWave = null;
        transitionTo(ExecutionStatus.RUNNING);
        return resumeAt;
    }

    /**
     * 실행 종료. 종료 시각과 소요 시간을 기록하고 모든 Wave를 완료로 표시합니다.
     */
    public void finish(ExecutionStatus finalStatus, Instant now, String statusReason) {
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("finalStatus must be terminal (current: " + finalStatus + ")");
        }
        transitionTo(finalStatus);
        this.endTime = now;
        this.durationSeconds = startTime == null ? null : Duration.between(startTime, now).getSeconds();
        this.allWavesCompleted = true;
        this.waveCompleted = true;
        if (statusReason != null) {
            this.statusReason = statusReason;
        }
    }

    public void setLastPolledTime(Instant lastPolledTime) {
        this.lastPolledTime = lastPolledTime;
    }

    private void ensureNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + key + " is terminal (" + status + ")");
        }
    }

    // ============================================================
    // 조회
    // ============================================================

    public Optional<Wave> wave(int waveNumber) {
        return waves.stream().filter(w -> w.getWaveNumber() == waveNumber).findFirst();
    }

    /**
     * 주어진 Wave 다음 Wave.
     */
    public Optional<Wave> nextWave(int waveNumber) {
        return waves.stream()
            .filter(w -> w.getWaveNumber() > waveNumber)
            .min((a, b) -> Integer.compare(a.getWaveNumber(), b.getWaveNumber()));
    }

    public Optional<Wave> currentWave() {
        return wave(currentWaveNumber);
    }

    public boolean hasJobHandle() {
        return jobId != null && !jobId.isBlank();
    }

    public boolean allWavesIn(WaveStatus waveStatus) {
        return waves.stream().allMatch(w -> w.getStatus() == waveStatus);
    }

    public boolean anyWaveIn(WaveStatus waveStatus) {
        return waves.stream().anyMatch(w -> w.getStatus() == waveStatus);
    }

    public ExecutionKey getKey() {
        return key;
    }

    public String getExecutionId() {
        return key.executionId();
    }

    public String getPlanId() {
        return key.planId();
    }

    public String getPlanName() {
        return planName;
    }

    public ExecutionType getType() {
        return type;
    }

    public AccountContext getAccountContext() {
        return accountContext;
    }

    public String getInitiatedBy() {
        return initiatedBy;
    }

    public List<Wave> getWaves() {
        return Collections.unmodifiableList(waves);
    }

    public List<WaveResult> getWaveResults() {
        return Collections.unmodifiableList(waveResults);
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Long getDurationSeconds() {
        return durationSeconds;
    }

    public Instant getLastPolledTime() {
        return lastPolledTime;
    }

    public Integer getPausedBeforeWave() {
        return pausedBeforeWave;
    }

    public int getCurrentWaveNumber() {
        return currentWaveNumber;
    }

    public String getJobId() {
        return jobId;
    }

    public String getRegion() {
        return region;
    }

    public List<String> getServerIds() {
        return serverIds;
    }

    public boolean isWaveCompleted() {
        return waveCompleted;
    }

    public boolean isAllWavesCompleted() {
        return allWavesCompleted;
    }

    public int getCompletedWaves() {
        return completedWaves;
    }

    public int getFailedWaves() {
        return failedWaves;
    }

    public long getCurrentWaveUpdateTime() {
        return currentWaveUpdateTime;
    }

    public long getCurrentWaveTotalWaitTime() {
        return currentWaveTotalWaitTime;
    }

    public long getCurrentWaveMaxWaitTime() {
        return currentWaveMaxWaitTime;
    }

    public String getError() {
        return error;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getStatusReason() {
        return statusReason;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "Execution{" + key + ", " + status + ", wave=" + currentWaveNumber + ", v" + version + "}";
    }
}
