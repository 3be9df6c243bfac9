package com.ryuqq.drorchestrator.core.model;

import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import com.ryuqq.drorchestrator.core.statemachine.WaveTransition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Execution에 값으로 포함되는 Wave 상태.
 *
 * <p><strong>불변식:</strong> Wave는 동시에 하나의 활성 jobId만 가집니다.
 * 이전 Job의 모든 서버가 종료 상태에 도달하기 전에는 새 Job을 만들 수 없습니다.</p>
 *
 * <p>모든 상태 변경은 {@link WaveTransition}으로 검증됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Wave {

    private final int waveNumber;
    private final String waveName;
    private final String protectionGroupId;
    private final boolean pauseBeforeWave;

    private WaveStatus status;
    private String jobId;
    private String region;
    private List<String> serverIds;
    private List<ServerStatus> servers;
    private Instant startTime;
    private Instant endTime;
    private String error;
    private ErrorCode errorCode;
    private String statusMessage;

    public Wave(int waveNumber, String waveName, String protectionGroupId, boolean pauseBeforeWave) {
        if (waveNumber < 0) {
            throw new IllegalArgumentException("waveNumber must not be negative (current: " + waveNumber + ")");
        }
        if (protectionGroupId == null || protectionGroupId.isBlank()) {
            throw new IllegalArgumentException("protectionGroupId cannot be null or blank");
        }
        this.waveNumber = waveNumber;
        this.waveName = waveName;
        this.protectionGroupId = protectionGroupId;
        this.pauseBeforeWave = pauseBeforeWave;
        this.status = WaveStatus.PENDING;
        this.serverIds = List.of();
        this.servers = List.of();
    }

    public static Wave from(WaveDefinition definition) {
        return new Wave(definition.waveNumber(), definition.waveName(),
            definition.protectionGroupId(), definition.pauseBeforeWave());
    }

    /**
     * 깊은 복사본 생성.
     */
    public Wave copy() {
        Wave copy = new Wave(waveNumber, waveName, protectionGroupId, pauseBeforeWave);
        copy.status = status;
        copy.jobId = jobId;
        copy.region = region;
        copy.serverIds = serverIds;
        copy.servers = servers;
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.error = error;
        copy.errorCode = errorCode;
        copy.statusMessage = statusMessage;
        return copy;
    }

    /**
     * 새 Job을 만들 수 있는지 확인.
     *
     * @return Job이 없거나 이전 Job의 모든 서버가 종료 상태이면 true
     */
    public boolean canStartJob() {
        if (jobId == null) {
            return true;
        }
        return !servers.isEmpty() && servers.stream().allMatch(s -> s.launchStatus().isTerminal());
    }

    /**
     * Job 생성 기록 (STARTED 전이).
     *
     * @throws IllegalStateException 활성 Job이 있거나 전이가 유효하지 않은 경우
     */
    public void start(String jobId, String region, List<String> serverIds, Instant now) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        if (!canStartJob()) {
            throw new IllegalStateException(
                "Wave " + waveNumber + " already has active job " + this.jobId
            );
        }
        this.status = WaveTransition.transition(status, WaveStatus.STARTED);
        this.jobId = jobId;
        this.region = region;
        this.serverIds = List.copyOf(serverIds);
        this.servers = serverIds.stream().map(ServerStatus::pending).toList();
        this.startTime = now;
        this.endTime = null;
        this.error = null;
        this.errorCode = null;
    }

    /**
     * 진행 중 스냅샷 갱신.
     */
    public void progress(WaveStatus phase, List<ServerStatus> snapshot) {
        this.status = WaveTransition.transition(status, phase);
        this.servers = List.copyOf(snapshot);
    }

    public void complete(List<ServerStatus> snapshot, Instant now) {
        this.status = WaveTransition.transition(status, WaveStatus.COMPLETED);
        this.servers = List.copyOf(snapshot);
        this.endTime = now;
    }

    public void fail(ErrorCode errorCode, String error, Instant now) {
        this.status = WaveTransition.transition(status, WaveStatus.FAILED);
        this.errorCode = errorCode;
        this.error = error;
        this.endTime = now;
    }

    public void timeout(String error, Instant now) {
        this.status = WaveTransition.transition(status, WaveStatus.TIMEOUT);
        this.errorCode = ErrorCode.WAVE_TIMEOUT;
        this.error = error;
        this.endTime = now;
    }

    /**
     * 종료되지 않은 Wave를 취소. 이미 종료된 Wave는 그대로 둡니다.
     */
    public void cancelIfActive(Instant now) {
        if (status.isTerminal()) {
            return;
        }
        this.status = WaveTransition.transition(status, WaveStatus.CANCELLED);
        this.endTime = now;
    }

    public void replaceServers(List<ServerStatus> snapshot) {
        this.servers = List.copyOf(snapshot);
    }

    public void setStatusMessage(String statusMessage) {
        this.statusMessage = statusMessage;
    }

    public Optional<ServerStatus> server(String sourceServerId) {
        return servers.stream().filter(s -> s.sourceServerId().equals(sourceServerId)).findFirst();
    }

    public int getWaveNumber() {
        return waveNumber;
    }

    public String getWaveName() {
        return waveName;
    }

    public String getProtectionGroupId() {
        return protectionGroupId;
    }

    public boolean isPauseBeforeWave() {
        return pauseBeforeWave;
    }

    public WaveStatus getStatus() {
        return status;
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

    public List<ServerStatus> getServers() {
        return servers;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public String getError() {
        return error;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    @Override
    public String toString() {
        return "Wave{" + waveNumber + ", " + status + (jobId != null ? ", job=" + jobId : "") + "}";
    }
}
