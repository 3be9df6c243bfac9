package com.ryuqq.drorchestrator.core.exception;

/**
 * Wave가 대기 예산을 초과함. 종료 상태이며 재시도하지 않습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WaveTimeoutException extends OrchestrationException {

    private final long elapsedSeconds;

    public WaveTimeoutException(int waveNumber, long elapsedSeconds) {
        super(ErrorCode.WAVE_TIMEOUT, "Wave " + waveNumber + " timed out after " + elapsedSeconds + "s");
        this.elapsedSeconds = elapsedSeconds;
    }

    public long getElapsedSeconds() {
        return elapsedSeconds;
    }
}
