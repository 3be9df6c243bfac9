package com.ryuqq.drorchestrator.core.outcome;

import com.ryuqq.drorchestrator.core.model.ServerStatus;

import java.util.List;

/**
 * 아직 진행 중. 부분 스냅샷은 저장됩니다.
 *
 * @param servers 서버 스냅샷
 * @param launchedCount 기동 완료 서버 수
 * @param total 전체 서버 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WaveInProgress(List<ServerStatus> servers, int launchedCount, int total) implements WaveOutcome {

    public WaveInProgress {
        servers = List.copyOf(servers);
    }

    /**
     * 일부만 기동된 상태인지 확인.
     */
    public boolean isPartiallyLaunched() {
        return launchedCount > 0 && launchedCount < total;
    }
}
