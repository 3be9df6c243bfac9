package com.ryuqq.drorchestrator.core.outcome;

import com.ryuqq.drorchestrator.core.model.ServerStatus;

import java.util.List;

/**
 * 모든 서버가 LAUNCHED이고 실패가 없음.
 *
 * @param servers 서버 스냅샷
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WaveCompleted(List<ServerStatus> servers) implements WaveOutcome {

    public WaveCompleted {
        servers = List.copyOf(servers);
    }
}
