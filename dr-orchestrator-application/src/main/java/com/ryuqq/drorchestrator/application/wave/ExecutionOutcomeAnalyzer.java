package com.ryuqq.drorchestrator.application.wave;

import com.ryuqq.drorchestrator.core.model.LaunchStatus;
import com.ryuqq.drorchestrator.core.model.ServerStatus;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;

import java.util.List;

/**
 * Wave 상태로부터 실행 결과 요약 생성.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionOutcomeAnalyzer {

    // Utility class - prevent instantiation
    private ExecutionOutcomeAnalyzer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ExecutionSummary analyze(List<Wave> waves) {
        if (waves == null) {
            throw new IllegalArgumentException("waves cannot be null");
        }
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        int servers = 0;
        int launched = 0;
        int failedServers = 0;

        for (Wave wave : waves) {
            if (wave.getStatus() == WaveStatus.COMPLETED) {
                completed++;
            } else if (wave.getStatus() == WaveStatus.FAILED || wave.getStatus() == WaveStatus.TIMEOUT) {
                failed++;
            } else if (wave.getStatus() == WaveStatus.CANCELLED) {
                cancelled++;
            }
            for (ServerStatus server : wave.getServers()) {
                servers++;
                if (server.launchStatus() == LaunchStatus.LAUNCHED) {
                    launched++;
                } else if (server.launchStatus().isFailure()) {
                    failedServers++;
                }
            }
        }

        ExecutionOutcome outcome;
        if (cancelled > 0) {
            outcome = ExecutionOutcome.CANCELLED;
        } else if (completed == waves.size()) {
            outcome = ExecutionOutcome.COMPLETED;
        } else if (completed == 0) {
            outcome = ExecutionOutcome.FAILED;
        } else {
            outcome = ExecutionOutcome.PARTIAL;
        }
        return new ExecutionSummary(outcome, waves.size(), completed, failed, cancelled, servers, launched, failedServers);
    }
}
