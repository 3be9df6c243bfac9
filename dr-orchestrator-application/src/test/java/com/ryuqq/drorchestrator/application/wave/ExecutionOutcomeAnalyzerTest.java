package com.ryuqq.drorchestrator.application.wave;

import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.model.LaunchStatus;
import com.ryuqq.drorchestrator.core.model.ServerStatus;
import com.ryuqq.drorchestrator.core.model.Wave;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ExecutionOutcomeAnalyzer 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExecutionOutcomeAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static Wave completed(int number, String... serverIds) {
        Wave wave = new Wave(number, null, "pg-" + number, false);
        wave.start("drsjob-" + number, "us-east-1", List.of(serverIds), NOW);
        wave.complete(List.of(serverIds).stream()
            .map(id -> ServerStatus.reported(id, LaunchStatus.LAUNCHED, "i-" + id))
            .toList(), NOW);
        return wave;
    }

    private static Wave failed(int number) {
        Wave wave = new Wave(number, null, "pg-" + number, false);
        wave.start("drsjob-" + number, "us-east-1", List.of("f-" + number), NOW);
        wave.replaceServers(List.of(ServerStatus.reported("f-" + number, LaunchStatus.FAILED, null)));
        wave.fail(ErrorCode.WAVE_LAUNCH_FAILED, "1 of 1 servers failed to launch", NOW);
        return wave;
    }

    private static Wave pending(int number) {
        return new Wave(number, null, "pg-" + number, false);
    }

    @Test
    void analyze_모든_Wave_완료면_COMPLETED() {
        ExecutionSummary summary = ExecutionOutcomeAnalyzer.analyze(List.of(completed(0, "s-1"), completed(1, "s-2")));

        assertThat(summary.outcome()).isEqualTo(ExecutionOutcome.COMPLETED);
        assertThat(summary.launchedServers()).isEqualTo(2);
        assertThat(summary.summary()).isEqualTo("2 of 2 waves completed; 2/2 servers launched");
    }

    @Test
    void analyze_일부만_완료면_PARTIAL() {
        ExecutionSummary summary = ExecutionOutcomeAnalyzer.analyze(List.of(completed(0, "s-1"), failed(1), pending(2)));

        assertThat(summary.outcome()).isEqualTo(ExecutionOutcome.PARTIAL);
        assertThat(summary.completedWaves()).isEqualTo(1);
        assertThat(summary.failedWaves()).isEqualTo(1);
        assertThat(summary.failedServers()).isEqualTo(1);
        assertThat(summary.summary()).isEqualTo("1 of 3 waves completed, 1 failed; 1/2 servers launched");
    }

    @Test
    void analyze_완료된_Wave가_없으면_FAILED() {
        ExecutionSummary summary = ExecutionOutcomeAnalyzer.analyze(List.of(failed(0), pending(1)));

        assertThat(summary.outcome()).isEqualTo(ExecutionOutcome.FAILED);
    }

    @Test
    void analyze_취소된_Wave가_있으면_CANCELLED가_우선함() {
        Wave cancelled = pending(1);
        cancelled.cancelIfActive(NOW);

        ExecutionSummary summary = ExecutionOutcomeAnalyzer.analyze(List.of(completed(0, "s-1"), cancelled));

        assertThat(summary.outcome()).isEqualTo(ExecutionOutcome.CANCELLED);
        assertThat(summary.summary()).isEqualTo("1 of 2 waves completed, 1 cancelled; 1/1 servers launched");
    }
}
