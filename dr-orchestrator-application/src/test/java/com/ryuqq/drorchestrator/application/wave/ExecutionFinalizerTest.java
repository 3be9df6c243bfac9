package com.ryuqq.drorchestrator.application.wave;

import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.model.WaveResult;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.spi.ServerReservations;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import com.ryuqq.drorchestrator.testkit.fake.ManualClock;
import com.ryuqq.drorchestrator.testkit.fixture.DrFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ExecutionFinalizer 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ExecutionFinalizerTest {

    @Mock
    private ExecutionStore executionStore;

    @Mock
    private ServerReservations reservations;

    private ManualClock clock;
    private ExecutionFinalizer finalizer;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(DrFixtures.T0);
        finalizer = new ExecutionFinalizer(executionStore, reservations, clock);
    }

    private static Execution twoWaves() {
        return DrFixtures.execution(DrFixtures.plan("plan-1", "pg-1", "pg-2"), "exec-1", ExecutionType.DRILL);
    }

    private void completeWave(Execution execution, int waveNumber) {
        Wave wave = execution.wave(waveNumber).orElseThrow();
        wave.start("drsjob-" + waveNumber, DrFixtures.REGION, List.of("s-" + waveNumber), clock.instant());
        execution.recordWaveStarted(wave, new WaveResult(waveNumber, wave.getWaveName(), wave.getProtectionGroupId(),
            wave.getJobId(), DrFixtures.REGION, wave.getServerIds(), clock.instant()));
        wave.complete(wave.getServers(), clock.instant());
        execution.markWaveCompleted();
    }

    private void returnSaved() {
        when(executionStore.update(any(Execution.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void finalizeExecution_모든_Wave_완료면_COMPLETED() {
        // given
        returnSaved();
        Execution execution = twoWaves();
        completeWave(execution, 0);
        completeWave(execution, 1);
        clock.advance(Duration.ofMinutes(5));

        // when
        Execution saved = finalizer.finalizeExecution(execution);

        // then
        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(saved.getDurationSeconds()).isEqualTo(300L);
        assertThat(saved.isAllWavesCompleted()).isTrue();
        verify(reservations).release(execution.getKey());
    }

    @Test
    void finalizeExecution_실패_Wave가_있으면_FAILED() {
        // given
        returnSaved();
        Execution execution = twoWaves();
        completeWave(execution, 0);
        execution.wave(1).orElseThrow().fail(ErrorCode.PROTECTION_GROUP_NOT_FOUND, "missing", clock.instant());

        // when & then
        assertThat(finalizer.finalizeExecution(execution).getStatus()).isEqualTo(ExecutionStatus.FAILED);
    }

    @Test
    void finalizeExecution_실패_없이_미완료_Wave가_남으면_COMPLETED_WITH_WARNINGS() {
        // given
        returnSaved();
        Execution execution = twoWaves();
        completeWave(execution, 0);

        // when
        Execution saved = finalizer.finalizeExecution(execution);

        // then
        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.COMPLETED_WITH_WARNINGS);
        assertThat(saved.getStatusReason()).isEqualTo("1 of 2 waves completed; 1/1 servers launched");
    }

    @Test
    void cancel_종료되지_않은_Wave만_취소함() {
        // given
        returnSaved();
        Execution execution = twoWaves();
        completeWave(execution, 0);

        // when
        Execution saved = finalizer.cancel(execution);

        // then
        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(saved.wave(0).orElseThrow().getStatus()).isEqualTo(WaveStatus.COMPLETED);
        assertThat(saved.wave(1).orElseThrow().getStatus()).isEqualTo(WaveStatus.CANCELLED);
        assertThat(saved.getStatusReason()).isEqualTo(ExecutionFinalizer.CANCELLED_REASON);
    }

    @Test
    void finish_예약_해제_실패는_종료를_되돌리지_않음() {
        // given
        returnSaved();
        Execution execution = twoWaves();
        doThrow(new IllegalStateException("lock table unavailable")).when(reservations).release(any());

        // when
        Execution saved = finalizer.finish(execution, ExecutionStatus.TIMEOUT, "Execution timed out");

        // then
        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(saved.getStatusReason()).isEqualTo("Execution timed out");
    }
}
