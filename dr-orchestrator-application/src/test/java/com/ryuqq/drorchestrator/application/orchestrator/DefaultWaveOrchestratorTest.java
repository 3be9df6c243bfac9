package com.ryuqq.drorchestrator.application.orchestrator;

import com.ryuqq.drorchestrator.application.DrHarness;
import com.ryuqq.drorchestrator.application.wave.WavePoller;
import com.ryuqq.drorchestrator.core.config.OrchestratorConfig;
import com.ryuqq.drorchestrator.core.config.QuotaLimits;
import com.ryuqq.drorchestrator.core.exception.ConflictException;
import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.exception.NotFoundException;
import com.ryuqq.drorchestrator.core.exception.QuotaExceededException;
import com.ryuqq.drorchestrator.core.exception.ValidationException;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionKey;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.model.RecoveryPlan;
import com.ryuqq.drorchestrator.core.model.WaveDefinition;
import com.ryuqq.drorchestrator.core.model.WaveResult;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import com.ryuqq.drorchestrator.testkit.fixture.DrFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * DefaultWaveOrchestrator 테스트.
 *
 * <p>진입점 경계 규칙과 전체 흐름을 in-memory 환경에서 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultWaveOrchestratorTest {

    @Mock
    private WavePoller brokenPoller;

    private DrHarness harness;
    private WaveOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        harness = new DrHarness();
        orchestrator = harness.orchestrator;
        harness.groupStore.save(DrFixtures.explicitGroup("pg-1", "s-1", "s-2"));
        harness.groupStore.save(DrFixtures.explicitGroup("pg-2", "s-3"));
    }

    private static RecoveryPlan twoWavePlan() {
        return DrFixtures.plan("plan-1", "pg-1", "pg-2");
    }

    // ============================================================
    // 1. begin
    // ============================================================

    @Test
    void begin_충돌이_없으면_PENDING_실행을_저장함() {
        // when
        Execution created = orchestrator.begin(twoWavePlan(), "exec-1", ExecutionType.DRILL, null, "alice");

        // then
        assertThat(created.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(created.getInitiatedBy()).isEqualTo("alice");
        assertThat(created.getWaves()).hasSize(2);
        assertThat(created.getStartTime()).isEqualTo(harness.clock.instant());
        assertThat(harness.stored(created).getVersion()).isEqualTo(created.getVersion());
    }

    @Test
    void begin_다른_계획의_실행과_서버가_겹치면_ConflictException() {
        // given
        harness.started(DrFixtures.plan("plan-other", "pg-1"), "exec-x", ExecutionType.DRILL);

        // when & then
        assertThatThrownBy(() -> orchestrator.begin(twoWavePlan(), "exec-1", ExecutionType.DRILL, null, "alice"))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("s-1");
        assertThat(harness.executionStore.find(ExecutionKey.of("exec-1", "plan-1"))).isEmpty();
    }

    @Test
    void begin_쿼터를_넘으면_QuotaExceededException() {
        // given
        DrHarness limited = new DrHarness(new OrchestratorConfig().withQuotaLimits(new QuotaLimits(1, 20, 500)));
        limited.groupStore.save(DrFixtures.explicitGroup("pg-1", "s-1", "s-2"));

        // when & then
        assertThatThrownBy(() -> limited.orchestrator.begin(
            DrFixtures.plan("plan-1", "pg-1"), "exec-1", ExecutionType.DRILL, null, "alice"))
            .isInstanceOf(QuotaExceededException.class)
            .hasMessageContaining("Wave 0 has 2 servers (limit: 1)");
    }

    // ============================================================
    // 2. startWave / poll
    // ============================================================

    @Test
    void startWave_없는_실행이면_NotFoundException() {
        assertThatThrownBy(() -> orchestrator.startWave(ExecutionKey.of("missing", "plan-1"), 0, null))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void startWave_검증_실패는_예외_없이_현재_상태를_반환함() {
        // given
        Execution created = orchestrator.begin(twoWavePlan(), "exec-1", ExecutionType.DRILL, null, "alice");

        // when
        Execution result = orchestrator.startWave(created.getKey(), 7, null);

        // then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(result.getVersion()).isEqualTo(created.getVersion());
        assertThat(harness.drs.startRecoveryCalls()).isZero();
    }

    @Test
    void poll_종료된_실행은_그대로_반환함() {
        // given
        Execution created = orchestrator.begin(twoWavePlan(), "exec-1", ExecutionType.DRILL, null, "alice");
        Execution cancelled = orchestrator.requestCancellation(created.getKey());

        // when
        Execution polled = orchestrator.poll(created);

        // then
        assertThat(polled.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(polled.getVersion()).isEqualTo(cancelled.getVersion());
        assertThat(harness.drs.describeJobCalls()).isZero();
    }

    @Test
    void poll_예상하지_못한_실패는_INTERNAL_ERROR로_종료함() {
        // given
        Execution started = harness.started(twoWavePlan(), "exec-1", ExecutionType.DRILL);
        when(brokenPoller.poll(any(Execution.class))).thenThrow(new IllegalStateException("boom"));
        DefaultWaveOrchestrator guarded = new DefaultWaveOrchestrator(harness.executionStore,
            harness.admissionController, harness.waveExecutor, brokenPoller, harness.finalizer,
            harness.config, harness.clock);

        // when
        Execution result = guarded.poll(started);

        // then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(result.getError()).isEqualTo("Internal error: boom");
        assertThat(harness.stored(started).getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(harness.reservations.holderOf("s-1")).isEmpty();
    }

    // ============================================================
    // 3. resume
    // ============================================================

    @Test
    void resume_일시정지된_실행의_다음_Wave를_시작함() {
        // given
        RecoveryPlan plan = new RecoveryPlan("plan-1", "plan-1", List.of(
            WaveDefinition.of(0, "pg-1"),
            new WaveDefinition(1, "db tier", "pg-2", true)));
        Execution started = harness.started(plan, "exec-1", ExecutionType.DRILL);
        harness.drs.launchAll(started.getJobId());
        Execution paused = orchestrator.poll(started);

        // when
        Execution resumed = orchestrator.resume(paused);

        // then
        assertThat(paused.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(resumed.getStatus()).isEqualTo(ExecutionStatus.POLLING);
        assertThat(resumed.getPausedBeforeWave()).isNull();
        assertThat(resumed.wave(1).orElseThrow().getStatus()).isEqualTo(WaveStatus.STARTED);
        assertThat(resumed.getJobId()).isEqualTo("drsjob-2");
    }

    @Test
    void resume_일시정지가_아니면_상태를_바꾸지_않음() {
        // given
        Execution started = harness.started(twoWavePlan(), "exec-1", ExecutionType.DRILL);

        // when
        Execution result = orchestrator.resume(started);

        // then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.POLLING);
        assertThat(result.getVersion()).isEqualTo(started.getVersion());
        assertThat(harness.drs.startRecoveryCalls()).isEqualTo(1);
    }

    // ============================================================
    // 4. requestCancellation
    // ============================================================

    @Test
    void requestCancellation_Job_진행_중이면_CANCELLING_후_다음_poll에서_종료함() {
        // given
        Execution started = harness.started(twoWavePlan(), "exec-1", ExecutionType.DRILL);

        // when
        Execution cancelling = orchestrator.requestCancellation(started.getKey());
        Execution again = orchestrator.requestCancellation(started.getKey());
        Execution polled = orchestrator.poll(cancelling);

        // then
        assertThat(cancelling.getStatus()).isEqualTo(ExecutionStatus.CANCELLING);
        assertThat(again.getVersion()).isEqualTo(cancelling.getVersion());
        assertThat(polled.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(polled.wave(0).orElseThrow().getStatus()).isEqualTo(WaveStatus.CANCELLED);
        assertThat(polled.wave(1).orElseThrow().getStatus()).isEqualTo(WaveStatus.CANCELLED);
    }

    @Test
    void requestCancellation_Job이_없으면_즉시_CANCELLED() {
        // given
        Execution created = orchestrator.begin(twoWavePlan(), "exec-1", ExecutionType.DRILL, null, "alice");

        // when
        Execution cancelled = orchestrator.requestCancellation(created.getKey());

        // then
        assertThat(cancelled.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(cancelled.getStatusReason()).isEqualTo("Cancelled by request");
        assertThat(cancelled.getEndTime()).isNotNull();
    }

    @Test
    void requestCancellation_이미_종료된_실행이면_ValidationException() {
        // given
        Execution created = orchestrator.begin(twoWavePlan(), "exec-1", ExecutionType.DRILL, null, "alice");
        orchestrator.requestCancellation(created.getKey());

        // when & then
        assertThatThrownBy(() -> orchestrator.requestCancellation(created.getKey()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("already CANCELLED");
    }

    // ============================================================
    // 5. 전체 흐름
    // ============================================================

    @Test
    void 전체_흐름_두_Wave_DRILL이_COMPLETED로_끝남() {
        // given
        Execution execution = orchestrator.begin(twoWavePlan(), "exec-1", ExecutionType.DRILL, null, "alice");

        // when
        execution = orchestrator.startWave(execution.getKey(), 0, null);
        harness.drs.launchAll(execution.getJobId());
        execution = orchestrator.poll(execution);
        harness.drs.launchAll(execution.getJobId());
        execution = orchestrator.poll(execution);

        // then
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.getCompletedWaves()).isEqualTo(2);
        assertThat(execution.getWaveResults()).extracting(WaveResult::jobId).containsExactly("drsjob-1", "drsjob-2");
        assertThat(execution.getStatusReason()).isEqualTo("2 of 2 waves completed; 3/3 servers launched");
        assertThat(harness.drs.lastStartWasDrill()).isTrue();
    }
}
