package com.ryuqq.drorchestrator.adapter.runner;

import com.ryuqq.drorchestrator.application.wave.ExecutionFinalizer;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.model.WaveResult;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import com.ryuqq.drorchestrator.testkit.fake.ManualClock;
import com.ryuqq.drorchestrator.testkit.fixture.DrFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ExecutionReaper 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>임계값을 넘긴 실행만 TIMEOUT 처리</li>
 *   <li>진행 중 Wave의 TIMEOUT 표시</li>
 *   <li>배치 크기 제한</li>
 *   <li>개별 실패 시에도 계속 진행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ExecutionReaperTest {

    @Mock
    private ExecutionStore executionStore;

    @Mock
    private ExecutionFinalizer finalizer;

    private ManualClock clock;
    private ExecutionReaper reaper;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(DrFixtures.T0);
        reaper = new ExecutionReaper(executionStore, finalizer, new ReaperConfig(), clock);
    }

    private static Execution running(String executionId) {
        Execution execution = DrFixtures.execution(
            DrFixtures.plan("plan-1", "pg-1", "pg-2"), executionId, ExecutionType.DRILL);
        Wave wave = execution.wave(0).orElseThrow();
        wave.start("drsjob-" + executionId, DrFixtures.REGION, List.of("s-1"), DrFixtures.T0);
        execution.recordWaveStarted(wave, new WaveResult(0, null, "pg-1", wave.getJobId(),
            DrFixtures.REGION, wave.getServerIds(), DrFixtures.T0));
        return execution;
    }

    // ============================================================
    // 1. 임계값
    // ============================================================

    @Test
    void scan_임계값을_넘긴_실행을_TIMEOUT으로_종료함() {
        // given
        when(executionStore.findActive()).thenReturn(List.of(running("exec-1")));
        clock.advance(Duration.ofDays(366));

        // when
        int reaped = reaper.scan();

        // then
        ArgumentCaptor<Execution> captor = ArgumentCaptor.forClass(Execution.class);
        verify(finalizer).finish(captor.capture(), eq(ExecutionStatus.TIMEOUT),
            eq("Execution timed out after 31536000s without completing"));
        assertThat(reaped).isEqualTo(1);
        assertThat(captor.getValue().wave(0).orElseThrow().getStatus()).isEqualTo(WaveStatus.TIMEOUT);
        assertThat(captor.getValue().wave(1).orElseThrow().getStatus()).isEqualTo(WaveStatus.PENDING);
    }

    @Test
    void scan_임계값_이내의_실행은_건드리지_않음() {
        // given
        when(executionStore.findActive()).thenReturn(List.of(running("exec-1")));
        clock.advance(Duration.ofDays(30));

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isZero();
        verify(finalizer, never()).finish(any(), any(), anyString());
    }

    @Test
    void scan_원본_실행_객체를_변경하지_않음() {
        // given
        Execution original = running("exec-1");
        when(executionStore.findActive()).thenReturn(List.of(original));
        clock.advance(Duration.ofDays(366));

        // when
        reaper.scan();

        // then
        assertThat(original.wave(0).orElseThrow().getStatus()).isEqualTo(WaveStatus.STARTED);
    }

    // ============================================================
    // 2. 배치 처리
    // ============================================================

    @Test
    void scan_배치_크기만큼만_처리함() {
        // given
        reaper = new ExecutionReaper(executionStore, finalizer, new ReaperConfig().withBatchSize(2), clock);
        when(executionStore.findActive()).thenReturn(List.of(running("exec-1"), running("exec-2"), running("exec-3")));
        clock.advance(Duration.ofDays(366));

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isEqualTo(2);
        verify(finalizer, times(2)).finish(any(), eq(ExecutionStatus.TIMEOUT), anyString());
    }

    @Test
    void scan_개별_실패가_나도_다음_실행을_계속_처리함() {
        // given
        when(executionStore.findActive()).thenReturn(List.of(running("exec-1"), running("exec-2")));
        when(finalizer.finish(argThat(e -> e != null && e.getExecutionId().equals("exec-1")),
            eq(ExecutionStatus.TIMEOUT), anyString()))
            .thenThrow(new IllegalStateException("version mismatch"));
        clock.advance(Duration.ofDays(366));

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isEqualTo(1);
        verify(finalizer, times(2)).finish(any(), eq(ExecutionStatus.TIMEOUT), anyString());
    }

    // ============================================================
    // 3. 설정 검증
    // ============================================================

    @Test
    void config_잘못된_값이면_예외() {
        assertThatThrownBy(() -> new ReaperConfig(Duration.ZERO, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeoutThreshold must be positive");
        assertThatThrownBy(() -> new ReaperConfig().withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize must be positive (current: 0)");
    }

    @Test
    void constructor_null_의존성이면_예외() {
        assertThatThrownBy(() -> new ExecutionReaper(null, finalizer, new ReaperConfig(), clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("executionStore cannot be null");
    }
}
