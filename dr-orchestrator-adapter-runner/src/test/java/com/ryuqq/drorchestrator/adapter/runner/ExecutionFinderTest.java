package com.ryuqq.drorchestrator.adapter.runner;

import com.ryuqq.drorchestrator.adapter.inmemory.store.InMemoryExecutionStore;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.model.ServerStatus;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.model.WaveResult;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import com.ryuqq.drorchestrator.testkit.fixture.DrFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutionFinder 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExecutionFinderTest {

    private static final Instant T0 = DrFixtures.T0;

    private InMemoryExecutionStore store;
    private ExecutionFinder finder;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionStore();
        finder = new ExecutionFinder(store, new FinderConfig());
    }

    private Execution created(String executionId) {
        return store.create(DrFixtures.execution(DrFixtures.plan("plan-1", "pg-1"), executionId, ExecutionType.DRILL));
    }

    private Execution started(String executionId, WaveStatus phase) {
        Execution execution = DrFixtures.execution(DrFixtures.plan("plan-1", "pg-1"), executionId, ExecutionType.DRILL);
        Wave wave = execution.wave(0).orElseThrow();
        wave.start("drsjob-" + executionId, DrFixtures.REGION, List.of("s-1"), T0);
        execution.recordWaveStarted(wave, new WaveResult(0, null, "pg-1", wave.getJobId(),
            DrFixtures.REGION, wave.getServerIds(), T0));
        if (phase != WaveStatus.STARTED) {
            wave.progress(phase, List.of(ServerStatus.pending("s-1")));
        }
        return store.create(execution);
    }

    private void polledAt(Execution execution, Instant at) {
        store.updateLastPolledTime(execution.getKey(), at);
    }

    private static List<String> ids(List<Execution> executions) {
        return executions.stream().map(Execution::getExecutionId).toList();
    }

    @Test
    void findDue_한번도_poll되지_않은_실행은_즉시_대상() {
        // given
        created("exec-1");

        // when & then
        assertThat(ids(finder.findDue(T0))).containsExactly("exec-1");
    }

    @Test
    void findDue_STARTED_단계는_15초_간격() {
        // given
        Execution execution = started("exec-1", WaveStatus.STARTED);
        polledAt(execution, T0);

        // when & then
        assertThat(finder.findDue(T0.plusSeconds(14))).isEmpty();
        assertThat(ids(finder.findDue(T0.plusSeconds(15)))).containsExactly("exec-1");
    }

    @Test
    void findDue_진행_단계는_30초_간격() {
        // given
        Execution launching = started("exec-1", WaveStatus.LAUNCHING);
        Execution inProgress = started("exec-2", WaveStatus.IN_PROGRESS);
        polledAt(launching, T0);
        polledAt(inProgress, T0);

        // when & then
        assertThat(finder.findDue(T0.plusSeconds(29))).isEmpty();
        assertThat(ids(finder.findDue(T0.plusSeconds(30)))).containsExactlyInAnyOrder("exec-1", "exec-2");
    }

    @Test
    void findDue_PENDING_단계는_45초_간격() {
        // given
        Execution execution = created("exec-1");
        polledAt(execution, T0);

        // when & then
        assertThat(finder.findDue(T0.plusSeconds(44))).isEmpty();
        assertThat(ids(finder.findDue(T0.plusSeconds(45)))).containsExactly("exec-1");
    }

    @Test
    void findDue_일시정지와_종료된_실행은_제외하고_CANCELLING은_포함함() {
        // given
        Execution paused = started("exec-paused", WaveStatus.STARTED);
        Execution working = paused.copy();
        working.wave(0).orElseThrow().complete(List.of(), T0);
        working.markWaveCompleted();
        working.pauseBefore(1);
        store.update(working);

        Execution finished = created("exec-done");
        Execution done = finished.copy();
        done.finish(ExecutionStatus.CANCELLED, T0, "Cancelled by request");
        store.update(done);

        Execution cancelling = started("exec-cancelling", WaveStatus.STARTED);
        Execution marked = cancelling.copy();
        marked.transitionTo(ExecutionStatus.CANCELLING);
        polledAt(store.update(marked), T0);

        // when & then
        assertThat(ids(finder.findDue(T0.plusSeconds(1)))).containsExactly("exec-cancelling");
    }

    @Test
    void findDue_오래전에_poll된_실행이_먼저_반환됨() {
        // given
        Execution recent = started("exec-recent", WaveStatus.STARTED);
        Execution old = started("exec-old", WaveStatus.STARTED);
        created("exec-new");
        polledAt(recent, T0.plusSeconds(10));
        polledAt(old, T0);

        // when & then
        assertThat(ids(finder.findDue(T0.plus(Duration.ofMinutes(5)))))
            .containsExactly("exec-new", "exec-old", "exec-recent");
    }

    @Test
    void config_간격이_양수가_아니면_예외() {
        assertThatThrownBy(() -> new FinderConfig().withStartedInterval(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("startedInterval must be positive");
    }
}
