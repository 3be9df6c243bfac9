package com.ryuqq.drorchestrator.adapter.runner;

import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * poll 대상 실행 선별.
 *
 * <p>호스트 스케줄러가 주기적으로 호출하여 이번 회차에 poll할 실행을 얻습니다.</p>
 *
 * <ul>
 *   <li>PAUSED: 재개 요청 전까지 대상 아님</li>
 *   <li>CANCELLING: 즉시 대상 (다음 poll에서 종료 처리)</li>
 *   <li>한 번도 poll되지 않은 실행: 즉시 대상</li>
 *   <li>그 외: 현재 Wave 단계별 간격이 지났으면 대상</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionFinder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionFinder.class);

    private final ExecutionStore executionStore;
    private final FinderConfig config;

    public ExecutionFinder(ExecutionStore executionStore, FinderConfig config) {
        if (executionStore == null) {
            throw new IllegalArgumentException("executionStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.executionStore = executionStore;
        this.config = config;
    }

    /**
     * poll 대상 실행 조회.
     *
     * @param now 기준 시각
     * @return poll 대상 실행 (마지막 poll이 오래된 순)
     */
    public List<Execution> findDue(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        List<Execution> due = executionStore.findActive().stream()
            .filter(e -> isDue(e, now))
            .sorted((a, b) -> compareLastPolled(a.getLastPolledTime(), b.getLastPolledTime()))
            .toList();
        log.debug("Found {} executions due for poll", due.size());
        return due;
    }

    /**
     * 단일 실행의 poll 필요 여부.
     */
    boolean isDue(Execution execution, Instant now) {
        ExecutionStatus status = execution.getStatus();
        if (!status.isActive() || status == ExecutionStatus.PAUSED) {
            return false;
        }
        if (status == ExecutionStatus.CANCELLING || execution.getLastPolledTime() == null) {
            return true;
        }
        Duration interval = intervalFor(execution);
        return !execution.getLastPolledTime().plus(interval).isAfter(now);
    }

    /**
     * 현재 Wave 단계에 맞는 poll 간격.
     */
    Duration intervalFor(Execution execution) {
        WaveStatus phase = execution.wave(execution.getCurrentWaveNumber())
            .map(Wave::getStatus)
            .orElse(WaveStatus.PENDING);
        if (phase == WaveStatus.STARTED) {
            return config.startedInterval();
        }
        if (phase.isRunning()) {
            return config.inProgressInterval();
        }
        return config.pendingInterval();
    }

    // null(미poll)을 가장 앞에 둡니다
    private static int compareLastPolled(Instant a, Instant b) {
        if (a == null) {
            return b == null ? 0 : -1;
        }
        if (b == null) {
            return 1;
        }
        return a.compareTo(b);
    }
}
