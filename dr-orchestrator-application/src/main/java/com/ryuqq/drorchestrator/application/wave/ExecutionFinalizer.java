package com.ryuqq.drorchestrator.application.wave;

import com.ryuqq.drorchestrator.core.codec.ExecutionDocument;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.spi.ServerReservations;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 실행 종료 처리.
 *
 * <p><strong>상태 결정:</strong></p>
 * <ul>
 *   <li>모든 Wave 완료 → COMPLETED</li>
 *   <li>실패 Wave 존재 → FAILED</li>
 *   <li>그 외 → COMPLETED_WITH_WARNINGS</li>
 * </ul>
 *
 * <p>CANCELLED와 TIMEOUT은 호출자가 직접 지정합니다. 모든 경로에서 종료 시각, 소요 시간,
 * allWavesCompleted를 기록하고 저장한 뒤 서버 예약을 해제합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ExecutionFinalizer {

    private static final Logger log = LoggerFactory.getLogger(ExecutionFinalizer.class);

    static final String CANCELLED_REASON = "Cancelled by request";

    private final ExecutionStore executionStore;
    private final ServerReservations reservations;
    private final Clock clock;

    public ExecutionFinalizer(ExecutionStore executionStore, ServerReservations reservations, Clock clock) {
        if (executionStore == null) {
            throw new IllegalArgumentException("executionStore cannot be null");
        }
        if (reservations == null) {
            throw new IllegalArgumentException("reservations cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.executionStore = executionStore;
        this.reservations = reservations;
        this.clock = clock;
    }

    /**
     * Wave 상태로 최종 상태를 결정하여 종료.
     */
    public Execution finalizeExecution(Execution execution) {
        ExecutionStatus finalStatus;
        if (execution.allWavesIn(WaveStatus.COMPLETED)) {
            finalStatus = ExecutionStatus.COMPLETED;
        } else if (execution.anyWaveIn(WaveStatus.FAILED)) {
            finalStatus = ExecutionStatus.FAILED;
        } else {
            finalStatus = ExecutionStatus.COMPLETED_WITH_WARNINGS;
        }
        return finish(execution, finalStatus, null);
    }

    /**
     * 종료되지 않은 Wave를 모두 취소하고 CANCELLED로 종료.
     */
    public Execution cancel(Execution execution) {
        Instant now = clock.instant();
        for (Wave wave : execution.getWaves()) {
            wave.cancelIfActive(now);
        }
        return finish(execution, ExecutionStatus.CANCELLED, CANCELLED_REASON);
    }

    /**
     * 지정 상태로 종료.
     *
     * @param execution 실행
     * @param finalStatus 종료 상태
     * @param reason 사유 (null이면 결과 요약 사용)
     * @return 저장된 실행
     */
    public Execution finish(Execution execution, ExecutionStatus finalStatus, String reason) {
        ExecutionSummary summary = ExecutionOutcomeAnalyzer.analyze(execution.getWaves());
        execution.finish(finalStatus, clock.instant(), reason == null ? summary.summary() : reason);
        Execution saved = executionStore.update(execution);

        try {
            reservations.release(saved.getKey());
        } catch (RuntimeException e) {
            log.error("Failed to release server reservations: key={}", saved.getKey(), e);
        }

        log.info("Execution finalized: key={}, status={}, outcome={}, duration={}s",
            saved.getKey(), finalStatus, summary.outcome(), saved.getDurationSeconds());
        if (log.isDebugEnabled()) {
            log.debug("Final execution document: {}", ExecutionDocument.toJson(saved));
        }
        return saved;
    }
}
