package com.ryuqq.drorchestrator.adapter.runner;

import com.ryuqq.drorchestrator.application.wave.ExecutionFinalizer;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 장기 미종료 실행 정리.
 *
 * <p>스케줄러가 poll을 멈춘 채 남은 실행(호스트 장애, 체크포인트 유실 등)을 찾아
 * TIMEOUT으로 종료합니다. 진행 중인 Wave도 TIMEOUT으로 표시되고 서버 예약이 해제됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. findActive() → 시작 시각이 (now - timeoutThreshold) 이전인 실행만 선택
 * 2. 오래된 순으로 batchSize개까지 처리
 * 3. 개별 실패는 로깅 후 다음 항목 진행
 * </pre>
 *
 * <p>다른 호출이 먼저 갱신한 실행은 버전 불일치로 실패하며, 다음 scan에서 다시 평가됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionReaper {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReaper.class);

    private final ExecutionStore executionStore;
    private final ExecutionFinalizer finalizer;
    private final ReaperConfig config;
    private final Clock clock;

    public ExecutionReaper(ExecutionStore executionStore, ExecutionFinalizer finalizer,
                           ReaperConfig config, Clock clock) {
        if (executionStore == null) {
            throw new IllegalArgumentException("executionStore cannot be null");
        }
        if (finalizer == null) {
            throw new IllegalArgumentException("finalizer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.executionStore = executionStore;
        this.finalizer = finalizer;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 장기 미종료 실행 스캔 및 종료.
     *
     * @return TIMEOUT으로 종료한 실행 수
     */
    public int scan() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.timeoutThreshold());

        List<Execution> stale = executionStore.findActive().stream()
            .filter(e -> e.getStartTime() != null && e.getStartTime().isBefore(cutoff))
            .sorted((a, b) -> a.getStartTime().compareTo(b.getStartTime()))
            .limit(config.batchSize())
            .toList();

        int reaped = 0;
        for (Execution execution : stale) {
            if (tryReap(execution, now)) {
                reaped++;
            }
        }

        if (!stale.isEmpty()) {
            log.info("Reaper scan completed: {} timed out out of {} stale", reaped, stale.size());
        }
        return reaped;
    }

    private boolean tryReap(Execution execution, Instant now) {
        try {
            Execution working = execution.copy();
            for (Wave wave : working.getWaves()) {
                if (wave.getStatus().isRunning()) {
                    wave.timeout("Execution exceeded " + config.timeoutThreshold().getSeconds() + "s", now);
                }
            }
            finalizer.finish(working, ExecutionStatus.TIMEOUT,
                "Execution timed out after " + config.timeoutThreshold().getSeconds() + "s without completing");
            log.warn("Reaper timed out stale execution: key={}, startedAt={}",
                execution.getKey(), execution.getStartTime());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to reap execution {}", execution.getKey(), e);
            return false;
        }
    }
}
