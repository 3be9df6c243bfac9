package com.ryuqq.drorchestrator.core.outcome;

import com.ryuqq.drorchestrator.core.model.ServerStatus;

import java.util.List;

/**
 * 한 번의 poll에서 관찰한 Wave 판정 결과.
 *
 * <ul>
 *   <li>{@link WaveCompleted}: 모든 서버 기동 완료</li>
 *   <li>{@link WaveInProgress}: 아직 진행 중</li>
 *   <li>{@link WaveFailed}: 영구 실패</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface WaveOutcome permits WaveCompleted, WaveInProgress, WaveFailed {

    /**
     * 제어 평면 보고값으로 만든 서버 스냅샷.
     */
    List<ServerStatus> servers();

    default boolean isCompleted() {
        return this instanceof WaveCompleted;
    }

    default boolean isFailed() {
        return this instanceof WaveFailed;
    }
}
