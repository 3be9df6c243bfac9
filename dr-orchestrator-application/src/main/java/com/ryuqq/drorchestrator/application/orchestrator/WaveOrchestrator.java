package com.ryuqq.drorchestrator.application.orchestrator;

import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionKey;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.model.RecoveryPlan;

/**
 * 다중 Wave DR 오케스트레이터 진입점.
 *
 * <p>외부 스케줄러가 호출하는 짧은 수명의 상태 전이 함수들입니다.
 * 각 호출은 완료될 때까지 실행되며 갱신된 실행 상태를 반환합니다.
 * 루프, 타이머, 체크포인트는 호스트가 담당합니다.</p>
 *
 * <p><strong>경계 규칙:</strong> {@link #startWave}, {@link #poll}, {@link #resume}은
 * 예외를 밖으로 던지지 않습니다. 예상하지 못한 실패는 실행을 FAILED(INTERNAL_ERROR)로 기록하고
 * 그 상태를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Execution execution = orchestrator.begin(plan, "exec-1", ExecutionType.DRILL, null, "alice");
 * execution = orchestrator.startWave(execution.getKey(), 0, null);
 * while (!execution.getStatus().isTerminal() &amp;&amp; execution.getStatus() != ExecutionStatus.PAUSED) {
 *     sleep(pollInterval);
 *     execution = orchestrator.poll(execution);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WaveOrchestrator {

    /**
     * 새 실행 생성 (PENDING).
     *
     * <p>계획 전체 승인 검사를 통과해야 생성됩니다.</p>
     *
     * @param plan 복구 계획
     * @param executionId 실행 ID
     * @param type 실행 유형
     * @param accountContext 대상 계정 (null이면 현재 계정)
     * @param initiatedBy 요청자
     * @return 저장된 실행
     * @throws com.ryuqq.drorchestrator.core.exception.ConflictException 서버 충돌이 있는 경우
     * @throws com.ryuqq.drorchestrator.core.exception.QuotaExceededException 할당량을 초과하는 경우
     */
    Execution begin(RecoveryPlan plan, String executionId, ExecutionType type,
                    AccountContext accountContext, String initiatedBy);

    /**
     * Wave 시작.
     *
     * @param key 실행 키
     * @param waveNumber Wave 번호
     * @param accountContext 요청 계정 컨텍스트 (null이면 실행의 컨텍스트)
     * @return 갱신된 실행
     * @throws com.ryuqq.drorchestrator.core.exception.NotFoundException 실행이 없는 경우
     */
    Execution startWave(ExecutionKey key, int waveNumber, AccountContext accountContext);

    /**
     * 한 번의 poll.
     */
    Execution poll(Execution execution);

    /**
     * 일시정지 해제 후 저장된 Wave 시작.
     */
    Execution resume(Execution execution);

    /**
     * 취소 요청.
     *
     * <p>실행 중이면 CANCELLING으로 표시하고 다음 poll에서 종료됩니다.
     * 일시정지 또는 시작 전 실행은 즉시 CANCELLED가 됩니다.</p>
     *
     * @param key 실행 키
     * @return 갱신된 실행
     * @throws com.ryuqq.drorchestrator.core.exception.NotFoundException 실행이 없는 경우
     * @throws com.ryuqq.drorchestrator.core.exception.ValidationException 이미 종료된 경우
     */
    Execution requestCancellation(ExecutionKey key);
}
