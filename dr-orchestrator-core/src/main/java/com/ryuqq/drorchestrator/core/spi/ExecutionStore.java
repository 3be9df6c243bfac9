package com.ryuqq.drorchestrator.core.spi;

import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionKey;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Execution 영속 저장소 SPI.
 *
 * <p><strong>조건부 쓰기:</strong> {@link #update(Execution)}는 저장된 버전과 전달된 버전이
 * 같을 때만 성공해야 합니다. 스케줄러가 오래된 상태로 중복 호출하는 경우를 막기 위함입니다.</p>
 *
 * <p><strong>반환 값:</strong> 저장소는 호출자의 객체를 보관하지 않고 복사본을 반환해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutionStore {

    /**
     * 실행 조회.
     *
     * @param key 실행 키
     * @return 저장된 실행 복사본 (없으면 empty)
     */
    Optional<Execution> find(ExecutionKey key);

    /**
     * 새 실행 저장.
     *
     * @param execution 실행
     * @return 버전이 부여된 저장본
     * @throws com.ryuqq.drorchestrator.core.exception.PersistenceException 이미 존재하는 경우
     */
    Execution create(Execution execution);

    /**
     * 조건부 갱신 (존재 + 버전 일치).
     *
     * @param execution 갱신할 실행 (조회 시점의 버전을 가져야 함)
     * @return 버전이 증가된 저장본
     * @throws com.ryuqq.drorchestrator.core.exception.PersistenceException 존재하지 않거나 버전이 다른 경우
     */
    Execution update(Execution execution);

    /**
     * 상태만 읽기 (취소 확인용).
     *
     * @param key 실행 키
     * @return 저장된 상태 (없으면 empty)
     */
    Optional<ExecutionStatus> readStatus(ExecutionKey key);

    /**
     * 종료되지 않은 모든 실행 조회.
     */
    List<Execution> findActive();

    /**
     * 마지막 poll 시각 기록. 버전을 변경하지 않는 부수 속성입니다.
     *
     * @param key 실행 키
     * @param polledAt poll 시각
     */
    void updateLastPolledTime(ExecutionKey key, Instant polledAt);
}
