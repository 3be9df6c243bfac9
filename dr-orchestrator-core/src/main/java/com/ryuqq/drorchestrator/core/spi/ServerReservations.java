package com.ryuqq.drorchestrator.core.spi;

import com.ryuqq.drorchestrator.core.model.ExecutionKey;

import java.util.Collection;
import java.util.Optional;

/**
 * 서버 예약 SPI.
 *
 * <p>승인 검사와 Job 등록 사이의 경쟁 구간을 닫기 위한 원자적 점유 단계입니다.
 * 승인 검사는 조언적이며, 예약이 실행 간 유일한 배타 지점입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ServerReservations {

    /**
     * 서버를 원자적으로 점유. 전부 성공하거나 아무것도 점유하지 않습니다.
     *
     * <p>같은 실행의 재예약은 멱등입니다.</p>
     *
     * @param holder 점유할 실행
     * @param serverIds 서버 ID
     * @throws com.ryuqq.drorchestrator.core.exception.ConflictException 다른 실행이 점유 중인 경우
     */
    void reserve(ExecutionKey holder, Collection<String> serverIds);

    /**
     * 실행이 점유한 모든 서버 해제. 점유가 없으면 아무 일도 하지 않습니다.
     */
    void release(ExecutionKey holder);

    Optional<ExecutionKey> holderOf(String serverId);
}
