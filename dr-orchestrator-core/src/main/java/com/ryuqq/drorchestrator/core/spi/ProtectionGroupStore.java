package com.ryuqq.drorchestrator.core.spi;

import com.ryuqq.drorchestrator.core.model.LaunchConfigStatus;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;

import java.util.Optional;

/**
 * 보호 그룹 저장소 SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ProtectionGroupStore {

    Optional<ProtectionGroup> find(String groupId);

    void save(ProtectionGroup group);

    /**
     * 구성 적용 상태 전체 교체 (원자적).
     *
     * @param groupId 그룹 ID
     * @param status 새 상태
     * @throws com.ryuqq.drorchestrator.core.exception.NotFoundException 그룹이 없는 경우
     * @throws com.ryuqq.drorchestrator.core.exception.PersistenceException 쓰기 실패 시
     */
    void replaceLaunchConfigStatus(String groupId, LaunchConfigStatus status);
}
