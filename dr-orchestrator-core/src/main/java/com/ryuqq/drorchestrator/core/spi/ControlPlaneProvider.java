package com.ryuqq.drorchestrator.core.spi;

import com.ryuqq.drorchestrator.core.model.AccountContext;

/**
 * 교차 계정 식별 제공자.
 *
 * <p>리전과 계정 컨텍스트로부터 범위가 지정된 제어 평면 클라이언트를 만듭니다.
 * 교차 계정이 아닌 컨텍스트는 오케스트레이터 자신의 계정을 의미합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ControlPlaneProvider {

    /**
     * 범위 지정 클라이언트 조회.
     *
     * @param region 리전
     * @param accountContext 계정 컨텍스트 (null이면 현재 계정)
     * @return 클라이언트
     * @throws ControlPlaneException 자격 증명 획득 실패 시
     */
    RecoveryControlPlane clientFor(String region, AccountContext accountContext);
}
