package com.ryuqq.drorchestrator.testkit.fake;

import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneProvider;
import com.ryuqq.drorchestrator.core.spi.RecoveryControlPlane;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 리전별 {@link FakeRecoveryControlPlane}을 제공하는 테스트용 Provider.
 *
 * <p>요청된 계정 컨텍스트를 기록하므로 교차 계정 해석을 검증할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeControlPlaneProvider implements ControlPlaneProvider {

    private final Map<String, FakeRecoveryControlPlane> regions = new HashMap<>();
    private final List<AccountContext> requestedContexts = new ArrayList<>();
    private RuntimeException credentialFailure;

    @Override
    public synchronized RecoveryControlPlane clientFor(String region, AccountContext accountContext) {
        requestedContexts.add(accountContext);
        if (credentialFailure != null) {
            throw credentialFailure;
        }
        return region(region);
    }

    /**
     * 리전의 fake 조회 (없으면 생성).
     */
    public synchronized FakeRecoveryControlPlane region(String region) {
        return regions.computeIfAbsent(region, r -> new FakeRecoveryControlPlane());
    }

    public synchronized List<AccountContext> requestedContexts() {
        return List.copyOf(requestedContexts);
    }

    public synchronized void failCredentials(String message) {
        this.credentialFailure = new ControlPlaneException("AccessDeniedException", message);
    }
}
