package com.ryuqq.drorchestrator.application.wave;

import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;

/**
 * Wave 단위 계정 컨텍스트 결정.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class AccountContexts {

    // Utility class - prevent instantiation
    private AccountContexts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 요청 컨텍스트가 교차 계정이면 그대로, 아니면 그룹 계정을 사용.
     */
    static AccountContext effective(AccountContext requested, ProtectionGroup group) {
        AccountContext groupContext = group == null ? null : group.accountContext();
        if (requested == null) {
            return groupContext == null ? AccountContext.current() : groupContext;
        }
        return requested.orElse(groupContext);
    }
}
