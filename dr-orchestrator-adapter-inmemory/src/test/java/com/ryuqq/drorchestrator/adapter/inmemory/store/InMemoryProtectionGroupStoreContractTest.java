package com.ryuqq.drorchestrator.adapter.inmemory.store;

import com.ryuqq.drorchestrator.core.spi.ProtectionGroupStore;
import com.ryuqq.drorchestrator.testkit.contract.AbstractProtectionGroupStoreContractTest;

/**
 * Contract Tests for {@link InMemoryProtectionGroupStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryProtectionGroupStoreContractTest extends AbstractProtectionGroupStoreContractTest {

    @Override
    protected ProtectionGroupStore createStore() {
        return new InMemoryProtectionGroupStore();
    }
}
