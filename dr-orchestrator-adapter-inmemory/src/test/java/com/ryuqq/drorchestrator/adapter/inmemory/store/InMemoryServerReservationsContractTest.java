package com.ryuqq.drorchestrator.adapter.inmemory.store;

import com.ryuqq.drorchestrator.core.spi.ServerReservations;
import com.ryuqq.drorchestrator.testkit.contract.AbstractServerReservationsContractTest;

/**
 * Contract Tests for {@link InMemoryServerReservations}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryServerReservationsContractTest extends AbstractServerReservationsContractTest {

    @Override
    protected ServerReservations createReservations() {
        return new InMemoryServerReservations();
    }
}
