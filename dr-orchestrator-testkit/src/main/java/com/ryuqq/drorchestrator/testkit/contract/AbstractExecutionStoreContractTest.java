package com.ryuqq.drorchestrator.testkit.contract;

import com.ryuqq.drorchestrator.core.exception.PersistenceException;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionKey;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import com.ryuqq.drorchestrator.testkit.fixture.DrFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link ExecutionStore} SPI 계약 테스트.
 *
 * <p>어댑터 모듈은 이 클래스를 상속하고 {@link #createStore()}만 구현합니다.</p>
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>create 후 find 시 복사본 반환</li>
 *   <li>중복 create 거부</li>
 *   <li>버전 가드 조건부 갱신 (오래된 버전 거부)</li>
 *   <li>활성 실행 조회와 상태 조회</li>
 *   <li>lastPolledTime 갱신은 버전을 바꾸지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractExecutionStoreContractTest {

    protected ExecutionStore store;

    protected abstract ExecutionStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    private static Execution newExecution(String executionId) {
        return DrFixtures.execution(DrFixtures.plan("plan-1", "pg-1"), executionId, ExecutionType.DRILL);
    }

    @Test
    void create_ThenFind_ReturnsIndependentCopy() {
        // Given
        Execution created = store.create(newExecution("exec-1"));

        // When
        Execution found = store.find(created.getKey()).orElseThrow();
        found.transitionTo(ExecutionStatus.POLLING);

        // Then
        assertEquals(ExecutionStatus.PENDING, store.find(created.getKey()).orElseThrow().getStatus());
    }

    @Test
    void create_Duplicate_ThrowsPersistenceException() {
        store.create(newExecution("exec-1"));
        assertThrows(PersistenceException.class, () -> store.create(newExecution("exec-1")));
    }

    @Test
    void update_CurrentVersion_IncrementsVersion() {
        // Given
        Execution created = store.create(newExecution("exec-1"));
        created.transitionTo(ExecutionStatus.POLLING);

        // When
        Execution updated = store.update(created);

        // Then
        assertEquals(created.getVersion() + 1, updated.getVersion());
        assertEquals(ExecutionStatus.POLLING, store.readStatus(created.getKey()).orElseThrow());
    }

    @Test
    void update_StaleVersion_ThrowsPersistenceException() {
        // Given
        Execution created = store.create(newExecution("exec-1"));
        Execution staleCopy = created.copy();
        store.update(created);

        // When & Then
        assertThrows(PersistenceException.class, () -> store.update(staleCopy));
    }

    @Test
    void update_Missing_ThrowsPersistenceException() {
        assertThrows(PersistenceException.class, () -> store.update(newExecution("ghost")));
    }

    @Test
    void findActive_ExcludesTerminal() {
        // Given
        store.create(newExecution("exec-1"));
        Execution done = store.create(newExecution("exec-2"));
        done.finish(ExecutionStatus.COMPLETED, Instant.now(), null);
        store.update(done);

        // When
        List<Execution> active = store.findActive();

        // Then
        assertEquals(1, active.size());
        assertEquals("exec-1", active.get(0).getExecutionId());
    }

    @Test
    void readStatus_Missing_ReturnsEmpty() {
        assertTrue(store.readStatus(ExecutionKey.of("none", "plan-1")).isEmpty());
    }

    @Test
    void updateLastPolledTime_DoesNotChangeVersion() {
        // Given
        Execution created = store.create(newExecution("exec-1"));
        Instant polledAt = Instant.parse("2026-05-01T00:00:00Z");

        // When
        store.updateLastPolledTime(created.getKey(), polledAt);

        // Then
        Execution found = store.find(created.getKey()).orElseThrow();
        assertEquals(polledAt, found.getLastPolledTime());
        assertEquals(created.getVersion(), found.getVersion());
        assertDoesNotThrow(() -> store.update(created));
    }

    @Test
    void updateLastPolledTime_DoesNotAlterPreviouslyFoundCopy() {
        // Given
        Execution created = store.create(newExecution("exec-1"));
        Execution before = store.find(created.getKey()).orElseThrow();
        Instant polledAt = Instant.parse("2026-05-01T00:00:00Z");

        // When
        store.updateLastPolledTime(created.getKey(), polledAt);

        // Then
        assertNull(before.getLastPolledTime());
        assertEquals(polledAt, store.find(created.getKey()).orElseThrow().getLastPolledTime());
    }
}
