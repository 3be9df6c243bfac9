package com.ryuqq.drorchestrator.adapter.inmemory.store;

import com.ryuqq.drorchestrator.core.exception.PersistenceException;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionKey;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ExecutionStore} SPI for testing and reference purposes.
 *
 * <p>실행은 (executionId, planId) 키로 {@link ConcurrentHashMap}에 보관되며,
 * 저장과 반환 모두 깊은 복사본을 사용하므로 호출자가 저장된 상태를 직접 변경할 수 없습니다.
 * 맵에 들어간 객체는 이후 변경되지 않고 새 복사본으로 교체되므로 잠금 없는 조회도 안전합니다.</p>
 *
 * <p><strong>조건부 쓰기:</strong></p>
 * <ul>
 *   <li>create: 키가 이미 있으면 {@link PersistenceException}</li>
 *   <li>update: 키가 없거나 버전이 다르면 {@link PersistenceException}</li>
 *   <li>updateLastPolledTime: 버전을 증가시키지 않는 부수 쓰기</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private final ConcurrentHashMap<ExecutionKey, Execution> executions = new ConcurrentHashMap<>();

    @Override
    public Optional<Execution> find(ExecutionKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Execution stored = executions.get(key);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }

    @Override
    public synchronized Execution create(Execution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        if (executions.containsKey(execution.getKey())) {
            throw new PersistenceException("Execution already exists: " + execution.getKey());
        }
        Execution stored = execution.withVersion(1);
        executions.put(stored.getKey(), stored);
        return stored.copy();
    }

    @Override
    public synchronized Execution update(Execution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        Execution current = executions.get(execution.getKey());
        if (current == null) {
            throw new PersistenceException("Execution not found: " + execution.getKey());
        }
        if (current.getVersion() != execution.getVersion()) {
            throw new PersistenceException(String.format(
                "Stale write for %s (stored version: %d, given: %d)",
                execution.getKey(), current.getVersion(), execution.getVersion()
            ));
        }
        Execution stored = execution.withVersion(current.getVersion() + 1);
        // lastPolledTime은 버전과 무관하게 갱신되므로 더 최신 값을 유지
        if (stored.getLastPolledTime() == null
            || (current.getLastPolledTime() != null && current.getLastPolledTime().isAfter(stored.getLastPolledTime()))) {
            stored.setLastPolledTime(current.getLastPolledTime());
        }
        executions.put(stored.getKey(), stored);
        return stored.copy();
    }

    @Override
    public Optional<ExecutionStatus> readStatus(ExecutionKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Execution stored = executions.get(key);
        return stored == null ? Optional.empty() : Optional.of(stored.getStatus());
    }

    @Override
    public List<Execution> findActive() {
        return executions.values().stream()
            .filter(execution -> !execution.getStatus().isTerminal())
            .sorted(Comparator.comparing(Execution::getStartTime))
            .map(Execution::copy)
            .toList();
    }

    @Override
    public synchronized void updateLastPolledTime(ExecutionKey key, Instant polledAt) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Execution stored = executions.get(key);
        if (stored == null) {
            throw new PersistenceException("Execution not found: " + key);
        }
        Execution polled = stored.copy();
        polled.setLastPolledTime(polledAt);
        executions.put(key, polled);
    }

    /**
     * 저장된 실행 수 (테스트용).
     */
    public int size() {
        return executions.size();
    }
}
