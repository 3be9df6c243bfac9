package com.ryuqq.drorchestrator.adapter.inmemory.store;

import com.ryuqq.drorchestrator.core.exception.ConflictException;
import com.ryuqq.drorchestrator.core.model.ExecutionKey;
import com.ryuqq.drorchestrator.core.spi.ServerReservations;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link ServerReservations}.
 *
 * <p>모든 연산은 인스턴스 모니터로 직렬화되므로 reserve는 전부 성공하거나 아무것도 점유하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryServerReservations implements ServerReservations {

    private final Map<String, ExecutionKey> holders = new HashMap<>();

    @Override
    public synchronized void reserve(ExecutionKey holder, Collection<String> serverIds) {
        if (holder == null) {
            throw new IllegalArgumentException("holder cannot be null");
        }
        if (serverIds == null) {
            throw new IllegalArgumentException("serverIds cannot be null");
        }

        Map<String, ExecutionKey> taken = new LinkedHashMap<>();
        for (String serverId : serverIds) {
            ExecutionKey current = holders.get(serverId);
            if (current != null && !current.equals(holder)) {
                taken.put(serverId, current);
            }
        }
        if (!taken.isEmpty()) {
            throw new ConflictException("Servers already reserved: " + taken);
        }
        for (String serverId : serverIds) {
            holders.put(serverId, holder);
        }
    }

    @Override
    public synchronized void release(ExecutionKey holder) {
        if (holder == null) {
            throw new IllegalArgumentException("holder cannot be null");
        }
        holders.values().removeIf(holder::equals);
    }

    @Override
    public synchronized Optional<ExecutionKey> holderOf(String serverId) {
        return Optional.ofNullable(holders.get(serverId));
    }
}
