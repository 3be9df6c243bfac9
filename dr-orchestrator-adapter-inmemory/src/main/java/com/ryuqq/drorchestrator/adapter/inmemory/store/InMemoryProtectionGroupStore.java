package com.ryuqq.drorchestrator.adapter.inmemory.store;

import com.ryuqq.drorchestrator.core.codec.LaunchConfigStatusCodec;
import com.ryuqq.drorchestrator.core.exception.NotFoundException;
import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.model.LaunchConfigStatus;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;
import com.ryuqq.drorchestrator.core.spi.ProtectionGroupStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ProtectionGroupStore}.
 *
 * <p>구성 적용 상태는 {@link LaunchConfigStatusCodec}으로 직렬화한 JSON 문서로 보관합니다.
 * 실제 문서 저장소와 같은 경계에서 왕복 변환을 거치게 하기 위함입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryProtectionGroupStore implements ProtectionGroupStore {

    private final ConcurrentHashMap<String, ProtectionGroup> groups = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> launchConfigStatuses = new ConcurrentHashMap<>();

    @Override
    public Optional<ProtectionGroup> find(String groupId) {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId cannot be null");
        }
        ProtectionGroup group = groups.get(groupId);
        if (group == null) {
            return Optional.empty();
        }
        String document = launchConfigStatuses.get(groupId);
        return Optional.of(document == null
            ? group.withLaunchConfigStatus(null)
            : group.withLaunchConfigStatus(LaunchConfigStatusCodec.decode(document)));
    }

    @Override
    public synchronized void save(ProtectionGroup group) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        groups.put(group.groupId(), group.withLaunchConfigStatus(null));
        if (group.launchConfigStatus() != null) {
            launchConfigStatuses.put(group.groupId(), LaunchConfigStatusCodec.encode(group.launchConfigStatus()));
        } else {
            launchConfigStatuses.remove(group.groupId());
        }
    }

    @Override
    public synchronized void replaceLaunchConfigStatus(String groupId, LaunchConfigStatus status) {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (!groups.containsKey(groupId)) {
            throw new NotFoundException(ErrorCode.PROTECTION_GROUP_NOT_FOUND, "Protection group not found: " + groupId);
        }
        launchConfigStatuses.put(groupId, LaunchConfigStatusCodec.encode(status));
    }
}
