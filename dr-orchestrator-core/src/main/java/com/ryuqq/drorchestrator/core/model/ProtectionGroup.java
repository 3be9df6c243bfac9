package com.ryuqq.drorchestrator.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 보호 그룹. 여러 실행이 공유하는 독립 소유 엔티티이며 ID로만 참조됩니다.
 *
 * <p>Execution/Wave에는 Wave 시작 시점에 해석된 서버 ID 스냅샷만 복사됩니다.</p>
 *
 * @param groupId 그룹 ID
 * @param groupName 그룹 이름
 * @param region 리전
 * @param selection 멤버십 방식 (null이면 미구성)
 * @param launchConfig 그룹 수준 기동 구성 (null 가능)
 * @param serverOverrides 서버별 재정의 (sourceServerId → override)
 * @param launchConfigStatus 마지막으로 저장된 구성 적용 상태 (null이면 저장된 적 없음)
 * @param accountId 소유 계정 ID (교차 계정 해석용, null 가능)
 * @param assumeRoleName 위임 역할 이름 (null 가능)
 * @param externalId 외부 ID (null 가능)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProtectionGroup(
    String groupId,
    String groupName,
    String region,
    ServerSelection selection,
    Map<String, Object> launchConfig,
    Map<String, ServerLaunchOverride> serverOverrides,
    LaunchConfigStatus launchConfigStatus,
    String accountId,
    String assumeRoleName,
    String externalId
) {

    public ProtectionGroup {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId cannot be null or blank");
        }
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region cannot be null or blank");
        }
        launchConfig = launchConfig == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(launchConfig));
        serverOverrides = serverOverrides == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(serverOverrides));
    }

    /**
     * 단순 그룹 생성 (구성/계정 정보 없음).
     */
    public static ProtectionGroup of(String groupId, String region, ServerSelection selection) {
        return new ProtectionGroup(groupId, groupId, region, selection, null, Map.of(), null, null, null, null);
    }

    public boolean hasSelection() {
        return selection != null;
    }

    /**
     * 기동 구성을 선언했는지 확인.
     *
     * @return 그룹 구성 또는 서버별 재정의가 하나라도 있으면 true
     */
    public boolean hasLaunchConfig() {
        return (launchConfig != null && !launchConfig.isEmpty()) || !serverOverrides.isEmpty();
    }

    /**
     * 서버에 실제로 적용될 기동 구성.
     *
     * @param sourceServerId 서버 ID
     * @return 병합된 구성 (없으면 빈 map)
     */
    public Map<String, Object> effectiveLaunchConfig(String sourceServerId) {
        Map<String, Object> effective = new LinkedHashMap<>();
        if (launchConfig != null) {
            effective.putAll(launchConfig);
        }

        ServerLaunchOverride override = serverOverrides.get(sourceServerId);
        if (override == null) {
            return effective;
        }
        if (!override.useGroupDefaults()) {
            return new LinkedHashMap<>(override.launchTemplate());
        }
        override.launchTemplate().forEach((key, value) -> {
            if (value != null) {
                effective.put(key, value);
            }
        });
        return effective;
    }

    /**
     * 여러 서버의 유효 구성. 구성이 비어 있는 서버는 결과에서 제외됩니다.
     *
     * @param sourceServerIds 서버 ID 목록
     * @return sourceServerId → 구성 (입력 순서 유지)
     */
    public Map<String, Map<String, Object>> effectiveLaunchConfigs(Collection<String> sourceServerIds) {
        Map<String, Map<String, Object>> configs = new LinkedHashMap<>();
        for (String serverId : sourceServerIds) {
            Map<String, Object> config = effectiveLaunchConfig(serverId);
            if (!config.isEmpty()) {
                configs.put(serverId, config);
            }
        }
        return configs;
    }

    /**
     * 그룹 소유 계정 컨텍스트.
     *
     * @return 교차 계정 정보가 있으면 해당 컨텍스트, 없으면 null
     */
    public AccountContext accountContext() {
        if (accountId == null || accountId.isBlank()) {
            return null;
        }
        return new AccountContext(accountId, assumeRoleName, externalId);
    }

    public ProtectionGroup withLaunchConfigStatus(LaunchConfigStatus status) {
        return new ProtectionGroup(groupId, groupName, region, selection, launchConfig, serverOverrides,
            status, accountId, assumeRoleName, externalId);
    }

    public ProtectionGroup withLaunchConfig(Map<String, Object> launchConfig) {
        return new ProtectionGroup(groupId, groupName, region, selection, launchConfig, serverOverrides,
            launchConfigStatus, accountId, assumeRoleName, externalId);
    }

    public ProtectionGroup withServerOverrides(Map<String, ServerLaunchOverride> serverOverrides) {
        return new ProtectionGroup(groupId, groupName, region, selection, launchConfig, serverOverrides,
            launchConfigStatus, accountId, assumeRoleName, externalId);
    }

    public ProtectionGroup withAccount(String accountId, String assumeRoleName, String externalId) {
        return new ProtectionGroup(groupId, groupName, region, selection, launchConfig, serverOverrides,
            launchConfigStatus, accountId, assumeRoleName, externalId);
    }
}
