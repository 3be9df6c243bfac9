package com.ryuqq.drorchestrator.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 보호 그룹의 구성 적용 상태.
 *
 * <p>저장 시 객체 전체가 원자적으로 교체됩니다. 부분 필드 갱신은 허용되지 않습니다.</p>
 *
 * <p>레코드 자체는 null 필드를 허용하며, 필수 필드 검증은 저장 경계에서 수행됩니다.</p>
 *
 * @param status 그룹 상태
 * @param lastApplied 마지막 적용 시각 (not_configured가 아니면 필수)
 * @param appliedBy 적용 주체
 * @param serverConfigs sourceServerId → 서버 상태
 * @param errors 그룹 수준 오류
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchConfigStatus(
    ConfigState status,
    Instant lastApplied,
    String appliedBy,
    Map<String, ServerConfigStatus> serverConfigs,
    List<String> errors
) {

    public LaunchConfigStatus {
        serverConfigs = serverConfigs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(serverConfigs));
        errors = errors == null ? null : List.copyOf(errors);
    }

    /**
     * 한 번도 저장된 적 없는 그룹의 기본 상태.
     */
    public static LaunchConfigStatus notConfigured() {
        return new LaunchConfigStatus(ConfigState.NOT_CONFIGURED, null, null, Map.of(), List.of());
    }

    public Optional<ServerConfigStatus> serverConfig(String sourceServerId) {
        if (serverConfigs == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(serverConfigs.get(sourceServerId));
    }

    public boolean isReady() {
        return status == ConfigState.READY;
    }
}
