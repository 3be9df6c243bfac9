package com.ryuqq.drorchestrator.application.launchconfig;

import com.ryuqq.drorchestrator.core.model.ConfigState;
import com.ryuqq.drorchestrator.core.model.LaunchConfigStatus;
import com.ryuqq.drorchestrator.core.model.ServerConfigStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 구성 적용 결과.
 *
 * <p>{@code appliedServers + failedServers + pendingServers}는 항상 요청한 서버 수와 같습니다.</p>
 *
 * @param groupId 보호 그룹 ID
 * @param status 집계 상태 (READY, FAILED, PARTIAL)
 * @param appliedServers 적용 성공 서버 수
 * @param failedServers 적용 실패 서버 수
 * @param pendingServers 시간 초과로 시도하지 않은 서버 수
 * @param serverConfigs 서버별 결과 (요청 순서 유지)
 * @param errors 그룹 수준 오류 (계정 정보 제거됨)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ApplyResult(
    String groupId,
    ConfigState status,
    int appliedServers,
    int failedServers,
    int pendingServers,
    Map<String, ServerConfigStatus> serverConfigs,
    List<String> errors
) {

    public ApplyResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        serverConfigs = Collections.unmodifiableMap(new LinkedHashMap<>(serverConfigs));
        errors = List.copyOf(errors);
    }

    public int totalServers() {
        return appliedServers + failedServers + pendingServers;
    }

    public boolean isReady() {
        return status == ConfigState.READY;
    }

    /**
     * 저장용 상태로 변환.
     *
     * @param lastApplied 적용 시각
     * @param appliedBy 적용 주체
     */
    public LaunchConfigStatus toLaunchConfigStatus(Instant lastApplied, String appliedBy) {
        return new LaunchConfigStatus(status, lastApplied, appliedBy, serverConfigs, errors);
    }
}
