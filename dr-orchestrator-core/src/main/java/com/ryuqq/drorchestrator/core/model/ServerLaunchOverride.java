package com.ryuqq.drorchestrator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 서버별 기동 구성 재정의.
 *
 * <p>useGroupDefaults가 true이면 그룹 구성 위에 null이 아닌 필드만 덮어쓰고,
 * false이면 그룹 구성을 완전히 대체합니다.</p>
 *
 * @param sourceServerId 대상 서버 ID
 * @param useGroupDefaults 그룹 기본값 병합 여부
 * @param launchTemplate 재정의 필드
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerLaunchOverride(String sourceServerId, boolean useGroupDefaults, Map<String, Object> launchTemplate) {

    public ServerLaunchOverride {
        if (sourceServerId == null || sourceServerId.isBlank()) {
            throw new IllegalArgumentException("sourceServerId cannot be null or blank");
        }
        launchTemplate = launchTemplate == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(launchTemplate));
    }
}
