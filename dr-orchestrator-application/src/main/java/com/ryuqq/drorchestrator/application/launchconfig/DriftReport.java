package com.ryuqq.drorchestrator.application.launchconfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drift 탐지 결과.
 *
 * @param hasDrift drift 서버가 하나라도 있으면 true
 * @param driftedServers drift 서버 ID (입력 순서)
 * @param details 서버 ID → 판정 근거 (drift 서버만)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DriftReport(boolean hasDrift, List<String> driftedServers, Map<String, DriftDetail> details) {

    public DriftReport {
        driftedServers = List.copyOf(driftedServers);
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    static DriftReport of(Map<String, DriftDetail> details) {
        return new DriftReport(!details.isEmpty(), List.copyOf(details.keySet()), details);
    }
}
