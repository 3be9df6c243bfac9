package com.ryuqq.drorchestrator.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 서버 단위 구성 적용 결과.
 *
 * @param status 적용 상태 (null 불가)
 * @param lastApplied 마지막 성공 적용 시각 (성공 전에는 null)
 * @param configHash 적용된 구성의 해시 ("sha256:..." 또는 null)
 * @param errors 오류 메시지
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerConfigStatus(ServerConfigState status, Instant lastApplied, String configHash, List<String> errors) {

    public ServerConfigStatus {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ServerConfigStatus ready(String configHash, Instant lastApplied) {
        return new ServerConfigStatus(ServerConfigState.READY, lastApplied, configHash, List.of());
    }

    public static ServerConfigStatus failed(String error) {
        return new ServerConfigStatus(ServerConfigState.FAILED, null, null, List.of(error));
    }

    public static ServerConfigStatus pending(String error) {
        return new ServerConfigStatus(ServerConfigState.PENDING, null, null, List.of(error));
    }

    public boolean hasHash() {
        return configHash != null && !configHash.isBlank();
    }
}
