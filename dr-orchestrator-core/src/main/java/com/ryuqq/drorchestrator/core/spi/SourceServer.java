package com.ryuqq.drorchestrator.core.spi;

import java.util.Map;

/**
 * 제어 평면에 등록된 소스 서버.
 *
 * @param sourceServerId 소스 서버 ID
 * @param hostname 호스트명 (null 가능)
 * @param tags 네이티브 태그
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SourceServer(String sourceServerId, String hostname, Map<String, String> tags) {

    public SourceServer {
        if (sourceServerId == null || sourceServerId.isBlank()) {
            throw new IllegalArgumentException("sourceServerId cannot be null or blank");
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }
}
