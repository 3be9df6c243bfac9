package com.ryuqq.drorchestrator.core.model;

import java.util.List;

/**
 * 명시적 서버 ID 목록 멤버십.
 *
 * @param sourceServerIds 소스 서버 ID 목록
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExplicitSelection(List<String> sourceServerIds) implements ServerSelection {

    public ExplicitSelection {
        if (sourceServerIds == null) {
            throw new IllegalArgumentException("sourceServerIds cannot be null");
        }
        sourceServerIds = List.copyOf(sourceServerIds);
    }
}
