package com.ryuqq.drorchestrator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 태그 기반 멤버십. 모든 태그가 일치하는 서버만 포함됩니다 (AND).
 *
 * @param tags 필수 태그 (key → value, 비어 있을 수 없음)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TagSelection(Map<String, String> tags) implements ServerSelection {

    public TagSelection {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("tags cannot be null or empty");
        }
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }
}
