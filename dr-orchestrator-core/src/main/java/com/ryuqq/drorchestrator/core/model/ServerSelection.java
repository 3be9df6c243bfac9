package com.ryuqq.drorchestrator.core.model;

/**
 * 보호 그룹 멤버십 결정 방식.
 *
 * <p>태그 기반({@link TagSelection})과 명시적 ID 목록({@link ExplicitSelection})은
 * 상호 배타적입니다. 보호 그룹에 selection이 없으면 멤버십이 구성되지 않은 것입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ServerSelection permits TagSelection, ExplicitSelection {
}
