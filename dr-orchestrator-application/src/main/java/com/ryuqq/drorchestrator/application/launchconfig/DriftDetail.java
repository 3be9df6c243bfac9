package com.ryuqq.drorchestrator.application.launchconfig;

/**
 * 서버 한 대의 drift 판정 근거.
 *
 * @param currentHash 현재 구성 해시
 * @param storedHash 저장된 해시 (없으면 null)
 * @param reason 판정 사유
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DriftDetail(String currentHash, String storedHash, String reason) {
}
