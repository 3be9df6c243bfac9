package com.ryuqq.drorchestrator.core.model;

/**
 * 복구 계획에 선언된 Wave 정의.
 *
 * @param waveNumber 0부터 시작하는 Wave 번호
 * @param waveName Wave 이름
 * @param protectionGroupId 대상 보호 그룹 ID
 * @param pauseBeforeWave 이 Wave 시작 전에 일시정지할지 여부
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WaveDefinition(int waveNumber, String waveName, String protectionGroupId, boolean pauseBeforeWave) {

    public WaveDefinition {
        if (waveNumber < 0) {
            throw new IllegalArgumentException("waveNumber must not be negative (current: " + waveNumber + ")");
        }
        if (protectionGroupId == null || protectionGroupId.isBlank()) {
            throw new IllegalArgumentException("protectionGroupId cannot be null or blank");
        }
        if (waveName == null || waveName.isBlank()) {
            waveName = "Wave " + (waveNumber + 1);
        }
    }

    public static WaveDefinition of(int waveNumber, String protectionGroupId) {
        return new WaveDefinition(waveNumber, null, protectionGroupId, false);
    }
}
