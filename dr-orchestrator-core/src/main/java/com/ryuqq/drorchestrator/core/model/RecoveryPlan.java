package com.ryuqq.drorchestrator.core.model;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 순서가 있는 Wave들로 구성된 복구 계획.
 *
 * @param planId 계획 ID
 * @param planName 계획 이름
 * @param waves Wave 정의 목록 (waveNumber 순으로 정렬되어 보관)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RecoveryPlan(String planId, String planName, List<WaveDefinition> waves) {

    public RecoveryPlan {
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("planId cannot be null or blank");
        }
        if (waves == null || waves.isEmpty()) {
            throw new IllegalArgumentException("waves cannot be null or empty");
        }
        Set<Integer> seen = new HashSet<>();
        for (WaveDefinition wave : waves) {
            if (!seen.add(wave.waveNumber())) {
                throw new IllegalArgumentException("Duplicate waveNumber: " + wave.waveNumber());
            }
        }
        waves = waves.stream()
            .sorted(Comparator.comparingInt(WaveDefinition::waveNumber))
            .toList();
    }

    public Optional<WaveDefinition> wave(int waveNumber) {
        return waves.stream().filter(w -> w.waveNumber() == waveNumber).findFirst();
    }
}
