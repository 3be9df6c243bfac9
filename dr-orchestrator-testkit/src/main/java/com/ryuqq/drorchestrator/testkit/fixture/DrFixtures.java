package com.ryuqq.drorchestrator.testkit.fixture;

import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.model.ExplicitSelection;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;
import com.ryuqq.drorchestrator.core.model.RecoveryPlan;
import com.ryuqq.drorchestrator.core.model.TagSelection;
import com.ryuqq.drorchestrator.core.model.WaveDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 테스트 픽스처 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DrFixtures {

    public static final String REGION = "us-east-1";
    public static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    // Utility class - prevent instantiation
    private DrFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 보호 그룹 ID 순서대로 Wave를 구성한 계획.
     */
    public static RecoveryPlan plan(String planId, String... protectionGroupIds) {
        List<WaveDefinition> waves = new ArrayList<>();
        for (int i = 0; i < protectionGroupIds.length; i++) {
            waves.add(WaveDefinition.of(i, protectionGroupIds[i]));
        }
        return new RecoveryPlan(planId, planId, waves);
    }

    public static ProtectionGroup explicitGroup(String groupId, String... serverIds) {
        return ProtectionGroup.of(groupId, REGION, new ExplicitSelection(List.of(serverIds)));
    }

    public static ProtectionGroup taggedGroup(String groupId, Map<String, String> tags) {
        return ProtectionGroup.of(groupId, REGION, new TagSelection(tags));
    }

    public static Execution execution(RecoveryPlan plan, String executionId, ExecutionType type) {
        return Execution.begin(plan, executionId, type, null, "tester", T0, 30, 31_536_000);
    }
}
