package com.ryuqq.drorchestrator.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProtectionGroup 유효 구성 병합 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProtectionGroupTest {

    private static ProtectionGroup group(Map<String, ServerLaunchOverride> overrides) {
        return ProtectionGroup.of("pg-1", "us-east-1", new ExplicitSelection(List.of("s-1", "s-2")))
            .withLaunchConfig(Map.of("copyTags", true, "launchDisposition", "STOPPED"))
            .withServerOverrides(overrides);
    }

    @Test
    void effectiveLaunchConfig_NoOverride_ReturnsGroupConfig() {
        Map<String, Object> effective = group(Map.of()).effectiveLaunchConfig("s-1");
        assertEquals(Map.of("copyTags", true, "launchDisposition", "STOPPED"), effective);
    }

    @Test
    void effectiveLaunchConfig_UseGroupDefaults_MergesNonNullFields() {
        // Given
        Map<String, Object> template = new HashMap<>();
        template.put("launchDisposition", "STARTED");
        template.put("copyTags", null);
        ProtectionGroup group = group(Map.of("s-1", new ServerLaunchOverride("s-1", true, template)));

        // When
        Map<String, Object> effective = group.effectiveLaunchConfig("s-1");

        // Then
        assertEquals(Map.of("copyTags", true, "launchDisposition", "STARTED"), effective);
    }

    @Test
    void effectiveLaunchConfig_WithoutGroupDefaults_ReplacesEntirely() {
        // Given
        ProtectionGroup group = group(Map.of("s-1",
            new ServerLaunchOverride("s-1", false, Map.of("name", "web-01"))));

        // When & Then
        assertEquals(Map.of("name", "web-01"), group.effectiveLaunchConfig("s-1"));
        assertEquals(2, group.effectiveLaunchConfig("s-2").size());
    }

    @Test
    void effectiveLaunchConfigs_SkipsServersWithoutConfig() {
        // Given
        ProtectionGroup group = ProtectionGroup.of("pg-1", "us-east-1", null)
            .withServerOverrides(Map.of("s-1", new ServerLaunchOverride("s-1", true, Map.of("copyTags", true))));

        // When
        Map<String, Map<String, Object>> configs = group.effectiveLaunchConfigs(List.of("s-1", "s-2"));

        // Then
        assertEquals(List.of("s-1"), List.copyOf(configs.keySet()));
        assertTrue(group.hasLaunchConfig());
        assertFalse(group.hasSelection());
    }

    @Test
    void accountContext_OnlyWhenAccountPresent() {
        ProtectionGroup plain = group(Map.of());
        ProtectionGroup crossAccount = plain.withAccount("123456789012", "DrRole", "ext");

        assertNull(plain.accountContext());
        assertTrue(crossAccount.accountContext().isCrossAccount());
        assertEquals("ext", crossAccount.accountContext().externalId());
    }
}
