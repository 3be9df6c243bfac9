package com.ryuqq.drorchestrator.core.spi;

import java.time.Instant;

/**
 * 기동된 복구 인스턴스의 메타데이터.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InstanceDetails(
    String instanceId,
    String hostname,
    String privateIp,
    String publicIp,
    String instanceType,
    Instant launchTime
) {
}
