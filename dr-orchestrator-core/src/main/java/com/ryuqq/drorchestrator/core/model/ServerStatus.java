package com.ryuqq.drorchestrator.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Wave 내 개별 서버의 기동 스냅샷.
 *
 * <p>recoveryInstanceId와 인스턴스 메타데이터(hostname, IP, instanceType, launchTime)는
 * 기동 완료 후 best-effort로 채워집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerStatus(
    String sourceServerId,
    String serverName,
    LaunchStatus launchStatus,
    String recoveryInstanceId,
    String hostname,
    String privateIp,
    String publicIp,
    String instanceType,
    Instant launchTime,
    List<String> errors
) {

    public ServerStatus {
        if (sourceServerId == null || sourceServerId.isBlank()) {
            throw new IllegalArgumentException("sourceServerId cannot be null or blank");
        }
        if (launchStatus == null) {
            throw new IllegalArgumentException("launchStatus cannot be null");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Job 생성 직후의 초기 레코드.
     */
    public static ServerStatus pending(String sourceServerId) {
        return new ServerStatus(sourceServerId, null, LaunchStatus.PENDING, null,
            null, null, null, null, null, List.of());
    }

    /**
     * 제어 평면 보고값으로 만든 레코드.
     */
    public static ServerStatus reported(String sourceServerId, LaunchStatus launchStatus, String recoveryInstanceId) {
        return new ServerStatus(sourceServerId, null, launchStatus, recoveryInstanceId,
            null, null, null, null, null, List.of());
    }

    /**
     * 인스턴스 메타데이터를 채운 새 레코드.
     */
    public ServerStatus withInstanceDetails(String hostname, String privateIp, String publicIp,
                                            String instanceType, Instant launchTime) {
        return new ServerStatus(sourceServerId, serverName, launchStatus, recoveryInstanceId,
            hostname, privateIp, publicIp, instanceType, launchTime, errors);
    }

    public ServerStatus withServerName(String serverName) {
        return new ServerStatus(sourceServerId, serverName, launchStatus, recoveryInstanceId,
            hostname, privateIp, publicIp, instanceType, launchTime, errors);
    }
}
