package com.ryuqq.drorchestrator.application.launchconfig;

import com.ryuqq.drorchestrator.core.exception.ApplicationException;
import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.exception.NotFoundException;
import com.ryuqq.drorchestrator.core.exception.ValidationException;
import com.ryuqq.drorchestrator.core.hash.ConfigHasher;
import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.ConfigState;
import com.ryuqq.drorchestrator.core.model.LaunchConfigStatus;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;
import com.ryuqq.drorchestrator.core.model.ServerConfigState;
import com.ryuqq.drorchestrator.core.model.ServerConfigStatus;
import com.ryuqq.drorchestrator.core.retry.RetryPolicy;
import com.ryuqq.drorchestrator.core.retry.Sleeper;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneProvider;
import com.ryuqq.drorchestrator.core.spi.LaunchTemplateSettings;
import com.ryuqq.drorchestrator.core.spi.ProtectionGroupStore;
import com.ryuqq.drorchestrator.core.spi.RecoveryControlPlane;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 보호 그룹 기동 구성 서비스.
 *
 * <p>서버별 기동 구성을 제어 평면에 적용하고, 적용 결과를 보호 그룹에 저장하며,
 * 저장된 해시와 현재 구성을 비교해 drift를 탐지합니다.</p>
 *
 * <p><strong>적용 흐름 (서버 단위):</strong></p>
 * <pre>
 * 1. 시간 예산 확인 → 초과 시 남은 서버 전부 PENDING
 * 2. 구성 조회 → 없으면 FAILED
 * 3. 제어 평면 기동 구성 갱신 (throttling은 RetryPolicy에 따라 재시도)
 * 4. EC2 기동 템플릿 갱신 (템플릿 설정이 있는 경우, 같은 재시도 규칙)
 * 5. 성공 → READY + configHash + lastApplied
 * </pre>
 *
 * <p>{@link #applyConfigs}는 저장하지 않습니다. 호출자가 {@link #persistStatus}로 저장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LaunchConfigService {

    private static final Logger log = LoggerFactory.getLogger(LaunchConfigService.class);

    public static final Duration DEFAULT_TIMEOUT_BUDGET = Duration.ofSeconds(300);

    static final String TIMED_OUT = "Configuration application timed out";
    static final String LOOKUP_FAILED = "Unable to retrieve stored configuration status";
    static final String NO_STORED_STATUS = "No stored configuration status";
    static final String NO_STORED_SERVER = "No stored configuration for this server";
    static final String NO_STORED_HASH = "Stored configuration has no hash";
    static final String HASH_MISMATCH = "Configuration hash mismatch";

    private final ProtectionGroupStore groupStore;
    private final ControlPlaneProvider controlPlaneProvider;
    private final RetryPolicy throttleRetry;
    private final Sleeper sleeper;
    private final Clock clock;

    public LaunchConfigService(ProtectionGroupStore groupStore, ControlPlaneProvider controlPlaneProvider,
                               RetryPolicy throttleRetry, Sleeper sleeper, Clock clock) {
        if (groupStore == null) {
            throw new IllegalArgumentException("groupStore cannot be null");
        }
        if (controlPlaneProvider == null) {
            throw new IllegalArgumentException("controlPlaneProvider cannot be null");
        }
        if (throttleRetry == null) {
            throw new IllegalArgumentException("throttleRetry cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.groupStore = groupStore;
        this.controlPlaneProvider = controlPlaneProvider;
        this.throttleRetry = throttleRetry;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    // ============================================================
    // 상태 조회 / 저장
    // ============================================================

    /**
     * 저장된 구성 적용 상태 조회.
     *
     * @param groupId 보호 그룹 ID
     * @return 저장된 상태 (한 번도 저장되지 않았으면 not_configured 기본값)
     * @throws NotFoundException 그룹이 없는 경우
     */
    public LaunchConfigStatus getStatus(String groupId) {
        requireText(groupId, "groupId");
        ProtectionGroup group = groupStore.find(groupId)
            .orElseThrow(() -> new NotFoundException(
                ErrorCode.PROTECTION_GROUP_NOT_FOUND, "Protection group not found: " + groupId));
        LaunchConfigStatus status = group.launchConfigStatus();
        return status == null ? LaunchConfigStatus.notConfigured() : status;
    }

    /**
     * 구성 적용 상태 전체 교체.
     *
     * @param groupId 보호 그룹 ID
     * @param status 새 상태
     * @throws ValidationException 필수 필드가 없는 경우
     * @throws NotFoundException 그룹이 없는 경우
     * @throws ApplicationException 저장소 쓰기 실패 시 (원인 보존)
     */
    public void persistStatus(String groupId, LaunchConfigStatus status) {
        requireText(groupId, "groupId");
        validateStatus(status);
        try {
            groupStore.replaceLaunchConfigStatus(groupId, status);
        } catch (NotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to persist launch config status: groupId={}", groupId, e);
            throw new ApplicationException(ErrorCode.PERSISTENCE_ERROR,
                "Failed to persist launch config status for group " + groupId + ": " + e.getMessage(), e);
        }
        log.info("Launch config status persisted: groupId={}, status={}, servers={}",
            groupId, status.status().wireValue(), status.serverConfigs().size());
    }

    private static void validateStatus(LaunchConfigStatus status) {
        if (status == null) {
            throw new ValidationException("status cannot be null");
        }
        if (status.status() == null) {
            throw new ValidationException("Missing required field: status");
        }
        if (status.serverConfigs() == null) {
            throw new ValidationException("Missing required field: serverConfigs");
        }
        if (status.errors() == null) {
            throw new ValidationException("Missing required field: errors");
        }
        if (status.status() != ConfigState.NOT_CONFIGURED && status.lastApplied() == null) {
            throw new ValidationException(
                "Missing required field: lastApplied (status: " + status.status().wireValue() + ")");
        }
    }

    // ============================================================
    // 구성 적용
    // ============================================================

    public ApplyResult applyConfigs(String groupId, String region, List<String> serverIds,
                                    Map<String, Map<String, Object>> launchConfigs) {
        return applyConfigs(groupId, region, serverIds, launchConfigs, DEFAULT_TIMEOUT_BUDGET, null);
    }

    /**
     * 서버별 기동 구성 적용.
     *
     * @param groupId 보호 그룹 ID
     * @param region 리전
     * @param serverIds 대상 서버 ID
     * @param launchConfigs 서버 ID → 전체 유효 구성
     * @param timeoutBudget 전체 시간 예산
     * @param accountContext 대상 계정 (null이면 현재 계정)
     * @return 적용 결과
     * @throws ValidationException 입력이 비어 있는 경우
     * @throws ApplicationException 제어 평면 클라이언트를 만들 수 없는 경우
     */
    public ApplyResult applyConfigs(String groupId, String region, List<String> serverIds,
                                    Map<String, Map<String, Object>> launchConfigs,
                                    Duration timeoutBudget, AccountContext accountContext) {
        if (groupId == null || groupId.isBlank()) {
            throw new ValidationException("groupId is required");
        }
        if (region == null || region.isBlank()) {
            throw new ValidationException("region is required");
        }
        if (serverIds == null || serverIds.isEmpty()) {
            throw new ValidationException("serverIds must not be empty");
        }
        if (timeoutBudget == null || timeoutBudget.isNegative()) {
            throw new ValidationException("timeoutBudget must not be negative");
        }
        Map<String, Map<String, Object>> configs = launchConfigs == null ? Map.of() : launchConfigs;

        RecoveryControlPlane client;
        try {
            client = controlPlaneProvider.clientFor(region, accountContext);
        } catch (ControlPlaneException e) {
            throw new ApplicationException("Failed to create DRS client: " + e.getMessage(), e);
        }

        Instant startedAt = clock.instant();
        Map<String, ServerConfigStatus> results = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        int applied = 0;
        int failed = 0;
        int pending = 0;

        for (int i = 0; i < serverIds.size(); i++) {
            String serverId = serverIds.get(i);

            Duration elapsed = Duration.between(startedAt, clock.instant());
            if (elapsed.compareTo(timeoutBudget) >= 0) {
                List<String> remaining = serverIds.subList(i, serverIds.size());
                for (String remainingId : remaining) {
                    results.put(remainingId, ServerConfigStatus.pending(TIMED_OUT));
                }
                pending = remaining.size();
                errors.add(String.format("Timeout after %ds, %d servers marked as pending",
                    elapsed.getSeconds(), remaining.size()));
                log.warn("Launch config application timed out: groupId={}, elapsed={}s, pending={}",
                    groupId, elapsed.getSeconds(), remaining.size());
                break;
            }

            Map<String, Object> config = configs.get(serverId);
            if (config == null) {
                results.put(serverId, ServerConfigStatus.failed("No launch config found for server " + serverId));
                failed++;
                continue;
            }

            String error = applyOne(client, serverId, config);
            if (error == null) {
                results.put(serverId, ServerConfigStatus.ready(ConfigHasher.hash(config), clock.instant()));
                applied++;
            } else {
                results.put(serverId, ServerConfigStatus.failed(error));
                errors.add("Server " + serverId + ": " + ErrorRedactor.redact(error));
                failed++;
            }
        }

        ConfigState status = aggregate(applied, failed, serverIds.size());
        log.info("Launch configs applied: groupId={}, status={}, applied={}, failed={}, pending={}",
            groupId, status.wireValue(), applied, failed, pending);
        return new ApplyResult(groupId, status, applied, failed, pending, results, errors);
    }

    /**
     * 서버 한 대에 적용. 제어 평면 기동 구성을 먼저 갱신하고, 템플릿 설정이 있으면 EC2 기동 템플릿을 갱신합니다.
     *
     * @return 실패 메시지 (성공 시 null)
     */
    private String applyOne(RecoveryControlPlane client, String serverId, Map<String, Object> config) {
        Map<String, Object> settings = LaunchConfigFields.forControlPlane(config);
        String error = callWithRetry(serverId, ApplyTarget.LAUNCH_CONFIGURATION,
            () -> client.updateLaunchConfiguration(serverId, settings));
        if (error != null) {
            return error;
        }
        LaunchTemplateSettings template = LaunchConfigFields.forLaunchTemplate(config);
        if (template.isEmpty()) {
            return null;
        }
        return callWithRetry(serverId, ApplyTarget.LAUNCH_TEMPLATE,
            () -> client.updateLaunchTemplate(serverId, template));
    }

    /**
     * throttling만 재시도하는 단일 갱신 호출.
     *
     * @return 실패 메시지 (성공 시 null)
     */
    private String callWithRetry(String serverId, ApplyTarget target, Runnable call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                call.run();
                return null;
            } catch (ControlPlaneException e) {
                if (e.isThrottling()) {
                    if (!throttleRetry.canRetryAfter(attempt)) {
                        log.warn("{} update throttled: serverId={}, attempts={}", target.subject, serverId, attempt);
                        return target.api + " API throttled after " + attempt + " attempts";
                    }
                    long delay = throttleRetry.delayBeforeRetry(attempt);
                    log.debug("Throttled, retrying: serverId={}, target={}, attempt={}, delayMs={}",
                        serverId, target, attempt, delay);
                    sleep(delay);
                    continue;
                }
                if (e.isValidation()) {
                    log.warn("Invalid {}: serverId={}, message={}", target.subject, serverId, e.getMessage());
                    return "Invalid " + target.subject + ": " + e.getMessage();
                }
                log.error("{} update failed: serverId={}, code={}", target.subject, serverId, e.getErrorCode(), e);
                return target.api + " API error (" + e.getErrorCode() + "): " + e.getMessage();
            } catch (RuntimeException e) {
                log.error("Unexpected error applying {}: serverId={}", target.subject, serverId, e);
                return "Unexpected error applying config: " + e.getMessage();
            }
        }
    }

    private void sleep(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApplicationException("Launch config retry interrupted", e);
        }
    }

    private static ConfigState aggregate(int applied, int failed, int total) {
        if (applied == total) {
            return ConfigState.READY;
        }
        if (failed == total) {
            return ConfigState.FAILED;
        }
        return ConfigState.PARTIAL;
    }

    /**
     * 부분 적용 결과를 기존 상태에 병합.
     *
     * <p>현재 구성원의 기존 항목 위에 새 결과를 덮어쓰고, 병합된 항목으로 상태를 다시 집계합니다.
     * 그룹을 떠난 서버의 항목은 버립니다.</p>
     *
     * @param previous 기존 상태 (null이면 빈 상태)
     * @param result 새 적용 결과
     * @param appliedBy 적용 주체
     * @param memberIds 현재 그룹 구성원
     * @return 저장할 상태
     */
    public LaunchConfigStatus merge(LaunchConfigStatus previous, ApplyResult result, String appliedBy,
                                   Collection<String> memberIds) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (memberIds == null) {
            throw new IllegalArgumentException("memberIds cannot be null");
        }
        Set<String> members = Set.copyOf(memberIds);
        Map<String, ServerConfigStatus> merged = new LinkedHashMap<>();
        List<String> departed = new ArrayList<>();
        if (previous != null && previous.serverConfigs() != null) {
            previous.serverConfigs().forEach((serverId, serverStatus) -> {
                if (members.contains(serverId)) {
                    merged.put(serverId, serverStatus);
                } else {
                    departed.add(serverId);
                }
            });
        }
        merged.putAll(result.serverConfigs());
        if (!departed.isEmpty()) {
            log.info("Dropped launch config entries for departed servers: groupId={}, servers={}",
                result.groupId(), departed);
        }

        int ready = 0;
        int failedCount = 0;
        for (ServerConfigStatus serverStatus : merged.values()) {
            if (serverStatus.status() == ServerConfigState.READY) {
                ready++;
            } else if (serverStatus.status() == ServerConfigState.FAILED) {
                failedCount++;
            }
        }
        ConfigState status = aggregate(ready, failedCount, merged.size());
        return new LaunchConfigStatus(status, clock.instant(), appliedBy, merged, result.errors());
    }

    // ============================================================
    // Drift 탐지
    // ============================================================

    /**
     * 현재 구성과 저장된 해시 비교.
     *
     * <p>상태 조회 자체가 실패하면 모든 서버를 drift로 간주합니다.</p>
     *
     * @param groupId 보호 그룹 ID
     * @param currentConfigs 서버 ID → 현재 유효 구성
     * @return drift 보고서
     */
    public DriftReport detectDrift(String groupId, Map<String, Map<String, Object>> currentConfigs) {
        Map<String, DriftDetail> details = new LinkedHashMap<>();
        if (currentConfigs == null || currentConfigs.isEmpty()) {
            return DriftReport.of(details);
        }

        LaunchConfigStatus stored;
        try {
            stored = getStatus(groupId);
        } catch (RuntimeException e) {
            log.warn("Drift lookup failed, treating all servers as drifted: groupId={}", groupId, e);
            currentConfigs.forEach((serverId, config) ->
                details.put(serverId, new DriftDetail(ConfigHasher.hash(config), null, LOOKUP_FAILED)));
            return DriftReport.of(details);
        }

        boolean notConfigured = stored.status() == ConfigState.NOT_CONFIGURED;
        currentConfigs.forEach((serverId, config) -> {
            String currentHash = ConfigHasher.hash(config);
            if (notConfigured) {
                details.put(serverId, new DriftDetail(currentHash, null, NO_STORED_STATUS));
                return;
            }
            ServerConfigStatus serverStatus = stored.serverConfig(serverId).orElse(null);
            if (serverStatus == null) {
                details.put(serverId, new DriftDetail(currentHash, null, NO_STORED_SERVER));
            } else if (!serverStatus.hasHash()) {
                details.put(serverId, new DriftDetail(currentHash, null, NO_STORED_HASH));
            } else if (!currentHash.equals(serverStatus.configHash())) {
                details.put(serverId, new DriftDetail(currentHash, serverStatus.configHash(), HASH_MISMATCH));
            }
        });

        if (!details.isEmpty()) {
            log.info("Configuration drift detected: groupId={}, drifted={}", groupId, details.keySet());
        }
        return DriftReport.of(details);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }

    private enum ApplyTarget {
        LAUNCH_CONFIGURATION("DRS", "launch config"),
        LAUNCH_TEMPLATE("EC2", "launch template");

        private final String api;
        private final String subject;

        ApplyTarget(String api, String subject) {
            this.api = api;
            this.subject = subject;
        }
    }
}
