package com.ryuqq.drorchestrator.application.admission;

import com.ryuqq.drorchestrator.core.config.QuotaLimits;
import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionKey;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;
import com.ryuqq.drorchestrator.core.model.RecoveryPlan;
import com.ryuqq.drorchestrator.core.model.ServerStatus;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.model.WaveDefinition;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneProvider;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.spi.JobStatus;
import com.ryuqq.drorchestrator.core.spi.JobType;
import com.ryuqq.drorchestrator.core.spi.ParticipatingServer;
import com.ryuqq.drorchestrator.core.spi.ProtectionGroupStore;
import com.ryuqq.drorchestrator.core.spi.RecoveryJob;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 실행 승인 검사.
 *
 * <p>두 출처를 함께 확인합니다:</p>
 * <ul>
 *   <li>내부 실행 기록: 다른 계획의 활성 실행이 점유 중인 서버</li>
 *   <li>제어 평면의 실행 중 Job: 오케스트레이터 밖에서 시작된 Job 포함</li>
 * </ul>
 *
 * <p>검사는 조언적입니다. 검사를 통과한 두 실행이 Job 등록 전에 경쟁할 수 있으며,
 * 실행 간 배타는 {@link com.ryuqq.drorchestrator.core.spi.ServerReservations}가 보장합니다.</p>
 *
 * <p>같은 계획의 이전 실행은 점유자로 보지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private static final Set<JobStatus> LIVE_JOB_STATUSES = Set.of(JobStatus.PENDING, JobStatus.STARTED);

    private final ExecutionStore executionStore;
    private final ProtectionGroupStore groupStore;
    private final MembershipResolver membershipResolver;
    private final ControlPlaneProvider controlPlaneProvider;
    private final QuotaLimits quotaLimits;

    public AdmissionController(ExecutionStore executionStore, ProtectionGroupStore groupStore,
                               MembershipResolver membershipResolver, ControlPlaneProvider controlPlaneProvider,
                               QuotaLimits quotaLimits) {
        if (executionStore == null) {
            throw new IllegalArgumentException("executionStore cannot be null");
        }
        if (groupStore == null) {
            throw new IllegalArgumentException("groupStore cannot be null");
        }
        if (membershipResolver == null) {
            throw new IllegalArgumentException("membershipResolver cannot be null");
        }
        if (controlPlaneProvider == null) {
            throw new IllegalArgumentException("controlPlaneProvider cannot be null");
        }
        if (quotaLimits == null) {
            throw new IllegalArgumentException("quotaLimits cannot be null");
        }
        this.executionStore = executionStore;
        this.groupStore = groupStore;
        this.membershipResolver = membershipResolver;
        this.controlPlaneProvider = controlPlaneProvider;
        this.quotaLimits = quotaLimits;
    }

    /**
     * 계획 전체 승인 검사.
     *
     * <p>보호 그룹이 없거나 구성원을 해석할 수 없는 Wave는 건너뜁니다.
     * 해당 오류는 Wave 시작 시 보고됩니다.</p>
     *
     * @param plan 복구 계획
     * @param accountContext 계정 컨텍스트
     * @return 충돌 목록 뒤에 할당량 위반 목록 (비어 있으면 승인)
     */
    public List<Conflict> checkConflicts(RecoveryPlan plan, AccountContext accountContext) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        Map<MembershipKey, List<String>> membershipCache = new HashMap<>();
        List<WaveMembers> members = new ArrayList<>();
        for (WaveDefinition definition : plan.waves()) {
            Optional<ProtectionGroup> group = groupStore.find(definition.protectionGroupId());
            if (group.isEmpty()) {
                log.warn("Skipping admission for wave {}: protection group {} not found",
                    definition.waveNumber(), definition.protectionGroupId());
                continue;
            }
            List<String> serverIds = resolveCached(group.get(), accountContext, membershipCache);
            if (serverIds == null) {
                continue;
            }
            members.add(new WaveMembers(definition.waveNumber(), group.get().region(), serverIds));
        }
        return evaluate(plan.planId(), members, accountContext, membershipCache);
    }

    /**
     * 단일 Wave 승인 검사 (구성원이 이미 해석된 경우).
     *
     * @param self 시작하려는 실행
     * @param waveNumber Wave 번호
     * @param region 리전
     * @param serverIds 구성원
     * @param accountContext 계정 컨텍스트
     * @return 충돌 목록 뒤에 할당량 위반 목록
     */
    public List<Conflict> checkWave(ExecutionKey self, int waveNumber, String region, List<String> serverIds,
                                    AccountContext accountContext) {
        if (self == null) {
            throw new IllegalArgumentException("self cannot be null");
        }
        return evaluate(self.planId(), List.of(new WaveMembers(waveNumber, region, serverIds)),
            accountContext, new HashMap<>());
    }

    private List<Conflict> evaluate(String planId, List<WaveMembers> waves, AccountContext accountContext,
                                    Map<MembershipKey, List<String>> membershipCache) {
        Map<String, ExecutionKey> held = heldServers(planId, membershipCache);

        List<Conflict> conflicts = new ArrayList<>();
        List<Conflict> violations = new ArrayList<>();
        Map<String, LiveJobs> liveJobsByRegion = new LinkedHashMap<>();
        Map<String, Integer> planServersByRegion = new LinkedHashMap<>();

        for (WaveMembers wave : waves) {
            planServersByRegion.merge(wave.region(), wave.serverIds().size(), Integer::sum);

            if (wave.serverIds().size() > quotaLimits.maxServersPerJob()) {
                violations.add(Conflict.quota(QuotaType.SERVERS_PER_JOB, wave.waveNumber(), wave.region(),
                    String.format("Wave %d has %d servers (limit: %d)",
                        wave.waveNumber(), wave.serverIds().size(), quotaLimits.maxServersPerJob())));
            }

            LiveJobs liveJobs = liveJobsByRegion.get(wave.region());
            if (liveJobs == null) {
                liveJobs = queryLiveJobs(wave.region(), accountContext);
                liveJobsByRegion.put(wave.region(), liveJobs);
                if (liveJobs.jobCount() >= quotaLimits.maxConcurrentJobs()) {
                    violations.add(Conflict.quota(QuotaType.CONCURRENT_JOBS, null, wave.region(),
                        String.format("Region %s has %d active jobs (limit: %d)",
                            wave.region(), liveJobs.jobCount(), quotaLimits.maxConcurrentJobs())));
                }
            }

            for (String serverId : wave.serverIds()) {
                ExecutionKey holder = held.get(serverId);
                if (holder != null) {
                    conflicts.add(Conflict.execution(wave.waveNumber(), serverId, holder, wave.region()));
                    continue;
                }
                String jobId = liveJobs.jobByServer().get(serverId);
                if (jobId != null) {
                    conflicts.add(Conflict.drsJob(wave.waveNumber(), serverId, jobId, wave.region()));
                }
            }
        }

        planServersByRegion.forEach((region, planServers) -> {
            int inJobs = liveJobsByRegion.get(region).serversInJobs();
            if (inJobs + planServers > quotaLimits.maxServersInAllJobs()) {
                violations.add(Conflict.quota(QuotaType.TOTAL_SERVERS_IN_JOBS, null, region,
                    String.format("Region %s would have %d servers in active jobs (current: %d, adding: %d, limit: %d)",
                        region, inJobs + planServers, inJobs, planServers, quotaLimits.maxServersInAllJobs())));
            }
        });

        if (!conflicts.isEmpty() || !violations.isEmpty()) {
            log.info("Admission check found issues: planId={}, conflicts={}, quotaViolations={}",
                planId, conflicts.size(), violations.size());
        }
        List<Conflict> result = new ArrayList<>(conflicts);
        result.addAll(violations);
        return result;
    }

    /**
     * 다른 계획의 활성 실행이 점유 중인 서버.
     *
     * <p>활성 실행은 취소되지 않은 모든 Wave의 서버를 점유합니다. 완료된 Wave의 서버도
     * 실행이 끝나 예약이 해제될 때까지 점유로 봅니다.</p>
     *
     * <p>서버 기록이 있는 Wave는 기록을 사용하고, 기록이 없는 Wave는 해당 실행의
     * 계정 컨텍스트로 보호 그룹을 다시 해석합니다.</p>
     */
    private Map<String, ExecutionKey> heldServers(String planId, Map<MembershipKey, List<String>> membershipCache) {
        Map<String, ExecutionKey> held = new HashMap<>();
        List<UnresolvedWave> unresolved = new ArrayList<>();

        for (Execution execution : executionStore.findActive()) {
            if (execution.getPlanId().equals(planId)) {
                continue;
            }
            for (Wave wave : execution.getWaves()) {
                if (wave.getStatus() == WaveStatus.CANCELLED) {
                    continue;
                }
                List<String> recorded = recordedServers(wave);
                if (recorded.isEmpty()) {
                    unresolved.add(new UnresolvedWave(wave.getProtectionGroupId(), execution.getKey(),
                        execution.getAccountContext()));
                    continue;
                }
                for (String serverId : recorded) {
                    held.putIfAbsent(serverId, execution.getKey());
                }
            }
        }

        for (UnresolvedWave wave : unresolved) {
            Optional<ProtectionGroup> group = groupStore.find(wave.protectionGroupId());
            if (group.isEmpty()) {
                continue;
            }
            List<String> serverIds = resolveCached(group.get(), wave.accountContext(), membershipCache);
            if (serverIds == null) {
                continue;
            }
            for (String serverId : serverIds) {
                held.putIfAbsent(serverId, wave.owner());
            }
        }
        return held;
    }

    private static List<String> recordedServers(Wave wave) {
        if (!wave.getServers().isEmpty()) {
            return wave.getServers().stream().map(ServerStatus::sourceServerId).toList();
        }
        return wave.getServerIds();
    }

    /**
     * 호출 단위 캐시를 사용한 구성원 해석. 캐시는 그룹과 계정 컨텍스트 쌍으로 구분합니다.
     *
     * @return 구성원 (해석 실패 시 null)
     */
    private List<String> resolveCached(ProtectionGroup group, AccountContext accountContext,
                                       Map<MembershipKey, List<String>> cache) {
        MembershipKey key = new MembershipKey(group.groupId(), accountContext);
        if (cache.containsKey(key)) {
            return cache.get(key);
        }
        List<String> serverIds;
        try {
            serverIds = membershipResolver.resolve(group, accountContext);
        } catch (RuntimeException e) {
            log.warn("Membership resolution failed during admission: groupId={}", group.groupId(), e);
            serverIds = null;
        }
        cache.put(key, serverIds);
        return serverIds;
    }

    private LiveJobs queryLiveJobs(String region, AccountContext accountContext) {
        List<RecoveryJob> jobs;
        try {
            jobs = controlPlaneProvider.clientFor(region, accountContext)
                .describeJobs(JobType.LAUNCH, LIVE_JOB_STATUSES);
        } catch (ControlPlaneException e) {
            log.warn("Live job query failed, skipping external job check: region={}", region, e);
            return LiveJobs.EMPTY;
        }

        Map<String, String> jobByServer = new HashMap<>();
        int serversInJobs = 0;
        for (RecoveryJob job : jobs) {
            for (ParticipatingServer server : job.participatingServers()) {
                jobByServer.putIfAbsent(server.sourceServerId(), job.jobId());
                serversInJobs++;
            }
        }
        return new LiveJobs(jobs.size(), serversInJobs, jobByServer);
    }

    private record WaveMembers(int waveNumber, String region, List<String> serverIds) {
    }

    private record UnresolvedWave(String protectionGroupId, ExecutionKey owner, AccountContext accountContext) {
    }

    private record MembershipKey(String groupId, AccountContext accountContext) {
    }

    private record LiveJobs(int jobCount, int serversInJobs, Map<String, String> jobByServer) {

        static final LiveJobs EMPTY = new LiveJobs(0, 0, Map.of());
    }
}
