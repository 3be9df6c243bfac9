package com.ryuqq.drorchestrator.testkit.fake;

import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.core.spi.InstanceDetails;
import com.ryuqq.drorchestrator.core.spi.JobLogItem;
import com.ryuqq.drorchestrator.core.spi.JobStatus;
import com.ryuqq.drorchestrator.core.spi.JobType;
import com.ryuqq.drorchestrator.core.spi.LaunchTemplateSettings;
import com.ryuqq.drorchestrator.core.spi.ParticipatingServer;
import com.ryuqq.drorchestrator.core.spi.RecoveryControlPlane;
import com.ryuqq.drorchestrator.core.spi.RecoveryJob;
import com.ryuqq.drorchestrator.core.spi.SourceServer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 스크립트 가능한 {@link RecoveryControlPlane} 테스트 구현.
 *
 * <p>Job, 소스 서버, 인스턴스를 메모리에 보관하며 호출별 실패를 주입할 수 있습니다.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * FakeRecoveryControlPlane drs = new FakeRecoveryControlPlane();
 * drs.addSourceServer("s-1", Map.of("Tier", "db"));
 * drs.failStartRecovery(ControlPlaneException.conflict("busy"), 2);
 *
 * String jobId = drs.startRecovery(true, List.of("s-1"));   // 세 번째 호출부터 성공
 * drs.setLaunchStatus(jobId, "s-1", "LAUNCHED");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeRecoveryControlPlane implements RecoveryControlPlane {

    private final Map<String, SourceServer> sourceServers = new LinkedHashMap<>();
    private final Map<String, RecoveryJob> jobs = new LinkedHashMap<>();
    private final Map<String, List<JobLogItem>> jobLogs = new HashMap<>();
    private final Map<String, InstanceDetails> instances = new HashMap<>();
    private final Map<String, Deque<RuntimeException>> updateFailures = new HashMap<>();
    private final Deque<RuntimeException> startFailures = new ArrayDeque<>();
    private final List<ConfigUpdate> configUpdates = new ArrayList<>();
    private final Map<String, Deque<RuntimeException>> templateFailures = new HashMap<>();
    private final Set<String> serversWithoutTemplate = new HashSet<>();
    private final List<TemplateUpdate> templateUpdates = new ArrayList<>();
    private final List<List<String>> startedServerLists = new ArrayList<>();

    private RuntimeException describeServersFailure;
    private RuntimeException describeJobFailure;
    private RuntimeException describeJobsFailure;
    private RuntimeException describeInstanceFailure;
    private RuntimeException describeJobLogFailure;
    private int jobSequence;
    private int startRecoveryCalls;
    private int describeJobCalls;
    private boolean lastStartWasDrill;

    /**
     * 구성 갱신 호출 기록.
     *
     * @param sourceServerId 서버 ID
     * @param settings 전달된 구성
     */
    public record ConfigUpdate(String sourceServerId, Map<String, Object> settings) {
    }

    /**
     * 기동 템플릿 갱신 호출 기록.
     *
     * @param sourceServerId 서버 ID
     * @param settings 전달된 템플릿 설정
     */
    public record TemplateUpdate(String sourceServerId, LaunchTemplateSettings settings) {
    }

    // ============================================================
    // RecoveryControlPlane
    // ============================================================

    @Override
    public synchronized String startRecovery(boolean drill, List<String> sourceServerIds) {
        startRecoveryCalls++;
        if (!startFailures.isEmpty()) {
            throw startFailures.poll();
        }
        lastStartWasDrill = drill;
        startedServerLists.add(List.copyOf(sourceServerIds));
        String jobId = "drsjob-" + (++jobSequence);
        List<ParticipatingServer> participants = sourceServerIds.stream()
            .map(id -> new ParticipatingServer(id, "PENDING", null, null))
            .toList();
        jobs.put(jobId, new RecoveryJob(jobId, JobType.LAUNCH, JobStatus.PENDING, participants, null));
        return jobId;
    }

    @Override
    public synchronized Optional<RecoveryJob> describeJob(String jobId) {
        describeJobCalls++;
        if (describeJobFailure != null) {
            throw describeJobFailure;
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<RecoveryJob> describeJobs(JobType type, Set<JobStatus> statuses) {
        if (describeJobsFailure != null) {
            throw describeJobsFailure;
        }
        return jobs.values().stream()
            .filter(job -> job.type() == type && statuses.contains(job.status()))
            .toList();
    }

    @Override
    public synchronized List<JobLogItem> describeJobLogItems(String jobId) {
        if (describeJobLogFailure != null) {
            throw describeJobLogFailure;
        }
        return List.copyOf(jobLogs.getOrDefault(jobId, List.of()));
    }

    @Override
    public synchronized void updateLaunchConfiguration(String sourceServerId, Map<String, Object> settings) {
        Deque<RuntimeException> failures = updateFailures.get(sourceServerId);
        if (failures != null && !failures.isEmpty()) {
            throw failures.poll();
        }
        configUpdates.add(new ConfigUpdate(sourceServerId, Map.copyOf(settings)));
    }

    @Override
    public synchronized void updateLaunchTemplate(String sourceServerId, LaunchTemplateSettings settings) {
        Deque<RuntimeException> failures = templateFailures.get(sourceServerId);
        if (failures != null && !failures.isEmpty()) {
            throw failures.poll();
        }
        if (serversWithoutTemplate.contains(sourceServerId)) {
            throw new ControlPlaneException("ResourceNotFoundException",
                "No EC2 launch template for source server " + sourceServerId);
        }
        templateUpdates.add(new TemplateUpdate(sourceServerId, settings));
    }

    @Override
    public synchronized List<SourceServer> describeSourceServers() {
        if (describeServersFailure != null) {
            throw describeServersFailure;
        }
        return List.copyOf(sourceServers.values());
    }

    @Override
    public synchronized Optional<InstanceDetails> describeInstance(String recoveryInstanceId) {
        if (describeInstanceFailure != null) {
            throw describeInstanceFailure;
        }
        return Optional.ofNullable(instances.get(recoveryInstanceId));
    }

    // ============================================================
    // 스크립트
    // ============================================================

    public synchronized FakeRecoveryControlPlane addSourceServer(String sourceServerId, Map<String, String> tags) {
        sourceServers.put(sourceServerId, new SourceServer(sourceServerId, sourceServerId + ".local", tags));
        return this;
    }

    /**
     * 외부에서 시작된 Job 등록.
     */
    public synchronized void putJob(RecoveryJob job) {
        jobs.put(job.jobId(), job);
    }

    public synchronized void removeJob(String jobId) {
        jobs.remove(jobId);
    }

    public synchronized void setJobStatus(String jobId, JobStatus status) {
        RecoveryJob job = requireJob(jobId);
        jobs.put(jobId, new RecoveryJob(jobId, job.type(), status, job.participatingServers(), job.creationTime()));
    }

    /**
     * 참여 서버의 기동 상태 변경. LAUNCHED면 recoveryInstanceId를 "i-" + serverId로 채웁니다.
     */
    public synchronized void setLaunchStatus(String jobId, String sourceServerId, String launchStatus) {
        setServer(jobId, sourceServerId, launchStatus, null);
    }

    public synchronized void setServer(String jobId, String sourceServerId, String launchStatus,
                                       String postLaunchActionsStatus) {
        RecoveryJob job = requireJob(jobId);
        List<ParticipatingServer> updated = new ArrayList<>();
        for (ParticipatingServer server : job.participatingServers()) {
            if (server.sourceServerId().equals(sourceServerId)) {
                String instanceId = "LAUNCHED".equals(launchStatus) ? "i-" + sourceServerId : server.recoveryInstanceId();
                updated.add(new ParticipatingServer(sourceServerId, launchStatus, instanceId, postLaunchActionsStatus));
            } else {
                updated.add(server);
            }
        }
        jobs.put(jobId, new RecoveryJob(jobId, job.type(), job.status(), updated, job.creationTime()));
    }

    /**
     * 모든 참여 서버를 LAUNCHED로, Job을 COMPLETED로 변경.
     */
    public synchronized void launchAll(String jobId) {
        RecoveryJob job = requireJob(jobId);
        for (ParticipatingServer server : job.participatingServers()) {
            setServer(jobId, server.sourceServerId(), "LAUNCHED", "COMPLETED");
        }
        setJobStatus(jobId, JobStatus.COMPLETED);
    }

    public synchronized void clearParticipants(String jobId) {
        RecoveryJob job = requireJob(jobId);
        jobs.put(jobId, new RecoveryJob(jobId, job.type(), job.status(), List.of(), job.creationTime()));
    }

    public synchronized void addJobLogItem(String jobId, JobLogItem item) {
        jobLogs.computeIfAbsent(jobId, k -> new ArrayList<>()).add(item);
    }

    public synchronized void addInstance(InstanceDetails details) {
        instances.put(details.instanceId(), details);
    }

    /**
     * 다음 n번의 startRecovery 호출을 실패시킴.
     */
    public synchronized void failStartRecovery(RuntimeException failure, int times) {
        for (int i = 0; i < times; i++) {
            startFailures.add(failure);
        }
    }

    /**
     * 특정 서버의 구성 갱신을 순서대로 실패시킴.
     */
    public synchronized void failUpdate(String sourceServerId, RuntimeException... failures) {
        Deque<RuntimeException> queue = updateFailures.computeIfAbsent(sourceServerId, k -> new ArrayDeque<>());
        for (RuntimeException failure : failures) {
            queue.add(failure);
        }
    }

    /**
     * 특정 서버의 기동 템플릿 갱신을 순서대로 실패시킴.
     */
    public synchronized void failTemplateUpdate(String sourceServerId, RuntimeException... failures) {
        Deque<RuntimeException> queue = templateFailures.computeIfAbsent(sourceServerId, k -> new ArrayDeque<>());
        for (RuntimeException failure : failures) {
            queue.add(failure);
        }
    }

    /**
     * 서버에 기동 템플릿이 없는 것으로 설정.
     */
    public synchronized void removeLaunchTemplate(String sourceServerId) {
        serversWithoutTemplate.add(sourceServerId);
    }

    public synchronized void failDescribeSourceServers(RuntimeException failure) {
        this.describeServersFailure = failure;
    }

    /**
     * 단건 Job 조회 실패 설정 (null이면 해제).
     */
    public synchronized void failDescribeJob(RuntimeException failure) {
        this.describeJobFailure = failure;
    }

    public synchronized void failDescribeJobs(RuntimeException failure) {
        this.describeJobsFailure = failure;
    }

    public synchronized void failDescribeInstance(RuntimeException failure) {
        this.describeInstanceFailure = failure;
    }

    public synchronized void failDescribeJobLogItems(RuntimeException failure) {
        this.describeJobLogFailure = failure;
    }

    // ============================================================
    // 관찰
    // ============================================================

    public synchronized List<ConfigUpdate> configUpdates() {
        return List.copyOf(configUpdates);
    }

    public synchronized List<TemplateUpdate> templateUpdates() {
        return List.copyOf(templateUpdates);
    }

    public synchronized List<List<String>> startedServerLists() {
        return List.copyOf(startedServerLists);
    }

    public synchronized int startRecoveryCalls() {
        return startRecoveryCalls;
    }

    public synchronized int describeJobCalls() {
        return describeJobCalls;
    }

    public synchronized boolean lastStartWasDrill() {
        return lastStartWasDrill;
    }

    public synchronized Optional<RecoveryJob> job(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    private RecoveryJob requireJob(String jobId) {
        RecoveryJob job = jobs.get(jobId);
        if (job == null) {
            throw new ControlPlaneException("ResourceNotFoundException", "Job " + jobId + " not found");
        }
        return job;
    }
}
