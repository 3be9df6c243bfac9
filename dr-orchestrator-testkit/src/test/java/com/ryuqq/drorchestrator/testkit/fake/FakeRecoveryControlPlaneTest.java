package com.ryuqq.drorchestrator.testkit.fake;

import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.core.spi.JobStatus;
import com.ryuqq.drorchestrator.core.spi.JobType;
import com.ryuqq.drorchestrator.core.spi.LaunchTemplateSettings;
import com.ryuqq.drorchestrator.core.spi.ParticipatingServer;
import com.ryuqq.drorchestrator.core.spi.RecoveryJob;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FakeRecoveryControlPlane 및 시간 관련 fake 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FakeRecoveryControlPlaneTest {

    @Test
    void startRecovery_CreatesPendingLaunchJobWithSequentialIds() {
        FakeRecoveryControlPlane drs = new FakeRecoveryControlPlane();

        String first = drs.startRecovery(true, List.of("s-1", "s-2"));
        String second = drs.startRecovery(false, List.of("s-3"));

        assertEquals("drsjob-1", first);
        assertEquals("drsjob-2", second);
        RecoveryJob job = drs.describeJob(first).orElseThrow();
        assertEquals(JobType.LAUNCH, job.type());
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(2, job.participatingServers().size());
        assertFalse(drs.lastStartWasDrill());
    }

    @Test
    void failStartRecovery_FailsOnlyRequestedTimes() {
        FakeRecoveryControlPlane drs = new FakeRecoveryControlPlane();
        drs.failStartRecovery(ControlPlaneException.conflict("busy"), 2);

        assertThrows(ControlPlaneException.class, () -> drs.startRecovery(true, List.of("s-1")));
        assertThrows(ControlPlaneException.class, () -> drs.startRecovery(true, List.of("s-1")));
        assertEquals("drsjob-1", drs.startRecovery(true, List.of("s-1")));
        assertEquals(3, drs.startRecoveryCalls());
    }

    @Test
    void launchAll_MarksServersLaunchedAndJobCompleted() {
        FakeRecoveryControlPlane drs = new FakeRecoveryControlPlane();
        String jobId = drs.startRecovery(true, List.of("s-1"));

        drs.launchAll(jobId);

        RecoveryJob job = drs.job(jobId).orElseThrow();
        ParticipatingServer server = job.participatingServers().get(0);
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals("LAUNCHED", server.launchStatus());
        assertEquals("i-s-1", server.recoveryInstanceId());
        assertTrue(drs.describeJobs(JobType.LAUNCH, Set.of(JobStatus.PENDING, JobStatus.STARTED)).isEmpty());
    }

    @Test
    void failDescribeJob_NullClearsFailure() {
        FakeRecoveryControlPlane drs = new FakeRecoveryControlPlane();
        drs.failDescribeJob(ControlPlaneException.throttling("slow down"));

        assertThrows(ControlPlaneException.class, () -> drs.describeJob("drsjob-1"));
        drs.failDescribeJob(null);

        assertTrue(drs.describeJob("drsjob-1").isEmpty());
        assertEquals(2, drs.describeJobCalls());
    }

    @Test
    void updateLaunchConfiguration_RecordsOnlySuccessfulUpdates() {
        FakeRecoveryControlPlane drs = new FakeRecoveryControlPlane();
        drs.failUpdate("s-1", ControlPlaneException.throttling("slow down"));

        assertThrows(ControlPlaneException.class,
            () -> drs.updateLaunchConfiguration("s-1", Map.of("copyTags", true)));
        drs.updateLaunchConfiguration("s-1", Map.of("copyTags", true));

        assertEquals(1, drs.configUpdates().size());
        assertEquals(Map.of("copyTags", true), drs.configUpdates().get(0).settings());
    }

    @Test
    void updateLaunchTemplate_RecordsSettingsAndReportsMissingTemplate() {
        FakeRecoveryControlPlane drs = new FakeRecoveryControlPlane();
        LaunchTemplateSettings settings = new LaunchTemplateSettings("m5.large", "subnet-1", List.of("sg-1"), null, null);
        drs.removeLaunchTemplate("s-2");

        drs.updateLaunchTemplate("s-1", settings);
        ControlPlaneException e = assertThrows(ControlPlaneException.class,
            () -> drs.updateLaunchTemplate("s-2", settings));

        assertTrue(e.isNotFound());
        assertEquals(1, drs.templateUpdates().size());
        assertEquals("s-1", drs.templateUpdates().get(0).sourceServerId());
        assertEquals(settings, drs.templateUpdates().get(0).settings());
    }

    @Test
    void setJobStatus_UnknownJob_ThrowsNotFound() {
        FakeRecoveryControlPlane drs = new FakeRecoveryControlPlane();

        ControlPlaneException e = assertThrows(ControlPlaneException.class,
            () -> drs.setJobStatus("missing", JobStatus.COMPLETED));
        assertTrue(e.isNotFound());
    }

    @Test
    void recordingSleeper_AdvancesManualClock() {
        ManualClock clock = ManualClock.at("2026-01-01T00:00:00Z");
        RecordingSleeper sleeper = new RecordingSleeper(clock);

        sleeper.sleep(1_500);
        sleeper.sleep(500);

        assertEquals(List.of(1_500L, 500L), sleeper.sleeps());
        assertEquals(clock.instant(), ManualClock.at("2026-01-01T00:00:00Z").instant().plus(Duration.ofSeconds(2)));
    }
}
