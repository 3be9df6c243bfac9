package com.ryuqq.drorchestrator.core.outcome;

import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.model.LaunchStatus;
import com.ryuqq.drorchestrator.core.model.ServerStatus;
import com.ryuqq.drorchestrator.core.spi.JobStatus;
import com.ryuqq.drorchestrator.core.spi.ParticipatingServer;
import com.ryuqq.drorchestrator.core.spi.RecoveryJob;

import java.util.List;

/**
 * Job 스냅샷으로부터 Wave 결과 판정.
 *
 * <p><strong>판정 규칙 (순서대로):</strong></p>
 * <ol>
 *   <li>참여 서버 없음: Job이 COMPLETED면 실패(DRS_JOB_NO_SERVERS), 아니면 진행 중</li>
 *   <li>FAILED/TERMINATED 서버가 하나라도 있으면 실패(WAVE_LAUNCH_FAILED)</li>
 *   <li>모든 서버 LAUNCHED: RECOVERY는 post-launch action 완료까지 진행 중, 그 외 완료</li>
 *   <li>Job이 COMPLETED인데 미기동 서버가 남음: 실패(DRS_JOB_COMPLETED_WITHOUT_LAUNCH)</li>
 *   <li>그 외 진행 중</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WaveClassifier {

    // Utility class - prevent instantiation
    private WaveClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Wave 결과 판정.
     *
     * @param job Job 스냅샷 (null 불가)
     * @param type 실행 유형 (null 불가)
     * @return 판정 결과
     */
    public static WaveOutcome classify(RecoveryJob job, ExecutionType type) {
        if (job == null || type == null) {
            throw new IllegalArgumentException("job and type cannot be null (job: " + job + ", type: " + type + ")");
        }

        List<ParticipatingServer> participants = job.participatingServers();
        if (participants.isEmpty()) {
            if (job.status() == JobStatus.COMPLETED) {
                return new WaveFailed(ErrorCode.DRS_JOB_NO_SERVERS,
                    "DRS job completed but no participating servers", List.of());
            }
            return new WaveInProgress(List.of(), 0, 0);
        }

        List<ServerStatus> snapshot = participants.stream()
            .map(p -> ServerStatus.reported(p.sourceServerId(),
                LaunchStatus.fromControlPlane(p.launchStatus()), p.recoveryInstanceId()))
            .toList();

        int total = snapshot.size();
        long launched = snapshot.stream().filter(s -> s.launchStatus() == LaunchStatus.LAUNCHED).count();
        long failed = snapshot.stream().filter(s -> s.launchStatus().isFailure()).count();

        if (failed > 0) {
            return new WaveFailed(ErrorCode.WAVE_LAUNCH_FAILED,
                failed + " of " + total + " servers failed to launch", snapshot);
        }

        if (launched == total) {
            boolean postLaunchDone = type.isDrill()
                || participants.stream().allMatch(ParticipatingServer::isPostLaunchComplete);
            if (postLaunchDone) {
                return new WaveCompleted(snapshot);
            }
            return new WaveInProgress(snapshot, (int) launched, total);
        }

        if (job.status() == JobStatus.COMPLETED) {
            return new WaveFailed(ErrorCode.DRS_JOB_COMPLETED_WITHOUT_LAUNCH,
                "DRS job completed but only " + launched + "/" + total + " servers launched", snapshot);
        }

        return new WaveInProgress(snapshot, (int) launched, total);
    }
}
