package com.ryuqq.drorchestrator.application.wave;

import com.ryuqq.drorchestrator.core.outcome.WaveInProgress;
import com.ryuqq.drorchestrator.core.spi.JobLogItem;
import com.ryuqq.drorchestrator.core.statemachine.WaveStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Job 로그로부터 진행 중 Wave 단계 판정.
 *
 * <p>최근 10개 이벤트를 최신순으로 보고 처음 일치하는 이벤트로 단계를 정합니다.
 * 일부 서버만 기동된 경우에는 IN_PROGRESS가 우선합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class JobPhaseDetector {

    static final int RECENT_EVENTS = 10;

    // Utility class - prevent instantiation
    private JobPhaseDetector() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static WaveStatus detect(List<JobLogItem> logItems, WaveInProgress progress) {
        if (progress.isPartiallyLaunched()) {
            return WaveStatus.IN_PROGRESS;
        }
        List<JobLogItem> recent = logItems.stream()
            .sorted(Comparator.comparing(JobLogItem::eventTime,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
            .limit(RECENT_EVENTS)
            .toList();

        for (JobLogItem item : recent) {
            String event = item.event() == null ? "" : item.event().toUpperCase(Locale.ROOT);
            if (event.contains("LAUNCH")) {
                return WaveStatus.LAUNCHING;
            }
            if (event.contains("CONVERSION") && event.contains("START")) {
                return WaveStatus.CONVERTING;
            }
        }
        return WaveStatus.STARTED;
    }
}
