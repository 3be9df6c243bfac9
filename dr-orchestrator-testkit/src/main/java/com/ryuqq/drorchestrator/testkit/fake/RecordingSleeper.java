package com.ryuqq.drorchestrator.testkit.fake;

import com.ryuqq.drorchestrator.core.retry.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 실제로 잠들지 않고 요청된 대기 시간만 기록하는 {@link Sleeper}.
 *
 * <p>{@link ManualClock}을 주면 대기 시간만큼 시계를 진행시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = new ArrayList<>();
    private final ManualClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(ManualClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(long millis) {
        sleeps.add(millis);
        if (clock != null) {
            clock.advance(Duration.ofMillis(millis));
        }
    }

    public synchronized List<Long> sleeps() {
        return List.copyOf(sleeps);
    }
}
