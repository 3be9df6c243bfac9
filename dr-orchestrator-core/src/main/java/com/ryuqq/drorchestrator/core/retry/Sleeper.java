package com.ryuqq.drorchestrator.core.retry;

/**
 * 재시도 대기 추상화. 테스트에서는 실제로 잠들지 않는 구현을 주입합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper system() {
        return Thread::sleep;
    }
}
