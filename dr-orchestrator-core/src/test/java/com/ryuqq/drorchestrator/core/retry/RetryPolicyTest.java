package com.ryuqq.drorchestrator.core.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryPolicyTest {

    @Test
    void jobStart_DelaysDoubleFromTenSeconds() {
        RetryPolicy policy = RetryPolicy.jobStart();

        assertEquals(5, policy.maxAttempts());
        assertEquals(10_000, policy.delayBeforeRetry(1));
        assertEquals(20_000, policy.delayBeforeRetry(2));
        assertEquals(40_000, policy.delayBeforeRetry(3));
        assertEquals(80_000, policy.delayBeforeRetry(4));
    }

    @Test
    void delayBeforeRetry_CappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(10, 1_000, 2.0, 5_000);
        assertEquals(5_000, policy.delayBeforeRetry(8));
    }

    @Test
    void canRetryAfter_StopsAtMaxAttempts() {
        RetryPolicy policy = RetryPolicy.throttling();

        assertTrue(policy.canRetryAfter(1));
        assertTrue(policy.canRetryAfter(2));
        assertFalse(policy.canRetryAfter(3));
    }

    @Test
    void constructor_InvalidValues_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1, 2.0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 10, 0.5, 10));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 10, 2.0, 5));
    }

    @Test
    void delayBeforeRetry_NonPositive_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.jobStart().delayBeforeRetry(0));
    }
}
