/**
 * 재시도 정책과 대기 추상화.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.core.retry;
