/**
 * 오케스트레이터 오류 분류 체계.
 *
 * <p>{@link com.ryuqq.drorchestrator.core.exception.OrchestrationException}을 최상위로 하며,
 * 각 예외는 {@link com.ryuqq.drorchestrator.core.exception.ErrorCode}를 통해
 * 영속 상태의 {@code errorCode}로 변환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.core.exception;
