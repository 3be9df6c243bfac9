/**
 * Wave와 Execution의 상태 머신.
 *
 * <p>상태 enum과 전이 검증기를 제공합니다. 모든 상태 변경은
 * {@link com.ryuqq.drorchestrator.core.statemachine.WaveTransition} 또는
 * {@link com.ryuqq.drorchestrator.core.statemachine.ExecutionTransition}을 거칩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.core.statemachine;
