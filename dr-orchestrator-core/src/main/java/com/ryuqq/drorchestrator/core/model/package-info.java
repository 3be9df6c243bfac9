/**
 * DR 실행 도메인 모델.
 *
 * <h2>애그리거트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drorchestrator.core.model.Execution} - Wave를 값으로 소유하는 실행</li>
 *   <li>{@link com.ryuqq.drorchestrator.core.model.ProtectionGroup} - ID로만 참조되는 공유 엔티티</li>
 * </ul>
 *
 * <h2>값 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drorchestrator.core.model.ExecutionKey}</li>
 *   <li>{@link com.ryuqq.drorchestrator.core.model.AccountContext}</li>
 *   <li>{@link com.ryuqq.drorchestrator.core.model.LaunchConfigStatus}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.core.model;
