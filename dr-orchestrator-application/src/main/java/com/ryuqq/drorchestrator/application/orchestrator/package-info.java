/**
 * DR 오케스트레이터 진입점.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drorchestrator.application.orchestrator.WaveOrchestrator} - 외부 스케줄러가 호출하는 상태 전이 함수</li>
 *   <li>{@link com.ryuqq.drorchestrator.application.orchestrator.DefaultWaveOrchestrator} - 기본 구현과 조립</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 저장소와 제어 평면은 core SPI로만 접근</li>
 *   <li><strong>외부 루프:</strong> 스레드 풀이나 이벤트 루프 없음, 호스트가 poll 주기를 결정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.application.orchestrator;
