/**
 * Runner Adapter Layer - 호스트 스케줄러 보조 구성요소.
 *
 * <h2>구성요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drorchestrator.adapter.runner.ExecutionFinder} - 단계별 간격에 따른 poll 대상 선별</li>
 *   <li>{@link com.ryuqq.drorchestrator.adapter.runner.ExecutionReaper} - 장기 미종료 실행의 TIMEOUT 처리</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * host scheduler
 *   ↓ findDue() → poll()
 * adapter-runner (ExecutionFinder, ExecutionReaper)
 *   ↓ depends on
 * application (WaveOrchestrator, ExecutionFinalizer)
 *   ↓ depends on
 * core (Execution, ExecutionStore SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.adapter.runner;
