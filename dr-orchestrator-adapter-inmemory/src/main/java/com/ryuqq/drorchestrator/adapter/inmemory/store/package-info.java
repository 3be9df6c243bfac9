/**
 * In-memory 저장소 어댑터.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.drorchestrator.adapter.inmemory.store.InMemoryExecutionStore}:
 *       버전 가드 조건부 쓰기를 지원하는 실행 저장소</li>
 *   <li>{@link com.ryuqq.drorchestrator.adapter.inmemory.store.InMemoryProtectionGroupStore}:
 *       구성 적용 상태를 JSON 문서로 보관하는 보호 그룹 저장소</li>
 *   <li>{@link com.ryuqq.drorchestrator.adapter.inmemory.store.InMemoryServerReservations}:
 *       원자적 서버 예약</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.adapter.inmemory.store;
