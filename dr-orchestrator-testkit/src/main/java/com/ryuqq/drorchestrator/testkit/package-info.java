/**
 * 테스트 지원 도구.
 *
 * <ul>
 *   <li>{@code fake} - 스크립트 가능한 제어 평면, 수동 시계, 기록 Sleeper</li>
 *   <li>{@code contract} - 저장소 SPI 계약 테스트 기반 클래스</li>
 *   <li>{@code fixture} - 계획/보호 그룹/실행 픽스처</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.testkit;
