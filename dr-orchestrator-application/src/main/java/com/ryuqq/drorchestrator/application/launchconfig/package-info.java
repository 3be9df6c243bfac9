/**
 * 보호 그룹 기동 구성 적용, 상태 저장, drift 탐지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.application.launchconfig;
