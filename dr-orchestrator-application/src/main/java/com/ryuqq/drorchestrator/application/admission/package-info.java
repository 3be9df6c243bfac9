/**
 * 구성원 해석과 승인 검사 (서버 충돌, 할당량).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.application.admission;
