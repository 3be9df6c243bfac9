/**
 * Wave 시작, 폴링, 실행 종료.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.application.wave;
