/**
 * 오케스트레이터 설정 record.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.core.config;
