/**
 * 영속/표시용 JSON 문서 변환.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.core.codec;
