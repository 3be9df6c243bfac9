/**
 * Wave poll 판정 결과 (sealed).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.core.outcome;
