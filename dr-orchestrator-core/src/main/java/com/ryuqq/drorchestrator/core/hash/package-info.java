/**
 * 기동 구성 해시.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.drorchestrator.core.hash;
