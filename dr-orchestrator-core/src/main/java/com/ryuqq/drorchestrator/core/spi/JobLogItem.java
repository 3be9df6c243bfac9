package com.ryuqq.drorchestrator.core.spi;

import java.time.Instant;

/**
 * Job 이벤트 로그 항목.
 *
 * @param event 이벤트 이름 (예: LAUNCH_START, CONVERSION_START)
 * @param eventTime 이벤트 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobLogItem(String event, Instant eventTime) {
}
