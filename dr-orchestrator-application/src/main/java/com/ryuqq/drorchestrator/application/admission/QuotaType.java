package com.ryuqq.drorchestrator.application.admission;

/**
 * 할당량 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum QuotaType {

    SERVERS_PER_JOB("servers_per_job"),
    CONCURRENT_JOBS("concurrent_jobs"),
    TOTAL_SERVERS_IN_JOBS("total_servers_in_jobs");

    private final String wireValue;

    QuotaType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
