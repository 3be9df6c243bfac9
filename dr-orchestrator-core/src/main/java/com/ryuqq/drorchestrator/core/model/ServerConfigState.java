package com.ryuqq.drorchestrator.core.model;

/**
 * 서버 단위 구성 적용 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ServerConfigState {

    READY("ready"),
    PENDING("pending"),
    FAILED("failed");

    private final String wireValue;

    ServerConfigState(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static ServerConfigState fromWireValue(String value) {
        for (ServerConfigState state : values()) {
            if (state.wireValue.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown server config state: " + value);
    }
}
