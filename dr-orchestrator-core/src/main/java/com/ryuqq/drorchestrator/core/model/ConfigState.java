package com.ryuqq.drorchestrator.core.model;

/**
 * 보호 그룹 수준 구성 적용 상태.
 *
 * <pre>
 * not_configured ──► pending ──► ready / partial / failed
 *                       ▲                 │
 *                       └─── 재적용/드리프트 ─┘
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConfigState {

    NOT_CONFIGURED("not_configured"),
    PENDING("pending"),
    READY("ready"),
    FAILED("failed"),
    PARTIAL("partial");

    private final String wireValue;

    ConfigState(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 영속 상태에 저장되는 소문자 값.
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 영속 값으로부터 상태 복원.
     *
     * @param value 소문자 영속 값
     * @return 상태
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ConfigState fromWireValue(String value) {
        for (ConfigState state : values()) {
            if (state.wireValue.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown config state: " + value);
    }
}
