package com.ryuqq.drorchestrator.core.codec;

/**
 * UI 레이어가 소비하는 영속 필드 이름.
 *
 * <p>마이그레이션 없이 이름을 바꾸면 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PersistedFields {

    public static final String STATUS = "status";
    public static final String LAST_APPLIED = "lastApplied";
    public static final String APPLIED_BY = "appliedBy";
    public static final String SERVER_CONFIGS = "serverConfigs";
    public static final String CONFIG_HASH = "configHash";
    public static final String ERRORS = "errors";
    public static final String PAUSED_BEFORE_WAVE = "pausedBeforeWave";
    public static final String WAVE_RESULTS = "wave_results";

    // Utility class - prevent instantiation
    private PersistedFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
