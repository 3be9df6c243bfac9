package com.ryuqq.drorchestrator.core.model;

/**
 * 교차 계정 작업을 위한 대상 계정 식별 정보.
 *
 * <p>accountId와 assumeRoleName이 모두 있으면 교차 계정으로 간주합니다.
 * {@link #current()}는 오케스트레이터 자신의 계정을 의미합니다.</p>
 *
 * @param accountId 대상 계정 ID (null이면 현재 계정)
 * @param assumeRoleName 위임 역할 이름
 * @param externalId 역할 위임 시 외부 ID (선택)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AccountContext(String accountId, String assumeRoleName, String externalId) {

    private static final AccountContext CURRENT = new AccountContext(null, null, null);

    public static AccountContext current() {
        return CURRENT;
    }

    public static AccountContext of(String accountId, String assumeRoleName) {
        return new AccountContext(accountId, assumeRoleName, null);
    }

    /**
     * 교차 계정 여부.
     *
     * @return accountId와 assumeRoleName이 모두 존재하면 true
     */
    public boolean isCrossAccount() {
        return accountId != null && !accountId.isBlank()
            && assumeRoleName != null && !assumeRoleName.isBlank();
    }

    /**
     * 이 컨텍스트가 교차 계정이 아니면 fallback을 사용.
     *
     * @param fallback 대체 컨텍스트 (null 가능)
     * @return 선택된 컨텍스트 (null이 아님)
     */
    public AccountContext orElse(AccountContext fallback) {
        if (isCrossAccount() || fallback == null) {
            return this;
        }
        return fallback;
    }
}
