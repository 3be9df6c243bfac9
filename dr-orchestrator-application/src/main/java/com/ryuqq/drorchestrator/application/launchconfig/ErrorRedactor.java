package com.ryuqq.drorchestrator.application.launchconfig;

import java.util.regex.Pattern;

/**
 * 그룹 수준 오류 메시지에서 계정 식별 정보 제거.
 *
 * <p>그룹 오류 목록은 UI에 노출되므로 ARN과 12자리 계정 ID를 가립니다.
 * 서버 단위 오류는 원문을 유지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ErrorRedactor {

    private static final Pattern ARN = Pattern.compile("arn:aws[a-zA-Z-]*:[^\\s,;\"')]+");
    private static final Pattern ACCOUNT_ID = Pattern.compile("(?<!\\d)\\d{12}(?!\\d)");

    static final String ARN_MASK = "arn:***";
    static final String ACCOUNT_MASK = "************";

    // Utility class - prevent instantiation
    private ErrorRedactor() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String redact(String message) {
        if (message == null) {
            return null;
        }
        String redacted = ARN.matcher(message).replaceAll(ARN_MASK);
        return ACCOUNT_ID.matcher(redacted).replaceAll(ACCOUNT_MASK);
    }
}
