package com.ryuqq.drorchestrator.application.launchconfig;

import com.ryuqq.drorchestrator.core.spi.LaunchTemplateSettings;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 기동 구성 필드 분류.
 *
 * <p>제어 평면 기동 구성 갱신 API가 허용하는 필드와 EC2 기동 템플릿에 반영할 필드
 * (인스턴스 유형, 서브넷, 보안 그룹, 고정 IP, 인스턴스 프로파일)로 나눕니다.
 * 구성 해시는 분류 전 전체 구성을 대상으로 계산하므로 두 갱신이 모두 성공해야 적용 완료입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LaunchConfigFields {

    public static final Set<String> CONTROL_PLANE_FIELDS = Set.of(
        "copyPrivateIp",
        "copyTags",
        "launchDisposition",
        "licensing",
        "targetInstanceTypeRightSizingMethod",
        "postLaunchEnabled",
        "name"
    );

    public static final String INSTANCE_TYPE = "instanceType";
    public static final String SUBNET_ID = "subnetId";
    public static final String SECURITY_GROUP_IDS = "securityGroupIds";
    public static final String STATIC_PRIVATE_IP = "staticPrivateIp";
    public static final String INSTANCE_PROFILE_NAME = "instanceProfileName";

    // Utility class - prevent instantiation
    private LaunchConfigFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 제어 평면 전송용 필드만 남긴 구성.
     *
     * @param config 전체 구성
     * @return 허용 필드만 포함한 새 map (null 값 제외)
     */
    public static Map<String, Object> forControlPlane(Map<String, Object> config) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        if (config == null) {
            return filtered;
        }
        config.forEach((key, value) -> {
            if (value != null && CONTROL_PLANE_FIELDS.contains(key)) {
                filtered.put(key, value);
            }
        });
        return filtered;
    }

    /**
     * EC2 기동 템플릿에 반영할 설정.
     *
     * <p>빈 문자열과 빈 목록은 값이 없는 것으로 봅니다.</p>
     *
     * @param config 전체 구성
     * @return 템플릿 설정 (반영할 값이 없으면 {@link LaunchTemplateSettings#isEmpty()})
     */
    public static LaunchTemplateSettings forLaunchTemplate(Map<String, Object> config) {
        if (config == null) {
            return new LaunchTemplateSettings(null, null, List.of(), null, null);
        }
        return new LaunchTemplateSettings(
            text(config.get(INSTANCE_TYPE)),
            text(config.get(SUBNET_ID)),
            texts(config.get(SECURITY_GROUP_IDS)),
            text(config.get(STATIC_PRIVATE_IP)),
            text(config.get(INSTANCE_PROFILE_NAME))
        );
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }

    private static List<String> texts(Object value) {
        if (!(value instanceof Collection<?> values)) {
            String single = text(value);
            return single == null ? List.of() : List.of(single);
        }
        List<String> result = new ArrayList<>();
        for (Object element : values) {
            String item = text(element);
            if (item != null) {
                result.add(item);
            }
        }
        return result;
    }
}
