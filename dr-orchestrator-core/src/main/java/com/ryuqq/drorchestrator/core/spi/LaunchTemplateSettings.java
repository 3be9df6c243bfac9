package com.ryuqq.drorchestrator.core.spi;

import java.util.List;

/**
 * 복구 인스턴스 EC2 기동 템플릿 설정.
 *
 * <p>값이 없는 필드는 템플릿에서 변경하지 않습니다. 고정 사설 IP가 있으면 서브넷과 함께
 * 첫 번째 네트워크 인터페이스에 지정됩니다.</p>
 *
 * @param instanceType 인스턴스 유형 (null 가능)
 * @param subnetId 서브넷 ID (null 가능)
 * @param securityGroupIds 보안 그룹 ID (비어 있을 수 있음)
 * @param staticPrivateIp 고정 사설 IP (null 가능)
 * @param instanceProfileName IAM 인스턴스 프로파일 이름 (null 가능)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchTemplateSettings(
    String instanceType,
    String subnetId,
    List<String> securityGroupIds,
    String staticPrivateIp,
    String instanceProfileName
) {

    public LaunchTemplateSettings {
        securityGroupIds = securityGroupIds == null ? List.of() : List.copyOf(securityGroupIds);
    }

    /**
     * 변경할 값이 하나도 없는지 여부.
     */
    public boolean isEmpty() {
        return instanceType == null
            && !hasNetworkInterface()
            && instanceProfileName == null;
    }

    /**
     * 네트워크 인터페이스 변경이 필요한지 여부.
     */
    public boolean hasNetworkInterface() {
        return subnetId != null || !securityGroupIds.isEmpty() || staticPrivateIp != null;
    }
}
