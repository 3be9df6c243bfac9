package com.ryuqq.drorchestrator.application.admission;

import com.ryuqq.drorchestrator.core.exception.ApplicationException;
import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.exception.ValidationException;
import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.ExplicitSelection;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;
import com.ryuqq.drorchestrator.core.model.TagSelection;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneProvider;
import com.ryuqq.drorchestrator.core.spi.SourceServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 보호 그룹 구성원 해석기.
 *
 * <p><strong>태그 선택:</strong> 그룹 리전/계정에서 보이는 모든 소스 서버 중
 * 필요한 태그를 전부 가진 서버만 남깁니다 (AND). 키와 값 모두 앞뒤 공백을 제거하고
 * 대소문자를 구분하지 않고 비교합니다.</p>
 *
 * <p><strong>명시 선택:</strong> ID 목록을 그대로 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MembershipResolver {

    private static final Logger log = LoggerFactory.getLogger(MembershipResolver.class);

    private final ControlPlaneProvider controlPlaneProvider;

    public MembershipResolver(ControlPlaneProvider controlPlaneProvider) {
        if (controlPlaneProvider == null) {
            throw new IllegalArgumentException("controlPlaneProvider cannot be null");
        }
        this.controlPlaneProvider = controlPlaneProvider;
    }

    /**
     * 구성원 해석.
     *
     * @param group 보호 그룹
     * @param accountContext 호출자 계정 컨텍스트 (교차 계정이 아니면 그룹 계정 사용)
     * @return 서버 ID 목록 (일치 서버가 없으면 빈 목록)
     * @throws ValidationException 선택 기준이 없는 경우
     * @throws ApplicationException 서버 조회 실패 시
     */
    public List<String> resolve(ProtectionGroup group, AccountContext accountContext) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        if (group.selection() instanceof ExplicitSelection explicit) {
            return explicit.sourceServerIds();
        }
        if (!(group.selection() instanceof TagSelection tagSelection)) {
            throw new ValidationException(ErrorCode.NO_SERVER_SELECTION_CONFIGURED,
                "Protection group " + group.groupId() + " has no server selection configured");
        }

        AccountContext context = accountContext == null
            ? group.accountContext()
            : accountContext.orElse(group.accountContext());

        List<SourceServer> servers;
        try {
            servers = controlPlaneProvider.clientFor(group.region(), context).describeSourceServers();
        } catch (ControlPlaneException e) {
            log.error("Source server query failed: groupId={}, region={}", group.groupId(), group.region(), e);
            throw new ApplicationException(ErrorCode.SERVER_RESOLUTION_FAILED,
                "Failed to resolve servers for protection group " + group.groupId() + ": " + e.getMessage(), e);
        }

        Map<String, String> required = normalize(tagSelection.tags());
        List<String> matched = servers.stream()
            .filter(server -> matches(normalize(server.tags()), required))
            .map(SourceServer::sourceServerId)
            .toList();

        log.debug("Resolved tag membership: groupId={}, candidates={}, matched={}",
            group.groupId(), servers.size(), matched.size());
        return matched;
    }

    private static boolean matches(Map<String, String> serverTags, Map<String, String> required) {
        for (Map.Entry<String, String> entry : required.entrySet()) {
            if (!entry.getValue().equals(serverTags.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, String> normalize(Map<String, String> tags) {
        Map<String, String> normalized = new HashMap<>();
        if (tags == null) {
            return normalized;
        }
        tags.forEach((key, value) -> {
            if (key != null) {
                normalized.put(key.trim().toLowerCase(Locale.ROOT),
                    value == null ? "" : value.trim().toLowerCase(Locale.ROOT));
            }
        });
        return normalized;
    }
}
