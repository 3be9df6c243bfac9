package com.ryuqq.drorchestrator.application.admission;

import com.ryuqq.drorchestrator.core.exception.ApplicationException;
import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.exception.ValidationException;
import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.ProtectionGroup;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneException;
import com.ryuqq.drorchestrator.testkit.fake.FakeControlPlaneProvider;
import com.ryuqq.drorchestrator.testkit.fake.FakeRecoveryControlPlane;
import com.ryuqq.drorchestrator.testkit.fixture.DrFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MembershipResolver 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MembershipResolverTest {

    private FakeControlPlaneProvider provider;
    private FakeRecoveryControlPlane drs;
    private MembershipResolver resolver;

    @BeforeEach
    void setUp() {
        provider = new FakeControlPlaneProvider();
        drs = provider.region(DrFixtures.REGION);
        resolver = new MembershipResolver(provider);
    }

    @Test
    void resolve_명시_선택은_ID를_그대로_반환하고_제어_평면을_호출하지_않음() {
        // when
        List<String> ids = resolver.resolve(DrFixtures.explicitGroup("pg-1", "s-2", "s-1"), null);

        // then
        assertThat(ids).containsExactly("s-2", "s-1");
        assertThat(provider.requestedContexts()).isEmpty();
    }

    @Test
    void resolve_태그는_공백과_대소문자를_무시하고_모두_일치해야_함() {
        // given
        drs.addSourceServer("s-1", Map.of(" Tier ", "DB", "Env", "prod"));
        drs.addSourceServer("s-2", Map.of("tier", "db"));
        drs.addSourceServer("s-3", Map.of("tier", "web", "env", "prod"));
        ProtectionGroup group = DrFixtures.taggedGroup("pg-1", Map.of("tier", "db ", "ENV", "Prod"));

        // when
        List<String> ids = resolver.resolve(group, null);

        // then
        assertThat(ids).containsExactly("s-1");
    }

    @Test
    void resolve_일치_서버가_없으면_빈_목록() {
        drs.addSourceServer("s-1", Map.of("tier", "web"));

        assertThat(resolver.resolve(DrFixtures.taggedGroup("pg-1", Map.of("tier", "db")), null)).isEmpty();
    }

    @Test
    void resolve_선택_기준이_없으면_ValidationException() {
        ProtectionGroup group = ProtectionGroup.of("pg-1", DrFixtures.REGION, null);

        assertThatThrownBy(() -> resolver.resolve(group, null))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.NO_SERVER_SELECTION_CONFIGURED));
    }

    @Test
    void resolve_서버_조회_실패는_ApplicationException() {
        // given
        drs.failDescribeSourceServers(ControlPlaneException.throttling("rate exceeded"));

        // when & then
        assertThatThrownBy(() -> resolver.resolve(DrFixtures.taggedGroup("pg-1", Map.of("tier", "db")), null))
            .isInstanceOf(ApplicationException.class)
            .hasMessageContaining("pg-1")
            .hasCauseInstanceOf(ControlPlaneException.class);
    }

    @Test
    void resolve_호출자가_교차_계정이_아니면_그룹_계정으로_조회함() {
        // given
        ProtectionGroup group = DrFixtures.taggedGroup("pg-1", Map.of("tier", "db"))
            .withAccount("222233334444", "DrRole", "ext-1");

        // when
        resolver.resolve(group, AccountContext.current());

        // then
        assertThat(provider.requestedContexts())
            .containsExactly(new AccountContext("222233334444", "DrRole", "ext-1"));
    }

    @Test
    void resolve_호출자가_교차_계정이면_호출자_계정을_우선함() {
        // given
        ProtectionGroup group = DrFixtures.taggedGroup("pg-1", Map.of("tier", "db"))
            .withAccount("222233334444", "DrRole", null);
        AccountContext caller = AccountContext.of("555566667777", "CallerRole");

        // when
        resolver.resolve(group, caller);

        // then
        assertThat(provider.requestedContexts()).containsExactly(caller);
    }
}
