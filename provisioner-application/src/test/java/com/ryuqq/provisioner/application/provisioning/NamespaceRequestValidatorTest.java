package com.ryuqq.provisioner.application.provisioning;

import com.ryuqq.provisioner.core.model.Environment;
import com.ryuqq.provisioner.core.model.NamespaceRequest;
import com.ryuqq.provisioner.core.model.NetworkPolicy;
import com.ryuqq.provisioner.core.model.ResourceTier;
import com.ryuqq.provisioner.testkit.fixture.TestRequests;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NamespaceRequestValidatorTest {

    private final NamespaceRequestValidator validator = new NamespaceRequestValidator(new ProvisioningConfig());

    @Test
    void 정상_요청은_위반_없음() {
        assertThat(validator.validate(TestRequests.namespaceRequest("payments-dev", "payments"))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Payments", "-payments", "payments-", "pay_ments", "pay.ments", ""})
    void 이름_형식_위반(String name) {
        // when
        var violations = validator.validate(TestRequests.namespaceRequest(name, "payments"));

        // then
        assertThat(violations).anySatisfy(v -> assertThat(v).startsWith("Invalid namespace name"));
    }

    @Test
    void 이름은_63자_이하() {
        // given
        String longName = "a".repeat(64);

        // when / then
        assertThat(validator.validate(TestRequests.namespaceRequest(longName, "payments")))
            .containsExactly("Namespace name cannot exceed 63 characters");
        assertThat(validator.validate(TestRequests.namespaceRequest("a".repeat(63), "payments"))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"a", "Payments", "team_one", "abcdefghijklmnopqrstuvwxyz0123456"})
    void 팀_형식_위반(String team) {
        assertThat(validator.validate(TestRequests.namespaceRequest("payments-dev", team)))
            .anySatisfy(v -> assertThat(v).startsWith("Invalid team"));
    }

    @Test
    void 허용되지_않은_기능은_모두_보고() {
        // given
        NamespaceRequest request = TestRequests.namespaceRequest("payments-dev", "payments")
            .withFeatures(Set.of("istio-injection", "root-access", "crypto-mining"));

        // when / then
        assertThat(validator.validate(request)).containsExactly("Invalid features: crypto-mining, root-access");
    }

    @Test
    void 운영_환경은_small_이상_등급과_open이_아닌_정책이_필요() {
        // given
        NamespaceRequest request = NamespaceRequest.of("payments", "payments", Environment.PRODUCTION, "micro", "alice")
            .withNetworkPolicy(NetworkPolicy.OPEN);

        // when / then
        assertThat(validator.validate(request)).containsExactly(
            "Production environments require at least \"small\" resource tier",
            "Production environments cannot use \"open\" network policy"
        );
    }

    @Test
    void 운영_환경의_알_수_없는_등급은_small로_해석되어_통과() {
        // given
        NamespaceRequest request = NamespaceRequest.of("payments", "payments", Environment.PRODUCTION, "xlarge", "alice");

        // when / then
        assertThat(validator.validate(request)).isEmpty();
        assertThat(NamespaceRequestValidator.resolveTier(request)).isEqualTo(ResourceTier.SMALL);
    }

    @Test
    void 설명과_비용센터_길이_제한() {
        // given
        NamespaceRequest request = new NamespaceRequest(
            "payments-dev", "payments", Environment.DEVELOPMENT, "small", NetworkPolicy.ISOLATED, Set.of(),
            "alice", "d".repeat(501), "c".repeat(51), null
        );

        // when / then
        assertThat(validator.validate(request)).containsExactly(
            "Description cannot exceed 500 characters",
            "Cost center cannot exceed 50 characters"
        );
    }

    @Test
    void 설정된_패턴과_길이를_따름() {
        // given
        NamespaceRequestValidator strict = new NamespaceRequestValidator(
            new ProvisioningConfig().withNamePattern("^team-[a-z]+$", 20)
        );

        // then
        assertThat(strict.validate(TestRequests.namespaceRequest("team-payments", "payments"))).isEmpty();
        assertThat(strict.validate(TestRequests.namespaceRequest("payments", "payments"))).hasSize(1);
    }
}
