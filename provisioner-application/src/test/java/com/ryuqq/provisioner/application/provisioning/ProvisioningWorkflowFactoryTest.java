package com.ryuqq.provisioner.application.provisioning;

import com.ryuqq.provisioner.core.model.Environment;
import com.ryuqq.provisioner.core.model.IdentityPrincipal;
import com.ryuqq.provisioner.core.model.NamespaceRequest;
import com.ryuqq.provisioner.core.model.NetworkPolicy;
import com.ryuqq.provisioner.core.model.PrincipalType;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.ResourceTier;
import com.ryuqq.provisioner.core.model.ResourceTierTable;
import com.ryuqq.provisioner.core.spi.DirectoryEntry;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;
import com.ryuqq.provisioner.core.workflow.WorkflowStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ProvisioningWorkflowFactoryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T09:00:00Z");

    private final ProvisioningWorkflowFactory factory = new ProvisioningWorkflowFactory(new ProvisioningConfig());
    private final ResourceTierTable tiers = ResourceTierTable.defaults();

    private ProvisioningRequest request;

    @BeforeEach
    void setUp() {
        NamespaceRequest namespaceRequest = new NamespaceRequest(
            "payments-prod", "payments", Environment.PRODUCTION, "medium", NetworkPolicy.TEAM_SHARED,
            Set.of("monitoring-enhanced", "istio-injection"), "alice@example.com", "Payments API", "cc-42", null
        );
        request = ProvisioningRequest.pending(RequestId.of("ns-1-abcd1234"), namespaceRequest, ResourceTier.MEDIUM, NOW);
    }

    @Test
    void 이름_레이블_어노테이션() {
        // when
        WorkflowDefinition definition = factory.build(request, tiers.lookup(ResourceTier.MEDIUM), null);

        // then
        assertThat(definition.getName()).isEqualTo("provision-namespace-ns-1-abcd1234");
        assertThat(definition.getEntrypoint()).isEqualTo("provision-namespace");
        assertThat(definition.getServiceAccount()).isEqualTo("platform-provisioner");
        assertThat(definition.getTemplateLibrary()).isEqualTo("create-namespace-template");
        assertThat(definition.getLabels())
            .containsEntry("platform.io/request-id", "ns-1-abcd1234")
            .containsEntry("platform.io/team", "payments")
            .containsEntry("platform.io/environment", "production")
            .containsEntry("platform.io/resource-tier", "medium");
        assertThat(definition.getAnnotations())
            .containsEntry("platform.io/requested-by", "alice@example.com")
            .containsEntry("platform.io/requested-at", "2024-01-01T09:00:00Z")
            .containsEntry("platform.io/description", "Payments API")
            .doesNotContainKey("platform.io/owner");
    }

    @Test
    void 파라미터는_등급_한도를_그대로_복사() {
        // when
        WorkflowDefinition definition = factory.build(request, tiers.lookup(ResourceTier.MEDIUM), null);

        // then
        assertThat(definition.getParameters()).containsExactly(
            entry("namespace-name", "payments-prod"),
            entry("team-name", "payments"),
            entry("environment", "production"),
            entry("resource-tier", "medium"),
            entry("network-policy", "team-shared"),
            entry("features", "istio-injection,monitoring-enhanced"),
            entry("cpu-limit", "4"),
            entry("memory-limit", "8Gi"),
            entry("storage-quota", "50Gi"),
            entry("max-pods", "20"),
            entry("max-services", "10"),
            entry("requested-by", "alice@example.com"),
            entry("cost-center", "cc-42")
        );
    }

    @Test
    void 단계_의존성() {
        // when
        WorkflowDefinition definition = factory.build(request, tiers.lookup(ResourceTier.MEDIUM), null);

        // then
        assertThat(definition.getSteps()).extracting(WorkflowStep::name).containsExactly(
            "validate", "create-namespace", "apply-rbac", "set-resource-quotas",
            "apply-network-policies", "enable-monitoring", "finalize"
        );
        assertThat(definition.findStep("create-namespace").orElseThrow().dependencies()).containsExactly("validate");
        assertThat(definition.findStep("finalize").orElseThrow().dependencies()).containsExactlyInAnyOrder(
            "apply-rbac", "set-resource-quotas", "apply-network-policies", "enable-monitoring"
        );
        assertThat(definition.findStep("set-resource-quotas").orElseThrow().arguments())
            .containsEntry("cpu-limit", "{{workflow.parameters.cpu-limit}}");
        assertThat(definition.findStep("validate").orElseThrow().resources().cpuLimit()).isEqualTo("100m");
    }

    @Test
    void 소유자가_있으면_표시_이름을_어노테이션으로() {
        // given
        IdentityPrincipal owner = IdentityPrincipal.verified(
            new DirectoryEntry("group-1", "Payments Owners", null), PrincipalType.GROUP
        );

        // when
        WorkflowDefinition definition = factory.build(request, tiers.lookup(ResourceTier.MEDIUM), owner);

        // then
        assertThat(definition.getAnnotations()).containsEntry("platform.io/owner", "Payments Owners");
    }

    private static Map.Entry<String, String> entry(String key, String value) {
        return Map.entry(key, value);
    }
}
