package com.ryuqq.provisioner.application.provisioning;

import com.ryuqq.provisioner.core.model.IdentityPrincipal;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.ResourceTierConfig;
import com.ryuqq.provisioner.core.workflow.StepResources;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;
import com.ryuqq.provisioner.core.workflow.WorkflowStep;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 프로비저닝 요청 → 워크플로우 DAG 변환.
 *
 * <p><strong>단계 구성:</strong></p>
 * <pre>
 * validate → create-namespace → apply-rbac ─────────────┐
 *                             → set-resource-quotas ────┤
 *                             → apply-network-policies ─┼→ finalize
 *                             → enable-monitoring ──────┘
 * </pre>
 *
 * <p>리소스 한도는 생성 시점의 등급 설정 값을 파라미터로 복사합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ProvisioningWorkflowFactory {

    public static final String NAME_PREFIX = "provision-namespace-";
    public static final String ENTRYPOINT = "provision-namespace";

    static final String LABEL_PREFIX = "platform.io/";

    private final ProvisioningConfig config;

    public ProvisioningWorkflowFactory(ProvisioningConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 워크플로우 정의 생성.
     *
     * @param request PENDING 상태의 요청
     * @param limits 요청 등급의 리소스 한도
     * @param owner 검증된 소유자 (nullable)
     * @return 제출할 워크플로우 정의
     */
    public WorkflowDefinition build(ProvisioningRequest request, ResourceTierConfig limits, IdentityPrincipal owner) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }

        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(NAME_PREFIX + request.getRequestId().getValue())
            .entrypoint(ENTRYPOINT)
            .templateLibrary(config.templateLibrary())
            .serviceAccount(config.workflowServiceAccount())
            .label(LABEL_PREFIX + "request-id", request.getRequestId().getValue())
            .label(LABEL_PREFIX + "team", request.getTeam())
            .label(LABEL_PREFIX + "environment", request.getEnvironment().value())
            .label(LABEL_PREFIX + "resource-tier", request.getResourceTier().value())
            .annotation(LABEL_PREFIX + "requested-by", request.getRequestedBy())
            .annotation(LABEL_PREFIX + "requested-at", request.getCreatedAt().toString())
            .annotation(LABEL_PREFIX + "description", request.getDescription().orElse(""));
        if (owner != null) {
            builder.annotation(LABEL_PREFIX + "owner", owner.getDisplayName());
        }

        Map<String, String> parameters = parameters(request, limits);
        parameters.forEach(builder::parameter);

        builder
            .step(step("validate", "validate-request", List.of(), StepResources.light(),
                "namespace-name", "team-name", "environment", "resource-tier"))
            .step(step("create-namespace", "create-namespace", List.of("validate"), StepResources.standard(),
                "namespace-name", "team-name", "environment", "cost-center", "requested-by"))
            .step(step("apply-rbac", "setup-rbac", List.of("create-namespace"), StepResources.standard(),
                "namespace-name", "team-name"))
            .step(step("set-resource-quotas", "apply-resource-quotas", List.of("create-namespace"),
                StepResources.standard(),
                "namespace-name", "cpu-limit", "memory-limit", "storage-quota", "max-pods", "max-services"))
            .step(step("apply-network-policies", "apply-network-policies", List.of("create-namespace"),
                StepResources.standard(),
                "namespace-name", "network-policy"))
            .step(step("enable-monitoring", "setup-monitoring", List.of("create-namespace"), StepResources.light(),
                "namespace-name", "features"))
            .step(step("finalize", "finalize-namespace",
                List.of("apply-rbac", "set-resource-quotas", "apply-network-policies", "enable-monitoring"),
                StepResources.light(),
                "namespace-name", "team-name", "features"));

        return builder.build();
    }

    private static Map<String, String> parameters(ProvisioningRequest request, ResourceTierConfig limits) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("namespace-name", request.getNamespaceName());
        parameters.put("team-name", request.getTeam());
        parameters.put("environment", request.getEnvironment().value());
        parameters.put("resource-tier", request.getResourceTier().value());
        parameters.put("network-policy", request.getNetworkPolicy().value());
        parameters.put("features", request.getFeatures().stream().sorted().collect(Collectors.joining(",")));
        parameters.put("cpu-limit", limits.cpuLimit());
        parameters.put("memory-limit", limits.memoryLimit());
        parameters.put("storage-quota", limits.storageQuota());
        parameters.put("max-pods", String.valueOf(limits.maxPods()));
        parameters.put("max-services", String.valueOf(limits.maxServices()));
        parameters.put("requested-by", request.getRequestedBy());
        parameters.put("cost-center", request.getCostCenter());
        return parameters;
    }

    private static WorkflowStep step(
        String name,
        String template,
        List<String> dependencies,
        StepResources resources,
        String... parameterNames
    ) {
        Map<String, String> arguments = new LinkedHashMap<>();
        for (String parameter : parameterNames) {
            arguments.put(parameter, "{{workflow.parameters." + parameter + "}}");
        }
        return new WorkflowStep(name, template, dependencies, arguments, resources);
    }
}
