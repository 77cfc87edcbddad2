package com.ryuqq.provisioner.adapter.web.dto;

import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.WorkflowRef;

import java.time.Instant;
import java.util.List;

/**
 * 프로비저닝 요청 조회 응답.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record NamespaceResponse(
    String requestId,
    String namespaceName,
    String team,
    String environment,
    String resourceTier,
    String networkPolicy,
    List<String> features,
    String requestedBy,
    String description,
    String costCenter,
    String ownerPrincipalId,
    String status,
    String statusMessage,
    String workflowRef,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) {

    public static NamespaceResponse from(ProvisioningRequest request) {
        return new NamespaceResponse(
            request.getRequestId().getValue(),
            request.getNamespaceName(),
            request.getTeam(),
            request.getEnvironment().value(),
            request.getResourceTier().value(),
            request.getNetworkPolicy().value(),
            request.getFeatures().stream().sorted().toList(),
            request.getRequestedBy(),
            request.getDescription().orElse(null),
            request.getCostCenter(),
            request.getOwnerPrincipalId().orElse(null),
            request.getStatus().name(),
            request.getStatusMessage(),
            request.getWorkflowRef().map(WorkflowRef::getValue).orElse(null),
            request.getErrorMessage().orElse(null),
            request.getCreatedAt(),
            request.getUpdatedAt(),
            request.getCompletedAt().orElse(null)
        );
    }
}
