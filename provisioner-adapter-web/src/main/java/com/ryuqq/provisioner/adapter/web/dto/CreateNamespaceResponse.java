package com.ryuqq.provisioner.adapter.web.dto;

import com.ryuqq.provisioner.core.model.ProvisioningRequest;

/**
 * {@code POST /namespaces} 202 응답.
 */
public record CreateNamespaceResponse(String requestId, String status, String message) {

    public static CreateNamespaceResponse from(ProvisioningRequest request) {
        return new CreateNamespaceResponse(
            request.getRequestId().getValue(),
            request.getStatus().name(),
            request.getStatusMessage()
        );
    }
}
