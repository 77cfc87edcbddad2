package com.ryuqq.provisioner.application.provisioning;

import com.ryuqq.provisioner.core.model.WorkflowStatus;

/**
 * 워크플로우 단계 → 사용자 메시지.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class WorkflowStatusMessages {

    static final String SUBMITTED = "Namespace provisioning request submitted";

    private WorkflowStatusMessages() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String describe(WorkflowStatus status) {
        return switch (status.phase()) {
            case PENDING -> "Namespace provisioning is queued and will start shortly";
            case RUNNING -> "Namespace provisioning is in progress";
            case SUCCEEDED -> "Namespace provisioned successfully and is ready for use";
            case FAILED, ERROR -> "Namespace provisioning failed: "
                + (status.message() == null || status.message().isBlank() ? "Unknown error" : status.message());
            case UNKNOWN -> SUBMITTED;
        };
    }
}
