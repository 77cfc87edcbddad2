package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.WorkflowRef;

/**
 * 워크플로우 엔진에 해당 워크플로우가 없음.
 *
 * <p>정상적인 부정 결과이며 서킷 브레이커 실패로 집계되지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class WorkflowNotFoundException extends ProvisioningException {

    private final WorkflowRef ref;

    public WorkflowNotFoundException(WorkflowRef ref) {
        super("Workflow not found: " + ref);
        this.ref = ref;
    }

    public WorkflowRef getRef() {
        return ref;
    }
}
