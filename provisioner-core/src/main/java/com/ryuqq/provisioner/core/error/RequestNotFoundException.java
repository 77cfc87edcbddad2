package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.RequestId;

/**
 * 존재하지 않는 요청 ID 조회.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class RequestNotFoundException extends ProvisioningException {

    public RequestNotFoundException(RequestId requestId) {
        super("Provisioning request not found: " + requestId, null, requestId);
    }
}
