package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.RequestId;

/**
 * 다른 요청과의 충돌 (이름 중복, 팀 쿼터 초과).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ConflictException extends ProvisioningException {

    /**
     * 충돌 사유.
     */
    public enum Reason {
        DUPLICATE_NAME,
        QUOTA_EXCEEDED
    }

    private final Reason reason;

    public ConflictException(Reason reason, String message) {
        this(reason, message, null);
    }

    public ConflictException(Reason reason, String message, RequestId requestId) {
        super(message, null, requestId);
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
